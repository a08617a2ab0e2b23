package com.newsbrief.pipeline.service.attachment;

import com.newsbrief.pipeline.util.UrlNormalizer;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 파일 확장자/Content-Type과 첨부파일 유형 태그 간 변환
 */
public final class AttachmentTypes {

    /**
     * 확장자로 유형을 추정할 수 있는 파일들 (문서 외 형식도 포함하여 허용 목록 밖 유형을 식별)
     */
    static final Set<String> KNOWN_EXTENSIONS = Set.of(
            "pdf", "doc", "docx", "ppt", "pptx", "xls", "xlsx", "txt", "csv", "md", "rtf", "odt",
            "zip", "rar", "7z", "jpg", "jpeg", "png", "gif", "mp4", "mp3", "hwp"
    );

    private static final Map<String, String> CONTENT_TYPES = new LinkedHashMap<>();

    static {
        CONTENT_TYPES.put("application/pdf", "pdf");
        CONTENT_TYPES.put("application/msword", "doc");
        CONTENT_TYPES.put("application/vnd.openxmlformats-officedocument.wordprocessingml.document", "docx");
        CONTENT_TYPES.put("application/vnd.ms-powerpoint", "ppt");
        CONTENT_TYPES.put("application/vnd.openxmlformats-officedocument.presentationml.presentation", "pptx");
        CONTENT_TYPES.put("application/vnd.ms-excel", "xls");
        CONTENT_TYPES.put("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", "xlsx");
    }

    private AttachmentTypes() {
    }

    /**
     * 파일명 또는 URL 경로의 확장자
     */
    public static Optional<String> extensionOf(String nameOrUrl) {
        if (nameOrUrl == null || nameOrUrl.isBlank()) {
            return Optional.empty();
        }
        String path = nameOrUrl.contains("://") ? UrlNormalizer.path(nameOrUrl) : nameOrUrl;
        int slash = path.lastIndexOf('/');
        String last = slash >= 0 ? path.substring(slash + 1) : path;
        int dot = last.lastIndexOf('.');
        if (dot < 0 || dot == last.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(last.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * 알려진 형식의 확장자만 유형 태그로 인정
     */
    public static Optional<String> knownTypeOf(String nameOrUrl) {
        return extensionOf(nameOrUrl).filter(KNOWN_EXTENSIONS::contains);
    }

    public static Optional<String> fromContentType(String contentType) {
        if (contentType == null) {
            return Optional.empty();
        }
        String mime = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return Optional.ofNullable(CONTENT_TYPES.get(mime));
    }

    /**
     * 문서로 볼 수 있는 Content-Type인지 (없으면 허용)
     */
    public static boolean isDocumentContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return true;
        }
        String mime = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return CONTENT_TYPES.containsKey(mime)
                || mime.equals("application/octet-stream")
                || mime.startsWith("application/vnd.openxmlformats-officedocument");
    }
}
