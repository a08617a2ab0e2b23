package com.newsbrief.pipeline.service.attachment;

import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.dto.AttachmentCandidate;
import com.newsbrief.pipeline.dto.AttachmentCandidate.Signal;
import com.newsbrief.pipeline.dto.FilteredItem;
import com.newsbrief.pipeline.entity.AttachmentStatus;
import com.newsbrief.pipeline.util.TextNormalizer;
import com.newsbrief.pipeline.util.UrlNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 기사 페이지에서 첨부파일 링크를 찾아 분류합니다.
 *
 * 링크마다 다음 규칙을 순서대로 적용하며 처음 일치한 규칙이 분류를 결정합니다.
 * <ol>
 *   <li>URL 경로의 확장자가 허용 유형에 포함</li>
 *   <li>링크 텍스트에 첨부파일 키워드 포함</li>
 *   <li>URL에 첨부파일 키워드 포함</li>
 * </ol>
 * 네트워크 요청은 하지 않습니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AttachmentResolver {

    private static final List<String> LINK_TEXT_KEYWORDS = List.of(
            "pdf", "word", "excel", "ppt", "doc", "xls",
            "附件", "下载", "文档", "报告", "文件",
            "attachment", "download", "첨부", "다운로드"
    );
    private static final List<String> URL_KEYWORDS = List.of("pdf", "attachment", "download", "file", "upload");

    private static final String INVALID_FILENAME_CHARS = "[<>:\"/\\\\|?*]";
    private static final int MAX_TEXT_FILENAME = 100;
    private static final DateTimeFormatter FALLBACK_NAME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Clock clock;

    public AttachmentResolution resolve(FilteredItem item, String pageContent, DownloadPolicy policy, int maxAttachments) {
        if (pageContent == null || pageContent.isBlank() || maxAttachments <= 0) {
            return AttachmentResolution.none();
        }

        List<AttachmentCandidate> candidates = new ArrayList<>();
        List<Attachment> rejected = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String ownUrl = UrlNormalizer.stripTracking(item.url());

        for (Element anchor : Jsoup.parse(pageContent, item.url()).select("a[href]")) {
            String url = anchor.absUrl("href");
            if (url.isEmpty() || !url.startsWith("http")) {
                continue;
            }
            String text = TextNormalizer.normalize(anchor.text());
            AttachmentCandidate candidate = classify(item.fingerprint(), url, text, policy);
            if (candidate == null) {
                continue;
            }

            String key = UrlNormalizer.stripTracking(url);
            if (key.equals(ownUrl) || !seen.add(key)) {
                continue;
            }

            if (candidate.hasKnownType() && !policy.allows(candidate.inferredType())) {
                rejected.add(Attachment.skipped(candidate, AttachmentStatus.SKIPPED_TYPE, candidate.inferredType(), 0,
                        "type not allowed: " + candidate.inferredType()));
                continue;
            }
            if (candidates.size() >= maxAttachments) {
                log.debug("Attachment limit {} reached for '{}', ignoring {}", maxAttachments, item.title(), url);
                continue;
            }
            candidates.add(candidate);
        }

        if (!candidates.isEmpty() || !rejected.isEmpty()) {
            log.debug("Resolved {} attachment candidates ({} rejected by type) for '{}'",
                    candidates.size(), rejected.size(), item.title());
        }
        return new AttachmentResolution(candidates, rejected);
    }

    AttachmentCandidate classify(String fingerprint, String url, String linkText, DownloadPolicy policy) {
        Optional<String> extension = AttachmentTypes.extensionOf(url);
        if (extension.isPresent() && policy.allows(extension.get())) {
            return new AttachmentCandidate(fingerprint, url, extension.get(), Signal.EXTENSION,
                    filenameOf(url, linkText));
        }

        String lowerText = linkText.toLowerCase(Locale.ROOT);
        if (LINK_TEXT_KEYWORDS.stream().anyMatch(lowerText::contains)) {
            return new AttachmentCandidate(fingerprint, url, inferType(url, lowerText), Signal.LINK_TEXT,
                    filenameOf(url, linkText));
        }

        String lowerUrl = url.toLowerCase(Locale.ROOT);
        if (URL_KEYWORDS.stream().anyMatch(lowerUrl::contains)) {
            return new AttachmentCandidate(fingerprint, url, inferType(url, lowerUrl), Signal.URL_KEYWORD,
                    filenameOf(url, linkText));
        }
        return null;
    }

    /**
     * 확장자가 알려진 형식이면 그 형식, 아니면 키워드에서 추정
     */
    private String inferType(String url, String lowerHint) {
        Optional<String> known = AttachmentTypes.knownTypeOf(url);
        if (known.isPresent()) {
            return known.get();
        }
        if (lowerHint.contains("pdf")) {
            return "pdf";
        }
        if (lowerHint.contains("docx")) {
            return "docx";
        }
        if (lowerHint.contains("word") || lowerHint.contains(".doc")) {
            return "doc";
        }
        if (lowerHint.contains("pptx")) {
            return "pptx";
        }
        if (lowerHint.contains("ppt") || lowerHint.contains("powerpoint")) {
            return "ppt";
        }
        if (lowerHint.contains("xlsx")) {
            return "xlsx";
        }
        if (lowerHint.contains("excel") || lowerHint.contains("xls")) {
            return "xls";
        }
        return AttachmentCandidate.UNKNOWN_TYPE;
    }

    /**
     * 원본 파일명: URL 마지막 경로(확장자 포함) → 링크 텍스트 → 시각 기반 이름
     */
    String filenameOf(String url, String linkText) {
        String path = UrlNormalizer.path(url);
        String last = path.substring(path.lastIndexOf('/') + 1);
        if (last.contains(".")) {
            return decode(last);
        }
        String fromText = linkText.replaceAll(INVALID_FILENAME_CHARS, "").trim();
        if (!fromText.isEmpty() && fromText.length() < MAX_TEXT_FILENAME) {
            return fromText;
        }
        return "attachment_" + LocalDateTime.now(clock).format(FALLBACK_NAME);
    }

    private String decode(String segment) {
        try {
            return URLDecoder.decode(segment, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return segment;
        }
    }
}
