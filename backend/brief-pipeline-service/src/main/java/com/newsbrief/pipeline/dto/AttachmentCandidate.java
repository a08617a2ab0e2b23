package com.newsbrief.pipeline.dto;

/**
 * 페이지에서 발견된 첨부파일 링크
 */
public record AttachmentCandidate(
        String itemFingerprint,
        String url,
        String inferredType,
        Signal sourceSignal,
        String filename
) {
    public static final String UNKNOWN_TYPE = "unknown";

    /**
     * 첨부파일로 판단한 근거
     */
    public enum Signal {
        EXTENSION,
        LINK_TEXT,
        URL_KEYWORD
    }

    public boolean hasKnownType() {
        return !UNKNOWN_TYPE.equals(inferredType);
    }
}
