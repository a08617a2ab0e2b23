package com.newsbrief.pipeline.dto;

/**
 * 소스 또는 항목 단위로 격리된 오류
 */
public record SourceError(String sourceName, String target, String errorCode, String message) {

    public static SourceError ofSource(String sourceName, String errorCode, String message) {
        return new SourceError(sourceName, null, errorCode, message);
    }

    public static SourceError ofItem(String sourceName, String itemTitle, String errorCode, String message) {
        return new SourceError(sourceName, itemTitle, errorCode, message);
    }
}
