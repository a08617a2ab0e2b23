package com.newsbrief.pipeline.entity;

/**
 * 출력 형식: 구조화 텍스트(markdown), 기계 판독(json), 일반 텍스트
 */
public enum OutputFormat {
    MARKDOWN,
    JSON,
    TEXT;

    public static OutputFormat fromValue(String value) {
        for (OutputFormat format : values()) {
            if (format.name().equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + value);
    }
}
