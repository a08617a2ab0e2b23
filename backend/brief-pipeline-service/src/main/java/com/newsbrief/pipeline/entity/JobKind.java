package com.newsbrief.pipeline.entity;

import java.util.Locale;

public enum JobKind {
    CRAWL,
    REPORT,
    CLEANUP;

    public static JobKind fromValue(String value) {
        for (JobKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown job kind: " + value);
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
