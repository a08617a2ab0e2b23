package com.newsbrief.pipeline.entity;

public enum SourceKind {
    RSS("rss"),
    HTML("html");

    private final String value;

    SourceKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SourceKind fromValue(String value) {
        for (SourceKind kind : SourceKind.values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown source kind: " + value);
    }
}
