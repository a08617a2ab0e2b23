package com.newsbrief.pipeline.entity;

import java.time.Duration;

/**
 * 게시일 신선도 필터 프리셋
 */
public enum DateFilter {
    TODAY(Duration.ofHours(24)),
    WEEK(Duration.ofDays(7)),
    MONTH(Duration.ofDays(30));

    private final Duration window;

    DateFilter(Duration window) {
        this.window = window;
    }

    public Duration getWindow() {
        return window;
    }
}
