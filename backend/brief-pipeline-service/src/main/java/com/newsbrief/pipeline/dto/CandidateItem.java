package com.newsbrief.pipeline.dto;

import java.time.Instant;

/**
 * 소스에서 조회된 원본 후보 항목 (사이클 범위)
 */
public record CandidateItem(
        String sourceName,
        String title,
        String url,
        Instant publishedAt,
        String rawExcerpt
) {
    public CandidateItem {
        title = title == null ? "" : title;
        rawExcerpt = rawExcerpt == null ? "" : rawExcerpt;
    }
}
