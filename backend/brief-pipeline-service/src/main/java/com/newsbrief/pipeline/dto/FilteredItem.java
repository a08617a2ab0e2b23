package com.newsbrief.pipeline.dto;

import java.time.Instant;

/**
 * 키워드/기간 필터를 통과한 항목과 중복 제거용 지문
 */
public record FilteredItem(CandidateItem candidate, String fingerprint) {

    public String sourceName() {
        return candidate.sourceName();
    }

    public String title() {
        return candidate.title();
    }

    public String url() {
        return candidate.url();
    }

    public Instant publishedAt() {
        return candidate.publishedAt();
    }

    public String excerpt() {
        return candidate.rawExcerpt();
    }
}
