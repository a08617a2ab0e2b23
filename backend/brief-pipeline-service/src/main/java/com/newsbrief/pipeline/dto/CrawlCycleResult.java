package com.newsbrief.pipeline.dto;

import com.newsbrief.pipeline.entity.AttachmentStatus;

import java.util.List;
import java.util.Map;

/**
 * 수집 사이클 1회의 결과 요약
 */
public record CrawlCycleResult(
        int sourcesAttempted,
        int sourcesFailed,
        int itemsFetched,
        int itemsFiltered,
        int itemsDuplicate,
        int itemsProcessed,
        int itemsFailed,
        Map<AttachmentStatus, Integer> attachments,
        List<SourceError> sourceErrors,
        List<SourceError> itemErrors
) {

    public boolean hasErrors() {
        return !sourceErrors.isEmpty() || !itemErrors.isEmpty();
    }

    /**
     * 오류가 있었고 처리된 항목이 하나도 없으면 전체 실패
     */
    public boolean isTotalFailure() {
        return itemsProcessed == 0 && hasErrors();
    }
}
