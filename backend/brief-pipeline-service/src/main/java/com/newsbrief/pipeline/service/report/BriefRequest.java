package com.newsbrief.pipeline.service.report;

import com.newsbrief.pipeline.dto.tenant.ReportSettings;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * 브리프 생성 입력. 기간은 [windowStart, windowEnd).
 */
public record BriefRequest(
        String tenantId,
        ReportSettings settings,
        List<String> kbIds,
        Instant windowStart,
        Instant windowEnd,
        ZoneId zone
) {
    public BriefRequest {
        kbIds = List.copyOf(kbIds);
    }
}
