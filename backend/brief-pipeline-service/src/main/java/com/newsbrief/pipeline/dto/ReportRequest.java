package com.newsbrief.pipeline.dto;

import com.newsbrief.pipeline.entity.BriefSection;
import com.newsbrief.pipeline.entity.ReportTemplate;

import java.time.Instant;
import java.util.List;

/**
 * 임의 기간/템플릿 브리프 생성 요청. null 항목은 테넌트 설정값을 사용.
 */
public record ReportRequest(
        Instant windowStart,
        Instant windowEnd,
        ReportTemplate template,
        String language,
        List<BriefSection> sections,
        List<String> kbIds
) {}
