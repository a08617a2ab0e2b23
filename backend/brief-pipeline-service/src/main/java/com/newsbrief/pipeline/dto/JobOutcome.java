package com.newsbrief.pipeline.dto;

import com.newsbrief.pipeline.entity.JobKind;
import com.newsbrief.pipeline.entity.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 작업 종료 알림 페이로드
 */
public record JobOutcome(
        String jobId,
        String tenantId,
        JobKind kind,
        JobStatus status,
        Instant startedAt,
        Instant finishedAt,
        String error,
        List<SourceError> sourceErrors,
        String briefId,
        Map<String, Object> stats
) {}
