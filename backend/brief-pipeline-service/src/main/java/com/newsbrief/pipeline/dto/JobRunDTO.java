package com.newsbrief.pipeline.dto;

import com.newsbrief.pipeline.entity.JobKind;
import com.newsbrief.pipeline.entity.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record JobRunDTO(
        String jobId,
        String tenantId,
        JobKind kind,
        JobStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        String error,
        List<SourceError> sourceErrors,
        String briefId,
        Map<String, Object> stats
) {}
