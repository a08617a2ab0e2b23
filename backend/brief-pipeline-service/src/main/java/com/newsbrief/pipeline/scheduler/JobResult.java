package com.newsbrief.pipeline.scheduler;

import com.newsbrief.pipeline.dto.SourceError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 작업 처리기 실행 결과. failure가 있으면 FAILED로 종료되지만 오류 목록과 통계는 유지됩니다.
 */
public record JobResult(List<SourceError> sourceErrors, String briefId, Map<String, Object> stats, String failure) {

    public JobResult {
        sourceErrors = sourceErrors == null ? List.of() : List.copyOf(sourceErrors);
        stats = stats == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stats));
    }

    public static JobResult of(Map<String, Object> stats) {
        return new JobResult(List.of(), null, stats, null);
    }

    public static JobResult empty() {
        return of(Map.of());
    }

    public boolean isFailure() {
        return failure != null;
    }
}
