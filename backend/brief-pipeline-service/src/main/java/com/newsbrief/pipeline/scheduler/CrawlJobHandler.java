package com.newsbrief.pipeline.scheduler;

import com.newsbrief.pipeline.dto.CrawlCycleResult;
import com.newsbrief.pipeline.dto.SourceError;
import com.newsbrief.pipeline.entity.JobKind;
import com.newsbrief.pipeline.service.process.CrawlCycleRunner;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 수집 작업. 일부 소스가 실패해도 처리된 항목이 있으면 성공이며 오류 목록을 함께 남깁니다.
 */
@Component
@RequiredArgsConstructor
public class CrawlJobHandler implements JobHandler {

    private final CrawlCycleRunner crawlCycleRunner;

    @Override
    public JobKind kind() {
        return JobKind.CRAWL;
    }

    @Override
    public JobResult run(JobRun run) {
        CrawlCycleResult result = crawlCycleRunner.run(run.getTenantId(), run.getConfig(), run.getSignal());

        List<SourceError> errors = new ArrayList<>(result.sourceErrors());
        errors.addAll(result.itemErrors());

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("sourcesAttempted", result.sourcesAttempted());
        stats.put("sourcesFailed", result.sourcesFailed());
        stats.put("itemsFetched", result.itemsFetched());
        stats.put("itemsFiltered", result.itemsFiltered());
        stats.put("itemsDuplicate", result.itemsDuplicate());
        stats.put("itemsProcessed", result.itemsProcessed());
        stats.put("itemsFailed", result.itemsFailed());
        result.attachments().forEach((status, count) -> stats.put("attachments." + status.name().toLowerCase(Locale.ROOT), count));

        String failure = result.isTotalFailure()
                ? "No items processed; " + errors.size() + " source/item errors"
                : null;
        return new JobResult(errors, null, stats, failure);
    }
}
