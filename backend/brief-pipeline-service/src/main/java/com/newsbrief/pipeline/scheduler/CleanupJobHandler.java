package com.newsbrief.pipeline.scheduler;

import com.newsbrief.pipeline.dto.tenant.TenantConfig;
import com.newsbrief.pipeline.entity.JobKind;
import com.newsbrief.pipeline.service.report.BriefStore;
import com.newsbrief.pipeline.service.store.ContentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 정리 작업: 보관 기간이 지난 저장 뉴스/첨부파일, 브리프, 종료된 작업 이력을 삭제합니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CleanupJobHandler implements JobHandler {

    private final ContentStore contentStore;
    private final BriefStore briefStore;
    private final JobRunRegistry jobRunRegistry;
    private final Clock clock;

    @Override
    public JobKind kind() {
        return JobKind.CLEANUP;
    }

    @Override
    public JobResult run(JobRun run) {
        TenantConfig config = run.getConfig();
        Instant cutoff = clock.instant().minus(Duration.ofDays(config.getCleanup().getRetentionDays()));

        Set<String> kbIds = new LinkedHashSet<>();
        if (config.getProcessor().getKbId() != null) {
            kbIds.add(config.getProcessor().getKbId());
        }
        kbIds.addAll(config.reportKbIds());

        int purgedNews = 0;
        for (String kbId : kbIds) {
            run.getSignal().throwIfCancelled();
            purgedNews += contentStore.purgeBefore(kbId, cutoff);
        }
        int briefs = briefStore.pruneBefore(run.getTenantId(), cutoff);
        int jobs = jobRunRegistry.pruneFinishedBefore(run.getTenantId(), cutoff);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("cutoff", cutoff.toString());
        stats.put("purgedNews", purgedNews);
        stats.put("prunedBriefs", briefs);
        stats.put("prunedJobs", jobs);
        log.info("[Cleanup:{}] {}", run.getTenantId(), stats);
        return JobResult.of(stats);
    }
}
