package com.newsbrief.pipeline.scheduler;

import com.newsbrief.pipeline.dto.Brief;
import com.newsbrief.pipeline.dto.tenant.TenantConfig;
import com.newsbrief.pipeline.entity.JobKind;
import com.newsbrief.pipeline.service.report.BriefRequest;
import com.newsbrief.pipeline.service.report.BriefStore;
import com.newsbrief.pipeline.service.report.ReportGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * 보고 작업: 최근 dateRangeDays 기간의 브리프를 생성하여 보관합니다.
 */
@Component
@RequiredArgsConstructor
public class ReportJobHandler implements JobHandler {

    private final ReportGenerator reportGenerator;
    private final BriefStore briefStore;
    private final Clock clock;

    @Override
    public JobKind kind() {
        return JobKind.REPORT;
    }

    @Override
    public JobResult run(JobRun run) {
        TenantConfig config = run.getConfig();
        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofDays(config.getReport().getDateRangeDays()));

        run.getSignal().throwIfCancelled();
        Brief brief = briefStore.save(reportGenerator.generate(new BriefRequest(run.getTenantId(),
                config.getReport(), config.reportKbIds(), start, end,
                ZoneId.of(config.getScheduler().getTimezone()))));

        return new JobResult(List.of(), brief.briefId(),
                Map.of("newsCount", brief.newsCount(), "sections", brief.sections().size()), null);
    }
}
