package com.newsbrief.pipeline.scheduler;

import com.newsbrief.pipeline.dto.Brief;
import com.newsbrief.pipeline.dto.JobRunDTO;
import com.newsbrief.pipeline.dto.ReportRequest;
import com.newsbrief.pipeline.dto.SchedulerStatusDTO;
import com.newsbrief.pipeline.dto.TestCrawlResponse;
import com.newsbrief.pipeline.dto.tenant.ReportSettings;
import com.newsbrief.pipeline.dto.tenant.ScheduleSettings;
import com.newsbrief.pipeline.dto.tenant.SourceConfig;
import com.newsbrief.pipeline.dto.tenant.TenantConfig;
import com.newsbrief.pipeline.entity.JobKind;
import com.newsbrief.pipeline.exception.SchedulerException;
import com.newsbrief.pipeline.service.process.CrawlCycleRunner;
import com.newsbrief.pipeline.service.report.BriefRequest;
import com.newsbrief.pipeline.service.report.BriefStore;
import com.newsbrief.pipeline.service.report.ReportGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 테넌트별 수집/보고/정리 일정 관리.
 *
 * 테넌트마다 독립된 트리거를 등록하며, 설정이 바뀌면 해당 테넌트의 트리거만 다시 등록합니다.
 * 트리거가 발동하면 그 시점의 설정 스냅샷으로 작업을 디스패치합니다.
 */
@Service
@Slf4j
public class SchedulerService {

    private static final int RECENT_JOBS = 50;

    private final TenantConfigService configService;
    private final JobDispatcher jobDispatcher;
    private final JobRunRegistry jobRunRegistry;
    private final CrawlCycleRunner crawlCycleRunner;
    private final ReportGenerator reportGenerator;
    private final BriefStore briefStore;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<String, List<ScheduledFuture<?>>> schedules = new ConcurrentHashMap<>();

    public SchedulerService(TenantConfigService configService,
                            JobDispatcher jobDispatcher,
                            JobRunRegistry jobRunRegistry,
                            CrawlCycleRunner crawlCycleRunner,
                            ReportGenerator reportGenerator,
                            BriefStore briefStore,
                            @Qualifier("pipelineTaskScheduler") TaskScheduler taskScheduler,
                            Clock clock) {
        this.configService = configService;
        this.jobDispatcher = jobDispatcher;
        this.jobRunRegistry = jobRunRegistry;
        this.crawlCycleRunner = crawlCycleRunner;
        this.reportGenerator = reportGenerator;
        this.briefStore = briefStore;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        configService.tenantIds().forEach(this::scheduleTenant);
        log.info("Scheduler started for {} tenants", schedules.size());
    }

    /**
     * 일정 트리거를 모두 해제합니다. 이미 실행 중인 작업은 계속 진행됩니다.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        schedules.keySet().forEach(this::unscheduleTenant);
        log.info("Scheduler stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public TenantConfig getConfig(String tenantId) {
        return configService.snapshot(tenantId);
    }

    /**
     * 설정 갱신 후 해당 테넌트 일정만 다시 등록 (검증 실패 시 기존 설정/일정 유지)
     */
    public synchronized TenantConfig updateConfig(String tenantId, TenantConfig config) {
        TenantConfig stored = configService.put(tenantId, config);
        if (running.get()) {
            scheduleTenant(tenantId);
        }
        return stored;
    }

    public synchronized void removeConfig(String tenantId) {
        if (!configService.remove(tenantId)) {
            throw SchedulerException.unknownTenant(tenantId);
        }
        unscheduleTenant(tenantId);
        log.info("Tenant {} removed", tenantId);
    }

    public JobRunDTO triggerJob(String tenantId, JobKind kind) {
        TenantConfig snapshot = configService.snapshot(tenantId);
        return jobDispatcher.submit(tenantId, kind, snapshot).toDTO();
    }

    public JobRunDTO cancelJob(String tenantId, String jobId) {
        JobRun run = jobRunRegistry.find(jobId)
                .filter(found -> found.getTenantId().equals(tenantId))
                .orElseThrow(() -> SchedulerException.unknownJob(tenantId, jobId));
        jobDispatcher.cancel(run);
        return run.toDTO();
    }

    public List<JobRunDTO> listJobs(String tenantId) {
        configService.snapshot(tenantId);
        return jobRunRegistry.findByTenant(tenantId).stream().map(JobRun::toDTO).toList();
    }

    public SchedulerStatusDTO status() {
        List<String> tenants = new ArrayList<>(configService.tenantIds());
        Map<String, Integer> runningJobs = new LinkedHashMap<>();
        Map<String, Integer> queuedJobs = new LinkedHashMap<>();
        for (String tenantId : tenants) {
            runningJobs.put(tenantId, jobDispatcher.runningCount(tenantId));
            queuedJobs.put(tenantId, jobDispatcher.queuedCount(tenantId));
        }
        List<JobRunDTO> recent = jobRunRegistry.recent(RECENT_JOBS).stream().map(JobRun::toDTO).toList();
        return new SchedulerStatusDTO(running.get(), tenants, runningJobs, queuedJobs, recent);
    }

    /**
     * 소스 1건 시험 수집 (저장하지 않음)
     */
    public TestCrawlResponse testCrawl(String tenantId, String sourceName) {
        TenantConfig snapshot = configService.snapshot(tenantId);
        SourceConfig source = snapshot.findSource(sourceName)
                .orElseThrow(() -> SchedulerException.unknownSource(tenantId, sourceName));
        return crawlCycleRunner.preview(snapshot, source);
    }

    /**
     * 임의 기간/템플릿 브리프 즉시 생성. 비어 있는 요청 항목은 테넌트 설정을 따릅니다.
     */
    public Brief generateReport(String tenantId, ReportRequest request) {
        TenantConfig snapshot = configService.snapshot(tenantId);
        ReportSettings settings = snapshot.getReport();
        if (request.template() != null) {
            settings.setTemplate(request.template());
        }
        if (request.language() != null && !request.language().isBlank()) {
            settings.setLanguage(request.language());
        }
        if (request.sections() != null && !request.sections().isEmpty()) {
            settings.setSections(new ArrayList<>(request.sections()));
        }
        List<String> kbIds = request.kbIds() != null && !request.kbIds().isEmpty()
                ? request.kbIds()
                : snapshot.reportKbIds();

        Instant end = request.windowEnd() != null ? request.windowEnd() : clock.instant();
        Instant start = request.windowStart() != null
                ? request.windowStart()
                : end.minus(Duration.ofDays(settings.getDateRangeDays()));
        if (!start.isBefore(end)) {
            throw new SchedulerException(SchedulerException.Kind.CONFIG_INVALID, "windowStart must be before windowEnd",
                    List.of("windowStart: must be before windowEnd"));
        }

        return briefStore.save(reportGenerator.generate(new BriefRequest(tenantId, settings, kbIds, start, end,
                ZoneId.of(snapshot.getScheduler().getTimezone()))));
    }

    private void scheduleTenant(String tenantId) {
        unscheduleTenant(tenantId);
        TenantConfig config = configService.find(tenantId).orElse(null);
        if (config == null || !config.getScheduler().isEnabled()) {
            log.info("Tenant {} has scheduling disabled", tenantId);
            return;
        }
        ZoneId zone = ZoneId.of(config.getScheduler().getTimezone());
        ScheduleSettings schedule = config.getSchedule();

        List<ScheduledFuture<?>> futures = new ArrayList<>();
        register(tenantId, JobKind.CRAWL, schedule.getCrawlSchedule(), zone, futures);
        register(tenantId, JobKind.REPORT, schedule.getReportSchedule(), zone, futures);
        register(tenantId, JobKind.CLEANUP, schedule.getCleanupSchedule(), zone, futures);
        schedules.put(tenantId, futures);
    }

    private void register(String tenantId, JobKind kind, String expression, ZoneId zone,
                          List<ScheduledFuture<?>> futures) {
        if (expression == null || expression.isBlank()) {
            return;
        }
        ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(tenantId, kind),
                ScheduleExpressions.toTrigger(expression, zone));
        if (future != null) {
            futures.add(future);
            log.info("Scheduled {} for tenant {}: '{}' ({})", kind, tenantId, expression, zone);
        }
    }

    private void unscheduleTenant(String tenantId) {
        List<ScheduledFuture<?>> futures = schedules.remove(tenantId);
        if (futures != null) {
            futures.forEach(future -> future.cancel(false));
        }
    }

    private void fire(String tenantId, JobKind kind) {
        if (!running.get()) {
            return;
        }
        try {
            TenantConfig snapshot = configService.snapshot(tenantId);
            if (!snapshot.getScheduler().isEnabled()) {
                return;
            }
            jobDispatcher.submit(tenantId, kind, snapshot);
        } catch (SchedulerException e) {
            log.warn("Scheduled {} for tenant {} skipped: {}", kind, tenantId, e.getMessage());
        }
    }
}
