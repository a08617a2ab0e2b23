package com.newsbrief.pipeline.scheduler;

import com.newsbrief.pipeline.dto.tenant.TenantConfig;
import com.newsbrief.pipeline.entity.JobKind;
import com.newsbrief.pipeline.entity.JobStatus;
import com.newsbrief.pipeline.exception.JobCancelledException;
import com.newsbrief.pipeline.exception.PipelineException;
import com.newsbrief.pipeline.exception.SchedulerException;
import com.newsbrief.pipeline.service.notification.NotificationDispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 작업 디스패치.
 *
 * 테넌트별 실행 중 작업 수가 maxConcurrentJobs에 도달하면 새 작업은 대기열에 들어가고,
 * 실행 중인 작업이 끝날 때(작업 스레드가 실제로 종료될 때) 다음 작업이 시작됩니다.
 * 각 작업은 jobTimeout 이후 TIMED_OUT으로 종료되고 취소 신호를 받습니다.
 */
@Service
@Slf4j
public class JobDispatcher {

    private final Map<JobKind, JobHandler> handlers = new EnumMap<>(JobKind.class);
    private final Map<String, TenantSlots> slots = new ConcurrentHashMap<>();
    private final JobRunRegistry registry;
    private final NotificationDispatcher notificationDispatcher;
    private final MeterRegistry meterRegistry;
    private final Executor jobExecutor;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public JobDispatcher(List<JobHandler> jobHandlers,
                         JobRunRegistry registry,
                         NotificationDispatcher notificationDispatcher,
                         MeterRegistry meterRegistry,
                         @Qualifier("jobExecutor") Executor jobExecutor,
                         @Qualifier("pipelineTaskScheduler") TaskScheduler taskScheduler,
                         Clock clock) {
        jobHandlers.forEach(handler -> handlers.put(handler.kind(), handler));
        this.registry = registry;
        this.notificationDispatcher = notificationDispatcher;
        this.meterRegistry = meterRegistry;
        this.jobExecutor = jobExecutor;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * 작업 생성 후 실행 또는 대기열 등록
     *
     * @param config 이 작업 전용으로 복사된 설정
     */
    public JobRun submit(String tenantId, JobKind kind, TenantConfig config) {
        if (!handlers.containsKey(kind)) {
            throw new IllegalStateException("No handler registered for job kind " + kind);
        }
        JobRun run = new JobRun(UUID.randomUUID().toString(), tenantId, kind, config, clock.instant());
        registry.register(run);

        TenantSlots tenant = slots.computeIfAbsent(tenantId, id -> new TenantSlots());
        int limit = config.getScheduler().getMaxConcurrentJobs();
        boolean startNow;
        synchronized (tenant) {
            startNow = tenant.running < limit;
            if (startNow) {
                tenant.running++;
            } else {
                tenant.queue.addLast(run);
            }
        }

        if (startNow) {
            start(run);
        } else {
            log.info("[{}/{}] {} job queued (running limit {} reached)", tenantId, run.getJobId(), kind, limit);
        }
        return run;
    }

    /**
     * 작업 취소. 대기 중이면 바로 종료되고, 실행 중이면 취소 신호를 보냅니다.
     *
     * @return 취소 대상이 아직 종료되지 않았으면 true
     */
    public boolean cancel(JobRun run) {
        if (run.isFinished()) {
            return false;
        }
        log.info("[{}/{}] Cancelling {} job", run.getTenantId(), run.getJobId(), run.getKind());
        run.getSignal().cancel("cancelled");
        if (run.getStatus() == JobStatus.PENDING) {
            TenantSlots tenant = slots.get(run.getTenantId());
            if (tenant != null) {
                synchronized (tenant) {
                    tenant.queue.remove(run);
                }
            }
            complete(run, JobStatus.FAILED, "cancelled", null);
        }
        return true;
    }

    public int runningCount(String tenantId) {
        TenantSlots tenant = slots.get(tenantId);
        if (tenant == null) {
            return 0;
        }
        synchronized (tenant) {
            return tenant.running;
        }
    }

    public int queuedCount(String tenantId) {
        TenantSlots tenant = slots.get(tenantId);
        if (tenant == null) {
            return 0;
        }
        synchronized (tenant) {
            return tenant.queue.size();
        }
    }

    private void start(JobRun run) {
        try {
            jobExecutor.execute(() -> execute(run));
        } catch (RejectedExecutionException e) {
            log.error("[{}/{}] Job rejected by executor: {}", run.getTenantId(), run.getJobId(), e.getMessage());
            complete(run, JobStatus.FAILED, "rejected: " + e.getMessage(), null);
            release(run.getTenantId());
        }
    }

    private void execute(JobRun run) {
        String prefix = "[" + run.getTenantId() + "/" + run.getJobId() + "]";
        try {
            if (!run.markRunning(clock.instant())) {
                return;
            }
            scheduleWatchdog(run);
            log.info("{} {} job started", prefix, run.getKind());

            JobResult result = handlers.get(run.getKind()).run(run);
            if (result.isFailure()) {
                complete(run, JobStatus.FAILED, result.failure(), result);
            } else {
                complete(run, JobStatus.SUCCEEDED, null, result);
            }
        } catch (JobCancelledException e) {
            complete(run, JobStatus.FAILED, run.getSignal().reason(), null);
        } catch (PipelineException e) {
            log.warn("{} {} job failed: {}", prefix, run.getKind(), e.getMessage());
            complete(run, JobStatus.FAILED, e.getErrorCode() + ": " + e.getMessage(), null);
        } catch (RuntimeException e) {
            log.error("{} {} job failed unexpectedly: {}", prefix, run.getKind(), e.getMessage(), e);
            complete(run, JobStatus.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage(), null);
        } finally {
            run.cancelWatchdog();
            release(run.getTenantId());
        }
    }

    private void scheduleWatchdog(JobRun run) {
        long timeoutSeconds = run.getConfig().getScheduler().getJobTimeout();
        run.setWatchdog(taskScheduler.schedule(() -> {
            SchedulerException timeout = SchedulerException.jobTimeout(run.getJobId(), timeoutSeconds);
            if (complete(run, JobStatus.TIMED_OUT, timeout.getMessage(), null)) {
                run.getSignal().cancel("timeout");
            }
        }, clock.instant().plus(Duration.ofSeconds(timeoutSeconds))));
    }

    /**
     * 종료 상태 설정 (한 번만 적용). 적용되면 지표/알림/이력 정리를 수행합니다.
     */
    private boolean complete(JobRun run, JobStatus status, String error, JobResult result) {
        if (!run.finish(status, clock.instant(), error, result)) {
            return false;
        }
        meterRegistry.counter("newsbrief.jobs.finished",
                "kind", run.getKind().name().toLowerCase(Locale.ROOT),
                "status", status.name().toLowerCase(Locale.ROOT)).increment();
        log.info("[{}/{}] {} job finished: {}{}", run.getTenantId(), run.getJobId(), run.getKind(), status,
                error != null ? " (" + error + ")" : "");
        notificationDispatcher.dispatch(run.toOutcome());
        registry.trim(run.getTenantId());
        return true;
    }

    /**
     * 실행 슬롯 반환 후 대기 작업 시작.
     * 대기 작업마다 자신의 설정 스냅샷에 있는 한도를 다시 확인하므로, 한도를 낮춘 설정은 즉시 적용됩니다.
     */
    private void release(String tenantId) {
        TenantSlots tenant = slots.get(tenantId);
        List<JobRun> next = new ArrayList<>();
        synchronized (tenant) {
            tenant.running--;
            while (!tenant.queue.isEmpty()) {
                JobRun candidate = tenant.queue.peekFirst();
                if (candidate.isFinished()) {
                    tenant.queue.pollFirst();
                    continue;
                }
                if (tenant.running >= candidate.getConfig().getScheduler().getMaxConcurrentJobs()) {
                    break;
                }
                tenant.queue.pollFirst();
                tenant.running++;
                next.add(candidate);
            }
        }
        next.forEach(this::start);
    }

    private static final class TenantSlots {
        private int running;
        private final Deque<JobRun> queue = new ArrayDeque<>();
    }
}
