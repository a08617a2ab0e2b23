package com.newsbrief.pipeline.scheduler;

import com.newsbrief.pipeline.dto.JobOutcome;
import com.newsbrief.pipeline.dto.JobRunDTO;
import com.newsbrief.pipeline.dto.SourceError;
import com.newsbrief.pipeline.dto.tenant.TenantConfig;
import com.newsbrief.pipeline.entity.JobKind;
import com.newsbrief.pipeline.entity.JobStatus;
import com.newsbrief.pipeline.service.CancellationSignal;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 작업 실행 1건.
 *
 * 상태 전이: PENDING → RUNNING → {SUCCEEDED, FAILED, TIMED_OUT}.
 * 종료 상태는 CAS로 단 한 번만 설정되며, 이후의 종료 시도는 무시됩니다.
 */
public class JobRun {

    private final String jobId;
    private final String tenantId;
    private final JobKind kind;
    private final TenantConfig config;
    private final Instant createdAt;
    private final CancellationSignal signal = CancellationSignal.create();
    private final AtomicReference<JobStatus> status = new AtomicReference<>(JobStatus.PENDING);

    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile String error;
    private volatile JobResult result = JobResult.empty();
    private volatile ScheduledFuture<?> watchdog;

    public JobRun(String jobId, String tenantId, JobKind kind, TenantConfig config, Instant createdAt) {
        this.jobId = jobId;
        this.tenantId = tenantId;
        this.kind = kind;
        this.config = config;
        this.createdAt = createdAt;
    }

    synchronized boolean markRunning(Instant now) {
        if (status.compareAndSet(JobStatus.PENDING, JobStatus.RUNNING)) {
            startedAt = now;
            return true;
        }
        return false;
    }

    /**
     * @return 이번 호출로 종료 상태가 설정되었으면 true
     */
    synchronized boolean finish(JobStatus terminal, Instant now, String failure, JobResult jobResult) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        JobStatus current = status.get();
        if (current.isTerminal()) {
            return false;
        }
        if (jobResult != null) {
            result = jobResult;
        }
        error = failure;
        finishedAt = now;
        status.set(terminal);
        return true;
    }

    void setWatchdog(ScheduledFuture<?> watchdog) {
        this.watchdog = watchdog;
    }

    void cancelWatchdog() {
        ScheduledFuture<?> current = watchdog;
        if (current != null) {
            current.cancel(false);
        }
    }

    public String getJobId() {
        return jobId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public JobKind getKind() {
        return kind;
    }

    /**
     * 디스패치 시점에 복사된 설정 (실행 중 변경되지 않음)
     */
    public TenantConfig getConfig() {
        return config;
    }

    public CancellationSignal getSignal() {
        return signal;
    }

    public JobStatus getStatus() {
        return status.get();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public String getError() {
        return error;
    }

    public JobResult getResult() {
        return result;
    }

    public boolean isFinished() {
        return status.get().isTerminal();
    }

    public JobRunDTO toDTO() {
        JobResult r = result;
        return new JobRunDTO(jobId, tenantId, kind, status.get(), createdAt, startedAt, finishedAt, error,
                r.sourceErrors(), r.briefId(), r.stats());
    }

    public JobOutcome toOutcome() {
        JobResult r = result;
        List<SourceError> errors = r.sourceErrors();
        Map<String, Object> stats = r.stats();
        return new JobOutcome(jobId, tenantId, kind, status.get(), startedAt, finishedAt, error, errors,
                r.briefId(), stats);
    }
}
