package com.newsbrief.pipeline.exception;

import java.util.List;

/**
 * 스케줄러/설정 관련 예외
 */
public class SchedulerException extends PipelineException {

    public enum Kind {
        JOB_TIMEOUT,
        CONFIG_INVALID,
        UNKNOWN_TENANT,
        UNKNOWN_SOURCE,
        UNKNOWN_JOB,
        NOT_RUNNING
    }

    private final Kind kind;
    private final List<String> violations;

    public SchedulerException(Kind kind, String message) {
        this(kind, message, List.of());
    }

    public SchedulerException(Kind kind, String message, List<String> violations) {
        super("SCHEDULER_" + kind.name(), message);
        this.kind = kind;
        this.violations = List.copyOf(violations);
    }

    public Kind getKind() {
        return kind;
    }

    public List<String> getViolations() {
        return violations;
    }

    public static SchedulerException configInvalid(String tenantId, List<String> violations) {
        return new SchedulerException(Kind.CONFIG_INVALID,
                "Invalid configuration for tenant " + tenantId + ": " + String.join("; ", violations),
                violations);
    }

    public static SchedulerException unknownTenant(String tenantId) {
        return new SchedulerException(Kind.UNKNOWN_TENANT, "Tenant not configured: " + tenantId);
    }

    public static SchedulerException unknownSource(String tenantId, String sourceName) {
        return new SchedulerException(Kind.UNKNOWN_SOURCE,
                "Source not found for tenant " + tenantId + ": " + sourceName);
    }

    public static SchedulerException unknownJob(String tenantId, String jobId) {
        return new SchedulerException(Kind.UNKNOWN_JOB, "Job " + jobId + " not found for tenant " + tenantId);
    }

    public static SchedulerException jobTimeout(String jobId, long timeoutSeconds) {
        return new SchedulerException(Kind.JOB_TIMEOUT,
                "Job " + jobId + " exceeded timeout of " + timeoutSeconds + "s");
    }

    public static SchedulerException notRunning() {
        return new SchedulerException(Kind.NOT_RUNNING, "Scheduler is not running");
    }
}
