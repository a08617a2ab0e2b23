package com.newsbrief.pipeline.service.notification;

import com.newsbrief.pipeline.dto.JobOutcome;
import com.newsbrief.pipeline.entity.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(JobOutcome outcome) {
        if (outcome.status() == JobStatus.SUCCEEDED) {
            log.info("[{}/{}] {} job {}: sourceErrors={}, brief={}, stats={}",
                    outcome.tenantId(), outcome.jobId(), outcome.kind(), outcome.status(),
                    outcome.sourceErrors().size(), outcome.briefId(), outcome.stats());
        } else {
            log.warn("[{}/{}] {} job {}: {}", outcome.tenantId(), outcome.jobId(), outcome.kind(),
                    outcome.status(), outcome.error());
        }
    }
}
