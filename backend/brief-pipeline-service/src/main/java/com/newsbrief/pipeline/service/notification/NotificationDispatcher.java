package com.newsbrief.pipeline.service.notification;

import com.newsbrief.pipeline.dto.JobOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 등록된 모든 알림 대상에 작업 결과 전달
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final List<NotificationSink> sinks;

    public void dispatch(JobOutcome outcome) {
        for (NotificationSink sink : sinks) {
            try {
                sink.notify(outcome);
            } catch (RuntimeException e) {
                log.warn("Notification sink '{}' failed for job {}: {}", sink.name(), outcome.jobId(), e.getMessage());
            }
        }
    }
}
