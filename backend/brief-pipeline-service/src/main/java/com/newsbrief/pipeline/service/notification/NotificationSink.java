package com.newsbrief.pipeline.service.notification;

import com.newsbrief.pipeline.dto.JobOutcome;

/**
 * 작업 종료 알림 대상. 알림 실패가 작업 결과를 바꾸지 않도록 호출자는 예외를 기록만 합니다.
 */
public interface NotificationSink {

    String name();

    void notify(JobOutcome outcome);
}
