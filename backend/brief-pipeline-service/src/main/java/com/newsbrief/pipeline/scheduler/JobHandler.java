package com.newsbrief.pipeline.scheduler;

import com.newsbrief.pipeline.entity.JobKind;

/**
 * 작업 종류별 실행기
 */
public interface JobHandler {

    JobKind kind();

    /**
     * 작업을 실행합니다. 예외를 던지면 작업은 FAILED로 끝납니다.
     * 취소 신호는 run.getSignal()로 전달됩니다.
     */
    JobResult run(JobRun run);
}
