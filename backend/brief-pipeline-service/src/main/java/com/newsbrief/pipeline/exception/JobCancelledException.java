package com.newsbrief.pipeline.exception;

/**
 * 작업 취소(타임아웃 포함) 시 블로킹 지점에서 발생
 */
public class JobCancelledException extends PipelineException {

    public JobCancelledException(String reason) {
        super("JOB_CANCELLED", "Job cancelled: " + reason);
    }
}
