package com.newsbrief.pipeline.exception;

/**
 * 파이프라인 예외 기본 클래스
 */
public class PipelineException extends RuntimeException {

    private final String errorCode;

    public PipelineException(String message) {
        super(message);
        this.errorCode = "PIPELINE_ERROR";
    }

    public PipelineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PipelineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
