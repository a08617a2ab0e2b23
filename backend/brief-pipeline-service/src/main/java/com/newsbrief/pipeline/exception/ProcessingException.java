package com.newsbrief.pipeline.exception;

/**
 * 뉴스 처리/저장 실패 예외
 */
public class ProcessingException extends PipelineException {

    public enum Kind {
        STORE_UNREACHABLE,
        INVALID_KB_ID,
        QUOTA_EXCEEDED
    }

    private final Kind kind;

    public ProcessingException(Kind kind, String message) {
        super("PROCESSING_" + kind.name(), message);
        this.kind = kind;
    }

    public ProcessingException(Kind kind, String message, Throwable cause) {
        super("PROCESSING_" + kind.name(), message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 설정 전체에 영향을 주는 오류인지 (잘못된 지식베이스 ID는 모든 항목에서 반복됨)
     */
    public boolean isConfigurationWide() {
        return kind == Kind.INVALID_KB_ID;
    }
}
