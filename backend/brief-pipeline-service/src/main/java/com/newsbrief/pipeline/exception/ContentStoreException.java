package com.newsbrief.pipeline.exception;

/**
 * 콘텐츠 저장소 경계에서 발생하는 예외
 */
public class ContentStoreException extends PipelineException {

    public enum Kind {
        UNREACHABLE,
        INVALID_KB_ID,
        QUOTA_EXCEEDED,
        NOT_FOUND
    }

    private final Kind kind;

    public ContentStoreException(Kind kind, String message) {
        super("STORE_" + kind.name(), message);
        this.kind = kind;
    }

    public ContentStoreException(Kind kind, String message, Throwable cause) {
        super("STORE_" + kind.name(), message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 처리 단계 예외로 변환
     */
    public ProcessingException toProcessingException() {
        ProcessingException.Kind mapped = switch (kind) {
            case INVALID_KB_ID -> ProcessingException.Kind.INVALID_KB_ID;
            case QUOTA_EXCEEDED -> ProcessingException.Kind.QUOTA_EXCEEDED;
            case UNREACHABLE, NOT_FOUND -> ProcessingException.Kind.STORE_UNREACHABLE;
        };
        return new ProcessingException(mapped, getMessage(), this);
    }
}
