package com.newsbrief.pipeline.exception;

/**
 * 브리프 생성 실패 예외
 */
public class GenerationException extends PipelineException {

    public enum Kind {
        NO_CONTENT,
        KB_UNREACHABLE
    }

    private final Kind kind;

    public GenerationException(Kind kind, String message) {
        super("GENERATION_" + kind.name(), message);
        this.kind = kind;
    }

    public GenerationException(Kind kind, String message, Throwable cause) {
        super("GENERATION_" + kind.name(), message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static GenerationException noContent(String window) {
        return new GenerationException(Kind.NO_CONTENT, "No content available for window " + window);
    }

    public static GenerationException kbUnreachable(String kbId, Throwable cause) {
        return new GenerationException(Kind.KB_UNREACHABLE,
                "Knowledge base unreachable: " + kbId + " - " + cause.getMessage(), cause);
    }
}
