package com.newsbrief.pipeline.exception;

/**
 * 첨부파일 텍스트 추출 실패
 */
public class TextExtractionException extends PipelineException {

    public enum Kind {
        UNSUPPORTED_FORMAT,
        CORRUPT_FILE
    }

    private final Kind kind;

    public TextExtractionException(Kind kind, String message) {
        super("EXTRACT_" + kind.name(), message);
        this.kind = kind;
    }

    public TextExtractionException(Kind kind, String message, Throwable cause) {
        super("EXTRACT_" + kind.name(), message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static TextExtractionException unsupported(String type) {
        return new TextExtractionException(Kind.UNSUPPORTED_FORMAT, "Unsupported attachment type: " + type);
    }

    public static TextExtractionException corrupt(String type, Throwable cause) {
        return new TextExtractionException(Kind.CORRUPT_FILE,
                "Corrupt " + type + " attachment: " + cause.getMessage(), cause);
    }
}
