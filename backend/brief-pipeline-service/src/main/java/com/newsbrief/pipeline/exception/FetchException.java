package com.newsbrief.pipeline.exception;

/**
 * 소스 조회 실패 예외
 */
public class FetchException extends PipelineException {

    public enum Kind {
        UNREACHABLE,
        MALFORMED,
        TIMEOUT
    }

    private final Kind kind;
    private final String url;
    private final boolean retryable;

    public FetchException(Kind kind, String url, String message) {
        super("FETCH_" + kind.name(), message);
        this.kind = kind;
        this.url = url;
        this.retryable = kind != Kind.MALFORMED;
    }

    public FetchException(Kind kind, String url, String message, Throwable cause) {
        this(kind, url, message, cause, kind != Kind.MALFORMED);
    }

    public FetchException(Kind kind, String url, String message, Throwable cause, boolean retryable) {
        super("FETCH_" + kind.name(), message, cause);
        this.kind = kind;
        this.url = url;
        this.retryable = retryable;
    }

    public Kind getKind() {
        return kind;
    }

    public String getUrl() {
        return url;
    }

    /**
     * 재시도 대상 여부 (파싱 오류, 4xx 응답은 재시도해도 결과가 같음)
     */
    public boolean isRetryable() {
        return retryable;
    }

    public static FetchException unreachable(String url, Throwable cause) {
        return new FetchException(Kind.UNREACHABLE, url,
                "Source unreachable: " + url + " - " + cause.getMessage(), cause);
    }

    public static FetchException rejected(String url, int status, Throwable cause) {
        return new FetchException(Kind.UNREACHABLE, url, "Source responded HTTP " + status + ": " + url, cause, false);
    }

    public static FetchException timeout(String url) {
        return new FetchException(Kind.TIMEOUT, url, "Source timed out: " + url);
    }

    public static FetchException malformed(String url, String reason) {
        return new FetchException(Kind.MALFORMED, url, "Malformed content from " + url + ": " + reason);
    }

    public static FetchException malformed(String url, Throwable cause) {
        return new FetchException(Kind.MALFORMED, url,
                "Malformed content from " + url + ": " + cause.getMessage(), cause);
    }
}
