package com.newsbrief.pipeline.service;

import com.newsbrief.pipeline.exception.JobCancelledException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * JobRun에 묶인 협조적 취소 신호.
 *
 * 네트워크 조회, 다운로드, 저장소 기록 등 모든 블로킹 지점에서 확인되며,
 * 리액티브 요청에는 takeUntilOther로 연결되어 취소 즉시 구독이 해제됩니다.
 */
public final class CancellationSignal {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final Sinks.One<String> sink = Sinks.one();
    private volatile String reason;

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * @return 이번 호출로 취소되었으면 true, 이미 취소된 상태면 false
     */
    public synchronized boolean cancel(String cancelReason) {
        if (reason != null) {
            return false;
        }
        reason = cancelReason == null ? "cancelled" : cancelReason;
        sink.tryEmitValue(reason);
        return true;
    }

    public boolean isCancelled() {
        return reason != null;
    }

    public String reason() {
        return reason;
    }

    public void throwIfCancelled() {
        String current = reason;
        if (current != null) {
            throw new JobCancelledException(current);
        }
    }

    public Mono<String> whenCancelled() {
        return sink.asMono();
    }

    /**
     * 취소 시 즉시 JobCancelledException으로 끝나는 Mono
     */
    public <T> Mono<T> guard(Mono<T> source) {
        return source.takeUntilOther(whenCancelled())
                .switchIfEmpty(Mono.defer(() -> isCancelled()
                        ? Mono.error(new JobCancelledException(reason))
                        : Mono.empty()));
    }

    /**
     * guard 후 블로킹 대기
     */
    public <T> T block(Mono<T> source) {
        throwIfCancelled();
        return guard(source).block();
    }

    /**
     * 취소를 확인하면서 세마포어 허가 획득
     */
    public void acquire(Semaphore semaphore) {
        try {
            while (!semaphore.tryAcquire(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
                throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException("interrupted");
        }
        if (isCancelled()) {
            semaphore.release();
            throwIfCancelled();
        }
    }
}
