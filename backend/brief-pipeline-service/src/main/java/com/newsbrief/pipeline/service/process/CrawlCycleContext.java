package com.newsbrief.pipeline.service.process;

import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.dto.CrawlCycleResult;
import com.newsbrief.pipeline.dto.SourceError;
import com.newsbrief.pipeline.dto.tenant.TenantConfig;
import com.newsbrief.pipeline.entity.AttachmentStatus;
import com.newsbrief.pipeline.service.CancellationSignal;
import com.newsbrief.pipeline.service.attachment.DownloadPolicy;
import com.newsbrief.pipeline.service.fetch.FetchContext;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 수집 사이클 1회의 상태. 사이클이 끝나면 버려집니다.
 */
final class CrawlCycleContext {

    private final String tenantId;
    private final TenantConfig config;
    private final CancellationSignal signal;
    private final Instant now;
    private final Semaphore downloadPermits;
    private final FetchContext fetchContext;
    private final DownloadPolicy downloadPolicy;

    private final Set<String> claimedFingerprints = ConcurrentHashMap.newKeySet();
    private final AtomicReference<RuntimeException> fatal = new AtomicReference<>();

    private final AtomicInteger sourcesAttempted = new AtomicInteger();
    private final AtomicInteger sourcesFailed = new AtomicInteger();
    private final AtomicInteger itemsFetched = new AtomicInteger();
    private final AtomicInteger itemsFiltered = new AtomicInteger();
    private final AtomicInteger itemsDuplicate = new AtomicInteger();
    private final AtomicInteger itemsProcessed = new AtomicInteger();
    private final AtomicInteger itemsFailed = new AtomicInteger();
    private final Map<AttachmentStatus, AtomicInteger> attachments = new EnumMap<>(AttachmentStatus.class);
    private final Queue<SourceError> sourceErrors = new ConcurrentLinkedQueue<>();
    private final Queue<SourceError> itemErrors = new ConcurrentLinkedQueue<>();

    CrawlCycleContext(String tenantId, TenantConfig config, CancellationSignal signal, Instant now) {
        this.tenantId = tenantId;
        this.config = config;
        this.signal = signal;
        this.now = now;
        this.downloadPermits = new Semaphore(config.getCrawl().getDownloadWorkers());
        this.fetchContext = new FetchContext(Duration.ofSeconds(config.getCrawl().getFetchTimeout()),
                ZoneId.of(config.getScheduler().getTimezone()), signal);
        this.downloadPolicy = DownloadPolicy.from(config.getProcessor());
        for (AttachmentStatus status : AttachmentStatus.values()) {
            attachments.put(status, new AtomicInteger());
        }
    }

    String tenantId() {
        return tenantId;
    }

    TenantConfig config() {
        return config;
    }

    CancellationSignal signal() {
        return signal;
    }

    Instant now() {
        return now;
    }

    Semaphore downloadPermits() {
        return downloadPermits;
    }

    FetchContext fetchContext() {
        return fetchContext;
    }

    DownloadPolicy downloadPolicy() {
        return downloadPolicy;
    }

    /**
     * 이번 사이클에서 이 지문을 처음 처리하는 경우에만 true
     */
    boolean claim(String fingerprint) {
        return claimedFingerprints.add(fingerprint);
    }

    /**
     * 작업 전체를 중단해야 하는 오류 기록. 나머지 소스는 취소 신호로 멈춥니다.
     */
    void abort(RuntimeException e) {
        if (fatal.compareAndSet(null, e)) {
            signal.cancel("aborted: " + e.getMessage());
        }
    }

    RuntimeException fatal() {
        return fatal.get();
    }

    void sourceAttempted() {
        sourcesAttempted.incrementAndGet();
    }

    void sourceFailed(SourceError error) {
        sourcesFailed.incrementAndGet();
        sourceErrors.add(error);
    }

    void fetched(int count) {
        itemsFetched.addAndGet(count);
    }

    void filtered(int count) {
        itemsFiltered.addAndGet(count);
    }

    void duplicate() {
        itemsDuplicate.incrementAndGet();
    }

    void processed() {
        itemsProcessed.incrementAndGet();
    }

    void itemFailed(SourceError error) {
        itemsFailed.incrementAndGet();
        itemErrors.add(error);
    }

    void attachment(Attachment attachment) {
        attachments.get(attachment.status()).incrementAndGet();
    }

    CrawlCycleResult toResult() {
        Map<AttachmentStatus, Integer> counts = new EnumMap<>(AttachmentStatus.class);
        attachments.forEach((status, count) -> counts.put(status, count.get()));
        return new CrawlCycleResult(sourcesAttempted.get(), sourcesFailed.get(), itemsFetched.get(),
                itemsFiltered.get(), itemsDuplicate.get(), itemsProcessed.get(), itemsFailed.get(),
                counts, List.copyOf(new ArrayList<>(sourceErrors)), List.copyOf(new ArrayList<>(itemErrors)));
    }
}
