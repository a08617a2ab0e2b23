package com.newsbrief.pipeline.support;

import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.dto.ProcessedNews;
import com.newsbrief.pipeline.exception.ContentStoreException;
import com.newsbrief.pipeline.service.store.ContentStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 테스트용 메모리 저장소. 지식베이스별 지문 upsert와 쓰기 횟수 기록만 지원합니다.
 */
public class InMemoryContentStore implements ContentStore {

    private final Map<String, Map<String, ProcessedNews>> news = new ConcurrentHashMap<>();
    private final Map<String, Map<String, byte[]>> blobs = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();
    private volatile ContentStoreException failure;

    /**
     * 이후 모든 호출이 주어진 예외로 실패
     */
    public void failWith(ContentStoreException e) {
        this.failure = e;
    }

    public int writes() {
        return writes.get();
    }

    public List<ProcessedNews> all(String kbId) {
        return new ArrayList<>(news.getOrDefault(kbId, Map.of()).values());
    }

    public void seed(String kbId, ProcessedNews entry) {
        news.computeIfAbsent(kbId, k -> new ConcurrentHashMap<>()).put(entry.fingerprint(), entry);
    }

    @Override
    public String put(String kbId, ProcessedNews entry) {
        check();
        writes.incrementAndGet();
        seed(kbId, entry);
        return kbId + "/" + entry.fingerprint();
    }

    @Override
    public String putBlob(String kbId, Attachment attachment) {
        check();
        blobs.computeIfAbsent(kbId, k -> new ConcurrentHashMap<>()).put(attachment.filename(), attachment.content());
        return attachment.filename();
    }

    @Override
    public List<ProcessedNews> query(String kbId, Instant from, Instant to) {
        check();
        return news.getOrDefault(kbId, Map.of()).values().stream()
                .filter(n -> !n.storedAt().isBefore(from) && n.storedAt().isBefore(to))
                .sorted(Comparator.comparing(ProcessedNews::storedAt).reversed()
                        .thenComparing(ProcessedNews::fingerprint))
                .toList();
    }

    @Override
    public boolean contains(String kbId, String fingerprint) {
        check();
        return news.getOrDefault(kbId, Map.of()).containsKey(fingerprint);
    }

    @Override
    public Optional<byte[]> getBlob(String kbId, String storageRef) {
        check();
        return Optional.ofNullable(blobs.getOrDefault(kbId, Map.of()).get(storageRef));
    }

    @Override
    public List<Attachment> findAttachments(String kbId, String filename, String type) {
        check();
        return List.of();
    }

    @Override
    public int purgeBefore(String kbId, Instant cutoff) {
        check();
        Map<String, ProcessedNews> entries = news.getOrDefault(kbId, Map.of());
        int before = entries.size();
        entries.values().removeIf(n -> n.storedAt().isBefore(cutoff));
        return before - entries.size();
    }

    private void check() {
        ContentStoreException current = failure;
        if (current != null) {
            throw current;
        }
    }
}
