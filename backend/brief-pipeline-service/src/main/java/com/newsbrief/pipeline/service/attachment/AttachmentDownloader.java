package com.newsbrief.pipeline.service.attachment;

import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.dto.AttachmentCandidate;
import com.newsbrief.pipeline.entity.AttachmentStatus;
import com.newsbrief.pipeline.exception.AttachmentException;
import com.newsbrief.pipeline.exception.JobCancelledException;
import com.newsbrief.pipeline.service.CancellationSignal;
import com.newsbrief.pipeline.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeoutException;

/**
 * 첨부파일 다운로드.
 *
 * 후보마다 독립된 타임아웃으로 내려받으며, 누적 크기가 상한을 넘는 즉시 전송을 끊고
 * 받은 바이트를 버립니다. 동시 다운로드 수는 사이클 단위 세마포어로 제한됩니다.
 */
@Service
@Slf4j
public class AttachmentDownloader {

    private static final int STORAGE_TITLE_LENGTH = 30;
    private static final int STORAGE_FILENAME_LENGTH = 100;

    private final WebClient webClient;
    private final Executor attachmentExecutor;

    public AttachmentDownloader(WebClient webClient,
                                @Qualifier("attachmentExecutor") Executor attachmentExecutor) {
        this.webClient = webClient;
        this.attachmentExecutor = attachmentExecutor;
    }

    /**
     * 후보 순서대로 결과를 반환합니다. 실패한 후보도 FAILED/SKIPPED 레코드로 포함됩니다.
     *
     * @param newsTitle 저장 이름 접두어로 쓰일 뉴스 제목
     * @param permits   사이클 전체가 공유하는 다운로드 허가
     * @throws JobCancelledException 작업이 취소된 경우 (받은 바이트는 모두 버려짐)
     */
    public List<Attachment> download(String newsTitle, List<AttachmentCandidate> candidates, DownloadPolicy policy,
                                     Semaphore permits, CancellationSignal signal) {
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<CompletableFuture<Attachment>> futures = candidates.stream()
                .map(candidate -> CompletableFuture.supplyAsync(
                        () -> downloadWithPermit(candidate, policy, permits, signal), attachmentExecutor))
                .toList();

        List<Attachment> results = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<Attachment> future : futures) {
                results.add(future.join());
            }
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        return assignStorageNames(newsTitle, results);
    }

    private Attachment downloadWithPermit(AttachmentCandidate candidate, DownloadPolicy policy,
                                          Semaphore permits, CancellationSignal signal) {
        signal.acquire(permits);
        try {
            return downloadOne(candidate, policy, signal);
        } finally {
            permits.release();
        }
    }

    Attachment downloadOne(AttachmentCandidate candidate, DownloadPolicy policy, CancellationSignal signal) {
        String url = candidate.url();
        try {
            Mono<Fetched> request = webClient.get()
                    .uri(URI.create(url))
                    .accept(MediaType.ALL)
                    .exchangeToMono(response -> readBody(response, policy.maxSize()))
                    .timeout(policy.timeout());

            Fetched fetched = signal.block(request);
            if (fetched == null) {
                return Attachment.failed(candidate, "empty response");
            }
            return toAttachment(candidate, fetched, policy);
        } catch (JobCancelledException e) {
            throw e;
        } catch (AttachmentException e) {
            log.info("Attachment {} {}: {}", url, e.getKind().getStatus(), e.getMessage());
            if (e.getKind().getStatus() == AttachmentStatus.FAILED) {
                return Attachment.failed(candidate, e.getMessage());
            }
            String type = e.getObservedType() != null ? e.getObservedType() : candidate.inferredType();
            return Attachment.skipped(candidate, e.getKind().getStatus(), type, e.getObservedSize(), e.getMessage());
        } catch (RuntimeException e) {
            if (isTimeout(e)) {
                log.warn("Attachment download timed out after {}s: {}", policy.timeout().toSeconds(), url);
                return Attachment.failed(candidate, "timeout after " + policy.timeout().toSeconds() + "s");
            }
            log.warn("Attachment download failed: {} - {}", url, e.getMessage());
            return Attachment.failed(candidate, e.getMessage());
        }
    }

    private boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    /**
     * 헤더로 크기/유형을 먼저 확인한 뒤, 본문을 읽으며 누적 크기를 검사
     */
    private Mono<Fetched> readBody(ClientResponse response, long maxSize) {
        if (!response.statusCode().is2xxSuccessful()) {
            return response.releaseBody()
                    .then(Mono.error(AttachmentException.failed("HTTP " + response.statusCode().value())));
        }
        long declared = response.headers().contentLength().orElse(-1L);
        if (declared > maxSize) {
            return response.releaseBody().then(Mono.error(AttachmentException.tooLarge(declared, maxSize)));
        }
        String contentType = response.headers().contentType().map(MediaType::toString).orElse(null);
        if (!AttachmentTypes.isDocumentContentType(contentType)) {
            return response.releaseBody().then(Mono.error(AttachmentException.rejectedType(contentType)));
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        return response.bodyToFlux(DataBuffer.class)
                .concatMap(buffer -> append(out, buffer, maxSize))
                .then(Mono.fromCallable(() -> new Fetched(out.toByteArray(), contentType)));
    }

    private Mono<Void> append(ByteArrayOutputStream out, DataBuffer buffer, long maxSize) {
        try {
            int readable = buffer.readableByteCount();
            long total = (long) out.size() + readable;
            if (total > maxSize) {
                out.reset();
                return Mono.error(AttachmentException.tooLarge(total, maxSize));
            }
            byte[] chunk = new byte[readable];
            buffer.read(chunk);
            out.write(chunk, 0, readable);
            return Mono.empty();
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private Attachment toAttachment(AttachmentCandidate candidate, Fetched fetched, DownloadPolicy policy) {
        String type = AttachmentTypes.knownTypeOf(candidate.filename())
                .or(() -> AttachmentTypes.fromContentType(fetched.contentType()))
                .orElse(candidate.inferredType());
        if (!policy.allows(type)) {
            log.info("Attachment {} resolved to disallowed type '{}'", candidate.url(), type);
            return Attachment.skipped(candidate, AttachmentStatus.SKIPPED_TYPE, type, fetched.bytes().length,
                    "type not allowed: " + type);
        }
        String filename = candidate.filename();
        if (AttachmentTypes.extensionOf(filename).isEmpty()) {
            filename = filename + "." + type;
        }
        log.debug("Downloaded attachment {} ({} bytes, {})", candidate.url(), fetched.bytes().length, type);
        return Attachment.downloaded(candidate, filename, type, fetched.bytes());
    }

    /**
     * 저장 이름 "뉴스제목_원본파일명". 같은 뉴스에서 이름이 겹치면 뒤의 것에 순번을 붙입니다.
     */
    List<Attachment> assignStorageNames(String newsTitle, List<Attachment> attachments) {
        String prefix = TextNormalizer.safeName(newsTitle, STORAGE_TITLE_LENGTH, false);
        Map<String, Integer> used = new HashMap<>();
        List<Attachment> named = new ArrayList<>(attachments.size());
        for (Attachment attachment : attachments) {
            if (!attachment.isDownloaded()) {
                named.add(attachment);
                continue;
            }
            String base = prefix + "_" + TextNormalizer.safeName(attachment.filename(), STORAGE_FILENAME_LENGTH, true);
            int seen = used.merge(base, 1, Integer::sum);
            String name = seen == 1 ? base : withCounter(base, seen - 1);
            named.add(new Attachment(attachment.itemFingerprint(), attachment.url(), name,
                    attachment.originalFilename(), attachment.type(), attachment.sizeBytes(), attachment.content(),
                    null, attachment.status(), null));
        }
        return named;
    }

    private String withCounter(String name, int counter) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return name + "_" + counter;
        }
        return name.substring(0, dot) + "_" + counter + name.substring(dot);
    }

    private record Fetched(byte[] bytes, String contentType) {
    }
}
