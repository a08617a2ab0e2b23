package com.newsbrief.pipeline.service.fetch;

import com.newsbrief.pipeline.config.NewsBriefProperties;
import com.newsbrief.pipeline.exception.FetchException;
import com.newsbrief.pipeline.exception.JobCancelledException;
import com.newsbrief.pipeline.service.CancellationSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * 소스/기사 페이지 조회.
 * 네트워크 오류와 타임아웃은 지수 백오프로 재시도한 뒤 FetchException으로 전달합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HttpFetcher {

    private final WebClient webClient;
    private final NewsBriefProperties properties;

    /**
     * HTML 페이지 조회 후 파싱.
     * 문자셋은 Content-Type 헤더를 우선하고, 없으면 BOM과 meta charset으로 판별합니다 (기본 UTF-8).
     */
    public Document fetchDocument(String url, FetchContext context) {
        ResponseEntity<byte[]> response = fetch(url, context);
        String charset = charsetOf(url, response.getHeaders().getContentType());
        try {
            return Jsoup.parse(new ByteArrayInputStream(response.getBody()), charset, url);
        } catch (IOException e) {
            throw FetchException.malformed(url, e);
        }
    }

    public byte[] fetchBytes(String url, FetchContext context) {
        return fetch(url, context).getBody();
    }

    private ResponseEntity<byte[]> fetch(String url, FetchContext context) {
        CancellationSignal signal = context.signal();
        NewsBriefProperties.Fetch fetch = properties.getFetch();

        Mono<ResponseEntity<byte[]>> request = Mono.defer(() -> webClient.get()
                        .uri(toUri(url))
                        .accept(MediaType.ALL)
                        .retrieve()
                        .toEntity(byte[].class))
                .timeout(context.timeout())
                .onErrorMap(e -> !(e instanceof FetchException) && !(e instanceof JobCancelledException),
                        e -> classify(url, e))
                .retryWhen(Retry.backoff(Math.max(0, fetch.getMaxAttempts() - 1),
                                Duration.ofMillis(fetch.getInitialBackoffMs()))
                        .maxBackoff(Duration.ofMillis(fetch.getMaxBackoffMs()))
                        .filter(e -> e instanceof FetchException fe && fe.isRetryable() && !signal.isCancelled())
                        .doBeforeRetry(rs -> log.debug("Retrying fetch of {} (attempt {}): {}",
                                url, rs.totalRetries() + 2, rs.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, rs) -> rs.failure()));

        ResponseEntity<byte[]> response = signal.block(request);
        if (response == null || response.getBody() == null || response.getBody().length == 0) {
            throw FetchException.malformed(url, "empty response");
        }
        return response;
    }

    private String charsetOf(String url, MediaType contentType) {
        if (contentType == null) {
            return null;
        }
        try {
            Charset charset = contentType.getCharset();
            return charset != null ? charset.name() : null;
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unsupported charset in Content-Type of {}: {}", url, contentType);
            return null;
        }
    }

    private FetchException classify(String url, Throwable e) {
        if (e instanceof TimeoutException) {
            return FetchException.timeout(url);
        }
        if (e instanceof WebClientResponseException wre) {
            int status = wre.getStatusCode().value();
            if (wre.getStatusCode().is4xxClientError() && status != 408 && status != 429) {
                return FetchException.rejected(url, status, e);
            }
        }
        return FetchException.unreachable(url, e);
    }

    private URI toUri(String url) {
        try {
            return URI.create(url.trim().replace(" ", "%20"));
        } catch (IllegalArgumentException e) {
            throw FetchException.malformed(url, e);
        }
    }
}
