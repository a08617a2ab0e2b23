package com.newsbrief.pipeline.service.notification;

import com.newsbrief.pipeline.config.NewsBriefProperties;
import com.newsbrief.pipeline.dto.JobOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * 웹훅으로 작업 결과 전송 (JSON POST, 응답을 기다리지 않음)
 */
@Component
@ConditionalOnProperty(prefix = "newsbrief.notification", name = "webhook-url")
@RequiredArgsConstructor
@Slf4j
public class WebhookNotificationSink implements NotificationSink {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient;
    private final NewsBriefProperties properties;

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public void notify(JobOutcome outcome) {
        String url = properties.getNotification().getWebhookUrl();
        if (url == null || url.isBlank()) {
            return;
        }
        webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(outcome)
                .retrieve()
                .toBodilessEntity()
                .timeout(TIMEOUT)
                .subscribe(
                        response -> log.debug("Webhook accepted job {} ({})", outcome.jobId(), response.getStatusCode()),
                        error -> log.warn("Webhook delivery failed for job {}: {}", outcome.jobId(), error.getMessage())
                );
    }
}
