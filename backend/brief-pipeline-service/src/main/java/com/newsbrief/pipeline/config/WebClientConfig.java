package com.newsbrief.pipeline.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final NewsBriefProperties properties;

    @Bean
    public WebClient webClient() {
        NewsBriefProperties.Http http = properties.getHttp();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, http.getConnectTimeoutMs())
                .responseTimeout(Duration.ofMillis(http.getReadTimeoutMs()))
                .doOnConnected(conn ->
                    conn.addHandlerLast(new ReadTimeoutHandler(http.getReadTimeoutMs(), TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(http.getReadTimeoutMs(), TimeUnit.MILLISECONDS))
                )
                .followRedirect(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("User-Agent", http.getUserAgent())
                .defaultHeader("Accept-Language", "zh-CN,zh;q=0.9,ko;q=0.8,en;q=0.7")
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(http.getMaxInMemorySize()))
                .build();
    }
}
