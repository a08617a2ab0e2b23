package com.newsbrief.pipeline.service.fetch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class PublishedDateParserTest {

    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");

    @Test
    @DisplayName("ISO-8601/RFC-1123 형식은 자체 오프셋 사용")
    void offsetFormats() {
        assertThat(PublishedDateParser.parse("2024-05-01T09:00:00+09:00", ZoneOffset.UTC))
                .contains(Instant.parse("2024-05-01T00:00:00Z"));
        assertThat(PublishedDateParser.parse("Wed, 01 May 2024 08:00:00 GMT", SEOUL))
                .contains(Instant.parse("2024-05-01T08:00:00Z"));
    }

    @Test
    @DisplayName("현지 날짜 표기는 테넌트 시간대로 해석")
    void localFormats() {
        assertThat(PublishedDateParser.parse("2024/05/01 09:30", SEOUL))
                .contains(Instant.parse("2024-05-01T00:30:00Z"));
        assertThat(PublishedDateParser.parse("发布时间：2024年5月1日", SEOUL))
                .contains(Instant.parse("2024-04-30T15:00:00Z"));
    }

    @Test
    @DisplayName("해석할 수 없으면 빈 값")
    void unparseable() {
        assertThat(PublishedDateParser.parse("yesterday", SEOUL)).isEmpty();
        assertThat(PublishedDateParser.parse("2024-13-45", SEOUL)).isEmpty();
        assertThat(PublishedDateParser.parse(null, SEOUL)).isEmpty();
    }
}
