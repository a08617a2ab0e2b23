package com.newsbrief.pipeline.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.SimpleTriggerContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleExpressionsTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:30:00Z");

    @Test
    @DisplayName("5필드 cron은 초 필드를 붙여 해석한다")
    void fiveFieldCron() {
        assertThat(ScheduleExpressions.toCron("0 9 * * *")).isEqualTo("0 0 9 * * *");
        assertThat(ScheduleExpressions.toCron("30 0 9 * * MON")).isEqualTo("30 0 9 * * MON");
    }

    @Test
    @DisplayName("cron은 테넌트 시간대 기준으로 다음 실행 시각을 계산한다")
    void cronUsesTenantZone() {
        // given: UTC 00:30 = 서울 09:30
        Trigger trigger = ScheduleExpressions.toTrigger("0 9 * * *", ZoneId.of("Asia/Seoul"));

        // when
        Instant next = trigger.nextExecution(new SimpleTriggerContext(Clock.fixed(NOW, ZoneOffset.UTC)));

        // then: 다음날 서울 09:00
        assertThat(next).isEqualTo(Instant.parse("2024-05-02T00:00:00Z"));
    }

    @Test
    @DisplayName("주기 표현은 첫 실행까지 한 주기를 기다린다")
    void periodicTriggerWaitsOnePeriod() {
        Trigger trigger = ScheduleExpressions.toTrigger("every 30m", ZoneOffset.UTC);

        Instant next = trigger.nextExecution(new SimpleTriggerContext(Clock.fixed(NOW, ZoneOffset.UTC)));

        assertThat(next).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
    }

    @Test
    @DisplayName("every 표현과 ISO-8601 기간을 모두 해석한다")
    void parsesPeriods() {
        assertThat(ScheduleExpressions.parsePeriod("every 45s")).contains(Duration.ofSeconds(45));
        assertThat(ScheduleExpressions.parsePeriod("Every 2H")).contains(Duration.ofHours(2));
        assertThat(ScheduleExpressions.parsePeriod("every 1d")).contains(Duration.ofDays(1));
        assertThat(ScheduleExpressions.parsePeriod("PT2H")).contains(Duration.ofHours(2));
        assertThat(ScheduleExpressions.parsePeriod("0 9 * * *")).isEmpty();
    }

    @Test
    @DisplayName("잘못된 ISO 기간은 IllegalArgumentException")
    void invalidIsoPeriod() {
        assertThatThrownBy(() -> ScheduleExpressions.parsePeriod("PTX"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("PTX");
    }

    @ParameterizedTest
    @ValueSource(strings = {"0 */2 * * *", "0 0 2 * * SUN", "every 15m", "every 1d", "PT6H"})
    @DisplayName("유효한 표현식은 오류 메시지가 없다")
    void validExpressions(String expression) {
        assertThat(ScheduleExpressions.validate(expression)).isEmpty();
    }

    @Test
    @DisplayName("잘못된 표현식은 사유를 돌려준다")
    void invalidExpressions() {
        assertThat(ScheduleExpressions.validate("")).contains("expression is empty");
        assertThat(ScheduleExpressions.validate("61 * * * *")).hasValueSatisfying(
                message -> assertThat(message).contains("invalid cron"));
        assertThat(ScheduleExpressions.validate("* * *")).hasValueSatisfying(
                message -> assertThat(message).contains("5 or 6 fields"));
        assertThat(ScheduleExpressions.validate("every 0m")).hasValueSatisfying(
                message -> assertThat(message).contains("positive"));
        assertThat(ScheduleExpressions.validate("P1Y")).isPresent();
    }
}
