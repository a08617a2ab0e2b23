package com.newsbrief.pipeline.scheduler;

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 일정 표현식 해석.
 *
 * 지원 형식:
 * <ul>
 *   <li>5필드 cron ("0 9 * * *", 분 단위) 또는 6필드 cron (초 포함)</li>
 *   <li>주기 "every 30m", "every 2h", "every 1d", "every 45s"</li>
 *   <li>ISO-8601 기간 "PT2H"</li>
 * </ul>
 * cron은 테넌트 시간대 기준으로 평가됩니다.
 */
public final class ScheduleExpressions {

    private static final Pattern EVERY = Pattern.compile("^every\\s+(\\d+)\\s*([smhd])$");

    private ScheduleExpressions() {
    }

    public static Trigger toTrigger(String expression, ZoneId zone) {
        Optional<Duration> period = parsePeriod(expression);
        if (period.isPresent()) {
            PeriodicTrigger trigger = new PeriodicTrigger(period.get());
            trigger.setInitialDelay(period.get());
            return trigger;
        }
        return new CronTrigger(toCron(expression), zone);
    }

    /**
     * @return 오류 메시지 (유효하면 empty)
     */
    public static Optional<String> validate(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.of("expression is empty");
        }
        Optional<Duration> period;
        try {
            period = parsePeriod(expression);
        } catch (IllegalArgumentException e) {
            return Optional.of(e.getMessage());
        }
        if (period.isPresent()) {
            return period.get().isZero() || period.get().isNegative()
                    ? Optional.of("interval must be positive: " + expression)
                    : Optional.empty();
        }
        try {
            String cron = toCron(expression);
            return CronExpression.isValidExpression(cron)
                    ? Optional.empty()
                    : Optional.of("invalid cron expression: " + expression);
        } catch (IllegalArgumentException e) {
            return Optional.of(e.getMessage());
        }
    }

    static String toCron(String expression) {
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        if (fields.length == 5) {
            return "0 " + trimmed;
        }
        if (fields.length == 6) {
            return trimmed;
        }
        throw new IllegalArgumentException("cron expression must have 5 or 6 fields: " + expression);
    }

    static Optional<Duration> parsePeriod(String expression) {
        String value = expression.trim().toLowerCase(Locale.ROOT);
        Matcher m = EVERY.matcher(value);
        if (m.matches()) {
            long amount = Long.parseLong(m.group(1));
            return Optional.of(switch (m.group(2)) {
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                default -> Duration.ofDays(amount);
            });
        }
        if (value.startsWith("p")) {
            try {
                return Optional.of(Duration.parse(expression.trim()));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("invalid ISO-8601 interval: " + expression, e);
            }
        }
        return Optional.empty();
    }
}
