package com.newsbrief.pipeline.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsbrief.pipeline.dto.tenant.ScheduleSettings;
import com.newsbrief.pipeline.dto.tenant.SourceConfig;
import com.newsbrief.pipeline.dto.tenant.TenantConfig;
import com.newsbrief.pipeline.exception.SchedulerException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 테넌트 설정 보관 및 검증.
 *
 * 저장과 조회 모두 복사본을 주고받으므로, 실행 중인 작업은 디스패치 시점의 설정만 봅니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TenantConfigService {

    private final Validator validator;
    private final ObjectMapper objectMapper;
    private final Map<String, TenantConfig> configs = new ConcurrentHashMap<>();

    /**
     * 검증 후 저장. 잘못된 설정이면 기존 설정을 유지하고 CONFIG_INVALID를 던집니다.
     */
    public TenantConfig put(String tenantId, TenantConfig config) {
        List<String> violations = validate(config);
        if (!violations.isEmpty()) {
            log.warn("Rejected configuration for tenant {}: {}", tenantId, violations);
            throw SchedulerException.configInvalid(tenantId, violations);
        }
        TenantConfig stored = copy(config);
        configs.put(tenantId, stored);
        log.info("Configuration updated for tenant {} ({} sources)", tenantId, stored.getSources().size());
        return copy(stored);
    }

    public Optional<TenantConfig> find(String tenantId) {
        return Optional.ofNullable(configs.get(tenantId)).map(this::copy);
    }

    /**
     * 작업 전달용 스냅샷
     */
    public TenantConfig snapshot(String tenantId) {
        return find(tenantId).orElseThrow(() -> SchedulerException.unknownTenant(tenantId));
    }

    public boolean remove(String tenantId) {
        return configs.remove(tenantId) != null;
    }

    public Set<String> tenantIds() {
        return new TreeSet<>(configs.keySet());
    }

    public List<String> validate(TenantConfig config) {
        List<String> violations = new ArrayList<>();
        if (config == null) {
            violations.add("config: must not be null");
            return violations;
        }
        for (ConstraintViolation<TenantConfig> v : validator.validate(config)) {
            violations.add(v.getPropertyPath() + ": " + v.getMessage());
        }
        violations.sort(String::compareTo);

        if (config.getScheduler() != null && config.getScheduler().getTimezone() != null) {
            try {
                ZoneId.of(config.getScheduler().getTimezone());
            } catch (DateTimeException e) {
                violations.add("scheduler.timezone: unknown time zone " + config.getScheduler().getTimezone());
            }
        }

        ScheduleSettings schedule = config.getSchedule();
        if (schedule != null) {
            checkSchedule("schedule.crawlSchedule", schedule.getCrawlSchedule(), violations);
            checkSchedule("schedule.reportSchedule", schedule.getReportSchedule(), violations);
            checkSchedule("schedule.cleanupSchedule", schedule.getCleanupSchedule(), violations);
        }

        if (config.getSources() != null) {
            Set<String> names = new HashSet<>();
            for (SourceConfig source : config.getSources()) {
                if (source == null || source.getName() == null) {
                    continue;
                }
                if (!names.add(source.getName())) {
                    violations.add("sources: duplicate source name '" + source.getName() + "'");
                }
                if (source.getEndpointUrl() != null && !isHttpUrl(source.fetchUrl())) {
                    violations.add("sources[" + source.getName() + "]: not an http(s) URL: " + source.fetchUrl());
                }
            }
        }
        return violations;
    }

    private void checkSchedule(String field, String expression, List<String> violations) {
        if (expression == null || expression.isBlank()) {
            return;
        }
        ScheduleExpressions.validate(expression)
                .ifPresent(message -> violations.add(field + ": " + message));
    }

    private boolean isHttpUrl(String url) {
        try {
            URI uri = URI.create(url.trim());
            return uri.getHost() != null
                    && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private TenantConfig copy(TenantConfig config) {
        try {
            return objectMapper.readValue(objectMapper.writeValueAsBytes(config), TenantConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy tenant configuration", e);
        }
    }
}
