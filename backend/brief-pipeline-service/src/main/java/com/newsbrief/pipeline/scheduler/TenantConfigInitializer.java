package com.newsbrief.pipeline.scheduler;

import com.newsbrief.pipeline.config.NewsBriefProperties;
import com.newsbrief.pipeline.dto.tenant.TenantConfig;
import com.newsbrief.pipeline.exception.SchedulerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 시작 시 application.yml의 테넌트 설정을 등록하고 스케줄러를 기동합니다.
 * 잘못된 설정의 테넌트는 등록하지 않고 나머지 테넌트로 계속 진행합니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TenantConfigInitializer implements ApplicationRunner {

    private final NewsBriefProperties properties;
    private final SchedulerService schedulerService;

    @Override
    public void run(ApplicationArguments args) {
        int registered = 0;
        for (Map.Entry<String, TenantConfig> entry : properties.getTenants().entrySet()) {
            try {
                schedulerService.updateConfig(entry.getKey(), entry.getValue());
                registered++;
            } catch (SchedulerException e) {
                log.error("Tenant {} not started: {}", entry.getKey(), e.getViolations());
            }
        }
        log.info("Registered {} of {} configured tenants", registered, properties.getTenants().size());

        if (properties.getScheduler().isAutoStart()) {
            schedulerService.start();
        }
    }
}
