package com.newsbrief.pipeline.config;

import com.newsbrief.pipeline.dto.tenant.TenantConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 서비스 전역 설정.
 *
 * application.yml 또는 환경변수로 조정할 수 있으며,
 * tenants 항목은 시작 시 테넌트 설정으로 등록됩니다.
 */
@ConfigurationProperties(prefix = "newsbrief")
@Data
public class NewsBriefProperties {

    private Http http = new Http();

    private Fetch fetch = new Fetch();

    private Executor executor = new Executor();

    private Scheduler scheduler = new Scheduler();

    private Store store = new Store();

    private Notification notification = new Notification();

    /**
     * 시작 시 등록할 테넌트 설정 (tenantId -> 설정)
     */
    private Map<String, TenantConfig> tenants = new LinkedHashMap<>();

    @Data
    public static class Http {
        private String userAgent = "Mozilla/5.0 (compatible; NewsBrief-Collector/1.0)";
        private int connectTimeoutMs = 10000;
        private int readTimeoutMs = 30000;
        /**
         * WebClient 메모리 버퍼 상한 (피드/페이지 본문용)
         */
        private int maxInMemorySize = 8 * 1024 * 1024;
    }

    @Data
    public static class Fetch {
        /**
         * 소스 조회 최대 시도 횟수 (최초 1회 포함)
         */
        private int maxAttempts = 3;
        private long initialBackoffMs = 500;
        private long maxBackoffMs = 5000;
    }

    @Data
    public static class Executor {
        private int crawlPoolSize = 8;
        private int attachmentPoolSize = 16;
        private int jobPoolSize = 16;
        private int schedulerPoolSize = 4;
    }

    @Data
    public static class Scheduler {
        /**
         * 시작 시 스케줄러 자동 기동
         */
        private boolean autoStart = true;
        /**
         * 테넌트별로 보관할 최근 작업 이력 수
         */
        private int historySize = 200;
    }

    @Data
    public static class Store {
        /**
         * 지식베이스당 최대 문서 수 (0 = 무제한)
         */
        private long maxDocumentsPerKb = 0;
    }

    @Data
    public static class Notification {
        /**
         * 작업 종료 알림 웹훅 URL (비어 있으면 로그로만 기록)
         */
        private String webhookUrl;
    }
}
