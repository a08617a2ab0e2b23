package com.newsbrief.pipeline.dto.tenant;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 테넌트별 전체 설정.
 *
 * 작업 디스패치 시점에 스냅샷으로 복사되어 전달되므로,
 * 한 사이클 동안 값이 바뀌지 않습니다.
 */
@Data
public class TenantConfig {

    @Valid
    @NotNull
    private SchedulerSettings scheduler = new SchedulerSettings();

    @Valid
    @NotNull
    private List<SourceConfig> sources = new ArrayList<>();

    @Valid
    @NotNull
    private CrawlSettings crawl = new CrawlSettings();

    @Valid
    @NotNull
    private ProcessorSettings processor = new ProcessorSettings();

    @Valid
    @NotNull
    private ReportSettings report = new ReportSettings();

    @Valid
    @NotNull
    private ScheduleSettings schedule = new ScheduleSettings();

    @Valid
    @NotNull
    private CleanupSettings cleanup = new CleanupSettings();

    public Optional<SourceConfig> findSource(String name) {
        return sources.stream()
                .filter(source -> source.getName().equals(name))
                .findFirst();
    }

    public List<SourceConfig> enabledSources() {
        return sources.stream()
                .filter(SourceConfig::isEnabled)
                .toList();
    }

    /**
     * 브리프 조회 대상 지식베이스. 별도 지정이 없으면 수집 대상 지식베이스를 사용.
     */
    public List<String> reportKbIds() {
        if (report.getKbIds() != null && !report.getKbIds().isEmpty()) {
            return List.copyOf(report.getKbIds());
        }
        return processor.getKbId() == null ? List.of() : List.of(processor.getKbId());
    }
}
