package com.newsbrief.pipeline.service.report;

import com.newsbrief.pipeline.dto.Brief;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 생성된 브리프 보관소 (프로세스 메모리)
 */
@Component
@Slf4j
public class BriefStore {

    private final Map<String, Brief> briefs = new ConcurrentHashMap<>();

    public Brief save(Brief brief) {
        briefs.put(brief.briefId(), brief);
        return brief;
    }

    public Optional<Brief> find(String briefId) {
        return Optional.ofNullable(briefs.get(briefId));
    }

    public List<Brief> findByTenant(String tenantId) {
        return briefs.values().stream()
                .filter(brief -> brief.tenantId().equals(tenantId))
                .sorted(Comparator.comparing(Brief::generatedAt).reversed())
                .toList();
    }

    /**
     * 테넌트의 브리프 중 cutoff 이전에 생성된 것 삭제
     */
    public int pruneBefore(String tenantId, Instant cutoff) {
        List<String> expired = briefs.values().stream()
                .filter(brief -> brief.tenantId().equals(tenantId) && brief.generatedAt().isBefore(cutoff))
                .map(Brief::briefId)
                .toList();
        expired.forEach(briefs::remove);
        if (!expired.isEmpty()) {
            log.info("Pruned {} briefs of tenant {} generated before {}", expired.size(), tenantId, cutoff);
        }
        return expired.size();
    }
}
