package com.newsbrief.pipeline.scheduler;

import com.newsbrief.pipeline.config.NewsBriefProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 작업 실행 이력 보관. 테넌트별로 종료된 작업은 설정된 개수까지만 유지합니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobRunRegistry {

    private final NewsBriefProperties properties;
    private final Map<String, JobRun> runs = new ConcurrentHashMap<>();

    public void register(JobRun run) {
        runs.put(run.getJobId(), run);
    }

    public Optional<JobRun> find(String jobId) {
        return Optional.ofNullable(runs.get(jobId));
    }

    /**
     * 테넌트의 작업 목록 (최근 생성순)
     */
    public List<JobRun> findByTenant(String tenantId) {
        return runs.values().stream()
                .filter(run -> run.getTenantId().equals(tenantId))
                .sorted(Comparator.comparing(JobRun::getCreatedAt).reversed())
                .toList();
    }

    public List<JobRun> recent(int limit) {
        return runs.values().stream()
                .sorted(Comparator.comparing(JobRun::getCreatedAt).reversed())
                .limit(limit)
                .toList();
    }

    /**
     * 보관 개수를 넘는 오래된 종료 작업 제거
     */
    public void trim(String tenantId) {
        int limit = properties.getScheduler().getHistorySize();
        List<JobRun> finished = findByTenant(tenantId).stream()
                .filter(JobRun::isFinished)
                .toList();
        for (int i = limit; i < finished.size(); i++) {
            runs.remove(finished.get(i).getJobId());
        }
    }

    /**
     * cutoff 이전에 종료된 작업 제거
     *
     * @return 제거된 수
     */
    public int pruneFinishedBefore(String tenantId, Instant cutoff) {
        int removed = 0;
        Iterator<JobRun> it = runs.values().iterator();
        while (it.hasNext()) {
            JobRun run = it.next();
            if (run.getTenantId().equals(tenantId) && run.isFinished()
                    && run.getFinishedAt() != null && run.getFinishedAt().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Pruned {} finished jobs of tenant {} before {}", removed, tenantId, cutoff);
        }
        return removed;
    }
}
