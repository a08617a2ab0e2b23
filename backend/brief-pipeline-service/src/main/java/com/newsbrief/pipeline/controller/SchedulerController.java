package com.newsbrief.pipeline.controller;

import com.newsbrief.pipeline.dto.Brief;
import com.newsbrief.pipeline.dto.JobRunDTO;
import com.newsbrief.pipeline.dto.ReportRequest;
import com.newsbrief.pipeline.dto.SchedulerStatusDTO;
import com.newsbrief.pipeline.dto.TestCrawlRequest;
import com.newsbrief.pipeline.dto.TestCrawlResponse;
import com.newsbrief.pipeline.dto.tenant.TenantConfig;
import com.newsbrief.pipeline.entity.JobKind;
import com.newsbrief.pipeline.scheduler.SchedulerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final SchedulerService schedulerService;

    /**
     * GET /api/v1/scheduler/tenants/{tenantId}/config - 테넌트 설정 조회
     */
    @GetMapping("/tenants/{tenantId}/config")
    public ResponseEntity<TenantConfig> getConfig(@PathVariable String tenantId) {
        return ResponseEntity.ok(schedulerService.getConfig(tenantId));
    }

    /**
     * PUT /api/v1/scheduler/tenants/{tenantId}/config - 테넌트 설정 등록/갱신 (검증 실패 시 400, 기존 설정 유지)
     */
    @PutMapping("/tenants/{tenantId}/config")
    public ResponseEntity<TenantConfig> updateConfig(@PathVariable String tenantId,
                                                     @RequestBody TenantConfig config) {
        return ResponseEntity.ok(schedulerService.updateConfig(tenantId, config));
    }

    /**
     * DELETE /api/v1/scheduler/tenants/{tenantId}/config - 테넌트 삭제 및 일정 해제
     */
    @DeleteMapping("/tenants/{tenantId}/config")
    public ResponseEntity<Void> removeConfig(@PathVariable String tenantId) {
        schedulerService.removeConfig(tenantId);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/scheduler/start - 전체 스케줄러 기동
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start() {
        schedulerService.start();
        return ResponseEntity.ok(Map.of("running", schedulerService.isRunning()));
    }

    /**
     * POST /api/v1/scheduler/stop - 전체 스케줄러 중지 (실행 중인 작업은 계속됨)
     */
    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        schedulerService.stop();
        return ResponseEntity.ok(Map.of("running", schedulerService.isRunning()));
    }

    /**
     * GET /api/v1/scheduler/status - 스케줄러 상태 및 최근 작업
     */
    @GetMapping("/status")
    public ResponseEntity<SchedulerStatusDTO> status() {
        return ResponseEntity.ok(schedulerService.status());
    }

    /**
     * GET /api/v1/scheduler/tenants/{tenantId}/jobs - 테넌트 작업 이력
     */
    @GetMapping("/tenants/{tenantId}/jobs")
    public ResponseEntity<List<JobRunDTO>> listJobs(@PathVariable String tenantId) {
        return ResponseEntity.ok(schedulerService.listJobs(tenantId));
    }

    /**
     * POST /api/v1/scheduler/tenants/{tenantId}/jobs/{kind} - 작업 즉시 실행 (crawl, report, cleanup)
     */
    @PostMapping("/tenants/{tenantId}/jobs/{kind}")
    public ResponseEntity<JobRunDTO> triggerJob(@PathVariable String tenantId, @PathVariable String kind) {
        JobRunDTO job = schedulerService.triggerJob(tenantId, JobKind.fromValue(kind));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    /**
     * POST /api/v1/scheduler/tenants/{tenantId}/jobs/{jobId}/cancel - 작업 취소
     */
    @PostMapping("/tenants/{tenantId}/jobs/{jobId}/cancel")
    public ResponseEntity<JobRunDTO> cancelJob(@PathVariable String tenantId, @PathVariable String jobId) {
        return ResponseEntity.ok(schedulerService.cancelJob(tenantId, jobId));
    }

    /**
     * POST /api/v1/scheduler/tenants/{tenantId}/test-crawl - 소스 1건 시험 수집 (저장하지 않음)
     */
    @PostMapping("/tenants/{tenantId}/test-crawl")
    public ResponseEntity<TestCrawlResponse> testCrawl(@PathVariable String tenantId,
                                                       @Valid @RequestBody TestCrawlRequest request) {
        return ResponseEntity.ok(schedulerService.testCrawl(tenantId, request.sourceName()));
    }

    /**
     * POST /api/v1/scheduler/tenants/{tenantId}/reports - 임의 기간/템플릿 브리프 생성
     */
    @PostMapping("/tenants/{tenantId}/reports")
    public ResponseEntity<Brief> generateReport(@PathVariable String tenantId,
                                                @RequestBody(required = false) ReportRequest request) {
        ReportRequest effective = request != null ? request : new ReportRequest(null, null, null, null, null, null);
        return ResponseEntity.status(HttpStatus.CREATED).body(schedulerService.generateReport(tenantId, effective));
    }
}
