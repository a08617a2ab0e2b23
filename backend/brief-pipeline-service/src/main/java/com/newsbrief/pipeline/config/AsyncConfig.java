package com.newsbrief.pipeline.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.RejectedExecutionException;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class AsyncConfig {

    private final NewsBriefProperties properties;

    /**
     * 소스 단위 수집 실행자
     */
    @Bean(name = "crawlExecutor")
    public ThreadPoolTaskExecutor crawlExecutor() {
        return boundedExecutor("crawl-", properties.getExecutor().getCrawlPoolSize());
    }

    /**
     * 첨부파일 다운로드 실행자.
     * 실제 동시 다운로드 수는 사이클별 worker 한도(semaphore)로 제한됩니다.
     */
    @Bean(name = "attachmentExecutor")
    public ThreadPoolTaskExecutor attachmentExecutor() {
        return boundedExecutor("attachment-", properties.getExecutor().getAttachmentPoolSize());
    }

    /**
     * 작업(JobRun) 실행자
     */
    @Bean(name = "jobExecutor")
    public ThreadPoolTaskExecutor jobExecutor() {
        return boundedExecutor("job-", properties.getExecutor().getJobPoolSize());
    }

    /**
     * cron/주기 트리거 및 작업 타임아웃 감시용 스케줄러
     */
    @Bean(name = "pipelineTaskScheduler")
    public TaskScheduler pipelineTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getExecutor().getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("pipeline-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> log.error("Scheduled task failed: {}", t.getMessage(), t));
        scheduler.initialize();
        return scheduler;
    }

    private ThreadPoolTaskExecutor boundedExecutor(String prefix, int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from {}executor: {}", prefix, r);
            throw new RejectedExecutionException("Executor " + prefix + " rejected task");
        });
        executor.initialize();
        return executor;
    }
}
