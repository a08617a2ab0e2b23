package com.newsbrief.pipeline.dto;

import java.util.List;
import java.util.Map;

public record SchedulerStatusDTO(
        boolean running,
        List<String> tenants,
        Map<String, Integer> runningJobs,
        Map<String, Integer> queuedJobs,
        List<JobRunDTO> recentJobs
) {}
