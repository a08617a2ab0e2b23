package com.newsbrief.pipeline.dto.tenant;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SchedulerSettings {

    private boolean enabled = true;

    @NotBlank
    private String timezone = "UTC";

    @Min(1)
    private int maxConcurrentJobs = 3;

    /**
     * 작업 전체 실행 시간 상한 (초)
     */
    @Min(1)
    private long jobTimeout = 1800;
}
