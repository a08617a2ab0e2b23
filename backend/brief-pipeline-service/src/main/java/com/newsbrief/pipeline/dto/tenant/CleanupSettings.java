package com.newsbrief.pipeline.dto.tenant;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class CleanupSettings {

    /**
     * 저장된 뉴스/첨부파일, 완료된 작업 이력, 브리프 보존 기간 (일)
     */
    @Min(1)
    private int retentionDays = 30;
}
