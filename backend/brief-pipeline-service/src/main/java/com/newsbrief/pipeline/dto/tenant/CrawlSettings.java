package com.newsbrief.pipeline.dto.tenant;

import com.newsbrief.pipeline.entity.DateFilter;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class CrawlSettings {

    @NotNull
    private DateFilter dateFilter = DateFilter.TODAY;

    /**
     * 명시적 신선도 기간 (시간). 지정 시 dateFilter보다 우선.
     */
    @Min(1)
    private Integer freshnessWindowHours;

    /**
     * 항목 링크의 기사 페이지를 조회하여 본문/첨부파일 탐색에 사용
     */
    private boolean fetchPageContent = true;

    /**
     * 사이클 전체에서 동시에 진행되는 첨부파일 다운로드 수
     */
    @Min(1)
    private int downloadWorkers = 4;

    @Min(0)
    private int maxAttachmentsPerItem = 10;

    /**
     * 소스/페이지 요청 1회의 타임아웃 (초)
     */
    @Min(1)
    private int fetchTimeout = 30;

    public Duration freshnessWindow(SourceConfig source) {
        if (freshnessWindowHours != null) {
            return Duration.ofHours(freshnessWindowHours);
        }
        DateFilter filter = source != null && source.getDateFilter() != null ? source.getDateFilter() : dateFilter;
        return filter.getWindow();
    }
}
