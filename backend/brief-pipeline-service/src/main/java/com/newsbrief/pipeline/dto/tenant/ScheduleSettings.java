package com.newsbrief.pipeline.dto.tenant;

import lombok.Data;

/**
 * 작업별 스케줄 표현식.
 * cron(5 또는 6 필드) 또는 주기 표현("every 30m", "PT2H")을 받습니다. 비어 있으면 해당 작업을 예약하지 않습니다.
 */
@Data
public class ScheduleSettings {

    private String crawlSchedule = "0 */2 * * *";

    private String reportSchedule = "0 9 * * *";

    private String cleanupSchedule = "0 2 * * 0";
}
