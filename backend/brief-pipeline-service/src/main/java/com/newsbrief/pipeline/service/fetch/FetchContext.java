package com.newsbrief.pipeline.service.fetch;

import com.newsbrief.pipeline.service.CancellationSignal;

import java.time.Duration;
import java.time.ZoneId;

/**
 * 조회 1회에 필요한 실행 문맥 (요청 타임아웃, 날짜 해석 기준 시간대, 취소 신호)
 */
public record FetchContext(Duration timeout, ZoneId zone, CancellationSignal signal) {

    public static FetchContext of(Duration timeout, ZoneId zone) {
        return new FetchContext(timeout, zone, CancellationSignal.create());
    }
}
