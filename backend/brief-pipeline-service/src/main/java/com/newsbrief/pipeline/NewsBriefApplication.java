package com.newsbrief.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * NewsBrief Pipeline Service Application
 *
 * Spring Boot 기반의 뉴스 수집/브리프 생성 서비스
 * - RSS, HTML 소스에서 뉴스 수집 및 키워드/기간 필터링
 * - 첨부파일 탐지 및 크기/타입/타임아웃 정책 하의 병렬 다운로드
 * - 지식베이스(콘텐츠 저장소)로의 멱등 저장
 * - 테넌트별 cron/주기 스케줄에 따른 수집, 브리프 생성, 정리 작업
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class NewsBriefApplication {

    public static void main(String[] args) {
        SpringApplication.run(NewsBriefApplication.class, args);
    }
}
