package com.newsbrief.pipeline.dto.tenant;

import com.newsbrief.pipeline.entity.DateFilter;
import com.newsbrief.pipeline.entity.SourceKind;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 뉴스 소스 정의. 테넌트 내에서 name이 식별자입니다.
 */
@Data
public class SourceConfig {

    @NotBlank
    private String name;

    /**
     * 소스 페이지 URL (HTML 소스의 크롤링 대상, RSS 소스의 기본 URL)
     */
    @NotBlank
    private String endpointUrl;

    @NotNull
    private SourceKind kind = SourceKind.RSS;

    /**
     * RSS 피드 URL. 비어 있으면 endpointUrl을 피드로 사용.
     */
    private String feedUrl;

    private List<String> keywords = new ArrayList<>();

    private List<String> excludeKeywords = new ArrayList<>();

    @Min(1)
    private int maxItems = 10;

    private boolean enabled = true;

    /**
     * 소스별 기간 필터 (null이면 테넌트 crawl 설정을 따름)
     */
    private DateFilter dateFilter;

    /**
     * 실제로 조회할 URL
     */
    public String fetchUrl() {
        if (kind == SourceKind.RSS && feedUrl != null && !feedUrl.isBlank()) {
            return feedUrl;
        }
        return endpointUrl;
    }

    public static SourceConfig of(String name, SourceKind kind, String endpointUrl) {
        SourceConfig source = new SourceConfig();
        source.setName(name);
        source.setKind(kind);
        source.setEndpointUrl(endpointUrl);
        return source;
    }
}
