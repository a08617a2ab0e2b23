package com.newsbrief.pipeline.service.fetch;

import com.newsbrief.pipeline.dto.CandidateItem;
import com.newsbrief.pipeline.dto.tenant.SourceConfig;
import com.newsbrief.pipeline.entity.SourceKind;

import java.util.List;

/**
 * 소스 종류별 조회 구현. SourceFetcher에 종류별로 등록됩니다.
 */
public interface SourceKindHandler {

    SourceKind kind();

    /**
     * 소스에서 후보 항목을 조회합니다. 결과는 최대 maxItems건이며 소스의 순서를 유지합니다.
     *
     * @throws com.newsbrief.pipeline.exception.FetchException 조회/파싱 실패 시
     */
    List<CandidateItem> fetch(SourceConfig source, FetchContext context);
}
