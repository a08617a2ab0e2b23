package com.newsbrief.pipeline.service.fetch;

import com.newsbrief.pipeline.dto.CandidateItem;
import com.newsbrief.pipeline.dto.tenant.SourceConfig;
import com.newsbrief.pipeline.entity.SourceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 소스 정의 1건을 조회하여 후보 항목을 반환.
 * 소스 종류별 구현은 SourceKindHandler 빈으로 등록됩니다.
 */
@Service
@Slf4j
public class SourceFetcher {

    private final Map<SourceKind, SourceKindHandler> handlers = new EnumMap<>(SourceKind.class);

    public SourceFetcher(List<SourceKindHandler> registered) {
        for (SourceKindHandler handler : registered) {
            SourceKindHandler previous = handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for source kind " + handler.kind()
                        + ": " + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
    }

    /**
     * @throws com.newsbrief.pipeline.exception.FetchException 재시도 후에도 조회에 실패한 경우
     */
    public List<CandidateItem> fetch(SourceConfig source, FetchContext context) {
        SourceKindHandler handler = handlers.get(source.getKind());
        if (handler == null) {
            throw new IllegalStateException("No handler registered for source kind " + source.getKind());
        }
        context.signal().throwIfCancelled();

        log.info("Fetching {} source '{}' from {}", source.getKind().getValue(), source.getName(), source.fetchUrl());
        List<CandidateItem> items = handler.fetch(source, context);
        log.info("Fetched {} candidates from source '{}'", items.size(), source.getName());
        return items;
    }

    public boolean supports(SourceKind kind) {
        return handlers.containsKey(kind);
    }
}
