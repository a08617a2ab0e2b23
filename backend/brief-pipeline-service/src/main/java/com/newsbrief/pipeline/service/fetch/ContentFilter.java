package com.newsbrief.pipeline.service.fetch;

import com.newsbrief.pipeline.dto.CandidateItem;
import com.newsbrief.pipeline.dto.FilteredItem;
import com.newsbrief.pipeline.dto.tenant.SourceConfig;
import com.newsbrief.pipeline.util.ContentHashes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 키워드 포함/제외 규칙과 신선도 기간으로 후보 항목을 거르고 지문을 계산합니다.
 * 입력 순서를 유지하며, 지문이 같은 항목은 먼저 나온 것만 남깁니다.
 */
@Component
@Slf4j
public class ContentFilter {

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(24);

    public List<FilteredItem> filter(List<CandidateItem> items, SourceConfig source, Instant now) {
        return filter(items, source, DEFAULT_WINDOW, now);
    }

    public List<FilteredItem> filter(List<CandidateItem> items, SourceConfig source, Duration window, Instant now) {
        List<String> include = lowerAll(source.getKeywords());
        List<String> exclude = lowerAll(source.getExcludeKeywords());
        Instant oldest = now.minus(window);

        List<FilteredItem> kept = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (CandidateItem item : items) {
            String haystack = (item.title() + " " + item.rawExcerpt()).toLowerCase(Locale.ROOT);

            if (exclude.stream().anyMatch(haystack::contains)) {
                log.debug("Excluded by keyword: {}", item.title());
                continue;
            }
            if (!include.isEmpty() && include.stream().noneMatch(haystack::contains)) {
                continue;
            }
            if (item.publishedAt() != null && item.publishedAt().isBefore(oldest)) {
                log.debug("Outside freshness window ({}): {}", item.publishedAt(), item.title());
                continue;
            }

            String fingerprint = ContentHashes.fingerprint(item.title(), item.url());
            if (!seen.add(fingerprint)) {
                log.debug("Collapsed duplicate item: {}", item.title());
                continue;
            }
            kept.add(new FilteredItem(item, fingerprint));
        }
        return kept;
    }

    private List<String> lowerAll(List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        return keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .toList();
    }
}
