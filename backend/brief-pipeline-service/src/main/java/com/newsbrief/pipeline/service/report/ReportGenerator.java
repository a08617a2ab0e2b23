package com.newsbrief.pipeline.service.report;

import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.dto.Brief;
import com.newsbrief.pipeline.dto.Brief.AttachmentEntry;
import com.newsbrief.pipeline.dto.Brief.AttachmentOverview;
import com.newsbrief.pipeline.dto.Brief.KeyEvent;
import com.newsbrief.pipeline.dto.Brief.Overview;
import com.newsbrief.pipeline.dto.Brief.Section;
import com.newsbrief.pipeline.dto.Brief.TopicCount;
import com.newsbrief.pipeline.dto.Brief.Trends;
import com.newsbrief.pipeline.dto.Brief.TypeStat;
import com.newsbrief.pipeline.dto.ProcessedNews;
import com.newsbrief.pipeline.dto.tenant.ReportSettings;
import com.newsbrief.pipeline.entity.BriefSection;
import com.newsbrief.pipeline.exception.ContentStoreException;
import com.newsbrief.pipeline.exception.GenerationException;
import com.newsbrief.pipeline.service.attachment.extract.AttachmentTextExtractors;
import com.newsbrief.pipeline.service.store.ContentStore;
import com.newsbrief.pipeline.util.ByteSizes;
import com.newsbrief.pipeline.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * 기간 내 저장된 뉴스로 브리프를 생성합니다.
 *
 * 섹션은 서로 독립적으로 만들어지고, 내용이 없는 섹션은 빈 섹션으로 표시됩니다.
 * 요청한 섹션이 모두 비어 있을 때만 NO_CONTENT로 실패합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportGenerator {

    private static final int HOT_TOPIC_LIMIT = 10;
    private static final int KEY_EVENT_SUMMARY_LENGTH = 200;

    private final ContentStore contentStore;
    private final AttachmentTextExtractors textExtractors;
    private final Clock clock;

    /**
     * @throws GenerationException 지식베이스 조회 실패 또는 내용 없음
     */
    public Brief generate(BriefRequest request) {
        ReportSettings settings = request.settings();
        List<StoredItem> window = load(request);
        List<StoredItem> keyItems = window.subList(0, Math.min(settings.getMaxNewsCount(), window.size()));
        SummaryCache summaries = new SummaryCache(settings);
        BriefLocalization localization = BriefLocalization.forLanguage(settings.getLanguage());

        Map<BriefSection, Section> sections = new EnumMap<>(BriefSection.class);
        for (BriefSection type : BriefSection.values()) {
            if (!settings.getSections().contains(type)) {
                continue;
            }
            Section section = switch (type) {
                case SUMMARY -> summarySection(window, localization);
                case KEY_EVENTS -> keyEventsSection(keyItems, settings, summaries);
                case TRENDS -> trendsSection(window);
                case ATTACHMENTS -> attachmentsSection(window, settings, summaries);
            };
            sections.put(type, section);
        }

        if (sections.values().stream().allMatch(Section::empty)) {
            throw GenerationException.noContent(request.windowStart() + "/" + request.windowEnd());
        }

        LocalDate day = request.windowEnd().minusNanos(1).atZone(request.zone()).toLocalDate();
        Brief brief = new Brief(UUID.randomUUID().toString(), request.tenantId(), settings.getTemplate(),
                localization.getTag(), localization.title(settings.getTemplate()) + " - " + day,
                request.windowStart(), request.windowEnd(), window.size(), sections, clock.instant());
        log.info("[Report:{}] Generated brief {} from {} news ({} key events)",
                request.tenantId(), brief.briefId(), window.size(), keyItems.size());
        return brief;
    }

    /**
     * 모든 대상 지식베이스의 기간 내 뉴스 (지문 중복 제거, 최신순)
     */
    private List<StoredItem> load(BriefRequest request) {
        Map<String, StoredItem> byFingerprint = new LinkedHashMap<>();
        for (String kbId : request.kbIds()) {
            List<ProcessedNews> found;
            try {
                found = contentStore.query(kbId, request.windowStart(), request.windowEnd());
            } catch (ContentStoreException e) {
                throw GenerationException.kbUnreachable(kbId, e);
            }
            for (ProcessedNews news : found) {
                byFingerprint.putIfAbsent(news.fingerprint(), new StoredItem(kbId, news));
            }
        }
        List<StoredItem> items = new ArrayList<>(byFingerprint.values());
        items.sort(Comparator.comparing((StoredItem item) -> item.news().storedAt(), Comparator.reverseOrder())
                .thenComparing(item -> item.news().fingerprint()));
        return items;
    }

    private Section summarySection(List<StoredItem> items, BriefLocalization localization) {
        if (items.isEmpty()) {
            return Section.empty(BriefSection.SUMMARY);
        }
        int sources = (int) items.stream().map(item -> item.news().sourceName()).distinct().count();
        int withAttachments = (int) items.stream().filter(item -> !item.news().downloadedAttachments().isEmpty()).count();
        int attachments = items.stream().mapToInt(item -> item.news().downloadedAttachments().size()).sum();
        return Section.of(BriefSection.SUMMARY, new Overview(items.size(), sources, withAttachments, attachments,
                localization.overview(items.size(), sources, withAttachments, attachments)));
    }

    private Section keyEventsSection(List<StoredItem> items, ReportSettings settings, SummaryCache summaries) {
        if (items.isEmpty()) {
            return Section.empty(BriefSection.KEY_EVENTS);
        }
        List<KeyEvent> events = new ArrayList<>();
        for (StoredItem item : items) {
            ProcessedNews news = item.news();
            List<Attachment> attachments = news.downloadedAttachments();
            String attachmentSummary = null;
            if (settings.isAttachmentSummary() && !attachments.isEmpty()) {
                attachmentSummary = summaries.summarize(item.kbId(), attachments.get(0)).orElse(null);
            }
            events.add(new KeyEvent(news.title(), news.sourceName(), news.publishedAt(),
                    TextNormalizer.abbreviate(news.summary(), KEY_EVENT_SUMMARY_LENGTH), news.url(),
                    !attachments.isEmpty(), attachmentSummary));
        }
        return Section.of(BriefSection.KEY_EVENTS, events);
    }

    private Section trendsSection(List<StoredItem> items) {
        if (items.isEmpty()) {
            return Section.empty(BriefSection.TRENDS);
        }
        List<TopicCount> topics = TopicExtractor.topTopics(
                        items.stream().map(item -> item.news().title()).toList(), HOT_TOPIC_LIMIT).stream()
                .map(entry -> new TopicCount(entry.getKey(), entry.getValue()))
                .toList();

        Map<String, Long> counts = new TreeMap<>();
        items.forEach(item -> counts.merge(String.valueOf(item.news().sourceName()), 1L, Long::sum));
        Map<String, Long> distribution = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(entry -> distribution.put(entry.getKey(), entry.getValue()));

        int withAttachments = (int) items.stream().filter(item -> !item.news().downloadedAttachments().isEmpty()).count();
        double ratio = Math.round(withAttachments * 1000.0 / items.size()) / 1000.0;
        return Section.of(BriefSection.TRENDS, new Trends(topics, distribution, withAttachments, ratio));
    }

    private Section attachmentsSection(List<StoredItem> items, ReportSettings settings, SummaryCache summaries) {
        if (!settings.isIncludeAttachments()) {
            return Section.empty(BriefSection.ATTACHMENTS);
        }
        List<AttachmentEntry> entries = new ArrayList<>();
        Map<String, TypeStat> byType = new TreeMap<>();
        long totalBytes = 0;
        for (StoredItem item : items) {
            for (Attachment attachment : item.news().downloadedAttachments()) {
                String summary = settings.isAttachmentSummary()
                        ? summaries.summarize(item.kbId(), attachment).orElse(null)
                        : null;
                entries.add(new AttachmentEntry(item.news().title(), attachment.filename(), attachment.type(),
                        attachment.sizeBytes(), summary));
                byType.merge(attachment.type(), new TypeStat(1, attachment.sizeBytes()),
                        (a, b) -> new TypeStat(a.count() + b.count(), a.sizeBytes() + b.sizeBytes()));
                totalBytes += attachment.sizeBytes();
            }
        }
        if (entries.isEmpty()) {
            return Section.empty(BriefSection.ATTACHMENTS);
        }
        return Section.of(BriefSection.ATTACHMENTS,
                new AttachmentOverview(entries.size(), ByteSizes.toMegabytes(totalBytes), byType, entries));
    }

    private record StoredItem(String kbId, ProcessedNews news) {
    }

    /**
     * 첨부파일 요약 (생성 1회 동안 저장 참조별로 한 번만 추출)
     */
    private final class SummaryCache {

        private final ReportSettings settings;
        private final Map<String, Optional<String>> cache = new HashMap<>();

        SummaryCache(ReportSettings settings) {
            this.settings = settings;
        }

        Optional<String> summarize(String kbId, Attachment attachment) {
            if (attachment.storageRef() == null) {
                return Optional.empty();
            }
            return cache.computeIfAbsent(kbId + "/" + attachment.storageRef(), key -> extract(kbId, attachment));
        }

        private Optional<String> extract(String kbId, Attachment attachment) {
            if (!textExtractors.supports(attachment.type())) {
                return Optional.empty();
            }
            int maxLength = settings.getMaxAttachmentSummaryLength();
            try {
                Optional<byte[]> content = contentStore.getBlob(kbId, attachment.storageRef());
                if (content.isEmpty()) {
                    return Optional.empty();
                }
                String text = TextNormalizer.normalize(
                        textExtractors.extractText(content.get(), attachment.type(), maxLength * 2));
                return text.isEmpty() ? Optional.empty() : Optional.of(TextNormalizer.abbreviate(text, maxLength));
            } catch (RuntimeException e) {
                log.warn("Skipping summary of attachment {}: {}", attachment.filename(), e.getMessage());
                return Optional.empty();
            }
        }
    }
}
