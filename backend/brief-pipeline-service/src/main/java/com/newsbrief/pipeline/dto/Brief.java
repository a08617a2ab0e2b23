package com.newsbrief.pipeline.dto;

import com.newsbrief.pipeline.entity.BriefSection;
import com.newsbrief.pipeline.entity.ReportTemplate;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 생성된 브리프. 생성 이후 읽기 전용.
 */
public record Brief(
        String briefId,
        String tenantId,
        ReportTemplate template,
        String language,
        String title,
        Instant windowStart,
        Instant windowEnd,
        int newsCount,
        Map<BriefSection, Section> sections,
        Instant generatedAt
) {
    public Brief {
        Map<BriefSection, Section> ordered = new EnumMap<>(BriefSection.class);
        ordered.putAll(sections);
        sections = Collections.unmodifiableMap(ordered);
    }

    /**
     * 섹션 본문. empty이면 빈 섹션 표시로 렌더링됩니다.
     */
    public record Section(BriefSection type, boolean empty, Object content) {

        public static Section empty(BriefSection type) {
            return new Section(type, true, null);
        }

        public static Section of(BriefSection type, Object content) {
            return new Section(type, false, content);
        }
    }

    public record Overview(
            int totalNews,
            int sourceCount,
            int newsWithAttachments,
            int totalAttachments,
            String text
    ) {}

    public record KeyEvent(
            String title,
            String source,
            Instant publishedAt,
            String summary,
            String link,
            boolean hasAttachments,
            String attachmentSummary
    ) {}

    public record Trends(
            List<TopicCount> hotTopics,
            Map<String, Long> sourceDistribution,
            int newsWithAttachments,
            double attachmentRatio
    ) {}

    public record TopicCount(String topic, long count) {}

    public record AttachmentOverview(
            int totalAttachments,
            double totalSizeMb,
            Map<String, TypeStat> typeDistribution,
            List<AttachmentEntry> entries
    ) {}

    public record TypeStat(int count, long sizeBytes) {}

    public record AttachmentEntry(String newsTitle, String filename, String type, long sizeBytes, String summary) {}
}
