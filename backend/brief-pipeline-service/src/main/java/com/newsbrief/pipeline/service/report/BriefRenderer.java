package com.newsbrief.pipeline.service.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsbrief.pipeline.dto.Brief;
import com.newsbrief.pipeline.dto.Brief.AttachmentEntry;
import com.newsbrief.pipeline.dto.Brief.AttachmentOverview;
import com.newsbrief.pipeline.dto.Brief.KeyEvent;
import com.newsbrief.pipeline.dto.Brief.Overview;
import com.newsbrief.pipeline.dto.Brief.Section;
import com.newsbrief.pipeline.dto.Brief.Trends;
import com.newsbrief.pipeline.entity.OutputFormat;
import com.newsbrief.pipeline.util.ByteSizes;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * 브리프 출력 (마크다운 / JSON / 일반 텍스트)
 */
@Component
@RequiredArgsConstructor
public class BriefRenderer {

    private final ObjectMapper objectMapper;

    public String render(Brief brief, OutputFormat format) {
        return switch (format) {
            case JSON -> json(brief);
            case MARKDOWN -> document(brief, true);
            case TEXT -> document(brief, false);
        };
    }

    private String json(Brief brief) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(brief);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render brief " + brief.briefId(), e);
        }
    }

    private String document(Brief brief, boolean markdown) {
        BriefLocalization l10n = BriefLocalization.forLanguage(brief.language());
        StringBuilder out = new StringBuilder();
        heading(out, markdown, 1, brief.title());
        out.append(brief.windowStart()).append(" ~ ").append(brief.windowEnd()).append("\n\n");

        for (Section section : brief.sections().values()) {
            heading(out, markdown, 2, l10n.sectionTitle(section.type()));
            if (section.empty()) {
                out.append(markdown ? "_" + l10n.getEmptyMarker() + "_" : l10n.getEmptyMarker()).append("\n\n");
                continue;
            }
            switch (section.type()) {
                case SUMMARY -> out.append(((Overview) section.content()).text()).append("\n\n");
                case KEY_EVENTS -> keyEvents(out, markdown, l10n, castEvents(section.content()));
                case TRENDS -> trends(out, markdown, l10n, (Trends) section.content());
                case ATTACHMENTS -> attachments(out, markdown, l10n, (AttachmentOverview) section.content());
            }
        }
        return out.toString().trim() + "\n";
    }

    private void keyEvents(StringBuilder out, boolean markdown, BriefLocalization l10n, List<KeyEvent> events) {
        int index = 1;
        for (KeyEvent event : events) {
            if (markdown) {
                out.append("### ").append(index++).append(". [").append(event.title()).append("](")
                        .append(event.link()).append(")\n\n");
            } else {
                out.append(index++).append(". ").append(event.title()).append('\n').append(event.link()).append('\n');
            }
            out.append(markdown ? "**" + l10n.getSourceLabel() + "**: " : l10n.getSourceLabel() + ": ")
                    .append(event.source());
            if (event.publishedAt() != null) {
                out.append(" | ").append(event.publishedAt());
            }
            out.append("\n\n");
            if (event.summary() != null && !event.summary().isEmpty()) {
                out.append(event.summary()).append("\n\n");
            }
            if (event.attachmentSummary() != null) {
                out.append(markdown ? "> " : "  ").append(event.attachmentSummary()).append("\n\n");
            }
        }
    }

    private void trends(StringBuilder out, boolean markdown, BriefLocalization l10n, Trends trends) {
        out.append(markdown ? "**" + l10n.getHotTopicsLabel() + "**: " : l10n.getHotTopicsLabel() + ": ");
        out.append(String.join(", ", trends.hotTopics().stream()
                .map(topic -> topic.topic() + " (" + topic.count() + ")")
                .toList())).append("\n\n");
        out.append(markdown ? "**" + l10n.getSourceDistributionLabel() + "**\n\n" : l10n.getSourceDistributionLabel() + "\n");
        for (Map.Entry<String, Long> entry : trends.sourceDistribution().entrySet()) {
            out.append("- ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        out.append('\n');
    }

    private void attachments(StringBuilder out, boolean markdown, BriefLocalization l10n, AttachmentOverview overview) {
        out.append(markdown ? "**" + l10n.getAttachmentTotalLabel() + "**: " : l10n.getAttachmentTotalLabel() + ": ")
                .append(overview.totalAttachments()).append(" (").append(overview.totalSizeMb()).append(" MB)\n\n");
        overview.typeDistribution().forEach((type, stat) -> out.append("- ").append(type).append(": ")
                .append(stat.count()).append(" (").append(ByteSizes.format(stat.sizeBytes())).append(")\n"));
        out.append('\n');
        for (AttachmentEntry entry : overview.entries()) {
            out.append("- ").append(markdown ? "`" + entry.filename() + "`" : entry.filename())
                    .append(" - ").append(entry.newsTitle())
                    .append(" (").append(ByteSizes.format(entry.sizeBytes())).append(")\n");
            if (entry.summary() != null) {
                out.append("  ").append(entry.summary()).append('\n');
            }
        }
        out.append('\n');
    }

    private void heading(StringBuilder out, boolean markdown, int level, String text) {
        if (markdown) {
            out.append("#".repeat(level)).append(' ').append(text).append("\n\n");
        } else {
            out.append(text).append('\n').append((level == 1 ? "=" : "-").repeat(Math.max(4, text.length()))).append("\n\n");
        }
    }

    @SuppressWarnings("unchecked")
    private List<KeyEvent> castEvents(Object content) {
        return (List<KeyEvent>) content;
    }
}
