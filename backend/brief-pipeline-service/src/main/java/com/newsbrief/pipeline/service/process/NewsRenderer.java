package com.newsbrief.pipeline.service.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.entity.OutputFormat;
import com.newsbrief.pipeline.util.ByteSizes;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 저장용 뉴스 문서 직렬화 (마크다운 / JSON / 일반 텍스트)
 */
@Component
@RequiredArgsConstructor
public class NewsRenderer {

    private final ObjectMapper objectMapper;

    public String render(OutputFormat format, String title, String sourceName, String url, Instant publishedAt,
                         String summary, String body, List<Attachment> attachments) {
        return switch (format) {
            case MARKDOWN -> markdown(title, sourceName, url, publishedAt, summary, body, attachments);
            case JSON -> json(title, sourceName, url, publishedAt, summary, body, attachments);
            case TEXT -> text(title, sourceName, url, publishedAt, summary, body, attachments);
        };
    }

    private String markdown(String title, String sourceName, String url, Instant publishedAt,
                            String summary, String body, List<Attachment> attachments) {
        StringBuilder md = new StringBuilder();
        md.append("# ").append(title).append("\n\n");
        md.append("**Source**: ").append(sourceName);
        if (publishedAt != null) {
            md.append(" | **Published**: ").append(publishedAt);
        }
        md.append(" | [Link](").append(url).append(")\n\n");
        if (!summary.isEmpty()) {
            md.append("## Summary\n\n").append(summary).append("\n\n");
        }
        if (!body.isEmpty()) {
            md.append("## Content\n\n").append(body).append("\n\n");
        }
        List<Attachment> downloaded = downloaded(attachments);
        if (!downloaded.isEmpty()) {
            md.append("## Attachments\n\n");
            for (int i = 0; i < downloaded.size(); i++) {
                Attachment a = downloaded.get(i);
                md.append(i + 1).append(". ").append(a.filename())
                        .append(" (").append(a.type()).append(", ").append(ByteSizes.format(a.sizeBytes())).append(")\n");
            }
        }
        return md.toString().trim();
    }

    private String json(String title, String sourceName, String url, Instant publishedAt,
                        String summary, String body, List<Attachment> attachments) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("title", title);
        doc.put("source", sourceName);
        doc.put("url", url);
        doc.put("publishedAt", publishedAt != null ? publishedAt.toString() : null);
        doc.put("summary", summary);
        doc.put("content", body);
        doc.put("attachments", downloaded(attachments).stream()
                .map(a -> Map.of("filename", a.filename(), "type", a.type(), "sizeBytes", a.sizeBytes()))
                .toList());
        try {
            return objectMapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render news as JSON", e);
        }
    }

    private String text(String title, String sourceName, String url, Instant publishedAt,
                        String summary, String body, List<Attachment> attachments) {
        StringBuilder text = new StringBuilder();
        text.append(title).append('\n');
        text.append(sourceName);
        if (publishedAt != null) {
            text.append(" - ").append(publishedAt);
        }
        text.append('\n').append(url).append("\n\n");
        if (!summary.isEmpty()) {
            text.append(summary).append("\n\n");
        }
        if (!body.isEmpty()) {
            text.append(body).append("\n\n");
        }
        for (Attachment a : downloaded(attachments)) {
            text.append("* ").append(a.filename()).append(" (").append(ByteSizes.format(a.sizeBytes())).append(")\n");
        }
        return text.toString().trim();
    }

    private List<Attachment> downloaded(List<Attachment> attachments) {
        return attachments.stream().filter(Attachment::isDownloaded).toList();
    }
}
