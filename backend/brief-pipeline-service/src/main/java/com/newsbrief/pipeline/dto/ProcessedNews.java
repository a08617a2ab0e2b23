package com.newsbrief.pipeline.dto;

import com.newsbrief.pipeline.entity.OutputFormat;

import java.time.Instant;
import java.util.List;

/**
 * 콘텐츠 저장소에 기록되는 뉴스 단위. 지문당 최대 1건.
 */
public record ProcessedNews(
        String fingerprint,
        String sourceName,
        String title,
        String url,
        Instant publishedAt,
        String summary,
        String body,
        OutputFormat format,
        String renderedContent,
        List<Attachment> attachments,
        Instant storedAt,
        String kbRef
) {
    public ProcessedNews {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public List<Attachment> downloadedAttachments() {
        return attachments.stream().filter(Attachment::isDownloaded).toList();
    }

    public ProcessedNews withStored(Instant at, String ref) {
        return new ProcessedNews(fingerprint, sourceName, title, url, publishedAt, summary, body, format,
                renderedContent, attachments, at, ref);
    }
}
