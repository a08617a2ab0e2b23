package com.newsbrief.pipeline.service.attachment;

import com.newsbrief.pipeline.dto.tenant.ProcessorSettings;

import java.time.Duration;
import java.util.Set;

/**
 * 첨부파일 다운로드 제한 (크기, 건당 타임아웃, 허용 유형)
 */
public record DownloadPolicy(long maxSize, Duration timeout, Set<String> allowedTypes) {

    public static DownloadPolicy from(ProcessorSettings processor) {
        return new DownloadPolicy(processor.getMaxAttachmentSize(),
                Duration.ofSeconds(processor.getAttachmentTimeout()),
                processor.allowedAttachmentTypes());
    }

    public boolean allows(String type) {
        return type != null && allowedTypes.contains(type);
    }
}
