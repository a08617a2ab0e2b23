package com.newsbrief.pipeline.service.attachment.extract;

import com.newsbrief.pipeline.exception.TextExtractionException;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 유형 태그로 추출기를 선택. 등록되지 않은 유형은 UNSUPPORTED_FORMAT.
 */
@Component
public class AttachmentTextExtractors {

    private final Map<String, AttachmentTextExtractor> byType = new HashMap<>();

    public AttachmentTextExtractors(List<AttachmentTextExtractor> extractors) {
        for (AttachmentTextExtractor extractor : extractors) {
            extractor.supportedTypes().forEach(type -> byType.put(type, extractor));
        }
    }

    public boolean supports(String type) {
        return type != null && byType.containsKey(type.toLowerCase(Locale.ROOT));
    }

    public String extractText(byte[] content, String type, int maxChars) {
        AttachmentTextExtractor extractor = type == null ? null : byType.get(type.toLowerCase(Locale.ROOT));
        if (extractor == null) {
            throw TextExtractionException.unsupported(type);
        }
        return extractor.extractText(content, type, maxChars);
    }
}
