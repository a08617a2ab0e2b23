package com.newsbrief.pipeline.service.attachment.extract;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Set;

@Component
public class PlainTextExtractor implements AttachmentTextExtractor {

    @Override
    public Set<String> supportedTypes() {
        return Set.of("txt", "csv", "md");
    }

    @Override
    public String extractText(byte[] content, String type, int maxChars) {
        String text = new String(content, StandardCharsets.UTF_8);
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
