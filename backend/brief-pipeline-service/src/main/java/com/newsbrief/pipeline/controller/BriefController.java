package com.newsbrief.pipeline.controller;

import com.newsbrief.pipeline.entity.OutputFormat;
import com.newsbrief.pipeline.service.report.BriefRenderer;
import com.newsbrief.pipeline.service.report.BriefStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/briefs")
@RequiredArgsConstructor
public class BriefController {

    private static final MediaType TEXT_MARKDOWN_UTF8 = MediaType.parseMediaType("text/markdown;charset=UTF-8");
    private static final MediaType TEXT_PLAIN_UTF8 = MediaType.parseMediaType("text/plain;charset=UTF-8");

    private final BriefStore briefStore;
    private final BriefRenderer briefRenderer;

    /**
     * GET /api/v1/briefs/{briefId}?format=markdown|json|text - 생성된 브리프 조회
     */
    @GetMapping("/{briefId}")
    public ResponseEntity<String> getBrief(@PathVariable String briefId,
                                           @RequestParam(defaultValue = "markdown") String format) {
        OutputFormat outputFormat = OutputFormat.fromValue(format);
        return briefStore.find(briefId)
                .map(brief -> ResponseEntity.ok()
                        .contentType(mediaType(outputFormat))
                        .body(briefRenderer.render(brief, outputFormat)))
                .orElse(ResponseEntity.notFound().build());
    }

    private MediaType mediaType(OutputFormat format) {
        return switch (format) {
            case MARKDOWN -> TEXT_MARKDOWN_UTF8;
            case JSON -> MediaType.APPLICATION_JSON;
            case TEXT -> TEXT_PLAIN_UTF8;
        };
    }
}
