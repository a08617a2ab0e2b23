package com.newsbrief.pipeline.dto;

import java.util.List;

public record TestCrawlResponse(
        String sourceName,
        int fetched,
        List<FilteredItem> items,
        List<AttachmentCandidate> attachmentCandidates
) {}
