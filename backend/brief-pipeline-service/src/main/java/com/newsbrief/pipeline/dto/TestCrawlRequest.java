package com.newsbrief.pipeline.dto;

import jakarta.validation.constraints.NotBlank;

public record TestCrawlRequest(@NotBlank String sourceName) {}
