package com.newsbrief.pipeline.dto;

import java.time.Instant;
import java.util.List;

public record ErrorResponse(String errorCode, String message, List<String> violations, int status, Instant timestamp) {}
