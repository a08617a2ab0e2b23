package com.newsbrief.pipeline.entity;

public enum AttachmentStatus {
    DOWNLOADED,
    SKIPPED_SIZE,
    SKIPPED_TYPE,
    FAILED
}
