package com.newsbrief.pipeline.entity;

public enum BriefSection {
    SUMMARY,
    KEY_EVENTS,
    TRENDS,
    ATTACHMENTS
}
