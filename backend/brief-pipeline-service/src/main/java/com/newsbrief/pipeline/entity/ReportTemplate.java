package com.newsbrief.pipeline.entity;

public enum ReportTemplate {
    DAILY_BRIEF,
    EXECUTIVE_SUMMARY,
    INDUSTRY_REPORT,
    CUSTOM
}
