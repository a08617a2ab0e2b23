package com.newsbrief.pipeline.dto;

/**
 * 항목 링크에서 가져온 기사 페이지 (원본 HTML과 정제된 본문)
 */
public record ArticlePage(String url, String html, String title, String bodyText) {

    public static ArticlePage empty(String url) {
        return new ArticlePage(url, "", "", "");
    }

    public boolean hasHtml() {
        return html != null && !html.isBlank();
    }
}
