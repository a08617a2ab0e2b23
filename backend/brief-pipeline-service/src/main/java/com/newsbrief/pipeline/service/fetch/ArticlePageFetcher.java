package com.newsbrief.pipeline.service.fetch;

import com.newsbrief.pipeline.dto.ArticlePage;
import com.newsbrief.pipeline.exception.FetchException;
import com.newsbrief.pipeline.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

/**
 * 항목 링크의 기사 페이지 조회.
 * 실패해도 항목 처리는 계속되어야 하므로 빈 페이지를 반환합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticlePageFetcher {

    private static final String BOILERPLATE = "script, style, nav, footer, aside, header, noscript, iframe";

    private final HttpFetcher httpFetcher;

    public ArticlePage fetch(String url, FetchContext context) {
        Document doc;
        try {
            doc = httpFetcher.fetchDocument(url, context);
        } catch (FetchException e) {
            log.warn("Failed to fetch article page {}: {}", url, e.getMessage());
            return ArticlePage.empty(url);
        }
        return parse(url, doc);
    }

    ArticlePage parse(String url, Document doc) {
        String title = TextNormalizer.normalize(doc.title());

        Document cleaned = doc.clone();
        cleaned.select(BOILERPLATE).remove();
        String bodyText = cleaned.body() != null ? TextNormalizer.normalize(cleaned.body().text()) : "";

        return new ArticlePage(url, doc.outerHtml(), title, bodyText);
    }
}
