package com.newsbrief.pipeline.service.fetch;

import com.newsbrief.pipeline.dto.CandidateItem;
import com.newsbrief.pipeline.dto.tenant.SourceConfig;
import com.newsbrief.pipeline.entity.SourceKind;
import com.newsbrief.pipeline.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * HTML 목록 페이지에서 기사 링크 추출 (jsoup).
 *
 * 알려진 목록 구조 셀렉터를 순서대로 시도하고, 첫 번째로 일치하는 셀렉터의 요소만 사용합니다.
 * 어떤 셀렉터도 일치하지 않으면 페이지의 모든 링크에서 기사로 보이는 것을 고릅니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HtmlSourceHandler implements SourceKindHandler {

    private static final List<String> ITEM_SELECTORS = List.of(
            "article", ".news-item", ".article", ".post", ".entry",
            ".news-list li", ".article-list li", ".post-list li",
            "h1", "h2", "h3", ".title", ".headline"
    );
    private static final List<String> TITLE_SELECTORS = List.of("h1", "h2", "h3", ".title", ".headline", "a");
    private static final List<String> SUMMARY_SELECTORS = List.of(".summary", ".excerpt", ".description", "p");
    private static final String TIME_SELECTOR = ".time, .date, .published, time";

    private static final int MIN_TITLE_LENGTH = 5;
    private static final int MIN_FALLBACK_LINK_TEXT = 10;

    private final HttpFetcher httpFetcher;

    @Override
    public SourceKind kind() {
        return SourceKind.HTML;
    }

    @Override
    public List<CandidateItem> fetch(SourceConfig source, FetchContext context) {
        String pageUrl = source.fetchUrl();
        List<CandidateItem> items = extract(source, httpFetcher.fetchDocument(pageUrl, context), context);
        log.debug("Extracted {} article links from '{}'", items.size(), source.getName());
        return items;
    }

    List<CandidateItem> extract(SourceConfig source, Document doc, FetchContext context) {
        List<CandidateItem> items = new ArrayList<>();
        Set<String> seenUrls = new LinkedHashSet<>();

        Elements elements = firstMatching(doc);
        if (elements.isEmpty()) {
            return fallbackLinks(source, doc, seenUrls);
        }

        for (Element element : elements) {
            if (items.size() >= source.getMaxItems()) {
                break;
            }
            String title = titleOf(element);
            String link = linkOf(element);
            if (title.length() <= MIN_TITLE_LENGTH || link.isEmpty() || !seenUrls.add(link)) {
                continue;
            }
            items.add(new CandidateItem(source.getName(), title, link,
                    timeOf(element, context), summaryOf(element)));
        }
        return items;
    }

    private Elements firstMatching(Document doc) {
        for (String selector : ITEM_SELECTORS) {
            Elements found = doc.select(selector);
            if (!found.isEmpty()) {
                return found;
            }
        }
        return new Elements();
    }

    private String titleOf(Element element) {
        for (String selector : TITLE_SELECTORS) {
            Element found = element.selectFirst(selector);
            if (found != null && !found.text().isBlank()) {
                return TextNormalizer.normalize(found.text());
            }
        }
        return "";
    }

    private String linkOf(Element element) {
        Element anchor = element.is("a[href]") ? element : element.selectFirst("a[href]");
        if (anchor == null) {
            // 제목 요소가 링크 안에 있는 구조
            anchor = element.closest("a[href]");
        }
        return anchor == null ? "" : usableHref(anchor);
    }

    private String summaryOf(Element element) {
        for (String selector : SUMMARY_SELECTORS) {
            Element found = element.selectFirst(selector);
            if (found != null && !found.text().isBlank()) {
                return TextNormalizer.normalize(found.text());
            }
        }
        return "";
    }

    private Instant timeOf(Element element, FetchContext context) {
        Element timeElement = element.selectFirst("time[datetime]");
        if (timeElement != null) {
            Instant parsed = PublishedDateParser.parse(timeElement.attr("datetime"), context.zone()).orElse(null);
            if (parsed != null) {
                return parsed;
            }
        }
        Element labelled = element.selectFirst(TIME_SELECTOR);
        return labelled == null ? null : PublishedDateParser.parse(labelled.text(), context.zone()).orElse(null);
    }

    private List<CandidateItem> fallbackLinks(SourceConfig source, Document doc, Set<String> seenUrls) {
        List<CandidateItem> items = new ArrayList<>();
        for (Element anchor : doc.select("a[href]")) {
            if (items.size() >= source.getMaxItems()) {
                break;
            }
            String text = TextNormalizer.normalize(anchor.text());
            String link = usableHref(anchor);
            if (text.length() <= MIN_FALLBACK_LINK_TEXT || link.isEmpty() || !seenUrls.add(link)) {
                continue;
            }
            items.add(new CandidateItem(source.getName(), text, link, null, ""));
        }
        return items;
    }

    private String usableHref(Element anchor) {
        String raw = anchor.attr("href").trim();
        if (raw.isEmpty() || raw.startsWith("#") || raw.startsWith("javascript:") || raw.startsWith("mailto:")) {
            return "";
        }
        String absolute = anchor.absUrl("href");
        return absolute.isEmpty() ? "" : absolute;
    }
}
