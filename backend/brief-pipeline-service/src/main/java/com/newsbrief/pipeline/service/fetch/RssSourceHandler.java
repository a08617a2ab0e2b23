package com.newsbrief.pipeline.service.fetch;

import com.newsbrief.pipeline.dto.CandidateItem;
import com.newsbrief.pipeline.dto.tenant.SourceConfig;
import com.newsbrief.pipeline.entity.SourceKind;
import com.newsbrief.pipeline.exception.FetchException;
import com.newsbrief.pipeline.util.TextNormalizer;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * RSS/Atom 피드 조회 (ROME)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RssSourceHandler implements SourceKindHandler {

    private final HttpFetcher httpFetcher;

    @Override
    public SourceKind kind() {
        return SourceKind.RSS;
    }

    @Override
    public List<CandidateItem> fetch(SourceConfig source, FetchContext context) {
        String feedUrl = source.fetchUrl();
        byte[] body = httpFetcher.fetchBytes(feedUrl, context);

        SyndFeed feed;
        try (XmlReader reader = new XmlReader(new ByteArrayInputStream(body))) {
            feed = new SyndFeedInput().build(reader);
        } catch (FeedException | IOException | IllegalArgumentException e) {
            throw FetchException.malformed(feedUrl, e);
        }

        List<CandidateItem> items = new ArrayList<>();
        for (SyndEntry entry : feed.getEntries()) {
            if (items.size() >= source.getMaxItems()) {
                break;
            }
            CandidateItem item = toCandidate(source, entry);
            if (item != null) {
                items.add(item);
            }
        }

        log.debug("Parsed {} of {} feed entries from source '{}'",
                items.size(), feed.getEntries().size(), source.getName());
        return items;
    }

    private CandidateItem toCandidate(SourceConfig source, SyndEntry entry) {
        String title = TextNormalizer.normalize(entry.getTitle());
        String link = entry.getLink() != null ? entry.getLink() : entry.getUri();
        if (title.isEmpty() || link == null || link.isBlank()) {
            return null;
        }
        return new CandidateItem(source.getName(), title, link.trim(), publishedAt(entry), excerpt(entry));
    }

    private Instant publishedAt(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date != null ? date.toInstant() : null;
    }

    private String excerpt(SyndEntry entry) {
        SyndContent description = entry.getDescription();
        String raw = description != null ? description.getValue() : null;
        if ((raw == null || raw.isBlank()) && entry.getContents() != null && !entry.getContents().isEmpty()) {
            raw = entry.getContents().get(0).getValue();
        }
        if (raw == null || raw.isBlank()) {
            return "";
        }
        // 설명 필드는 HTML 조각인 경우가 많음
        return TextNormalizer.normalize(Jsoup.parse(raw).text());
    }
}
