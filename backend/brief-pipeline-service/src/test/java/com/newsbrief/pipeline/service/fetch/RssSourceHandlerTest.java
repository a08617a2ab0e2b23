package com.newsbrief.pipeline.service.fetch;

import com.newsbrief.pipeline.dto.CandidateItem;
import com.newsbrief.pipeline.dto.tenant.SourceConfig;
import com.newsbrief.pipeline.entity.SourceKind;
import com.newsbrief.pipeline.exception.FetchException;
import com.newsbrief.pipeline.support.StubExchangeFunction;
import com.newsbrief.pipeline.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RssSourceHandlerTest {

    private static final String FEED_URL = "https://news.example.com/rss.xml";

    private static final String FEED = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0">
              <channel>
                <title>Example News</title>
                <link>https://news.example.com</link>
                <description>Example</description>
                <item>
                  <title>First story</title>
                  <link>https://news.example.com/1</link>
                  <description>&lt;p&gt;Lead &lt;b&gt;paragraph&lt;/b&gt;&lt;/p&gt;</description>
                  <pubDate>Wed, 01 May 2024 08:00:00 GMT</pubDate>
                </item>
                <item>
                  <title></title>
                  <link>https://news.example.com/untitled</link>
                </item>
                <item>
                  <title>Second story</title>
                  <link>https://news.example.com/2</link>
                </item>
                <item>
                  <title>Third story</title>
                  <link>https://news.example.com/3</link>
                </item>
              </channel>
            </rss>
            """;

    private StubExchangeFunction exchange;
    private RssSourceHandler handler;
    private SourceConfig source;

    @BeforeEach
    void setUp() {
        exchange = new StubExchangeFunction();
        handler = new RssSourceHandler(new HttpFetcher(exchange.webClient(), TestProperties.fast()));
        source = SourceConfig.of("example", SourceKind.RSS, "https://news.example.com");
        source.setFeedUrl(FEED_URL);
    }

    @Test
    @DisplayName("피드 순서대로 항목을 읽고 제목 없는 항목은 건너뜀")
    void parsesFeed() {
        // given
        exchange.respond(FEED_URL, "application/rss+xml", FEED);
        source.setMaxItems(2);

        // when
        List<CandidateItem> items = handler.fetch(source, FetchContext.of(Duration.ofSeconds(5), ZoneOffset.UTC));

        // then
        assertThat(items).extracting(CandidateItem::title).containsExactly("First story", "Second story");
        CandidateItem first = items.get(0);
        assertThat(first.url()).isEqualTo("https://news.example.com/1");
        assertThat(first.publishedAt()).isEqualTo(Instant.parse("2024-05-01T08:00:00Z"));
        assertThat(first.rawExcerpt()).isEqualTo("Lead paragraph");
        assertThat(items.get(1).publishedAt()).isNull();
    }

    @Test
    @DisplayName("XML이 아니면 MALFORMED")
    void malformedFeed() {
        exchange.respond(FEED_URL, "text/html", "<html><body>not a feed</body></html>");

        assertThatThrownBy(() -> handler.fetch(source, FetchContext.of(Duration.ofSeconds(5), ZoneOffset.UTC)))
                .isInstanceOf(FetchException.class)
                .extracting(e -> ((FetchException) e).getKind())
                .isEqualTo(FetchException.Kind.MALFORMED);
    }
}
