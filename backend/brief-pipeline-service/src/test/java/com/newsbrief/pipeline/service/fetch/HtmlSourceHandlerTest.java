package com.newsbrief.pipeline.service.fetch;

import com.newsbrief.pipeline.dto.CandidateItem;
import com.newsbrief.pipeline.dto.tenant.SourceConfig;
import com.newsbrief.pipeline.entity.SourceKind;
import com.newsbrief.pipeline.support.StubExchangeFunction;
import com.newsbrief.pipeline.support.TestProperties;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlSourceHandlerTest {

    private static final String PAGE_URL = "https://gov.example.cn/news/";
    private static final ZoneId SHANGHAI = ZoneId.of("Asia/Shanghai");

    private StubExchangeFunction exchange;
    private HtmlSourceHandler handler;
    private SourceConfig source;
    private FetchContext context;

    @BeforeEach
    void setUp() {
        exchange = new StubExchangeFunction();
        handler = new HtmlSourceHandler(new HttpFetcher(exchange.webClient(), TestProperties.fast()));
        source = SourceConfig.of("gov", SourceKind.HTML, PAGE_URL);
        context = FetchContext.of(Duration.ofSeconds(5), SHANGHAI);
    }

    @Test
    @DisplayName("article 요소에서 제목/링크/요약/게시일 추출")
    void extractsArticles() {
        String html = """
                <html><body>
                  <article>
                    <h2><a href="/news/2024/policy.html">New industrial policy released</a></h2>
                    <p class="summary">Policy summary text</p>
                    <span class="date">2024-05-01 10:30</span>
                  </article>
                  <article>
                    <h2><a href="#">Anchor only headline</a></h2>
                  </article>
                  <article>
                    <h2><a href="/short">Tiny</a></h2>
                  </article>
                  <article>
                    <h3><a href="https://gov.example.cn/news/2024/trade.html">Trade statistics for April</a></h3>
                    <time datetime="2024-05-01T02:00:00Z">May 1</time>
                  </article>
                </body></html>
                """;

        List<CandidateItem> items = handler.extract(source, Jsoup.parse(html, PAGE_URL), context);

        assertThat(items).hasSize(2);
        CandidateItem first = items.get(0);
        assertThat(first.title()).isEqualTo("New industrial policy released");
        assertThat(first.url()).isEqualTo("https://gov.example.cn/news/2024/policy.html");
        assertThat(first.rawExcerpt()).isEqualTo("Policy summary text");
        assertThat(first.publishedAt()).isEqualTo(Instant.parse("2024-05-01T02:30:00Z"));
        assertThat(items.get(1).publishedAt()).isEqualTo(Instant.parse("2024-05-01T02:00:00Z"));
    }

    @Test
    @DisplayName("목록 구조가 없으면 긴 링크 텍스트로 대체 추출")
    void fallsBackToLinks() {
        String html = """
                <html><body>
                  <div><a href="/a">Home</a></div>
                  <div><a href="/story-1">A sufficiently long link headline</a></div>
                  <div><a href="/story-1">A sufficiently long link headline</a></div>
                  <div><a href="mailto:press@example.cn">Contact the press office today</a></div>
                </body></html>
                """;

        List<CandidateItem> items = handler.extract(source, Jsoup.parse(html, PAGE_URL), context);

        assertThat(items).extracting(CandidateItem::url).containsExactly("https://gov.example.cn/story-1");
    }

    @Test
    @DisplayName("GBK 인코딩 페이지의 제목을 깨짐 없이 추출하고 키워드와 비교할 수 있다")
    void decodesGbkPage() {
        // given
        String html = """
                <html><body>
                  <article>
                    <h2><a href="/news/2024/ai.html">人工智能产业发展政策发布</a></h2>
                  </article>
                </body></html>
                """;
        exchange.respond(PAGE_URL, "text/html; charset=GBK", html.getBytes(Charset.forName("GBK")));

        // when
        List<CandidateItem> items = handler.fetch(source, context);

        // then
        assertThat(items).extracting(CandidateItem::title).containsExactly("人工智能产业发展政策发布");
        source.setKeywords(List.of("人工智能"));
        assertThat(new ContentFilter().filter(items, source, Duration.ofDays(1), Instant.now())).hasSize(1);
    }
}
