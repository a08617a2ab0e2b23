package com.newsbrief.pipeline.service.process;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsbrief.pipeline.dto.ArticlePage;
import com.newsbrief.pipeline.dto.CandidateItem;
import com.newsbrief.pipeline.dto.CrawlCycleResult;
import com.newsbrief.pipeline.dto.SourceError;
import com.newsbrief.pipeline.dto.tenant.SourceConfig;
import com.newsbrief.pipeline.dto.tenant.TenantConfig;
import com.newsbrief.pipeline.entity.JobKind;
import com.newsbrief.pipeline.entity.SourceKind;
import com.newsbrief.pipeline.exception.ContentStoreException;
import com.newsbrief.pipeline.exception.FetchException;
import com.newsbrief.pipeline.exception.JobCancelledException;
import com.newsbrief.pipeline.exception.ProcessingException;
import com.newsbrief.pipeline.scheduler.CrawlJobHandler;
import com.newsbrief.pipeline.scheduler.JobResult;
import com.newsbrief.pipeline.scheduler.JobRun;
import com.newsbrief.pipeline.service.CancellationSignal;
import com.newsbrief.pipeline.service.attachment.AttachmentDownloader;
import com.newsbrief.pipeline.service.attachment.AttachmentResolver;
import com.newsbrief.pipeline.service.fetch.ArticlePageFetcher;
import com.newsbrief.pipeline.service.fetch.ContentFilter;
import com.newsbrief.pipeline.service.fetch.SourceFetcher;
import com.newsbrief.pipeline.support.InMemoryContentStore;
import com.newsbrief.pipeline.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * CrawlCycleRunner 테스트 (소스 격리, 중복 처리, 사이클 중단)
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CrawlCycleRunnerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");

    @Mock
    private SourceFetcher sourceFetcher;

    @Mock
    private ArticlePageFetcher articlePageFetcher;

    @Mock
    private AttachmentResolver attachmentResolver;

    @Mock
    private AttachmentDownloader attachmentDownloader;

    private InMemoryContentStore store;
    private ExecutorService executor;
    private CrawlCycleRunner runner;
    private TenantConfig config;
    private SourceConfig sourceX;
    private SourceConfig sourceY;

    @BeforeEach
    void setUp() {
        store = new InMemoryContentStore();
        executor = Executors.newFixedThreadPool(4);
        MutableClock clock = new MutableClock(NOW);
        ContentProcessor processor = new ContentProcessor(store, new NewsRenderer(new ObjectMapper()), clock);
        runner = new CrawlCycleRunner(sourceFetcher, new ContentFilter(), articlePageFetcher, attachmentResolver,
                attachmentDownloader, processor, store, new SimpleMeterRegistry(), executor, clock);

        sourceX = SourceConfig.of("source-x", SourceKind.RSS, "https://x.example.com/rss");
        sourceY = SourceConfig.of("source-y", SourceKind.HTML, "https://y.example.com/news");
        config = new TenantConfig();
        config.getProcessor().setKbId("kb-1");
        config.setSources(List.of(sourceX, sourceY));

        when(articlePageFetcher.fetch(anyString(), any())).thenAnswer(inv -> ArticlePage.empty(inv.getArgument(0)));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("한 소스가 타임아웃되어도 다른 소스는 처리되고 작업은 성공")
    void isolatesSourceFailure() {
        // given
        when(sourceFetcher.fetch(eq(sourceX), any())).thenThrow(FetchException.timeout(sourceX.fetchUrl()));
        when(sourceFetcher.fetch(eq(sourceY), any())).thenReturn(List.of(
                item("source-y", "Export figures rise", "https://y.example.com/1"),
                item("source-y", "Factory output slows", "https://y.example.com/2")));
        JobRun jobRun = new JobRun("job-1", "tenant-a", JobKind.CRAWL, config, NOW);

        // when
        JobResult result = new CrawlJobHandler(runner).run(jobRun);

        // then
        assertThat(result.isFailure()).isFalse();
        assertThat(result.sourceErrors()).singleElement().satisfies(error -> {
            assertThat(error.sourceName()).isEqualTo("source-x");
            assertThat(error.errorCode()).isEqualTo("FETCH_TIMEOUT");
        });
        assertThat(result.stats()).containsEntry("itemsProcessed", 2);
        assertThat(store.all("kb-1")).hasSize(2);
    }

    @Test
    @DisplayName("지식베이스에 이미 있는 항목은 페이지 조회 없이 건너뜀")
    void skipsStoredItems() {
        config.setSources(List.of(sourceY));
        when(sourceFetcher.fetch(eq(sourceY), any())).thenReturn(List.of(
                item("source-y", "Export figures rise", "https://y.example.com/1")));

        runner.run("tenant-a", config, CancellationSignal.create());
        CrawlCycleResult second = runner.run("tenant-a", config, CancellationSignal.create());

        assertThat(second.itemsDuplicate()).isEqualTo(1);
        assertThat(second.itemsProcessed()).isZero();
        assertThat(second.isTotalFailure()).isFalse();
        assertThat(store.writes()).isEqualTo(1);
    }

    @Test
    @DisplayName("여러 소스에 같은 기사가 있으면 한 번만 처리")
    void claimsFingerprintOnce() {
        CandidateItem shared = item("source-x", "Shared headline here", "https://wire.example.com/a");
        when(sourceFetcher.fetch(eq(sourceX), any())).thenReturn(List.of(shared));
        when(sourceFetcher.fetch(eq(sourceY), any())).thenReturn(List.of(
                new CandidateItem("source-y", "Shared headline here", "https://wire.example.com/a?utm_source=y",
                        null, "")));

        CrawlCycleResult result = runner.run("tenant-a", config, CancellationSignal.create());

        assertThat(result.itemsProcessed()).isEqualTo(1);
        assertThat(result.itemsDuplicate()).isEqualTo(1);
    }

    @Test
    @DisplayName("저장소 장애는 항목 단위로 기록되고 처리된 항목이 없으면 전체 실패")
    void storeUnreachableIsPerItem() {
        config.setSources(List.of(sourceY));
        when(sourceFetcher.fetch(eq(sourceY), any())).thenReturn(List.of(
                item("source-y", "Export figures rise", "https://y.example.com/1")));
        store.failWith(new ContentStoreException(ContentStoreException.Kind.UNREACHABLE, "connection refused"));

        CrawlCycleResult result = runner.run("tenant-a", config, CancellationSignal.create());

        assertThat(result.itemErrors()).extracting(SourceError::errorCode)
                .containsExactly("PROCESSING_STORE_UNREACHABLE");
        assertThat(result.isTotalFailure()).isTrue();
    }

    @Test
    @DisplayName("잘못된 지식베이스 ID는 사이클 전체를 중단")
    void invalidKbIdAborts() {
        config.setSources(List.of(sourceY));
        when(sourceFetcher.fetch(eq(sourceY), any())).thenReturn(List.of(
                item("source-y", "Export figures rise", "https://y.example.com/1")));
        store.failWith(new ContentStoreException(ContentStoreException.Kind.INVALID_KB_ID, "bad id"));

        assertThatThrownBy(() -> runner.run("tenant-a", config, CancellationSignal.create()))
                .isInstanceOf(ProcessingException.class)
                .extracting(e -> ((ProcessingException) e).getKind())
                .isEqualTo(ProcessingException.Kind.INVALID_KB_ID);
    }

    @Test
    @DisplayName("취소된 사이클은 항목을 처리하지 않음")
    void cancelled() {
        config.setSources(List.of(sourceY));
        when(sourceFetcher.fetch(eq(sourceY), any())).thenReturn(List.of(
                item("source-y", "Export figures rise", "https://y.example.com/1")));
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel("cancelled");

        assertThatThrownBy(() -> runner.run("tenant-a", config, signal))
                .isInstanceOf(JobCancelledException.class);
        assertThat(store.writes()).isZero();
    }

    @Test
    @DisplayName("페이지 조회를 끄면 기사 페이지를 요청하지 않음")
    void skipsPageFetch() {
        config.setSources(List.of(sourceY));
        config.getCrawl().setFetchPageContent(false);
        when(sourceFetcher.fetch(eq(sourceY), any())).thenReturn(List.of(
                item("source-y", "Export figures rise", "https://y.example.com/1")));

        CrawlCycleResult result = runner.run("tenant-a", config, CancellationSignal.create());

        assertThat(result.itemsProcessed()).isEqualTo(1);
        verify(articlePageFetcher, never()).fetch(anyString(), any());
    }

    private CandidateItem item(String source, String title, String url) {
        return new CandidateItem(source, title, url, null, "");
    }
}
