package com.newsbrief.pipeline.service.process;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsbrief.pipeline.dto.ArticlePage;
import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.dto.CandidateItem;
import com.newsbrief.pipeline.dto.FilteredItem;
import com.newsbrief.pipeline.dto.ProcessedNews;
import com.newsbrief.pipeline.dto.tenant.ProcessorSettings;
import com.newsbrief.pipeline.entity.AttachmentStatus;
import com.newsbrief.pipeline.entity.OutputFormat;
import com.newsbrief.pipeline.exception.ContentStoreException;
import com.newsbrief.pipeline.exception.JobCancelledException;
import com.newsbrief.pipeline.exception.ProcessingException;
import com.newsbrief.pipeline.service.CancellationSignal;
import com.newsbrief.pipeline.support.InMemoryContentStore;
import com.newsbrief.pipeline.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ContentProcessor 단위 테스트
 */
class ContentProcessorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");

    private InMemoryContentStore store;
    private ContentProcessor processor;
    private ProcessorSettings settings;
    private FilteredItem item;

    @BeforeEach
    void setUp() {
        store = new InMemoryContentStore();
        processor = new ContentProcessor(store, new NewsRenderer(new ObjectMapper()), new MutableClock(NOW));
        settings = new ProcessorSettings();
        settings.setKbId("kb-1");
        item = new FilteredItem(new CandidateItem("gov", "Policy  update", "https://site/news/1",
                Instant.parse("2024-05-01T08:00:00Z"), "Short excerpt"), "fp-1");
    }

    @Nested
    @DisplayName("정규화")
    class Normalization {

        @Test
        @DisplayName("본문은 최대 길이로 정확히 자르고, 요약은 발췌문을 사용")
        void truncatesBody() {
            // given
            settings.setMaxContentLength(50);
            ArticlePage page = new ArticlePage(item.url(), "<html/>", "Page title", "b".repeat(120));

            // when
            ProcessedNews news = processor.process(item, page, List.of(), settings, CancellationSignal.create());

            // then
            assertThat(news.title()).isEqualTo("Policy update");
            assertThat(news.body()).hasSize(50);
            assertThat(news.summary()).isEqualTo("Short excerpt");
            assertThat(news.renderedContent()).startsWith("# Policy update").contains("## Content");
        }

        @Test
        @DisplayName("발췌문이 없으면 본문 앞부분으로 요약")
        void summaryFromBody() {
            FilteredItem noExcerpt = new FilteredItem(new CandidateItem("gov", "Title here", "https://site/2",
                    null, ""), "fp-2");
            ArticlePage page = new ArticlePage(noExcerpt.url(), "<html/>", "", "x".repeat(300));

            ProcessedNews news = processor.process(noExcerpt, page, List.of(), settings, CancellationSignal.create());

            assertThat(news.summary()).hasSize(200).endsWith("...");
        }

        @Test
        @DisplayName("JSON 형식 렌더링")
        void rendersJson() {
            settings.setFormatOutput(OutputFormat.JSON);

            ProcessedNews news = processor.process(item, ArticlePage.empty(item.url()), List.of(), settings,
                    CancellationSignal.create());

            assertThat(news.renderedContent()).startsWith("{\"title\":\"Policy update\"");
        }
    }

    @Nested
    @DisplayName("저장")
    class Storing {

        @Test
        @DisplayName("같은 항목을 두 번 처리해도 지식베이스에는 1건")
        void idempotent() {
            processor.process(item, ArticlePage.empty(item.url()), List.of(), settings, CancellationSignal.create());
            ProcessedNews second = processor.process(item, ArticlePage.empty(item.url()), List.of(), settings,
                    CancellationSignal.create());

            assertThat(store.all("kb-1")).hasSize(1);
            assertThat(store.writes()).isEqualTo(2);
            assertThat(second.kbRef()).isEqualTo("kb-1/fp-1");
            assertThat(second.storedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("다운로드된 첨부파일은 바이트를 저장하고 참조만 남김")
        void storesAttachmentBlobs() {
            Attachment downloaded = new Attachment("fp-1", "https://site/a.pdf", "Policy update_a.pdf", "a.pdf",
                    "pdf", 3, new byte[]{1, 2, 3}, null, AttachmentStatus.DOWNLOADED, null);
            Attachment skipped = new Attachment("fp-1", "https://site/b.pdf", "b.pdf", "b.pdf", "pdf",
                    60L * 1024 * 1024, null, null, AttachmentStatus.SKIPPED_SIZE, "too large");

            ProcessedNews news = processor.process(item, ArticlePage.empty(item.url()), List.of(downloaded, skipped),
                    settings, CancellationSignal.create());

            assertThat(news.attachments()).hasSize(2);
            assertThat(news.attachments().get(0).storageRef()).isEqualTo("Policy update_a.pdf");
            assertThat(news.attachments()).allSatisfy(a -> assertThat(a.content()).isNull());
            assertThat(store.getBlob("kb-1", "Policy update_a.pdf")).isPresent();
            assertThat(news.renderedContent()).contains("## Attachments").contains("1. Policy update_a.pdf (pdf, 3 B)");
        }

        @Test
        @DisplayName("saveToKb=false면 저장하지 않음")
        void skipStore() {
            settings.setSaveToKb(false);

            ProcessedNews news = processor.process(item, ArticlePage.empty(item.url()), List.of(), settings,
                    CancellationSignal.create());

            assertThat(store.writes()).isZero();
            assertThat(news.kbRef()).isNull();
        }

        @Test
        @DisplayName("취소된 작업은 기록하지 않음")
        void cancelled() {
            CancellationSignal signal = CancellationSignal.create();
            signal.cancel("timeout");

            assertThatThrownBy(() -> processor.process(item, ArticlePage.empty(item.url()), List.of(), settings, signal))
                    .isInstanceOf(JobCancelledException.class);
            assertThat(store.writes()).isZero();
        }

        @Test
        @DisplayName("저장소 오류는 ProcessingException으로 변환")
        void storeFailure() {
            store.failWith(new ContentStoreException(ContentStoreException.Kind.UNREACHABLE, "down"));

            assertThatThrownBy(() -> processor.process(item, ArticlePage.empty(item.url()), List.of(), settings,
                    CancellationSignal.create()))
                    .isInstanceOf(ProcessingException.class)
                    .extracting(e -> ((ProcessingException) e).getKind())
                    .isEqualTo(ProcessingException.Kind.STORE_UNREACHABLE);
        }
    }
}
