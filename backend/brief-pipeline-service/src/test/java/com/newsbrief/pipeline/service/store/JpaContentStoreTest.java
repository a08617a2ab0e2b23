package com.newsbrief.pipeline.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsbrief.pipeline.config.NewsBriefProperties;
import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.dto.ProcessedNews;
import com.newsbrief.pipeline.entity.AttachmentStatus;
import com.newsbrief.pipeline.entity.OutputFormat;
import com.newsbrief.pipeline.entity.StoredAttachment;
import com.newsbrief.pipeline.exception.ContentStoreException;
import com.newsbrief.pipeline.repository.StoredAttachmentRepository;
import com.newsbrief.pipeline.repository.StoredNewsRepository;
import com.newsbrief.pipeline.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

/**
 * JpaContentStore 통합 테스트 (내장 H2)
 */
@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaContentStoreTest {

    private static final String KB = "kb-test";
    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    @Autowired
    private StoredNewsRepository newsRepository;

    @Autowired
    private StoredAttachmentRepository attachmentRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private MutableClock clock;
    private NewsBriefProperties properties;
    private JpaContentStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        properties = new NewsBriefProperties();
        store = new JpaContentStore(newsRepository, attachmentRepository, transactionManager,
                new ObjectMapper(), properties, clock);
    }

    @AfterEach
    void tearDown() {
        attachmentRepository.deleteAll();
        newsRepository.deleteAll();
    }

    @Test
    @DisplayName("같은 지문으로 다시 기록하면 덮어쓰기")
    void putIsIdempotent() {
        // given
        store.put(KB, news("fp-1", "First title", T0));

        // when
        String ref = store.put(KB, news("fp-1", "Updated title", T0.plusSeconds(60)));

        // then
        assertThat(ref).isEqualTo(KB + "/fp-1");
        assertThat(newsRepository.countByKbId(KB)).isEqualTo(1);
        assertThat(store.contains(KB, "fp-1")).isTrue();
        assertThat(store.query(KB, T0, T0.plus(Duration.ofHours(1))))
                .singleElement()
                .extracting(ProcessedNews::title)
                .isEqualTo("Updated title");
    }

    @Test
    @DisplayName("기간 조회는 [from, to) 범위를 최신순으로 반환하고 첨부파일 메타데이터를 복원")
    void queryWindow() {
        Attachment meta = new Attachment("fp-2", "https://site/a.pdf", "News_a.pdf", "a.pdf", "pdf", 10,
                null, "News_a.pdf", AttachmentStatus.DOWNLOADED, null);
        store.put(KB, news("fp-1", "Older", T0.plusSeconds(10)));
        store.put(KB, withAttachment(news("fp-2", "Newer", T0.plusSeconds(20)), meta));
        store.put(KB, news("fp-3", "Outside", T0.plus(Duration.ofHours(2))));

        List<ProcessedNews> result = store.query(KB, T0, T0.plus(Duration.ofHours(1)));

        assertThat(result).extracting(ProcessedNews::fingerprint).containsExactly("fp-2", "fp-1");
        assertThat(result.get(0).attachments()).singleElement().satisfies(a -> {
            assertThat(a.filename()).isEqualTo("News_a.pdf");
            assertThat(a.storageRef()).isEqualTo("News_a.pdf");
            assertThat(a.content()).isNull();
        });
    }

    @Test
    @DisplayName("같은 이름·같은 크기 첨부파일은 기존 참조, 크기가 다르면 새 이름")
    void putBlobNaming() {
        String first = store.putBlob(KB, blob("News_report.pdf", new byte[]{1, 2, 3}));
        String same = store.putBlob(KB, blob("News_report.pdf", new byte[]{1, 2, 3}));
        String changed = store.putBlob(KB, blob("News_report.pdf", new byte[]{1, 2, 3, 4}));

        assertThat(first).isEqualTo("News_report.pdf");
        assertThat(same).isEqualTo("News_report.pdf");
        assertThat(changed).isEqualTo("News_report.pdf_");
        assertThat(store.getBlob(KB, changed)).hasValueSatisfying(bytes -> assertThat(bytes).hasSize(4));
        assertThat(store.findAttachments(KB, null, "pdf")).hasSize(2);
    }

    @Test
    @DisplayName("잘못된 지식베이스 ID는 INVALID_KB_ID")
    void invalidKbId() {
        assertThatThrownBy(() -> store.put("../etc", news("fp-1", "Title", T0)))
                .isInstanceOf(ContentStoreException.class)
                .extracting(e -> ((ContentStoreException) e).getKind())
                .isEqualTo(ContentStoreException.Kind.INVALID_KB_ID);
    }

    @Test
    @DisplayName("문서 수 상한을 넘으면 QUOTA_EXCEEDED, 기존 문서 갱신은 허용")
    void quota() {
        properties.getStore().setMaxDocumentsPerKb(1);
        store.put(KB, news("fp-1", "Title", T0));

        assertThatThrownBy(() -> store.put(KB, news("fp-2", "Other", T0)))
                .isInstanceOf(ContentStoreException.class)
                .extracting(e -> ((ContentStoreException) e).getKind())
                .isEqualTo(ContentStoreException.Kind.QUOTA_EXCEEDED);
        assertThat(store.put(KB, news("fp-1", "Title again", T0))).isEqualTo(KB + "/fp-1");
    }

    @Test
    @DisplayName("보존 기간 이전 문서 삭제")
    void purge() {
        store.put(KB, news("fp-old", "Old", T0.minus(Duration.ofDays(40))));
        store.put(KB, news("fp-new", "New", T0));

        int purged = store.purgeBefore(KB, T0.minus(Duration.ofDays(30)));

        assertThat(purged).isEqualTo(1);
        assertThat(store.contains(KB, "fp-old")).isFalse();
        assertThat(store.contains(KB, "fp-new")).isTrue();
    }

    private ProcessedNews news(String fingerprint, String title, Instant storedAt) {
        return new ProcessedNews(fingerprint, "source", title, "https://site/" + fingerprint, null,
                "summary", "body", OutputFormat.MARKDOWN, "# " + title, List.of(), storedAt, null);
    }

    private ProcessedNews withAttachment(ProcessedNews base, Attachment attachment) {
        return new ProcessedNews(base.fingerprint(), base.sourceName(), base.title(), base.url(), base.publishedAt(),
                base.summary(), base.body(), base.format(), base.renderedContent(), List.of(attachment),
                base.storedAt(), null);
    }

    @Test
    @DisplayName("다른 항목이 같은 첨부파일 이름을 동시에 먼저 저장하면 새 이름으로 다시 저장")
    void putBlobRetriesAfterConcurrentInsert() {
        // given: 이름 조회 이후, 저장 직전에 다른 트랜잭션이 같은 이름을 커밋
        AtomicBoolean raced = new AtomicBoolean();
        StoredAttachmentRepository racing = mock(StoredAttachmentRepository.class, delegatesTo(attachmentRepository));
        doAnswer(invocation -> {
            if (raced.compareAndSet(false, true)) {
                Thread competitor = new Thread(() -> attachmentRepository.saveAndFlush(StoredAttachment.builder()
                        .kbId(KB)
                        .storageName("News_report.pdf")
                        .itemFingerprint("fp-other")
                        .type("pdf")
                        .sizeBytes(5)
                        .content(new byte[]{9, 9, 9, 9, 9})
                        .storedAt(T0)
                        .build()));
                competitor.start();
                competitor.join();
            }
            return attachmentRepository.saveAndFlush(invocation.<StoredAttachment>getArgument(0));
        }).when(racing).saveAndFlush(any());
        JpaContentStore racingStore = new JpaContentStore(newsRepository, racing, transactionManager,
                new ObjectMapper(), properties, clock);

        // when
        String name = racingStore.putBlob(KB, blob("News_report.pdf", new byte[]{1, 2, 3}));

        // then
        assertThat(raced).isTrue();
        assertThat(name).isEqualTo("News_report.pdf_");
        assertThat(attachmentRepository.findByKbIdAndStorageName(KB, "News_report.pdf"))
                .hasValueSatisfying(a -> assertThat(a.getItemFingerprint()).isEqualTo("fp-other"));
        assertThat(store.getBlob(KB, "News_report.pdf_")).hasValueSatisfying(
                content -> assertThat(content).containsExactly(1, 2, 3));
    }

    private Attachment blob(String name, byte[] content) {
        return new Attachment("fp-1", "https://site/report.pdf", name, "report.pdf", "pdf", content.length,
                content, null, AttachmentStatus.DOWNLOADED, null);
    }
}
