package com.newsbrief.pipeline.service.process;

import com.newsbrief.pipeline.dto.ArticlePage;
import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.dto.FilteredItem;
import com.newsbrief.pipeline.dto.ProcessedNews;
import com.newsbrief.pipeline.dto.tenant.ProcessorSettings;
import com.newsbrief.pipeline.exception.ContentStoreException;
import com.newsbrief.pipeline.service.CancellationSignal;
import com.newsbrief.pipeline.service.store.ContentStore;
import com.newsbrief.pipeline.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 필터링된 항목을 정규화하여 ProcessedNews로 만들고 지식베이스에 기록합니다.
 *
 * 같은 지문에 대한 기록은 잠금으로 직렬화되며, 저장소 쪽도 지문 기준 upsert이므로
 * 재처리는 중복 없이 덮어쓰기가 됩니다.
 */
@Service
@Slf4j
public class ContentProcessor {

    private static final int SUMMARY_LENGTH = 200;
    private static final int LOCK_STRIPES = 64;

    private final ContentStore contentStore;
    private final NewsRenderer renderer;
    private final Clock clock;
    private final ReentrantLock[] writeLocks = new ReentrantLock[LOCK_STRIPES];

    public ContentProcessor(ContentStore contentStore, NewsRenderer renderer, Clock clock) {
        this.contentStore = contentStore;
        this.renderer = renderer;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            writeLocks[i] = new ReentrantLock();
        }
    }

    /**
     * @throws com.newsbrief.pipeline.exception.ProcessingException 저장소 기록 실패 시
     * @throws com.newsbrief.pipeline.exception.JobCancelledException 기록 전에 작업이 취소된 경우
     */
    public ProcessedNews process(FilteredItem item, ArticlePage page, List<Attachment> attachments,
                                 ProcessorSettings settings, CancellationSignal signal) {
        String title = TextNormalizer.normalize(item.title());
        if (title.isEmpty() && page != null) {
            title = page.title();
        }

        String pageText = page != null && settings.isProcessContent() ? page.bodyText() : "";
        String excerpt = TextNormalizer.normalize(item.excerpt());
        String body = TextNormalizer.truncate(pageText.isEmpty() ? excerpt : pageText, settings.getMaxContentLength());
        String summary = TextNormalizer.abbreviate(excerpt.isEmpty() ? body : excerpt, SUMMARY_LENGTH);

        String rendered = renderer.render(settings.getFormatOutput(), title, item.sourceName(), item.url(),
                item.publishedAt(), summary, body, attachments);
        ProcessedNews news = new ProcessedNews(item.fingerprint(), item.sourceName(), title, item.url(),
                item.publishedAt(), summary, body, settings.getFormatOutput(), rendered,
                attachments.stream().map(Attachment::metadataOnly).toList(), null, null);

        if (!settings.isSaveToKb()) {
            return news;
        }
        return store(news, attachments, settings.getKbId(), signal);
    }

    private ProcessedNews store(ProcessedNews news, List<Attachment> attachments, String kbId,
                                CancellationSignal signal) {
        ReentrantLock lock = writeLocks[Math.floorMod(news.fingerprint().hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            List<Attachment> stored = new ArrayList<>(attachments.size());
            for (Attachment attachment : attachments) {
                if (attachment.isDownloaded()) {
                    signal.throwIfCancelled();
                    stored.add(attachment.withStorageRef(contentStore.putBlob(kbId, attachment)));
                } else {
                    stored.add(attachment.metadataOnly());
                }
            }

            // 취소된 작업은 뉴스 문서를 완료 상태로 기록하지 않음
            signal.throwIfCancelled();
            Instant storedAt = clock.instant();
            ProcessedNews complete = new ProcessedNews(news.fingerprint(), news.sourceName(), news.title(), news.url(),
                    news.publishedAt(), news.summary(), news.body(), news.format(), news.renderedContent(),
                    stored, storedAt, null);
            String kbRef = contentStore.put(kbId, complete);
            log.debug("Stored '{}' as {} with {} attachments", news.title(), kbRef, stored.size());
            return complete.withStored(storedAt, kbRef);
        } catch (ContentStoreException e) {
            throw e.toProcessingException();
        } finally {
            lock.unlock();
        }
    }
}
