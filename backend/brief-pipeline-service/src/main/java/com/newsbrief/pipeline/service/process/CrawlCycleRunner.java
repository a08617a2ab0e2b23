package com.newsbrief.pipeline.service.process;

import com.newsbrief.pipeline.dto.ArticlePage;
import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.dto.AttachmentCandidate;
import com.newsbrief.pipeline.dto.CandidateItem;
import com.newsbrief.pipeline.dto.CrawlCycleResult;
import com.newsbrief.pipeline.dto.FilteredItem;
import com.newsbrief.pipeline.dto.SourceError;
import com.newsbrief.pipeline.dto.TestCrawlResponse;
import com.newsbrief.pipeline.dto.tenant.CrawlSettings;
import com.newsbrief.pipeline.dto.tenant.ProcessorSettings;
import com.newsbrief.pipeline.dto.tenant.SourceConfig;
import com.newsbrief.pipeline.dto.tenant.TenantConfig;
import com.newsbrief.pipeline.exception.ContentStoreException;
import com.newsbrief.pipeline.exception.FetchException;
import com.newsbrief.pipeline.exception.JobCancelledException;
import com.newsbrief.pipeline.exception.ProcessingException;
import com.newsbrief.pipeline.service.CancellationSignal;
import com.newsbrief.pipeline.service.attachment.AttachmentDownloader;
import com.newsbrief.pipeline.service.attachment.AttachmentResolution;
import com.newsbrief.pipeline.service.attachment.AttachmentResolver;
import com.newsbrief.pipeline.service.fetch.ArticlePageFetcher;
import com.newsbrief.pipeline.service.fetch.ContentFilter;
import com.newsbrief.pipeline.service.fetch.SourceFetcher;
import com.newsbrief.pipeline.service.store.ContentStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 수집 사이클 실행.
 *
 * 소스들은 병렬로 조회되고, 한 소스 안의 항목은 순서대로 처리됩니다.
 * 소스/항목 단위 실패는 결과에 기록만 하고 사이클은 계속되며,
 * 지식베이스 ID 오류처럼 모든 항목에 반복될 실패만 사이클 전체를 중단시킵니다.
 */
@Service
@Slf4j
public class CrawlCycleRunner {

    private final SourceFetcher sourceFetcher;
    private final ContentFilter contentFilter;
    private final ArticlePageFetcher articlePageFetcher;
    private final AttachmentResolver attachmentResolver;
    private final AttachmentDownloader attachmentDownloader;
    private final ContentProcessor contentProcessor;
    private final ContentStore contentStore;
    private final MeterRegistry meterRegistry;
    private final Executor crawlExecutor;
    private final Clock clock;

    public CrawlCycleRunner(SourceFetcher sourceFetcher,
                            ContentFilter contentFilter,
                            ArticlePageFetcher articlePageFetcher,
                            AttachmentResolver attachmentResolver,
                            AttachmentDownloader attachmentDownloader,
                            ContentProcessor contentProcessor,
                            ContentStore contentStore,
                            MeterRegistry meterRegistry,
                            @Qualifier("crawlExecutor") Executor crawlExecutor,
                            Clock clock) {
        this.sourceFetcher = sourceFetcher;
        this.contentFilter = contentFilter;
        this.articlePageFetcher = articlePageFetcher;
        this.attachmentResolver = attachmentResolver;
        this.attachmentDownloader = attachmentDownloader;
        this.contentProcessor = contentProcessor;
        this.contentStore = contentStore;
        this.meterRegistry = meterRegistry;
        this.crawlExecutor = crawlExecutor;
        this.clock = clock;
    }

    /**
     * @throws JobCancelledException    작업이 취소/타임아웃된 경우
     * @throws ProcessingException      설정 전체에 해당하는 저장 오류
     */
    public CrawlCycleResult run(String tenantId, TenantConfig config, CancellationSignal signal) {
        CrawlCycleContext context = new CrawlCycleContext(tenantId, config, signal, clock.instant());
        List<SourceConfig> sources = config.enabledSources();
        log.info("[Crawl:{}] Starting cycle over {} sources", tenantId, sources.size());

        List<CompletableFuture<Void>> futures = sources.stream()
                .map(source -> CompletableFuture.runAsync(() -> crawlSource(context, source), crawlExecutor))
                .toList();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (context.fatal() == null && !(e.getCause() instanceof JobCancelledException)) {
                log.error("[Crawl:{}] Unexpected failure in source worker: {}", tenantId, e.getMessage(), e);
            }
        }

        if (context.fatal() != null) {
            throw context.fatal();
        }
        signal.throwIfCancelled();

        CrawlCycleResult result = context.toResult();
        log.info("[Crawl:{}] Cycle finished: sources={}/{} failed, fetched={}, filtered={}, duplicate={}, processed={}, itemFailures={}",
                tenantId, result.sourcesFailed(), result.sourcesAttempted(), result.itemsFetched(),
                result.itemsFiltered(), result.itemsDuplicate(), result.itemsProcessed(), result.itemsFailed());
        return result;
    }

    private void crawlSource(CrawlCycleContext context, SourceConfig source) {
        context.sourceAttempted();
        CancellationSignal signal = context.signal();
        String tenantId = context.tenantId();

        List<CandidateItem> candidates;
        try {
            candidates = sourceFetcher.fetch(source, context.fetchContext());
        } catch (FetchException e) {
            log.warn("[Crawl:{}] Source '{}' failed: {}", tenantId, source.getName(), e.getMessage());
            context.sourceFailed(SourceError.ofSource(source.getName(), e.getErrorCode(), e.getMessage()));
            return;
        } catch (JobCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[Crawl:{}] Unexpected error fetching source '{}': {}", tenantId, source.getName(), e.getMessage(), e);
            context.sourceFailed(SourceError.ofSource(source.getName(), "FETCH_ERROR", e.getMessage()));
            return;
        }
        context.fetched(candidates.size());

        CrawlSettings crawl = context.config().getCrawl();
        List<FilteredItem> items = contentFilter.filter(candidates, source, crawl.freshnessWindow(source), context.now());
        context.filtered(items.size());
        log.info("[Crawl:{}] Source '{}': {} fetched, {} kept after filtering",
                tenantId, source.getName(), candidates.size(), items.size());

        for (FilteredItem item : items) {
            signal.throwIfCancelled();
            if (!context.claim(item.fingerprint())) {
                log.debug("[Crawl:{}] Duplicate within cycle: {}", tenantId, item.title());
                context.duplicate();
                continue;
            }
            try {
                processItem(context, item);
            } catch (ProcessingException e) {
                if (e.isConfigurationWide()) {
                    log.error("[Crawl:{}] Aborting cycle: {}", tenantId, e.getMessage());
                    context.abort(e);
                    return;
                }
                log.warn("[Crawl:{}] Item '{}' failed: {}", tenantId, item.title(), e.getMessage());
                context.itemFailed(SourceError.ofItem(source.getName(), item.title(), e.getErrorCode(), e.getMessage()));
            }
        }
    }

    private void processItem(CrawlCycleContext context, FilteredItem item) {
        TenantConfig config = context.config();
        ProcessorSettings processor = config.getProcessor();
        CancellationSignal signal = context.signal();

        if (processor.isSaveToKb() && alreadyStored(processor.getKbId(), item)) {
            log.debug("[Crawl:{}] Already in knowledge base: {}", context.tenantId(), item.title());
            context.duplicate();
            return;
        }

        ArticlePage page = config.getCrawl().isFetchPageContent()
                ? articlePageFetcher.fetch(item.url(), context.fetchContext())
                : ArticlePage.empty(item.url());

        List<Attachment> attachments = new ArrayList<>();
        if (processor.isDownloadAttachments() && page.hasHtml()) {
            AttachmentResolution resolution = attachmentResolver.resolve(item, page.html(),
                    context.downloadPolicy(), config.getCrawl().getMaxAttachmentsPerItem());
            attachments.addAll(attachmentDownloader.download(item.title(), resolution.candidates(),
                    context.downloadPolicy(), context.downloadPermits(), signal));
            attachments.addAll(resolution.rejected());
            attachments.forEach(attachment -> {
                context.attachment(attachment);
                meterRegistry.counter("newsbrief.attachments",
                        "status", attachment.status().name().toLowerCase(Locale.ROOT)).increment();
            });
        }

        contentProcessor.process(item, page, attachments, processor, signal);
        context.processed();
    }

    private boolean alreadyStored(String kbId, FilteredItem item) {
        try {
            return contentStore.contains(kbId, item.fingerprint());
        } catch (ContentStoreException e) {
            throw e.toProcessingException();
        }
    }

    /**
     * 소스 1건 시험 수집: 조회와 필터링, 첫 항목의 첨부파일 후보 탐색까지만 수행하고 저장하지 않습니다.
     */
    public TestCrawlResponse preview(TenantConfig config, SourceConfig source) {
        CrawlCycleContext context = new CrawlCycleContext("test", config, CancellationSignal.create(), clock.instant());
        List<CandidateItem> candidates = sourceFetcher.fetch(source, context.fetchContext());
        List<FilteredItem> items = contentFilter.filter(candidates, source,
                config.getCrawl().freshnessWindow(source), context.now());

        List<AttachmentCandidate> attachmentCandidates = List.of();
        if (!items.isEmpty() && config.getProcessor().isDownloadAttachments()) {
            FilteredItem first = items.get(0);
            ArticlePage page = articlePageFetcher.fetch(first.url(), context.fetchContext());
            if (page.hasHtml()) {
                attachmentCandidates = attachmentResolver.resolve(first, page.html(), context.downloadPolicy(),
                        config.getCrawl().getMaxAttachmentsPerItem()).candidates();
            }
        }
        return new TestCrawlResponse(source.getName(), candidates.size(), items, attachmentCandidates);
    }
}
