package com.newsbrief.pipeline.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsbrief.pipeline.config.NewsBriefProperties;
import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.dto.ProcessedNews;
import com.newsbrief.pipeline.entity.AttachmentStatus;
import com.newsbrief.pipeline.entity.StoredAttachment;
import com.newsbrief.pipeline.entity.StoredNews;
import com.newsbrief.pipeline.exception.ContentStoreException;
import com.newsbrief.pipeline.repository.StoredAttachmentRepository;
import com.newsbrief.pipeline.repository.StoredNewsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * JPA 기반 지식베이스 저장소
 */
@Service
@Slf4j
public class JpaContentStore implements ContentStore {

    private static final Pattern KB_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]{0,127}$");
    private static final TypeReference<List<AttachmentMetadata>> METADATA_LIST = new TypeReference<>() {
    };

    private final StoredNewsRepository newsRepository;
    private final StoredAttachmentRepository attachmentRepository;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final NewsBriefProperties properties;
    private final Clock clock;

    public JpaContentStore(StoredNewsRepository newsRepository,
                           StoredAttachmentRepository attachmentRepository,
                           PlatformTransactionManager transactionManager,
                           ObjectMapper objectMapper,
                           NewsBriefProperties properties,
                           Clock clock) {
        this.newsRepository = newsRepository;
        this.attachmentRepository = attachmentRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String put(String kbId, ProcessedNews news) {
        validateKbId(kbId);
        String attachmentsJson = writeMetadata(news.attachments());
        Instant storedAt = news.storedAt() != null ? news.storedAt() : clock.instant();

        try {
            return access(kbId, () -> upsert(kbId, news, attachmentsJson, storedAt));
        } catch (ContentStoreException e) {
            if (e.getCause() instanceof DataIntegrityViolationException) {
                // 동시 삽입 경합: 다시 시도하면 기존 행을 갱신
                log.debug("Concurrent insert for fingerprint {} in {}, retrying as update", news.fingerprint(), kbId);
                return access(kbId, () -> upsert(kbId, news, attachmentsJson, storedAt));
            }
            throw e;
        }
    }

    private String upsert(String kbId, ProcessedNews news, String attachmentsJson, Instant storedAt) {
        return transactionTemplate.execute(status -> {
            StoredNews entity = newsRepository.findByKbIdAndFingerprint(kbId, news.fingerprint()).orElse(null);
            if (entity == null) {
                checkQuota(kbId);
                entity = StoredNews.builder()
                        .kbId(kbId)
                        .fingerprint(news.fingerprint())
                        .build();
            }
            entity.setSourceName(news.sourceName());
            entity.setTitle(news.title());
            entity.setUrl(news.url());
            entity.setPublishedAt(news.publishedAt());
            entity.setSummary(news.summary());
            entity.setBody(news.body());
            entity.setFormat(news.format());
            entity.setRenderedContent(news.renderedContent());
            entity.setAttachmentsJson(attachmentsJson);
            entity.setStoredAt(storedAt);
            newsRepository.saveAndFlush(entity);
            return kbRef(kbId, news.fingerprint());
        });
    }

    @Override
    public String putBlob(String kbId, Attachment attachment) {
        validateKbId(kbId);
        if (!attachment.isDownloaded() || attachment.content() == null) {
            throw new IllegalArgumentException("Only downloaded attachments carry content: " + attachment.url());
        }
        try {
            return access(kbId, () -> storeBlob(kbId, attachment));
        } catch (ContentStoreException e) {
            if (e.getCause() instanceof DataIntegrityViolationException) {
                // 다른 항목이 같은 이름을 먼저 차지함: 이름 규칙을 다시 적용
                log.debug("Concurrent insert for attachment {} in {}, retrying name lookup", attachment.filename(), kbId);
                return access(kbId, () -> storeBlob(kbId, attachment));
            }
            throw e;
        }
    }

    private String storeBlob(String kbId, Attachment attachment) {
        return transactionTemplate.execute(status -> {
            String name = attachment.filename();
            Optional<StoredAttachment> existing = attachmentRepository.findByKbIdAndStorageName(kbId, name);
            while (existing.isPresent()) {
                if (existing.get().getSizeBytes() == attachment.sizeBytes()) {
                    return existing.get().getStorageName();
                }
                // 크기가 다른 재수집 파일은 새 이름으로 보관
                name = name + "_";
                existing = attachmentRepository.findByKbIdAndStorageName(kbId, name);
            }
            checkQuota(kbId);
            attachmentRepository.saveAndFlush(StoredAttachment.builder()
                    .kbId(kbId)
                    .storageName(name)
                    .itemFingerprint(attachment.itemFingerprint())
                    .originalFilename(attachment.originalFilename())
                    .type(attachment.type())
                    .sizeBytes(attachment.sizeBytes())
                    .url(attachment.url())
                    .content(attachment.content())
                    .storedAt(clock.instant())
                    .build());
            log.debug("Stored attachment {} ({} bytes) in {}", name, attachment.sizeBytes(), kbId);
            return name;
        });
    }

    @Override
    public List<ProcessedNews> query(String kbId, Instant from, Instant to) {
        validateKbId(kbId);
        return access(kbId, () -> newsRepository.findInWindow(kbId, from, to).stream()
                .map(this::toProcessedNews)
                .toList());
    }

    @Override
    public boolean contains(String kbId, String fingerprint) {
        validateKbId(kbId);
        return access(kbId, () -> newsRepository.existsByKbIdAndFingerprint(kbId, fingerprint));
    }

    @Override
    public Optional<byte[]> getBlob(String kbId, String storageRef) {
        validateKbId(kbId);
        return access(kbId, () -> attachmentRepository.findByKbIdAndStorageName(kbId, storageRef)
                .map(StoredAttachment::getContent));
    }

    @Override
    public List<Attachment> findAttachments(String kbId, String filename, String type) {
        validateKbId(kbId);
        return access(kbId, () -> attachmentRepository.search(kbId, filename, type).stream()
                .map(a -> new Attachment(a.getItemFingerprint(), a.getUrl(), a.getStorageName(),
                        a.getOriginalFilename(), a.getType(), a.getSizeBytes(), null, a.getStorageName(),
                        AttachmentStatus.DOWNLOADED, null))
                .toList());
    }

    @Override
    public int purgeBefore(String kbId, Instant cutoff) {
        validateKbId(kbId);
        return access(kbId, () -> {
            int blobs = attachmentRepository.deleteStoredBefore(kbId, cutoff);
            int news = newsRepository.deleteStoredBefore(kbId, cutoff);
            log.info("Purged {} news and {} attachments stored before {} from {}", news, blobs, cutoff, kbId);
            return news;
        });
    }

    private void checkQuota(String kbId) {
        long limit = properties.getStore().getMaxDocumentsPerKb();
        if (limit > 0 && newsRepository.countByKbId(kbId) >= limit) {
            throw new ContentStoreException(ContentStoreException.Kind.QUOTA_EXCEEDED,
                    "Knowledge base " + kbId + " reached its limit of " + limit + " documents");
        }
    }

    private void validateKbId(String kbId) {
        if (kbId == null || !KB_ID.matcher(kbId).matches()) {
            throw new ContentStoreException(ContentStoreException.Kind.INVALID_KB_ID, "Invalid knowledge base id: " + kbId);
        }
    }

    private <T> T access(String kbId, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            throw new ContentStoreException(ContentStoreException.Kind.UNREACHABLE,
                    "Content store unavailable for " + kbId + ": " + e.getMessage(), e);
        }
    }

    private String kbRef(String kbId, String fingerprint) {
        return kbId + "/" + fingerprint;
    }

    private ProcessedNews toProcessedNews(StoredNews entity) {
        List<Attachment> attachments = readMetadata(entity.getAttachmentsJson()).stream()
                .map(AttachmentMetadata::toAttachment)
                .toList();
        return new ProcessedNews(entity.getFingerprint(), entity.getSourceName(), entity.getTitle(), entity.getUrl(),
                entity.getPublishedAt(), entity.getSummary(), entity.getBody(), entity.getFormat(),
                entity.getRenderedContent(), attachments, entity.getStoredAt(),
                kbRef(entity.getKbId(), entity.getFingerprint()));
    }

    private String writeMetadata(List<Attachment> attachments) {
        try {
            return objectMapper.writeValueAsString(attachments.stream().map(AttachmentMetadata::of).toList());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize attachment metadata", e);
        }
    }

    private List<AttachmentMetadata> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable attachment metadata, ignoring: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * 뉴스 행에 함께 저장되는 첨부파일 요약 (바이트 제외)
     */
    record AttachmentMetadata(String itemFingerprint, String url, String filename, String originalFilename,
                              String type, long sizeBytes, String storageRef, AttachmentStatus status,
                              String failureReason) {

        static AttachmentMetadata of(Attachment a) {
            return new AttachmentMetadata(a.itemFingerprint(), a.url(), a.filename(), a.originalFilename(), a.type(),
                    a.sizeBytes(), a.storageRef(), a.status(), a.failureReason());
        }

        Attachment toAttachment() {
            return new Attachment(itemFingerprint, url, filename, originalFilename, type, sizeBytes, null,
                    storageRef, status, failureReason);
        }
    }
}
