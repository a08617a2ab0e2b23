package com.newsbrief.pipeline.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 지식베이스에 저장된 뉴스. (kb_id, fingerprint)당 1건.
 */
@Entity
@Table(name = "stored_news",
        uniqueConstraints = @UniqueConstraint(name = "uk_stored_news_kb_fingerprint", columnNames = {"kb_id", "fingerprint"}),
        indexes = {
                @Index(name = "idx_stored_news_kb_stored_at", columnList = "kb_id, stored_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredNews {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "kb_id", nullable = false, length = 128)
    private String kbId;

    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;

    @Column(name = "source_name", length = 255)
    private String sourceName;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "url", columnDefinition = "TEXT")
    private String url;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "summary", columnDefinition = "TEXT")
    private String summary;

    @Column(name = "body", columnDefinition = "TEXT")
    private String body;

    @Enumerated(EnumType.STRING)
    @Column(name = "format", length = 16)
    private OutputFormat format;

    @Column(name = "rendered_content", columnDefinition = "TEXT")
    private String renderedContent;

    /**
     * 첨부파일 메타데이터 목록 (JSON, 바이트 제외)
     */
    @Column(name = "attachments_json", columnDefinition = "TEXT")
    private String attachmentsJson;

    @Column(name = "stored_at", nullable = false)
    private Instant storedAt;
}
