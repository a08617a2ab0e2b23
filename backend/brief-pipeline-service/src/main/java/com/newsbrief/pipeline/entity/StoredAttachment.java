package com.newsbrief.pipeline.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * 첨부파일 원본 바이트와 검색용 메타데이터. 저장 후 변경하지 않습니다.
 */
@Entity
@Table(name = "stored_attachment",
        uniqueConstraints = @UniqueConstraint(name = "uk_stored_attachment_kb_name", columnNames = {"kb_id", "storage_name"}),
        indexes = {
                @Index(name = "idx_stored_attachment_item", columnList = "kb_id, item_fingerprint"),
                @Index(name = "idx_stored_attachment_type", columnList = "kb_id, type")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredAttachment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "kb_id", nullable = false, length = 128)
    private String kbId;

    @Column(name = "storage_name", nullable = false, length = 512)
    private String storageName;

    @Column(name = "item_fingerprint", length = 64)
    private String itemFingerprint;

    @Column(name = "original_filename", length = 512)
    private String originalFilename;

    @Column(name = "type", length = 16)
    private String type;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "url", columnDefinition = "TEXT")
    private String url;

    @ToString.Exclude
    @Basic(fetch = FetchType.LAZY)
    @Column(name = "content", length = 104857600)
    private byte[] content;

    @Column(name = "stored_at", nullable = false)
    private Instant storedAt;
}
