package com.newsbrief.pipeline.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.newsbrief.pipeline.entity.AttachmentStatus;

/**
 * 다운로드 결과 레코드. 저장 후에는 변경하지 않습니다.
 * content는 DOWNLOADED 상태에서만 존재하며, 저장소 기록 뒤에는 storageRef로 대체됩니다.
 */
public record Attachment(
        String itemFingerprint,
        String url,
        String filename,
        String originalFilename,
        String type,
        long sizeBytes,
        @JsonIgnore byte[] content,
        String storageRef,
        AttachmentStatus status,
        String failureReason
) {

    public static Attachment downloaded(AttachmentCandidate candidate, String filename, String type, byte[] content) {
        return new Attachment(candidate.itemFingerprint(), candidate.url(), filename, candidate.filename(),
                type, content.length, content, null, AttachmentStatus.DOWNLOADED, null);
    }

    public static Attachment skipped(AttachmentCandidate candidate, AttachmentStatus status, String type,
                                     long observedSize, String reason) {
        return new Attachment(candidate.itemFingerprint(), candidate.url(), candidate.filename(),
                candidate.filename(), type, observedSize, null, null, status, reason);
    }

    public static Attachment failed(AttachmentCandidate candidate, String reason) {
        return new Attachment(candidate.itemFingerprint(), candidate.url(), candidate.filename(),
                candidate.filename(), candidate.inferredType(), 0, null, null, AttachmentStatus.FAILED, reason);
    }

    public boolean isDownloaded() {
        return status == AttachmentStatus.DOWNLOADED;
    }

    public Attachment withStorageRef(String ref) {
        return new Attachment(itemFingerprint, url, filename, originalFilename, type, sizeBytes,
                null, ref, status, failureReason);
    }

    public Attachment metadataOnly() {
        return new Attachment(itemFingerprint, url, filename, originalFilename, type, sizeBytes,
                null, storageRef, status, failureReason);
    }
}
