package com.newsbrief.pipeline.exception;

import com.newsbrief.pipeline.entity.AttachmentStatus;

/**
 * 첨부파일 1건의 다운로드 중단 사유.
 * AttachmentDownloader 내부에서만 사용되며, 항목 처리를 중단시키지 않고 Attachment 상태로 기록됩니다.
 */
public class AttachmentException extends PipelineException {

    public enum Kind {
        SKIPPED_SIZE(AttachmentStatus.SKIPPED_SIZE),
        SKIPPED_TYPE(AttachmentStatus.SKIPPED_TYPE),
        FAILED(AttachmentStatus.FAILED),
        TIMEOUT(AttachmentStatus.FAILED);

        private final AttachmentStatus status;

        Kind(AttachmentStatus status) {
            this.status = status;
        }

        public AttachmentStatus getStatus() {
            return status;
        }
    }

    private final Kind kind;
    private final long observedSize;
    private final String observedType;

    public AttachmentException(Kind kind, String message, long observedSize, String observedType) {
        super("ATTACHMENT_" + kind.name(), message);
        this.kind = kind;
        this.observedSize = observedSize;
        this.observedType = observedType;
    }

    public Kind getKind() {
        return kind;
    }

    public long getObservedSize() {
        return observedSize;
    }

    public String getObservedType() {
        return observedType;
    }

    public static AttachmentException tooLarge(long observedSize, long maxSize) {
        return new AttachmentException(Kind.SKIPPED_SIZE,
                "Attachment exceeds " + maxSize + " bytes (observed " + observedSize + ")", observedSize, null);
    }

    public static AttachmentException rejectedType(String type) {
        return new AttachmentException(Kind.SKIPPED_TYPE, "Attachment type not allowed: " + type, 0, type);
    }

    public static AttachmentException failed(String message) {
        return new AttachmentException(Kind.FAILED, message, 0, null);
    }
}
