package com.newsbrief.pipeline.service.attachment;

import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.dto.AttachmentCandidate;

import java.util.List;

/**
 * 항목 1건의 첨부파일 탐색 결과.
 * rejected는 허용되지 않은 유형으로 판정되어 다운로드 없이 SKIPPED_TYPE으로 기록되는 링크입니다.
 */
public record AttachmentResolution(List<AttachmentCandidate> candidates, List<Attachment> rejected) {

    public static AttachmentResolution none() {
        return new AttachmentResolution(List.of(), List.of());
    }
}
