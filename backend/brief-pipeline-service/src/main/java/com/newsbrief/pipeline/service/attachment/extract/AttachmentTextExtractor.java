package com.newsbrief.pipeline.service.attachment.extract;

import java.util.Set;

/**
 * 유형 태그별 첨부파일 텍스트 추출기
 */
public interface AttachmentTextExtractor {

    Set<String> supportedTypes();

    /**
     * @param maxChars 필요한 최대 글자 수 (초과분은 읽지 않아도 됨)
     * @throws com.newsbrief.pipeline.exception.TextExtractionException 형식이 손상된 경우
     */
    String extractText(byte[] content, String type, int maxChars);
}
