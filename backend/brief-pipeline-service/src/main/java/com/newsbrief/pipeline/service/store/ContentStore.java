package com.newsbrief.pipeline.service.store;

import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.dto.ProcessedNews;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 처리된 뉴스와 첨부파일을 보관하는 지식베이스 저장소.
 * 모든 메서드는 실패 시 ContentStoreException을 던집니다.
 */
public interface ContentStore {

    /**
     * 지문 기준 upsert. 같은 지문으로 다시 쓰면 덮어씁니다.
     *
     * @return 지식베이스 참조
     */
    String put(String kbId, ProcessedNews news);

    /**
     * 첨부파일 바이트 저장. 같은 이름·같은 크기면 기존 참조를 반환하고,
     * 크기가 다르면 이름을 바꾸어 새 레코드로 저장합니다.
     *
     * @return 저장 참조
     */
    String putBlob(String kbId, Attachment attachment);

    /**
     * stored_at이 [from, to)에 속하는 뉴스 (최신순)
     */
    List<ProcessedNews> query(String kbId, Instant from, Instant to);

    boolean contains(String kbId, String fingerprint);

    Optional<byte[]> getBlob(String kbId, String storageRef);

    /**
     * 파일명/유형으로 첨부파일 메타데이터 검색 (null 조건은 무시)
     */
    List<Attachment> findAttachments(String kbId, String filename, String type);

    /**
     * cutoff 이전에 저장된 뉴스와 첨부파일 삭제
     *
     * @return 삭제된 뉴스 수
     */
    int purgeBefore(String kbId, Instant cutoff);
}
