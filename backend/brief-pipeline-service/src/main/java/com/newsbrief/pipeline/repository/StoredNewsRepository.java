package com.newsbrief.pipeline.repository;

import com.newsbrief.pipeline.entity.StoredNews;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface StoredNewsRepository extends JpaRepository<StoredNews, Long> {

    Optional<StoredNews> findByKbIdAndFingerprint(String kbId, String fingerprint);

    boolean existsByKbIdAndFingerprint(String kbId, String fingerprint);

    long countByKbId(String kbId);

    /**
     * 기간 [from, to) 내 저장된 뉴스 (최신순, 같은 시각이면 지문순)
     */
    @Query("SELECT n FROM StoredNews n WHERE n.kbId = :kbId AND n.storedAt >= :from AND n.storedAt < :to " +
            "ORDER BY n.storedAt DESC, n.fingerprint ASC")
    List<StoredNews> findInWindow(@Param("kbId") String kbId, @Param("from") Instant from, @Param("to") Instant to);

    @Modifying
    @Transactional
    @Query("DELETE FROM StoredNews n WHERE n.kbId = :kbId AND n.storedAt < :cutoff")
    int deleteStoredBefore(@Param("kbId") String kbId, @Param("cutoff") Instant cutoff);
}
