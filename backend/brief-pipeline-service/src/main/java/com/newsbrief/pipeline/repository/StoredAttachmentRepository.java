package com.newsbrief.pipeline.repository;

import com.newsbrief.pipeline.entity.StoredAttachment;
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
public interface StoredAttachmentRepository extends JpaRepository<StoredAttachment, Long> {

    Optional<StoredAttachment> findByKbIdAndStorageName(String kbId, String storageName);

    @Query("SELECT a FROM StoredAttachment a WHERE a.kbId = :kbId " +
            "AND (:filename IS NULL OR a.originalFilename = :filename OR a.storageName = :filename) " +
            "AND (:type IS NULL OR a.type = :type) ORDER BY a.storedAt DESC")
    List<StoredAttachment> search(@Param("kbId") String kbId,
                                  @Param("filename") String filename,
                                  @Param("type") String type);

    @Modifying
    @Transactional
    @Query("DELETE FROM StoredAttachment a WHERE a.kbId = :kbId AND a.storedAt < :cutoff")
    int deleteStoredBefore(@Param("kbId") String kbId, @Param("cutoff") Instant cutoff);
}
