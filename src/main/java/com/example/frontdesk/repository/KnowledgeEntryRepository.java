package com.example.frontdesk.repository;

import com.example.frontdesk.domain.KnowledgeEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface KnowledgeEntryRepository extends JpaRepository<KnowledgeEntry, Long> {

    // 삽입 순서 (스냅샷 적재 순서와 동일해야 함)
    List<KnowledgeEntry> findAllByOrderByIdAsc();

    // usage_count 증가 (엔티티 로드 없이 원자적으로)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE KnowledgeEntry k
           SET k.usageCount = k.usageCount + 1,
               k.updatedAt = :now
         WHERE k.id = :id
    """)
    int incrementUsage(@Param("id") Long id, @Param("now") LocalDateTime now);

    /**
     * Case-insensitive substring match over question and answer, most used first.
     * {@code pattern} must already be escaped with '\'. Both columns are LOBs, hence the CAST.
     */
    @Query("""
        SELECT k
          FROM KnowledgeEntry k
         WHERE LOWER(CAST(k.question AS String)) LIKE CONCAT('%', :pattern, '%') ESCAPE '\\'
            OR LOWER(CAST(k.answer AS String)) LIKE CONCAT('%', :pattern, '%') ESCAPE '\\'
         ORDER BY k.usageCount DESC, k.id ASC
    """)
    List<KnowledgeEntry> searchByText(@Param("pattern") String pattern);
}
