package com.example.frontdesk.repository;

import com.example.frontdesk.domain.HelpRequest;
import com.example.frontdesk.domain.enums.RequestStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * HelpRequest JPA Repository
 * - 상태 전이는 단일 조건부 UPDATE 로만 수행 (다중 프로세스에서도 PENDING 에서 한 번만 성공)
 */
@Repository
public interface HelpRequestRepository extends JpaRepository<HelpRequest, Long> {

    /** 대기 중 요청, 최신순 */
    List<HelpRequest> findByStatusOrderByCreatedAtDesc(RequestStatus status);

    /** 최근 요청 (limit 은 Pageable 로) */
    List<HelpRequest> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE HelpRequest h
           SET h.status = :resolved,
               h.supervisorAnswer = :answer,
               h.supervisorName = :resolver,
               h.resolvedAt = :resolvedAt
         WHERE h.id = :id
           AND h.status = :pending
    """)
    int markResolved(@Param("id") Long id,
                     @Param("answer") String answer,
                     @Param("resolver") String resolver,
                     @Param("resolvedAt") LocalDateTime resolvedAt,
                     @Param("resolved") RequestStatus resolved,
                     @Param("pending") RequestStatus pending);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE HelpRequest h
           SET h.status = :timeout,
               h.resolvedAt = :resolvedAt
         WHERE h.id = :id
           AND h.status = :pending
    """)
    int markTimeout(@Param("id") Long id,
                    @Param("resolvedAt") LocalDateTime resolvedAt,
                    @Param("timeout") RequestStatus timeout,
                    @Param("pending") RequestStatus pending);

    default int markResolved(Long id, String answer, String resolver, LocalDateTime resolvedAt) {
        return markResolved(id, answer, resolver, resolvedAt, RequestStatus.RESOLVED, RequestStatus.PENDING);
    }

    default int markTimeout(Long id, LocalDateTime resolvedAt) {
        return markTimeout(id, resolvedAt, RequestStatus.TIMEOUT, RequestStatus.PENDING);
    }
}
