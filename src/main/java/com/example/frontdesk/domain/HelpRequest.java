package com.example.frontdesk.domain;

import com.example.frontdesk.domain.enums.RequestStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 에이전트가 답하지 못해 감독자에게 넘긴 질문 한 건.
 *
 * <p>상태 전이는 {@code HelpRequestRepository} 의 조건부 UPDATE (WHERE status = 'PENDING')로만
 * 일어납니다. 엔티티를 읽어서 setStatus 후 save 하는 경로는 없습니다.</p>
 */
@Entity
@Table(
        name = "help_request",
        indexes = {
                @Index(name = "idx_hr_status_created", columnList = "status,created_at"),
                @Index(name = "idx_hr_created", columnList = "created_at")
        }
)
@Getter @Setter @Builder
@NoArgsConstructor @AllArgsConstructor
public class HelpRequest {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /* 통화 식별자 (call log id 또는 외부 participant id) */
    @Column(name = "caller_id", nullable = false, length = 120)
    private String callerId;

    @Column(name = "caller_contact", nullable = false, length = 120)
    private String callerContact;

    @Lob
    @Column(nullable = false)
    private String question;

    /** last few turns, "role: text" per line */
    @Lob
    @ToString.Exclude
    private String context;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private RequestStatus status = RequestStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Lob
    @Column(name = "supervisor_answer")
    @ToString.Exclude
    private String supervisorAnswer;

    @Column(name = "supervisor_name", length = 120)
    private String supervisorName;

    public boolean isPending() {
        return status == RequestStatus.PENDING;
    }

    /** Minutes from creation to resolution, or null when not RESOLVED. */
    public Double resolutionMinutes() {
        if (status != RequestStatus.RESOLVED || createdAt == null || resolvedAt == null) {
            return null;
        }
        return Duration.between(createdAt, resolvedAt).toMillis() / 60_000.0;
    }
}
