package com.example.frontdesk.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 통화 한 건의 기록. 통화 종료 시 endedAt / transcript 가 채워집니다.
 */
@Entity
@Table(name = "call_log", indexes = @Index(name = "idx_cl_started", columnList = "started_at"))
@Getter @Setter @Builder
@NoArgsConstructor @AllArgsConstructor
public class CallLog {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "caller_id", nullable = false, length = 120)
    private String callerId;

    @Column(name = "caller_contact", nullable = false, length = 120)
    private String callerContact;

    @Column(name = "started_at", nullable = false, updatable = false)
    private LocalDateTime startedAt;

    @Column(name = "ended_at")
    private LocalDateTime endedAt;

    @Lob
    @ToString.Exclude
    private String transcript;

    /* help requests raised during this call, in escalation order */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "call_log_help_request", joinColumns = @JoinColumn(name = "call_log_id"))
    @OrderColumn(name = "seq")
    @Column(name = "help_request_id", nullable = false)
    @Builder.Default
    private List<Long> helpRequestIds = new ArrayList<>();

    @Column(name = "resolved_by_ai", nullable = false)
    @Builder.Default
    private boolean resolvedByAi = true;
}
