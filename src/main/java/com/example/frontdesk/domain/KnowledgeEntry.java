package com.example.frontdesk.domain;

import com.example.frontdesk.domain.enums.KnowledgeSource;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A learned question/answer pair.
 *
 * <p>Content is never edited in place; a corrected answer is a new entry. The only column the
 * service mutates after insert is {@code usage_count} (plus {@code updated_at}).</p>
 */
@Entity
@Table(
        name = "knowledge_entry",
        indexes = {
                @Index(name = "idx_ke_usage", columnList = "usage_count"),
                @Index(name = "idx_ke_help_request", columnList = "help_request_id")
        }
)
@Getter @Setter @Builder
@NoArgsConstructor @AllArgsConstructor
public class KnowledgeEntry {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /* 발화 길이에 상한이 없으므로 CLOB; 검색 쿼리는 CAST 후 LOWER */
    @Lob
    @Column(nullable = false)
    private String question;

    @Lob
    @Column(nullable = false)
    @ToString.Exclude
    private String answer;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private KnowledgeSource source = KnowledgeSource.SUPERVISOR;

    /* 원본 help request (seed 항목은 null) */
    @Column(name = "help_request_id")
    private Long helpRequestId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "usage_count", nullable = false)
    @Builder.Default
    private long usageCount = 0L;
}
