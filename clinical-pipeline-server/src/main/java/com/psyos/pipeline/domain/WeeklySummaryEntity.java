package com.psyos.pipeline.domain;

import com.psyos.pipeline.repository.scope.TenantOwned;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Cached signal tally of one conversation week. Counts only: no message text is kept.
 */
@Entity
@Table(name = "weekly_summaries",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_weekly_summaries_week", columnNames = {"conversationId", "weekStart"})
    },
    indexes = {
        @Index(name = "idx_weekly_summaries_tenant", columnList = "tenantId")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeeklySummaryEntity implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 100)
    private String tenantId;

    @Column(nullable = false, length = 100)
    private String conversationId;

    /**
     * Monday 00:00 UTC.
     */
    @Column(nullable = false)
    private Instant weekStart;

    /**
     * Exclusive: the following Monday 00:00 UTC.
     */
    @Column(nullable = false)
    private Instant weekEnd;

    /**
     * Messages that fired each signal, keyed by the signal's JSON name.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Integer> signalCounts;

    @Column(nullable = false)
    private int messageCount;

    @Column(nullable = false)
    private Instant generatedAt;

    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (generatedAt == null) {
            generatedAt = Instant.now();
        }
        updatedAt = generatedAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
