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

/**
 * AI policy owned either by a psychologist (ownerUserId set, conversationId null)
 * or by a single conversation (conversationId set).
 */
@Entity
@Table(name = "ai_policies", indexes = {
    @Index(name = "idx_ai_policies_owner", columnList = "tenantId,ownerUserId"),
    @Index(name = "idx_ai_policies_conversation", columnList = "tenantId,conversationId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiPolicyEntity implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 100)
    private String tenantId;

    @Column(length = 100)
    private String ownerUserId;

    @Column(length = 100)
    private String conversationId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String policyText;

    @JdbcTypeCode(SqlTypes.JSON)
    private PolicyFlags flags;

    @Column(nullable = false)
    private Instant updatedAt;

    public enum Scope {
        PSYCHOLOGIST,
        CONVERSATION
    }

    public Scope getScope() {
        return conversationId != null ? Scope.CONVERSATION : Scope.PSYCHOLOGIST;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
