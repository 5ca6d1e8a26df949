package com.psyos.pipeline.domain;

import com.psyos.pipeline.repository.scope.TenantOwned;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Bounded run of AI turns within a conversation.
 *
 * openSlot holds the conversation id while the episode is open and is cleared on close.
 * Its unique constraint allows any number of closed episodes (null slots) but only one
 * open episode per conversation, so concurrent creators cannot both succeed.
 */
@Entity
@Table(name = "ai_episodes",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_ai_episodes_open_slot", columnNames = {"tenantId", "openSlot"}),
        @UniqueConstraint(name = "uq_ai_episodes_number", columnNames = {"conversationId", "episodeNumber"})
    },
    indexes = {
        @Index(name = "idx_ai_episodes_tenant_conversation", columnList = "tenantId,conversationId,isOpen")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiEpisodeEntity implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 100)
    private String tenantId;

    @Column(nullable = false, length = 100)
    private String conversationId;

    @Column(nullable = false)
    private int episodeNumber;

    @Column(nullable = false)
    private int aiTurnsUsed;

    @Column(name = "isOpen", nullable = false)
    private boolean open;

    @Column(length = 100)
    private String openSlot;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public void close() {
        this.open = false;
        this.openSlot = null;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
        openSlot = open ? conversationId : null;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
        openSlot = open ? conversationId : null;
    }
}
