package com.psyos.pipeline.domain;

import com.psyos.pipeline.repository.scope.TenantOwned;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Conversation between one psychologist and one patient.
 * encryptedDek is the conversation's data key wrapped under the master key; it is
 * unwrapped per operation and never cached.
 */
@Entity
@Table(name = "conversations", indexes = {
    @Index(name = "idx_conversations_tenant_patient", columnList = "tenantId,patientUserId,status"),
    @Index(name = "idx_conversations_tenant_psychologist", columnList = "tenantId,psychologistUserId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationEntity implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 100)
    private String tenantId;

    @Column(nullable = false, length = 100)
    private String psychologistUserId;

    @Column(nullable = false, length = 100)
    private String patientUserId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ConversationStatus status;

    @Column(nullable = false)
    private boolean aiEnabled;

    @ToString.Exclude
    @Column(nullable = false, length = 512)
    private String encryptedDek;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public enum ConversationStatus {
        OPEN,
        CLOSED,
        ARCHIVED
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
        if (status == null) {
            status = ConversationStatus.OPEN;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
