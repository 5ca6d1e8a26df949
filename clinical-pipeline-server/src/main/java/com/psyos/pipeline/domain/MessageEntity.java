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
 * Encrypted message. Body and optional attachment are AES-GCM ciphertexts under the
 * conversation data key, stored base64 with their nonce and tag.
 * Rows are never removed; deletion only sets deletedAt.
 */
@Entity
@Table(name = "messages",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_messages_tenant_external_id", columnNames = {"tenantId", "externalMessageId"}),
        @UniqueConstraint(name = "uq_messages_tenant_reply_to", columnNames = {"tenantId", "replyToMessageId"})
    },
    indexes = {
        @Index(name = "idx_messages_tenant_conversation_created", columnList = "tenantId,conversationId,createdAt")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageEntity implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 100)
    private String tenantId;

    @Column(nullable = false, length = 100)
    private String conversationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Direction direction;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AuthorType authorType;

    @ToString.Exclude
    @Column(nullable = false, columnDefinition = "TEXT")
    private String ciphertext;

    @Column(nullable = false, length = 64)
    private String iv;

    @Column(nullable = false, length = 64)
    private String authTag;

    @ToString.Exclude
    @Column(columnDefinition = "TEXT")
    private String attachmentCiphertext;

    @Column(length = 64)
    private String attachmentIv;

    @Column(length = 64)
    private String attachmentAuthTag;

    @Column(length = 100)
    private String attachmentMime;

    private Integer attachmentSize;

    @Column(length = 255)
    private String externalMessageId;

    /** Patient message an AI reply answers; at most one reply per trigger. */
    @Column(length = 100)
    private String replyToMessageId;

    private Instant deletedAt;

    /** Set once the channel accepted the message; outbound redeliveries skip it. */
    private Instant dispatchedAt;

    @Column(length = 100)
    private String deletedByUserId;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public enum Direction {
        IN,
        OUT
    }

    public enum AuthorType {
        PATIENT,
        PSYCHOLOGIST,
        AI,
        SYSTEM
    }

    public boolean hasAttachment() {
        return attachmentCiphertext != null && attachmentIv != null && attachmentAuthTag != null;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
