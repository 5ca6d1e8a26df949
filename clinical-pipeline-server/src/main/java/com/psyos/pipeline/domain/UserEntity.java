package com.psyos.pipeline.domain;

import com.psyos.pipeline.repository.scope.TenantOwned;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Clinician, patient or admin account. Patients carry the channel address (E.164 digits)
 * inbound messages are matched against.
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_users_tenant_phone", columnList = "tenantId,phoneE164"),
    @Index(name = "idx_users_email", columnList = "email")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserEntity implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 100)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role;

    @Column(length = 255)
    private String email;

    @Column(length = 255)
    private String displayName;

    @Column(length = 32)
    private String phoneE164;

    @Enumerated(EnumType.STRING)
    @Column(length = 4)
    private PatientLanguage preferredLanguage;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
