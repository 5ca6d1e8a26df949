package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.AiPolicyEntity;
import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.PolicyFlags;
import com.psyos.pipeline.domain.PolicyFlags.AiSettings;
import com.psyos.pipeline.domain.PolicyUpdateRequest;
import com.psyos.pipeline.domain.SignalOverrides;
import com.psyos.pipeline.domain.SignalRule;
import com.psyos.pipeline.domain.TenantUserContext;
import com.psyos.pipeline.domain.UserRole;
import com.psyos.pipeline.exception.AccessDeniedException;
import com.psyos.pipeline.repository.PolicyStore;
import com.psyos.pipeline.service.PolicyService.ResolvedPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PolicyServiceTest {

    private static final String TENANT = "tenant-1";

    private PolicyStore policyStore;
    private ConversationAccessGuard accessGuard;
    private AuditService auditService;
    private PolicyService service;

    private final ConversationEntity conversation = ConversationEntity.builder()
            .id("conv-1").tenantId(TENANT).psychologistUserId("psy-1").patientUserId("patient-1").build();

    @BeforeEach
    void setUp() {
        policyStore = mock(PolicyStore.class);
        accessGuard = mock(ConversationAccessGuard.class);
        auditService = mock(AuditService.class);
        service = new PolicyService(policyStore, accessGuard, auditService);
    }

    private static TenantUserContext caller(String userId, UserRole role) {
        return new TenantUserContext(TENANT, userId, role);
    }

    @Nested
    @DisplayName("Resolving the policy for the AI path")
    class Resolve {

        @Test
        @DisplayName("Texts are concatenated and tuning comes from the psychologist flags")
        void mergesLevels() {
            SignalOverrides overrides = SignalOverrides.builder()
                    .anger(SignalRule.builder().keywords(List.of("furiosa")).build()).build();
            when(policyStore.findPsychologistPolicy(TENANT, "psy-1")).thenReturn(Optional.of(AiPolicyEntity.builder()
                    .policyText("  Seja acolhedora.  ")
                    .flags(PolicyFlags.builder()
                            .aiSettings(AiSettings.builder().maxTurns(5).build())
                            .signalConfig(overrides).build())
                    .build()));
            when(policyStore.findConversationPolicy(TENANT, "conv-1")).thenReturn(Optional.of(AiPolicyEntity.builder()
                    .conversationId("conv-1").policyText("Foque em sono.")
                    .flags(PolicyFlags.builder().aiSettings(AiSettings.builder().maxTurns(1).build()).build())
                    .build()));

            ResolvedPolicy resolved = service.resolve(TENANT, conversation);

            assertThat(resolved.getPromptText()).isEqualTo("Seja acolhedora.\n\nFoque em sono.");
            assertThat(resolved.getTuning().getMaxTurns()).isEqualTo(5);
            assertThat(resolved.getSignalOverrides()).isSameAs(overrides);
        }

        @Test
        @DisplayName("No policies resolve to defaults")
        void noPolicies() {
            when(policyStore.findPsychologistPolicy(TENANT, "psy-1")).thenReturn(Optional.empty());
            when(policyStore.findConversationPolicy(TENANT, "conv-1")).thenReturn(Optional.empty());

            ResolvedPolicy resolved = service.resolve(TENANT, conversation);

            assertThat(resolved.getPromptText()).isEmpty();
            assertThat(resolved.getTuning()).isEqualTo(AiTuning.DEFAULTS);
            assertThat(resolved.getSignalOverrides()).isNull();
        }

        @ParameterizedTest
        @CsvSource(value = {
                "A, NULL, A",
                "NULL, B, B",
                "'   ', ' B ', B",
                "NULL, NULL, ''"
        }, nullValues = "NULL")
        @DisplayName("Blank blocks are dropped")
        void mergePolicies(String psychologist, String conversationText, String expected) {
            assertThat(PolicyService.mergePolicies(psychologist, conversationText)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Both blocks are joined by a blank line")
        void joinsWithBlankLine() {
            assertThat(PolicyService.mergePolicies("A", "B")).isEqualTo("A\n\nB");
        }
    }

    @Nested
    @DisplayName("Updating policies")
    class Upsert {

        @Test
        @DisplayName("A psychologist updates their own policy and it is audited")
        void ownPolicy() {
            AiPolicyEntity saved = AiPolicyEntity.builder().id("pol-1").tenantId(TENANT).ownerUserId("psy-1").build();
            when(policyStore.upsertPsychologistPolicy(eq(TENANT), eq("psy-1"), eq("Nova politica"), any()))
                    .thenReturn(saved);

            AiPolicyEntity result = service.upsertPolicy(caller("psy-1", UserRole.PSYCHOLOGIST),
                    PolicyUpdateRequest.builder().scope("user").policyText("Nova politica").build());

            assertThat(result).isSameAs(saved);
            verify(auditService).record(TENANT, "psy-1", AuditService.POLICY_UPDATE, "AiPolicy", "pol-1",
                    Map.of("scope", "user"));
        }

        @Test
        @DisplayName("A conversation policy requires participation")
        void conversationPolicy() {
            when(policyStore.upsertConversationPolicy(eq(TENANT), eq("conv-1"), eq("Texto"), any()))
                    .thenReturn(AiPolicyEntity.builder().id("pol-2").build());

            service.upsertPolicy(caller("psy-1", UserRole.PSYCHOLOGIST), PolicyUpdateRequest.builder()
                    .scope("conversation").conversationId("conv-1").policyText("Texto").build());

            verify(accessGuard).requireParticipant(caller("psy-1", UserRole.PSYCHOLOGIST), "conv-1");
        }

        @Test
        @DisplayName("Tenant scope is disabled")
        void tenantScope() {
            assertThatThrownBy(() -> service.upsertPolicy(caller("psy-1", UserRole.PSYCHOLOGIST),
                    PolicyUpdateRequest.builder().scope("tenant").policyText("x").build()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Tenant policy disabled");
        }

        @Test
        @DisplayName("Admins and patients cannot write policies")
        void onlyPsychologists() {
            for (UserRole role : new UserRole[]{UserRole.ADMIN, UserRole.PATIENT}) {
                assertThatThrownBy(() -> service.upsertPolicy(caller("u-1", role),
                        PolicyUpdateRequest.builder().scope("user").policyText("x").build()))
                        .isInstanceOf(AccessDeniedException.class);
            }
            verifyNoInteractions(policyStore, auditService);
        }

        @Test
        @DisplayName("A request for another tenant is refused")
        void foreignTenant() {
            assertThatThrownBy(() -> service.upsertPolicy(caller("psy-1", UserRole.PSYCHOLOGIST),
                    PolicyUpdateRequest.builder().tenantId("tenant-2").scope("user").policyText("x").build()))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        @DisplayName("Another psychologist's policy cannot be overwritten")
        void otherOwner() {
            assertThatThrownBy(() -> service.upsertPolicy(caller("psy-1", UserRole.PSYCHOLOGIST),
                    PolicyUpdateRequest.builder().scope("user").ownerUserId("psy-2").policyText("x").build()))
                    .isInstanceOf(AccessDeniedException.class);
            verify(policyStore, never()).upsertPsychologistPolicy(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Policy text is required")
        void blankText() {
            assertThatThrownBy(() -> service.upsertPolicy(caller("psy-1", UserRole.PSYCHOLOGIST),
                    PolicyUpdateRequest.builder().scope("user").policyText(" ").build()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Reading policies")
    class Read {

        @Test
        @DisplayName("Patients cannot read policies")
        void patientDenied() {
            assertThatThrownBy(() -> service.getPolicy(caller("patient-1", UserRole.PATIENT), "user", null, null))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        @DisplayName("Admins may read a psychologist's policy")
        void adminReadsUserPolicy() {
            when(policyStore.findPsychologistPolicy(TENANT, "psy-1")).thenReturn(Optional.empty());

            assertThat(service.getPolicy(caller("admin-1", UserRole.ADMIN), "user", "psy-1", null)).isEmpty();
        }

        @Test
        @DisplayName("Admins read conversation policies through operator access")
        void adminReadsConversationPolicy() {
            service.getPolicy(caller("admin-1", UserRole.ADMIN), "conversation", null, "conv-1");

            verify(accessGuard).requireParticipantOrAdmin(caller("admin-1", UserRole.ADMIN), "conv-1");
            verify(policyStore).findConversationPolicy(TENANT, "conv-1");
        }

        @Test
        @DisplayName("Unknown scopes are rejected")
        void unknownScope() {
            assertThatThrownBy(() -> service.getPolicy(caller("psy-1", UserRole.PSYCHOLOGIST), "global", null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
