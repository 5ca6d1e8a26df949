package com.psyos.pipeline.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Exact prompt sent to the model for a conversation, kept briefly for operator inspection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptSnapshot {

    private String tenantId;
    private String conversationId;
    private Instant createdAt;
    private String model;
    private List<ChatTurn> messages;
}
