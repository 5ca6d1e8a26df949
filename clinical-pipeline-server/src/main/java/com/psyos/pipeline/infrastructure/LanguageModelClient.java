package com.psyos.pipeline.infrastructure;

import com.psyos.pipeline.domain.ChatTurn;

import java.util.List;

/**
 * Chat-completion provider.
 */
public interface LanguageModelClient {

    /**
     * @return the trimmed completion text; empty when the model answered without content
     * @throws com.psyos.pipeline.exception.ProviderException on transport errors, non-2xx responses
     *         and timeouts
     * @throws com.psyos.pipeline.exception.ConfigurationException when credentials are missing
     */
    String complete(List<ChatTurn> messages, int maxTokens, double temperature);

    String modelName();
}
