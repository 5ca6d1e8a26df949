package com.psyos.pipeline.infrastructure;

import com.psyos.pipeline.exception.ChannelDeliveryException;
import com.psyos.pipeline.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Sends WhatsApp text messages through an Evolution API instance.
 */
@Slf4j
@Component
public class EvolutionChannelClient implements ChannelClient {

    private final RestTemplate restTemplate;
    private final String apiUrl;
    private final String apiKey;
    private final String instance;

    public EvolutionChannelClient(RestTemplate providerRestTemplate,
                                  @Value("${evolution.api-url:}") String apiUrl,
                                  @Value("${evolution.api-key:}") String apiKey,
                                  @Value("${evolution.instance:}") String instance) {
        this.restTemplate = providerRestTemplate;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.instance = instance;
    }

    @Override
    public void sendText(String toPhone, String text) {
        if (isBlank(apiUrl) || isBlank(apiKey)) {
            throw new ConfigurationException("Evolution API configuration missing");
        }
        if (isBlank(instance)) {
            throw new ConfigurationException("evolution.instance is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("apikey", apiKey);
        HttpEntity<Map<String, String>> entity = new HttpEntity<>(Map.of("number", toPhone, "text", text), headers);

        String url = apiUrl + "/message/sendText/" + instance;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, entity, String.class);
            log.debug("Channel send accepted: instance={}, status={}", instance, response.getStatusCode());
        } catch (RestClientException e) {
            log.warn("Channel send failed: instance={}, error={}", instance, e.getMessage());
            throw new ChannelDeliveryException("Failed to send Evolution message", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
