package io.vulnscan.providers.completion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vulnscan.TransientProviderException;
import io.vulnscan.providers.JsonHttpClient;
import io.vulnscan.providers.ProviderEndpoint;
import io.vulnscan.providers.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat-completions endpoint.
 */
public class HttpCompletionModel implements CompletionModel {

    private static final Logger log = LoggerFactory.getLogger(HttpCompletionModel.class);

    private final ProviderEndpoint endpoint;
    private final RetryPolicy retry;
    private final JsonHttpClient http;
    private final double temperature;
    private final int maxTokens;

    public HttpCompletionModel(ProviderEndpoint endpoint, RetryPolicy retry, JsonHttpClient http) {
        this(endpoint, retry, http, 0.1, 1000);
    }

    public HttpCompletionModel(ProviderEndpoint endpoint, RetryPolicy retry, JsonHttpClient http,
                               double temperature, int maxTokens) {
        this.endpoint = endpoint;
        this.retry = retry;
        this.http = http;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        log.info("Initialized completion model: {} at {}", endpoint.model(), endpoint.url());
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", endpoint.model());
        request.put("messages", List.of(
            Map.of("role", "system", "content", systemPrompt),
            Map.of("role", "user", "content", userPrompt)
        ));
        request.put("temperature", temperature);
        request.put("max_tokens", maxTokens);

        ChatResponse response = retry.execute("Completion request",
            () -> http.post(endpoint.url(), endpoint.apiKey(), request, ChatResponse.class));
        if (response.choices == null || response.choices.isEmpty()
                || response.choices.get(0).message == null || response.choices.get(0).message.content == null) {
            throw new TransientProviderException(TransientProviderException.Reason.SERVICE_ERROR,
                "Completion response has no content");
        }
        return response.choices.get(0).message.content.trim();
    }

    @Override
    public String getModelId() {
        return endpoint.model();
    }

    // ==================== Response DTOs ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatResponse {
        @JsonProperty("choices")
        public List<Choice> choices;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Choice {
        @JsonProperty("message")
        public Message message;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Message {
        @JsonProperty("content")
        public String content;
    }
}
