package io.vulnscan.providers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vulnscan.PermanentInputException;
import io.vulnscan.TransientProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * JSON-over-HTTP POST with provider error mapping.
 *
 * <p>Status codes map onto the error taxonomy: 401/403 are
 * {@code AUTH_REQUIRED}, 404 is {@code NOT_FOUND}, other 4xx are
 * {@code INVALID_INPUT}; 408, 429 and 5xx are transient, as are I/O failures.</p>
 */
public class JsonHttpClient {

    private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final int MAX_LOGGED_BODY = 500;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public JsonHttpClient(Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build(), new ObjectMapper(), requestTimeout);
    }

    public JsonHttpClient(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    public <T> T post(URI uri, String apiKey, Object body, Class<T> responseType) {
        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new PermanentInputException(PermanentInputException.Reason.INVALID_INPUT,
                "Cannot serialize request to " + uri, e);
        }

        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(uri)
            .header("Content-Type", "application/json")
            .timeout(requestTimeout)
            .POST(HttpRequest.BodyPublishers.ofString(requestBody));
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientProviderException(TransientProviderException.Reason.TIMEOUT,
                "Request to " + uri + " timed out", e);
        } catch (IOException e) {
            throw new TransientProviderException(TransientProviderException.Reason.NETWORK,
                "Failed to call " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during call to " + uri, e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            try {
                return objectMapper.readValue(response.body(), responseType);
            } catch (JsonProcessingException e) {
                throw new TransientProviderException(TransientProviderException.Reason.SERVICE_ERROR,
                    "Malformed response from " + uri + ": " + e.getOriginalMessage(), e);
            }
        }
        throw toException(uri, status, response.body());
    }

    static RuntimeException toException(URI uri, int status, String body) {
        String detail = body == null ? "" : body.length() > MAX_LOGGED_BODY ? body.substring(0, MAX_LOGGED_BODY) : body;
        String message = String.format("%s returned %d: %s", uri, status, detail);
        log.debug("Provider error: {}", message);
        if (status == 401 || status == 403) {
            return new PermanentInputException(PermanentInputException.Reason.AUTH_REQUIRED, message);
        }
        if (status == 404) {
            return new PermanentInputException(PermanentInputException.Reason.NOT_FOUND, message);
        }
        if (status == 408) {
            return new TransientProviderException(TransientProviderException.Reason.TIMEOUT, message);
        }
        if (status == 429) {
            return new TransientProviderException(TransientProviderException.Reason.RATE_LIMITED, message);
        }
        if (status >= 500) {
            return new TransientProviderException(TransientProviderException.Reason.SERVICE_ERROR, message);
        }
        return new PermanentInputException(PermanentInputException.Reason.INVALID_INPUT, message);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
