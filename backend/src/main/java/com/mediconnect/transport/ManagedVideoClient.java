package com.mediconnect.transport;

import com.mediconnect.exception.TransportUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * HTTP client for the hosted video provider.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManagedVideoClient implements ManagedVideoProvider {

    private final WebClient.Builder webClientBuilder;

    @Value("${mediconnect.video.base-url:}")
    private String baseUrl;

    @Value("${mediconnect.video.api-key:}")
    private String apiKey;

    @Value("${mediconnect.video.token-ttl-seconds:3600}")
    private long tokenTtlSeconds;

    @Value("${mediconnect.video.timeout-ms:5000}")
    private long timeoutMs;

    private volatile WebClient client;

    @Override
    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank() && apiKey != null && !apiKey.isBlank();
    }

    @Override
    public boolean isHealthy() {
        if (!isConfigured()) {
            return false;
        }
        try {
            client().get()
                .uri("/v1/health")
                .retrieve()
                .toBodilessEntity()
                .block(timeout());
            return true;
        } catch (RuntimeException e) {
            log.warn("Video provider health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String createManagedRoom(String roomId) {
        Map<?, ?> response = call("create room " + roomId, () -> client().post()
            .uri("/v1/rooms")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("uniqueName", roomId, "type", "group"))
            .retrieve()
            .bodyToMono(Map.class)
            .block(timeout()));
        Object sid = response.get("sid");
        if (sid == null) {
            throw new TransportUnavailableException("Provider returned no room reference for " + roomId);
        }
        return sid.toString();
    }

    @Override
    public void teardownManagedRoom(String roomId) {
        WebClient webClient = client();
        try {
            webClient.post()
                .uri("/v1/rooms/{roomId}/complete", roomId)
                .retrieve()
                .toBodilessEntity()
                .block(timeout());
        } catch (RuntimeException e) {
            throw new TransportUnavailableException("Could not complete managed room " + roomId, e);
        }
    }

    @Override
    public String issueAccessToken(String roomId, String userId) {
        Map<?, ?> response = call("issue token for " + userId, () -> client().post()
            .uri("/v1/rooms/{roomId}/tokens", roomId)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("identity", userId, "ttlSeconds", tokenTtlSeconds))
            .retrieve()
            .bodyToMono(Map.class)
            .block(timeout()));
        Object token = response.get("token");
        if (token == null) {
            throw new TransportUnavailableException("Provider returned no access token for " + userId);
        }
        return token.toString();
    }

    private Map<?, ?> call(String action, Supplier<Map<?, ?>> request) {
        Map<?, ?> response;
        try {
            response = request.get();
        } catch (TransportUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransportUnavailableException("Video provider failed to " + action + ": " + e.getMessage(), e);
        }
        if (response == null) {
            throw new TransportUnavailableException("Empty response from video provider: " + action);
        }
        return response;
    }

    private WebClient client() {
        if (!isConfigured()) {
            throw new TransportUnavailableException("Managed video provider is not configured");
        }
        WebClient current = client;
        if (current == null) {
            current = webClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .build();
            client = current;
        }
        return current;
    }

    private Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }
}
