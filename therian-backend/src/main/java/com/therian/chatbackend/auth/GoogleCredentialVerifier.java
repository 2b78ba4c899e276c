package com.therian.chatbackend.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.therian.chatbackend.shared.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Validates a Google id_token against the token-info endpoint.
 */
@Slf4j
@Component
public class GoogleCredentialVerifier implements CredentialVerifier {

    private final String tokenInfoUrl;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public GoogleCredentialVerifier(
            @Value("${therian.auth.google.tokeninfo-url:https://oauth2.googleapis.com/tokeninfo}") String tokenInfoUrl,
            ObjectMapper objectMapper
    ) {
        this.tokenInfoUrl = tokenInfoUrl;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public ExternalIdentity verify(String externalToken) {
        JsonNode body;
        try {
            var req = HttpRequest.newBuilder()
                    .uri(URI.create(tokenInfoUrl + "?id_token=" + URLEncoder.encode(externalToken, StandardCharsets.UTF_8)))
                    .timeout(Duration.ofSeconds(15))
                    .GET()
                    .build();
            var resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() >= 500) {
                throw new UpstreamUnavailableException("Identity provider answered " + resp.statusCode());
            }
            body = objectMapper.readTree(resp.body());
        } catch (IOException e) {
            log.warn("Identity provider call failed: {}", e.getMessage());
            throw new UpstreamUnavailableException("Identity provider unreachable", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("Identity provider call interrupted", e);
        }

        String subject = body.path("sub").asText("");
        if (subject.isBlank()) {
            String reason = body.path("error_description").asText(body.path("error").asText("Invalid token"));
            log.warn("Google rejected id_token: {}", reason);
            throw new AuthException(AuthError.INVALID, reason);
        }
        return new ExternalIdentity(
                subject,
                textOrNull(body, "name"),
                textOrNull(body, "picture"),
                textOrNull(body, "email")
        );
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
