package io.github.drompincen.fixflow.runtime.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.fixflow.runtime.config.FixFlowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Calls the identity provider's session-data endpoint with the {@code X-Session-ID}
 * header and reads {@code email}, {@code name}, {@code picture} and {@code session_token}
 * from the JSON reply.
 */
@Component
public class HttpIdentityExchange implements IdentityExchange {

    private static final Logger log = LoggerFactory.getLogger(HttpIdentityExchange.class);

    static final String SESSION_HEADER = "X-Session-ID";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String exchangeUrl;
    private final Duration readTimeout;

    @Autowired
    public HttpIdentityExchange(FixFlowProperties properties, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                        .connectTimeout(properties.getIdentity().getConnectTimeout())
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                objectMapper,
                properties.getIdentity().getExchangeUrl(),
                properties.getIdentity().getReadTimeout());
    }

    HttpIdentityExchange(HttpClient httpClient, ObjectMapper objectMapper, String exchangeUrl, Duration readTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.exchangeUrl = exchangeUrl;
        this.readTimeout = readTimeout;
    }

    @Override
    public ExternalIdentity exchange(String sessionId) throws IdentityExchangeException {
        if (exchangeUrl == null || exchangeUrl.isBlank()) {
            throw new IdentityExchangeException("Identity exchange URL is not configured");
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(exchangeUrl))
                .timeout(readTimeout)
                .header(SESSION_HEADER, sessionId)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.warn("Identity exchange timed out after {}", readTimeout);
            throw new IdentityExchangeException("Identity provider timed out", true, e);
        } catch (IOException e) {
            throw new IdentityExchangeException("Identity provider unreachable: " + e.getMessage(), false, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IdentityExchangeException("Interrupted while contacting identity provider", false, e);
        }

        if (response.statusCode() / 100 != 2) {
            log.warn("Identity exchange rejected session with HTTP {}", response.statusCode());
            throw new IdentityExchangeException("Invalid session ID");
        }
        return parse(response.body());
    }

    ExternalIdentity parse(String body) throws IdentityExchangeException {
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new IdentityExchangeException("Malformed identity response", false, e);
        }
        String email = text(node, "email");
        String sessionToken = text(node, "session_token");
        if (email == null || sessionToken == null) {
            throw new IdentityExchangeException("Identity response is missing email or session_token");
        }
        return new ExternalIdentity(email, text(node, "name"), text(node, "picture"), sessionToken);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
