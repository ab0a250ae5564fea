package com.ellin.agentcore.authgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.jwk.JWKSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.text.ParseException;
import java.time.Duration;

/**
 * Fetches the realm's OpenID discovery document and then the JWKS it points at.
 */
public class KeyDirectoryLoader {

    private static final Logger log = LoggerFactory.getLogger(KeyDirectoryLoader.class);

    static final String DISCOVERY_PATH = "/.well-known/openid-configuration";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public KeyDirectoryLoader(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Performs both fetches sequentially, each bounded by {@code timeout}.
     * {@code realmUrl} is expected without a trailing slash.
     *
     * @throws KeyDirectoryException if either fetch fails, times out or returns an unusable body
     */
    public KeyDirectory load(String realmUrl, Duration timeout) {
        if (realmUrl == null || realmUrl.isBlank()) {
            throw new KeyDirectoryException("Realm URL is not configured");
        }
        String discoveryUrl = realmUrl.trim() + DISCOVERY_PATH;

        log.info("Fetching OpenID configuration from {}", discoveryUrl);
        String discoveryBody = fetch(discoveryUrl, timeout);
        String jwksUri = jwksUriOf(discoveryUrl, discoveryBody);

        log.info("Fetching signing keys from {}", jwksUri);
        String jwksBody = fetch(jwksUri, timeout);

        JWKSet jwkSet;
        try {
            jwkSet = JWKSet.parse(jwksBody);
        } catch (ParseException e) {
            throw new KeyDirectoryException("Unparseable key set from " + jwksUri + ": " + e.getMessage(), e);
        }

        KeyDirectory directory = KeyDirectory.of(jwkSet);
        if (directory.size() == 0) {
            throw new KeyDirectoryException("Key set from " + jwksUri + " contains no usable keys");
        }
        log.info("Loaded {} signing key(s)", directory.size());
        return directory;
    }

    private String fetch(String url, Duration timeout) {
        String body;
        try {
            body = webClient.get()
                    .uri(url)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw new KeyDirectoryException("Failed to fetch " + url + ": " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new KeyDirectoryException("Empty response from " + url);
        }
        return body;
    }

    private String jwksUriOf(String discoveryUrl, String body) {
        JsonNode document;
        try {
            document = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new KeyDirectoryException("Unparseable OpenID configuration from " + discoveryUrl, e);
        }
        JsonNode jwksUri = document.path("jwks_uri");
        if (!jwksUri.isTextual() || jwksUri.asText().isBlank()) {
            throw new KeyDirectoryException("OpenID configuration from " + discoveryUrl + " has no jwks_uri");
        }
        return jwksUri.asText();
    }
}
