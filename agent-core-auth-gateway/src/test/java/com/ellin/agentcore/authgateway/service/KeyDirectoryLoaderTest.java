package com.ellin.agentcore.authgateway.service;

import com.ellin.agentcore.authgateway.config.AuthProperties;
import com.ellin.agentcore.authgateway.support.MockIdentityProvider;
import com.ellin.agentcore.authgateway.support.TestTokens;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.jwk.JWKSet;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.InetSocketAddress;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyDirectoryLoaderTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MockIdentityProvider idp;
    private KeyDirectoryLoader loader;

    @BeforeEach
    void setUp() {
        idp = MockIdentityProvider.start(new JWKSet(TestTokens.rsaKey("kid-1")));
        loader = new KeyDirectoryLoader(WebClient.create(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        idp.close();
    }

    @Test
    void loads_keys_through_discovery_document() {
        KeyDirectory directory = loader.load(idp.realmUrl(), TIMEOUT);

        assertThat(directory.size()).isEqualTo(1);
        assertThat(directory.lookup("kid-1")).isPresent();
    }

    @Test
    void configured_realm_url_with_trailing_slash_loads() {
        AuthProperties properties = new AuthProperties();
        properties.setRealmUrl(idp.realmUrl() + "/");

        KeyDirectory directory = loader.load(properties.resolveRealmUrl(), TIMEOUT);

        assertThat(directory.lookup("kid-1")).isPresent();
    }

    @Test
    void discovery_error_status_is_fatal() {
        idp.discoveryResponds(404, "{\"error\":\"Realm does not exist\"}");

        assertThatThrownBy(() -> loader.load(idp.realmUrl(), TIMEOUT))
            .isInstanceOf(KeyDirectoryException.class)
            .hasMessageContaining("openid-configuration");
    }

    @Test
    void unparseable_discovery_document_is_fatal() {
        idp.discoveryResponds(200, "<html>not json</html>");

        assertThatThrownBy(() -> loader.load(idp.realmUrl(), TIMEOUT))
            .isInstanceOf(KeyDirectoryException.class)
            .hasMessageContaining("Unparseable OpenID configuration");
    }

    @Test
    void discovery_document_without_jwks_uri_is_fatal() {
        idp.discoveryResponds(200, "{\"issuer\":\"" + idp.realmUrl() + "\"}");

        assertThatThrownBy(() -> loader.load(idp.realmUrl(), TIMEOUT))
            .isInstanceOf(KeyDirectoryException.class)
            .hasMessageContaining("no jwks_uri");
    }

    @Test
    void unparseable_key_set_is_fatal() {
        idp.certsRespond("{\"keys\": \"nope\"}");

        assertThatThrownBy(() -> loader.load(idp.realmUrl(), TIMEOUT))
            .isInstanceOf(KeyDirectoryException.class)
            .hasMessageContaining("Unparseable key set");
    }

    @Test
    void empty_key_set_is_fatal() {
        idp.certsRespond("{\"keys\": []}");

        assertThatThrownBy(() -> loader.load(idp.realmUrl(), TIMEOUT))
            .isInstanceOf(KeyDirectoryException.class)
            .hasMessageContaining("no usable keys");
    }

    @Test
    void unreachable_provider_is_fatal() throws Exception {
        HttpServer closed = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        closed.start();
        int port = closed.getAddress().getPort();
        closed.stop(0);

        assertThatThrownBy(() -> loader.load("http://localhost:" + port + "/realms/test", TIMEOUT))
            .isInstanceOf(KeyDirectoryException.class)
            .hasMessageContaining("Failed to fetch");
    }

    @Test
    void slow_provider_times_out() throws Exception {
        HttpServer slow = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        slow.createContext("/", exchange -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
        });
        slow.start();
        try {
            String realmUrl = "http://localhost:" + slow.getAddress().getPort() + "/realms/test";

            assertThatThrownBy(() -> loader.load(realmUrl, Duration.ofMillis(200)))
                .isInstanceOf(KeyDirectoryException.class)
                .hasMessageContaining("Failed to fetch");
        } finally {
            slow.stop(0);
        }
    }

    @Test
    void missing_realm_url_is_fatal() {
        assertThatThrownBy(() -> loader.load(" ", TIMEOUT))
            .isInstanceOf(KeyDirectoryException.class);
    }
}
