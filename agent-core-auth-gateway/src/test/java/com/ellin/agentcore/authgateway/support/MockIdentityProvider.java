package com.ellin.agentcore.authgateway.support;

import com.nimbusds.jose.jwk.JWKSet;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Serves a Keycloak-like realm: discovery document plus certs endpoint.
 */
public final class MockIdentityProvider implements AutoCloseable {

    public static final String REALM_PATH = "/realms/test";
    static final String CERTS_PATH = REALM_PATH + "/protocol/openid-connect/certs";

    private final HttpServer server;
    private final String baseUrl;
    private volatile String discoveryOverride;
    private volatile int discoveryStatus = 200;
    private volatile String certsBody;

    private MockIdentityProvider(JWKSet jwkSet) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        this.baseUrl = "http://localhost:" + server.getAddress().getPort();
        // toString() publishes public parameters only
        this.certsBody = jwkSet.toString();

        server.createContext(REALM_PATH + "/.well-known/openid-configuration", exchange -> {
            String body = discoveryOverride != null
                    ? discoveryOverride
                    : "{\"issuer\":\"" + realmUrl() + "\",\"jwks_uri\":\"" + baseUrl + CERTS_PATH + "\"}";
            respond(exchange, discoveryStatus, body);
        });
        server.createContext(CERTS_PATH, exchange -> respond(exchange, 200, certsBody));
        server.start();
    }

    public static MockIdentityProvider start(JWKSet jwkSet) {
        try {
            return new MockIdentityProvider(jwkSet);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String realmUrl() {
        return baseUrl + REALM_PATH;
    }

    public void discoveryResponds(int status, String body) {
        this.discoveryStatus = status;
        this.discoveryOverride = body;
    }

    public void certsRespond(String body) {
        this.certsBody = body;
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
