package com.ellin.agentcore.authgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Bearer token authentication settings.
 * Realm and audience are normally supplied through {@code REALM_URL} and {@code AUDIENCE}.
 */
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    /**
     * Base URL of the Keycloak realm, e.g. {@code http://localhost:8080/realms/master}.
     */
    private String realmUrl = "http://localhost:8080/realms/master";

    /**
     * Audience (client id) that tokens must be issued for.
     */
    private String audience = "adk-client";

    /**
     * Expected {@code iss} claim. Defaults to the realm URL.
     */
    private String issuer;

    /**
     * Path prefixes served without authentication.
     */
    private List<String> publicPaths = new ArrayList<>(List.of("/healthz"));

    /**
     * Bound on each of the two startup fetches (discovery document, key set).
     */
    private Duration discoveryTimeout = Duration.ofSeconds(5);

    /**
     * Tolerance applied to exp and nbf. Zero unless the realm's clock is known to drift.
     */
    private Duration clockSkew = Duration.ZERO;

    /**
     * Realm role that lets a caller act as another user.
     */
    private String impersonationRole = "can_impersonate";

    private String actorUserHeader = "X-Actor-User";

    private String actorEmailHeader = "X-Actor-Email";

    private final Relay relay = new Relay();

    public String getRealmUrl() {
        return realmUrl;
    }

    /**
     * The realm URL without a trailing slash, as discovery paths are appended to it and
     * Keycloak issues it as {@code iss}.
     */
    public String resolveRealmUrl() {
        return stripTrailingSlash(realmUrl);
    }

    public void setRealmUrl(String realmUrl) {
        this.realmUrl = realmUrl;
    }

    public String getAudience() {
        return audience;
    }

    public void setAudience(String audience) {
        this.audience = audience;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    /**
     * The issuer tokens are checked against: {@link #getIssuer()} when set, otherwise the realm
     * URL without a trailing slash.
     */
    public String resolveIssuer() {
        if (issuer != null && !issuer.isBlank()) {
            return issuer;
        }
        return resolveRealmUrl();
    }

    public List<String> getPublicPaths() {
        return publicPaths;
    }

    public void setPublicPaths(List<String> publicPaths) {
        this.publicPaths = publicPaths;
    }

    public Duration getDiscoveryTimeout() {
        return discoveryTimeout;
    }

    public void setDiscoveryTimeout(Duration discoveryTimeout) {
        this.discoveryTimeout = discoveryTimeout;
    }

    public Duration getClockSkew() {
        return clockSkew;
    }

    public void setClockSkew(Duration clockSkew) {
        this.clockSkew = clockSkew;
    }

    public String getImpersonationRole() {
        return impersonationRole;
    }

    public void setImpersonationRole(String impersonationRole) {
        this.impersonationRole = impersonationRole;
    }

    public String getActorUserHeader() {
        return actorUserHeader;
    }

    public void setActorUserHeader(String actorUserHeader) {
        this.actorUserHeader = actorUserHeader;
    }

    public String getActorEmailHeader() {
        return actorEmailHeader;
    }

    public void setActorEmailHeader(String actorEmailHeader) {
        this.actorEmailHeader = actorEmailHeader;
    }

    public Relay getRelay() {
        return relay;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * Headers used to hand the resolved actor to the agent behind the gateway route.
     */
    public static class Relay {

        /**
         * When disabled the headers are still stripped from inbound requests, just never set.
         */
        private boolean enabled = true;

        private String userHeader = "X-Authenticated-User";

        private String emailHeader = "X-Authenticated-Email";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUserHeader() {
            return userHeader;
        }

        public void setUserHeader(String userHeader) {
            this.userHeader = userHeader;
        }

        public String getEmailHeader() {
            return emailHeader;
        }

        public void setEmailHeader(String emailHeader) {
            this.emailHeader = emailHeader;
        }
    }
}
