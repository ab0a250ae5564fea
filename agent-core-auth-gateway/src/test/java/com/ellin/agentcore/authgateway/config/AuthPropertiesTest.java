package com.ellin.agentcore.authgateway.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AuthPropertiesTest {

    @Test
    void realm_url_and_default_issuer_drop_trailing_slashes() {
        AuthProperties properties = new AuthProperties();
        properties.setRealmUrl(" http://localhost:8080/realms/test// ");

        assertThat(properties.resolveRealmUrl()).isEqualTo("http://localhost:8080/realms/test");
        assertThat(properties.resolveIssuer()).isEqualTo("http://localhost:8080/realms/test");
    }

    @Test
    void explicit_issuer_is_used_verbatim() {
        AuthProperties properties = new AuthProperties();
        properties.setIssuer("https://sso.example.com/realms/agents/");

        assertThat(properties.resolveIssuer()).isEqualTo("https://sso.example.com/realms/agents/");
    }

    @Test
    void expiry_is_enforced_without_leeway_by_default() {
        assertThat(new AuthProperties().getClockSkew()).isEqualTo(Duration.ZERO);
    }
}
