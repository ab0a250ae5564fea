package com.ellin.agentcore.authgateway.service;

import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the identity provider's signing keys, indexed by key id.
 * Built once at startup by {@link KeyDirectoryLoader}; safe to share across requests.
 */
public final class KeyDirectory {

    private final Map<String, SigningKey> keys;

    private KeyDirectory(Map<String, SigningKey> keys) {
        this.keys = Collections.unmodifiableMap(keys);
    }

    /**
     * Indexes every public key that carries a {@code kid}. Keys without one can never be selected.
     */
    public static KeyDirectory of(JWKSet jwkSet) {
        Map<String, SigningKey> indexed = new LinkedHashMap<>();
        for (JWK jwk : jwkSet.getKeys()) {
            // symmetric keys have no public half
            if (jwk.getKeyID() == null || jwk.toPublicJWK() == null) {
                continue;
            }
            // first key wins on a duplicated kid
            indexed.putIfAbsent(jwk.getKeyID(), SigningKey.from(jwk));
        }
        return new KeyDirectory(indexed);
    }

    public Optional<SigningKey> lookup(String kid) {
        if (kid == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keys.get(kid));
    }

    public int size() {
        return keys.size();
    }
}
