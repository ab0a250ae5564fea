package com.ellin.agentcore.authgateway.service;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.KeyType;

import java.util.Objects;

/**
 * A published signing key together with the only algorithm it may verify.
 *
 * @param kid       key id as published by the identity provider
 * @param algorithm algorithm taken from the key descriptor, never from a token header
 * @param jwk       public key material
 */
public record SigningKey(String kid, JWSAlgorithm algorithm, JWK jwk) {

    public SigningKey {
        Objects.requireNonNull(kid, "kid");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(jwk, "jwk");
    }

    public static SigningKey from(JWK jwk) {
        return new SigningKey(jwk.getKeyID(), algorithmOf(jwk), jwk.toPublicJWK());
    }

    static JWSAlgorithm algorithmOf(JWK jwk) {
        if (jwk.getAlgorithm() != null) {
            return JWSAlgorithm.parse(jwk.getAlgorithm().getName());
        }
        KeyType type = jwk.getKeyType();
        if (KeyType.EC.equals(type)) {
            Curve curve = ((ECKey) jwk).getCurve();
            if (Curve.P_384.equals(curve)) {
                return JWSAlgorithm.ES384;
            }
            if (Curve.P_521.equals(curve)) {
                return JWSAlgorithm.ES512;
            }
            return JWSAlgorithm.ES256;
        }
        if (KeyType.OKP.equals(type)) {
            return JWSAlgorithm.EdDSA;
        }
        return JWSAlgorithm.RS256;
    }
}
