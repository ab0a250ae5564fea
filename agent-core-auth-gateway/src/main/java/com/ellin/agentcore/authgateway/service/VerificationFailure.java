package com.ellin.agentcore.authgateway.service;

/**
 * Why a bearer token was rejected. Every kind is terminal for the request.
 */
public enum VerificationFailure {
    MALFORMED,
    UNKNOWN_KEY,
    INVALID_SIGNATURE,
    INVALID_CLAIMS,
    BAD_ISSUER
}
