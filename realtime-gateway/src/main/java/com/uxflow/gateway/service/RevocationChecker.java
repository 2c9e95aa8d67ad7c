package com.uxflow.gateway.service;

import java.util.concurrent.CompletableFuture;

/**
 * Checks whether a credential has been revoked (logout, password change).
 */
public interface RevocationChecker {

    /**
     * Never completes exceptionally; a failed lookup resolves according to the
     * implementation's fail-open/fail-closed policy.
     */
    CompletableFuture<Boolean> isRevoked(String credential);
}
