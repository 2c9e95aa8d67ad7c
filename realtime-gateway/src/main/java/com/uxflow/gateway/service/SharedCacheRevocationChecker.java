package com.uxflow.gateway.service;

import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.infrastructure.SharedStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Revocation list kept by the auth service in the shared cache under
 * {@code token:blacklist:{token}}.
 */
@Service
@Slf4j
public class SharedCacheRevocationChecker implements RevocationChecker {

    private final SharedStateStore sharedStore;
    private final String keyPrefix;
    private final boolean failOpen;

    public SharedCacheRevocationChecker(SharedStateStore sharedStore, GatewayProperties properties) {
        this.sharedStore = sharedStore;
        this.keyPrefix = properties.getSecurity().getRevocationKeyPrefix();
        this.failOpen = properties.getSecurity().isRevocationFailOpen();
    }

    @Override
    public CompletableFuture<Boolean> isRevoked(String credential) {
        return sharedStore.exists(keyPrefix + credential).thenApply(result -> {
            if (result.isOk()) {
                return result.getValue();
            }
            log.warn("Revocation list unavailable, {}: reason={}",
                    failOpen ? "admitting" : "rejecting", result.getReason());
            return !failOpen;
        });
    }
}
