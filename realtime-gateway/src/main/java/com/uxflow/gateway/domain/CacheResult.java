package com.uxflow.gateway.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Outcome of a shared-cache operation: either the value, or a degradation
 * reason when the cache was unreachable, timed out or failed.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CacheResult<T> {

    private final boolean degraded;
    private final T value;
    private final String reason;

    public static <T> CacheResult<T> ok(T value) {
        return new CacheResult<>(false, value, null);
    }

    public static <T> CacheResult<T> degraded(String reason) {
        return new CacheResult<>(true, null, reason);
    }

    public boolean isOk() {
        return !degraded;
    }

    /**
     * Wait for all operations; the combined result is degraded if any was.
     */
    @SafeVarargs
    public static CompletableFuture<CacheResult<Void>> allOf(CompletableFuture<? extends CacheResult<?>>... results) {
        return CompletableFuture.allOf(results).thenApply(ignored -> {
            String reasons = Arrays.stream(results)
                    .map(CompletableFuture::join)
                    .filter(CacheResult::isDegraded)
                    .map(CacheResult::getReason)
                    .collect(Collectors.joining("; "));
            return reasons.isEmpty() ? CacheResult.<Void>ok(null) : CacheResult.<Void>degraded(reasons);
        });
    }

    @Override
    public String toString() {
        return degraded ? "Degraded(" + reason + ")" : "Ok(" + value + ")";
    }
}
