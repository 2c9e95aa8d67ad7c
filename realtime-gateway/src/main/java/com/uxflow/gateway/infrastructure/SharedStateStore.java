package com.uxflow.gateway.infrastructure;

import com.uxflow.gateway.domain.CacheResult;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous access to the cache shared by all gateway instances.
 *
 * Implementations must never complete a returned future exceptionally:
 * unreachable cache, timeout and command failure all surface as
 * {@link CacheResult#degraded(String)}. Shared state is advisory; local maps
 * remain the source of truth for this process's own connections.
 */
public interface SharedStateStore {

    CompletableFuture<CacheResult<Void>> put(String key, String value, Duration ttl);

    CompletableFuture<CacheResult<Boolean>> exists(String key);

    CompletableFuture<CacheResult<Boolean>> delete(String key);

    CompletableFuture<CacheResult<Boolean>> expire(String key, Duration ttl);

    /**
     * Add to a set, or re-arm an existing member. The TTL applies to the member
     * alone: expired members drop out of {@link #members} while the rest of
     * the set lives on.
     */
    CompletableFuture<CacheResult<Void>> addMember(String key, String member, Duration ttl);

    CompletableFuture<CacheResult<Boolean>> removeMember(String key, String member);

    /**
     * Unexpired members of a set.
     */
    CompletableFuture<CacheResult<Set<String>>> members(String key);

    /**
     * Increment a counter. The TTL is set only when the counter is created, so
     * the window resets exactly when the key expires.
     */
    CompletableFuture<CacheResult<Long>> increment(String key, Duration window);

    /**
     * Remaining time to live in milliseconds, or a negative value if the key is
     * missing or has no TTL.
     */
    CompletableFuture<CacheResult<Long>> timeToLive(String key);
}
