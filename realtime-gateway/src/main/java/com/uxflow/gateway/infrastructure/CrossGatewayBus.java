package com.uxflow.gateway.infrastructure;

import com.uxflow.gateway.domain.CacheResult;
import com.uxflow.gateway.domain.RelayEnvelope;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Publish/subscribe channel between gateway instances. At-most-once: no
 * acknowledgement, no retry, no ordering across publishers.
 */
public interface CrossGatewayBus {

    CompletableFuture<CacheResult<Void>> publish(RelayEnvelope envelope);

    /**
     * Register the handler for envelopes received from the channel, including
     * this instance's own publications.
     */
    void subscribe(Consumer<RelayEnvelope> handler);
}
