package com.uxflow.gateway.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateDecision {

    private boolean allowed;
    private long count;
    private long limit;
    private long retryAfterMs;
    /** True when the decision came from the process-local fallback counter. */
    private boolean local;

    public static RateDecision allow(long count, long limit, boolean local) {
        return RateDecision.builder()
                .allowed(true)
                .count(count)
                .limit(limit)
                .local(local)
                .build();
    }

    public static RateDecision deny(long count, long limit, long retryAfterMs, boolean local) {
        return RateDecision.builder()
                .allowed(false)
                .count(count)
                .limit(limit)
                .retryAfterMs(retryAfterMs)
                .local(local)
                .build();
    }
}
