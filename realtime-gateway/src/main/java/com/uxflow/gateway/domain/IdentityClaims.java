package com.uxflow.gateway.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Verified identity returned by the identity verifier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdentityClaims {
    private String userId;
    private Tier tier;
    private Instant expiresAt;
    private String credential;
}
