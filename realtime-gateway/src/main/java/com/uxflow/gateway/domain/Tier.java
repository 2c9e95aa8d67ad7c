package com.uxflow.gateway.domain;

import java.util.Locale;

public enum Tier {
    FREE,
    PRO,
    ENTERPRISE;

    /**
     * Resolve a tier claim, falling back to FREE for missing or unknown values.
     */
    public static Tier fromClaim(Object claim) {
        if (claim == null) {
            return FREE;
        }
        try {
            return Tier.valueOf(claim.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FREE;
        }
    }
}
