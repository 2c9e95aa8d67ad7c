package com.uxflow.gateway.service;

import com.uxflow.gateway.domain.IdentityClaims;
import com.uxflow.gateway.exception.AdmissionException;

/**
 * Verifies a bearer credential presented on the upgrade request.
 */
public interface IdentityVerifier {

    /**
     * @throws AdmissionException with {@code UNAUTHENTICATED} or {@code EXPIRED}
     */
    IdentityClaims verify(String credential);
}
