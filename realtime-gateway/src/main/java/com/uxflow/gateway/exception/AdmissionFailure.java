package com.uxflow.gateway.exception;

/**
 * Reasons a connection is refused, with the close code sent to the client.
 */
public enum AdmissionFailure {
    UNAUTHENTICATED(4401),
    EXPIRED(4401),
    REVOKED(4401),
    TOO_MANY_CONNECTIONS(4429),
    ADMISSION_RATE_LIMITED(4429),
    BAD_REQUEST(1008);

    private final int closeCode;

    AdmissionFailure(int closeCode) {
        this.closeCode = closeCode;
    }

    public int closeCode() {
        return closeCode;
    }
}
