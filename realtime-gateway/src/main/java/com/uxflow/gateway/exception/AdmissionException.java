package com.uxflow.gateway.exception;

import lombok.Getter;

/**
 * Terminates the upgrade or connection. Never retried by the gateway.
 */
@Getter
public class AdmissionException extends GatewayException {

    private final AdmissionFailure failure;

    public AdmissionException(AdmissionFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public AdmissionException(AdmissionFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
