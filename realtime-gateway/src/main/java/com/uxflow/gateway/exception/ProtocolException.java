package com.uxflow.gateway.exception;

import lombok.Getter;

/**
 * The offending frame is dropped and an error frame is returned; the
 * connection stays open.
 */
@Getter
public class ProtocolException extends GatewayException {

    private final ProtocolError error;

    public ProtocolException(ProtocolError error, String message) {
        super(message);
        this.error = error;
    }
}
