package com.uxflow.gateway.exception;

public enum ProtocolError {
    FRAME_TOO_LARGE,
    INVALID_MESSAGE,
    MISSING_FIELD,
    UNKNOWN_TYPE,
    DISALLOWED_CONTENT,
    NOT_IN_ROOM
}
