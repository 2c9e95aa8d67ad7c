package com.uxflow.gateway.domain;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Client-to-server frame types accepted by the router.
 */
public enum InboundType {
    USER_MESSAGE("user_message"),
    PLAN_APPROVED("plan_approved"),
    PLAN_FEEDBACK("plan_feedback"),
    IMAGE_UPLOAD("image_upload"),
    JOIN_PROJECT("join_project"),
    LEAVE_PROJECT("leave_project"),
    CURSOR_POSITION("cursor_position"),
    PING("ping");

    private static final Map<String, InboundType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(InboundType::wireName, Function.identity()));

    private final String wireName;

    InboundType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<InboundType> fromWireName(String name) {
        return Optional.ofNullable(BY_WIRE_NAME.get(name));
    }
}
