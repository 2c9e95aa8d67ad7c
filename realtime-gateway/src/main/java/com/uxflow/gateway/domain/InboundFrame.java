package com.uxflow.gateway.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A structurally valid client frame.
 */
@Getter
@AllArgsConstructor
public class InboundFrame {

    private final InboundType type;
    private final ObjectNode body;

    public String text(String field) {
        JsonNode node = body.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    public JsonNode node(String field) {
        return body.get(field);
    }

    public boolean has(String field) {
        JsonNode node = body.get(field);
        return node != null && !node.isNull();
    }
}
