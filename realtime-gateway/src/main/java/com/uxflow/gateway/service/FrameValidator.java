package com.uxflow.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.InboundFrame;
import com.uxflow.gateway.domain.InboundType;
import com.uxflow.gateway.exception.ProtocolError;
import com.uxflow.gateway.exception.ProtocolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Structural validation of inbound frames.
 *
 * Handles:
 * - Frame size limit (checked before parsing)
 * - JSON parsing and the enumerated {@code type}
 * - Required fields per type
 * - Operator injection aimed at downstream document stores
 */
@Service
@Slf4j
public class FrameValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");
    private static final Pattern OBJECT_ID = Pattern.compile("^[0-9a-fA-F]{24}$");
    private static final Pattern UUID = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private static final Pattern OPERATOR = Pattern.compile(
            "\\$(where|regex|ne|gte?|lte?|n?in|or|and|not|exists|type|mod|text)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Map<InboundType, List<String>> REQUIRED_FIELDS = new EnumMap<>(InboundType.class);

    static {
        REQUIRED_FIELDS.put(InboundType.USER_MESSAGE, List.of("message"));
        REQUIRED_FIELDS.put(InboundType.PLAN_APPROVED, List.of("planId"));
        REQUIRED_FIELDS.put(InboundType.PLAN_FEEDBACK, List.of("message"));
        REQUIRED_FIELDS.put(InboundType.IMAGE_UPLOAD, List.of("imageData"));
        REQUIRED_FIELDS.put(InboundType.JOIN_PROJECT, List.of("projectId"));
        REQUIRED_FIELDS.put(InboundType.LEAVE_PROJECT, List.of());
        REQUIRED_FIELDS.put(InboundType.CURSOR_POSITION, List.of("position"));
        REQUIRED_FIELDS.put(InboundType.PING, List.of());
    }

    private final ObjectMapper objectMapper;
    private final int maxFrameBytes;
    private final int maxImageBytes;

    public FrameValidator(ObjectMapper objectMapper, GatewayProperties properties) {
        this.objectMapper = objectMapper;
        this.maxFrameBytes = properties.getWebsocket().getMaxFrameBytes();
        this.maxImageBytes = properties.getWebsocket().getMaxImageBytes();
        if (maxImageBytes >= maxFrameBytes) {
            log.warn("Image limit is unreachable: maxImageBytes={} is not below maxFrameBytes={}",
                    maxImageBytes, maxFrameBytes);
        }
    }

    /**
     * Size check only. Runs before the rate limiter so oversized frames never
     * consume quota or get parsed.
     */
    public void checkSize(String raw) {
        int size = byteLength(raw);
        if (size > maxFrameBytes) {
            throw new ProtocolException(ProtocolError.FRAME_TOO_LARGE,
                    "Frame of " + size + " bytes exceeds limit of " + maxFrameBytes);
        }
    }

    /**
     * Parse and validate a frame that already passed {@link #checkSize}.
     */
    public InboundFrame parse(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProtocolException(ProtocolError.INVALID_MESSAGE, "Frame is not valid JSON");
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException(ProtocolError.INVALID_MESSAGE, "Frame must be a JSON object");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new ProtocolException(ProtocolError.MISSING_FIELD, "Field 'type' is required");
        }
        InboundType type = InboundType.fromWireName(typeNode.asText())
                .orElseThrow(() -> new ProtocolException(ProtocolError.UNKNOWN_TYPE,
                        "Unknown message type: " + typeNode.asText()));

        ObjectNode body = (ObjectNode) root;
        for (String field : REQUIRED_FIELDS.get(type)) {
            JsonNode value = body.get(field);
            if (value == null || value.isNull() || (value.isTextual() && value.asText().isBlank())) {
                throw new ProtocolException(ProtocolError.MISSING_FIELD,
                        "Field '" + field + "' is required for " + type.wireName());
            }
        }

        if (containsOperator(body)) {
            throw new ProtocolException(ProtocolError.DISALLOWED_CONTENT, "Frame contains disallowed content");
        }

        if (type == InboundType.IMAGE_UPLOAD) {
            checkImageSize(body.get("imageData"));
        }
        if (type == InboundType.JOIN_PROJECT && !isValidIdentifier(body.get("projectId").asText())) {
            throw new ProtocolException(ProtocolError.INVALID_MESSAGE, "Invalid projectId");
        }

        return new InboundFrame(type, body);
    }

    /**
     * Room and workspace ids: alphanumeric/hyphen/underscore up to 64 chars,
     * a 24-hex object id, or a UUID.
     */
    public static boolean isValidIdentifier(String value) {
        if (value == null) {
            return false;
        }
        return IDENTIFIER.matcher(value).matches()
                || OBJECT_ID.matcher(value).matches()
                || UUID.matcher(value).matches();
    }

    private void checkImageSize(JsonNode imageData) {
        if (!imageData.isTextual()) {
            throw new ProtocolException(ProtocolError.INVALID_MESSAGE, "Field 'imageData' must be a string");
        }
        if (imageData.asText().length() > maxImageBytes) {
            throw new ProtocolException(ProtocolError.FRAME_TOO_LARGE,
                    "Image exceeds limit of " + maxImageBytes + " characters");
        }
    }

    private boolean containsOperator(JsonNode node) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getKey().startsWith("$")) {
                    return true;
                }
                // base64 payloads cannot carry operators
                if (!"imageData".equals(field.getKey()) && containsOperator(field.getValue())) {
                    return true;
                }
            }
            return false;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (containsOperator(element)) {
                    return true;
                }
            }
            return false;
        }
        return node.isTextual() && OPERATOR.matcher(node.asText()).find();
    }

    private static int byteLength(String raw) {
        return raw.getBytes(StandardCharsets.UTF_8).length;
    }
}
