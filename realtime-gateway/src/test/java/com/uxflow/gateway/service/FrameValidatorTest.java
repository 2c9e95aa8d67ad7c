package com.uxflow.gateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.InboundFrame;
import com.uxflow.gateway.domain.InboundType;
import com.uxflow.gateway.exception.ProtocolError;
import com.uxflow.gateway.exception.ProtocolException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameValidatorTest {

    private FrameValidator validator;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getWebsocket().setMaxFrameBytes(1024);
        properties.getWebsocket().setMaxImageBytes(100);
        validator = new FrameValidator(new ObjectMapper(), properties);
    }

    @Test
    void oversizedFrameIsRejectedBeforeParsing() {
        String frame = "x".repeat(1025);

        assertThatThrownBy(() -> validator.checkSize(frame))
                .isInstanceOf(ProtocolException.class)
                .extracting(e -> ((ProtocolException) e).getError())
                .isEqualTo(ProtocolError.FRAME_TOO_LARGE);
    }

    @Test
    void sizeIsMeasuredInUtf8Bytes() {
        // 400 three-byte characters
        String frame = "€".repeat(400);

        assertThatThrownBy(() -> validator.checkSize(frame)).isInstanceOf(ProtocolException.class);
        assertThatCode(() -> validator.checkSize("€".repeat(300))).doesNotThrowAnyException();
    }

    @Test
    void malformedJsonIsInvalidMessage() {
        assertError("{\"type\": ", ProtocolError.INVALID_MESSAGE);
        assertError("[1, 2]", ProtocolError.INVALID_MESSAGE);
    }

    @Test
    void missingTypeIsRejected() {
        assertError("{\"message\":\"hi\"}", ProtocolError.MISSING_FIELD);
    }

    @Test
    void unknownTypeIsRejected() {
        assertError("{\"type\":\"delete_everything\"}", ProtocolError.UNKNOWN_TYPE);
    }

    @Test
    void requiredFieldsArePerType() {
        assertError("{\"type\":\"user_message\"}", ProtocolError.MISSING_FIELD);
        assertError("{\"type\":\"user_message\",\"message\":\"  \"}", ProtocolError.MISSING_FIELD);
        assertError("{\"type\":\"plan_approved\"}", ProtocolError.MISSING_FIELD);
        assertError("{\"type\":\"cursor_position\"}", ProtocolError.MISSING_FIELD);
        assertError("{\"type\":\"join_project\"}", ProtocolError.MISSING_FIELD);
    }

    @Test
    void operatorKeysAreDisallowed() {
        assertError("{\"type\":\"plan_approved\",\"planId\":{\"$ne\":null}}", ProtocolError.DISALLOWED_CONTENT);
        assertError("{\"type\":\"cursor_position\",\"position\":{\"x\":1,\"meta\":[{\"$where\":\"1\"}]}}",
                ProtocolError.DISALLOWED_CONTENT);
    }

    @Test
    void operatorSubstringsInValuesAreDisallowed() {
        assertError("{\"type\":\"user_message\",\"message\":\"find {$where: function() {}}\"}",
                ProtocolError.DISALLOWED_CONTENT);
    }

    @Test
    void dollarSignsInPlainTextAreAllowed() {
        InboundFrame frame = validator.parse("{\"type\":\"user_message\",\"message\":\"costs $5 and $index\"}");

        assertThat(frame.getType()).isEqualTo(InboundType.USER_MESSAGE);
    }

    @Test
    void oversizedImageIsRejected() {
        String image = "a".repeat(101);

        assertError("{\"type\":\"image_upload\",\"imageData\":\"" + image + "\"}", ProtocolError.FRAME_TOO_LARGE);
    }

    @Test
    void defaultImageLimitRejectsImagesThatStillFitInAFrame() {
        FrameValidator defaults = new FrameValidator(new ObjectMapper(), new GatewayProperties());
        String frame = "{\"type\":\"image_upload\",\"imageData\":\"" + "a".repeat(400 * 1024) + "\"}";

        assertThatCode(() -> defaults.checkSize(frame)).doesNotThrowAnyException();
        assertThatThrownBy(() -> defaults.parse(frame))
                .isInstanceOf(ProtocolException.class)
                .extracting(e -> ((ProtocolException) e).getError())
                .isEqualTo(ProtocolError.FRAME_TOO_LARGE);
    }

    @Test
    void joinProjectRequiresValidIdentifier() {
        assertError("{\"type\":\"join_project\",\"projectId\":\"../etc/passwd\"}", ProtocolError.INVALID_MESSAGE);

        InboundFrame frame = validator.parse("{\"type\":\"join_project\",\"projectId\":\"proj-2\"}");
        assertThat(frame.text("projectId")).isEqualTo("proj-2");
    }

    @Test
    void validFrameExposesTypeAndFields() {
        InboundFrame frame = validator.parse(
                "{\"type\":\"cursor_position\",\"position\":{\"x\":10,\"y\":20},\"elementId\":\"node-1\"}");

        assertThat(frame.getType()).isEqualTo(InboundType.CURSOR_POSITION);
        assertThat(frame.node("position").get("x").asInt()).isEqualTo(10);
        assertThat(frame.text("elementId")).isEqualTo("node-1");
        assertThat(frame.has("missing")).isFalse();
    }

    @Test
    void identifierPatterns() {
        assertThat(FrameValidator.isValidIdentifier("proj-1")).isTrue();
        assertThat(FrameValidator.isValidIdentifier("proj_1")).isTrue();
        assertThat(FrameValidator.isValidIdentifier("507f1f77bcf86cd799439011")).isTrue();
        assertThat(FrameValidator.isValidIdentifier("3f2504e0-4f89-11d3-9a0c-0305e82c3301")).isTrue();

        assertThat(FrameValidator.isValidIdentifier(null)).isFalse();
        assertThat(FrameValidator.isValidIdentifier("")).isFalse();
        assertThat(FrameValidator.isValidIdentifier("a".repeat(65))).isFalse();
        assertThat(FrameValidator.isValidIdentifier("proj 1")).isFalse();
        assertThat(FrameValidator.isValidIdentifier("proj;drop")).isFalse();
    }

    private void assertError(String frame, ProtocolError expected) {
        assertThatThrownBy(() -> validator.parse(frame))
                .isInstanceOf(ProtocolException.class)
                .extracting(e -> ((ProtocolException) e).getError())
                .isEqualTo(expected);
    }
}
