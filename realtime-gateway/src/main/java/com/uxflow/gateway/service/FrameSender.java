package com.uxflow.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uxflow.gateway.domain.Connection;
import com.uxflow.gateway.domain.OutboundFrame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Serializes and writes a single frame to one connection.
 */
@Component
@Slf4j
public class FrameSender {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FrameSender(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public boolean send(Connection connection, OutboundFrame frame) {
        try {
            boolean sent = connection.send(objectMapper.writeValueAsString(frame.stamp(clock.instant())));
            if (!sent) {
                log.debug("Frame not delivered, connection closing: connectionId={}, type={}",
                        connection.getConnectionId(), frame.getType());
            }
            return sent;
        } catch (JsonProcessingException e) {
            log.error("Error serializing frame: type={}", frame.getType(), e);
            return false;
        } catch (Exception e) {
            log.error("Failed to send frame: connectionId={}, type={}",
                    connection.getConnectionId(), frame.getType(), e);
            return false;
        }
    }
}
