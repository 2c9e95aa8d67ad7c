package com.uxflow.gateway.domain;

/**
 * Send capability owned by a single client socket.
 */
public interface ClientChannel {

    /**
     * @return false if the frame could not be written (socket closed or failing)
     */
    boolean send(String frame);

    boolean ping();

    void close(int code, String reason);

    boolean isOpen();
}
