package com.syro.api;

/**
 * Outbound side of the chat platform. Registered by the platform listener so
 * that the dispatcher and handlers can answer without knowing the client.
 */
@FunctionalInterface
public interface MessageSender {
    void send(InboundMessage origin, String text);
}
