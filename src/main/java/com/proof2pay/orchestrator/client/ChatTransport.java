package com.proof2pay.orchestrator.client;

/**
 * Outbound side of the chat integration. Posting is the dispatcher's job only.
 */
public interface ChatTransport {

    void post(String channel, String text);
}
