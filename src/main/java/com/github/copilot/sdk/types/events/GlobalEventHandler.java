package com.github.copilot.sdk.types.events;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Subscriber for connection-global notifications that carry no session id.
 */
@FunctionalInterface
public interface GlobalEventHandler {
    void onEvent(String method, JsonNode params);
}
