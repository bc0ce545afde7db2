package com.github.copilot.sdk.types.events;

/**
 * Subscriber for a session's events, invoked in arrival order.
 */
@FunctionalInterface
public interface SessionEventHandler {
    void onEvent(SessionEvent event);
}
