package com.github.copilot.sdk.types.options;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery mode of a prompt relative to work already in progress on the session.
 */
public enum MessageMode {
    /**
     * Queue behind the message currently being processed. Order is preserved.
     */
    ENQUEUE("enqueue"),
    /**
     * Ask the server to preempt in-progress generation.
     */
    IMMEDIATE("immediate");

    private final String value;

    MessageMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
