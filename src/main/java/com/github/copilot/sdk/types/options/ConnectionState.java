package com.github.copilot.sdk.types.options;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Connection state of a {@link com.github.copilot.sdk.client.CopilotClient}.
 */
public enum ConnectionState {
    DISCONNECTED("disconnected"),
    CONNECTING("connecting"),
    CONNECTED("connected"),
    ERROR("error");

    private final String value;

    ConnectionState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
