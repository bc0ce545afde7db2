package com.github.copilot.sdk.types.options;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a caller-supplied system message combines with the server's own.
 */
public enum SystemMessageMode {
    /**
     * Keep the server foundation and append the supplied content.
     */
    APPEND("append"),
    /**
     * Use the supplied content as the entire system message.
     */
    REPLACE("replace");

    private final String value;

    SystemMessageMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
