package com.github.copilot.sdk.types.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolResultType {
    SUCCESS("success"),
    FAILURE("failure"),
    REJECTED("rejected"),
    DENIED("denied");

    private final String value;

    ToolResultType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ToolResultType fromValue(String value) {
        for (ToolResultType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown tool result type: " + value);
    }
}
