package com.github.copilot.sdk.types.permissions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of action the server asks permission for.
 */
public enum PermissionKind {
    SHELL("shell"),
    WRITE("write"),
    MCP("mcp"),
    READ("read"),
    URL("url");

    private final String value;

    PermissionKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PermissionKind fromValue(String value) {
        for (PermissionKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown permission kind: " + value);
    }
}
