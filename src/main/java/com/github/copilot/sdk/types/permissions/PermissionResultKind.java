package com.github.copilot.sdk.types.permissions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PermissionResultKind {
    APPROVED("approved"),
    DENIED_BY_RULES("denied-by-rules"),
    DENIED_NO_APPROVAL_RULE_AND_COULD_NOT_REQUEST_FROM_USER("denied-no-approval-rule-and-could-not-request-from-user"),
    DENIED_INTERACTIVELY_BY_USER("denied-interactively-by-user");

    private final String value;

    PermissionResultKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PermissionResultKind fromValue(String value) {
        for (PermissionResultKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown permission result kind: " + value);
    }
}
