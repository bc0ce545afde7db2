package com.github.copilot.sdk.types.options;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AttachmentType {
    FILE("file"),
    DIRECTORY("directory");

    private final String value;

    AttachmentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
