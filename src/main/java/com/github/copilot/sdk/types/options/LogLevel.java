package com.github.copilot.sdk.types.options;

/**
 * Log level passed to the CLI server via {@code --log-level}.
 */
public enum LogLevel {
    NONE("none"),
    ERROR("error"),
    WARNING("warning"),
    INFO("info"),
    DEBUG("debug"),
    ALL("all");

    private final String value;

    LogLevel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
