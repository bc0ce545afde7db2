package com.github.copilot.sdk.types.options;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import javax.annotation.Nullable;

/**
 * System message customisation for session creation.
 */
@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SystemMessageConfig {

    @JsonProperty("mode")
    private final SystemMessageMode mode;

    @JsonProperty("content")
    @Nullable
    private final String content;

    public static SystemMessageConfig append(@Nullable String content) {
        return new SystemMessageConfig(SystemMessageMode.APPEND, content);
    }

    public static SystemMessageConfig replace(String content) {
        return new SystemMessageConfig(SystemMessageMode.REPLACE, content);
    }
}
