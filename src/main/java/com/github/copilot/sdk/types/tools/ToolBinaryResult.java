package com.github.copilot.sdk.types.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import javax.annotation.Nullable;

/**
 * Binary payload returned by a tool, base64 encoded.
 */
@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ToolBinaryResult {

    @JsonProperty("data")
    private final String data;

    @JsonProperty("mimeType")
    private final String mimeType;

    @JsonProperty("type")
    private final String type;

    @JsonProperty("description")
    @Nullable
    private final String description;
}
