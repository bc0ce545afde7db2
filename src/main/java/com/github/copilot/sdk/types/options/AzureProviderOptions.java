package com.github.copilot.sdk.types.options;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Azure-specific provider settings.
 */
@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AzureProviderOptions {

    /**
     * Azure API version; the server defaults to {@code 2024-10-21}.
     */
    @JsonProperty("apiVersion")
    private final String apiVersion;
}
