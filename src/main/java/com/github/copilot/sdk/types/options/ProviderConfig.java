package com.github.copilot.sdk.types.options;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Custom model provider ("bring your own key").
 */
@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProviderConfig {

    /**
     * {@code openai}, {@code azure} or {@code anthropic}; server default is {@code openai}.
     */
    @JsonProperty("type")
    @Nullable
    private final String type;

    /**
     * {@code completions} or {@code responses} (openai/azure only).
     */
    @JsonProperty("wireApi")
    @Nullable
    private final String wireApi;

    @JsonProperty("baseUrl")
    private final String baseUrl;

    @JsonProperty("apiKey")
    @Nullable
    private final String apiKey;

    /**
     * Sent as the Authorization header; takes precedence over {@link #apiKey}.
     */
    @JsonProperty("bearerToken")
    @Nullable
    private final String bearerToken;

    @JsonProperty("azure")
    @Nullable
    private final AzureProviderOptions azure;
}
