package com.github.copilot.sdk.types.options;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * A remote MCP server reached over HTTP or SSE.
 */
@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class McpRemoteServerConfig implements McpServerConfig {

    @JsonProperty("type")
    @Builder.Default
    private final String type = "http";

    @JsonProperty("tools")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    @Singular
    private final List<String> tools;

    @JsonProperty("timeout")
    @Nullable
    private final Integer timeout;

    @JsonProperty("url")
    private final String url;

    @JsonProperty("headers")
    @Singular
    private final Map<String, String> headers;
}
