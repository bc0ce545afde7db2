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
 * A local MCP server launched by the CLI and spoken to over stdio.
 */
@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class McpLocalServerConfig implements McpServerConfig {

    @JsonProperty("type")
    @Builder.Default
    private final String type = "local";

    @JsonProperty("tools")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    @Singular
    private final List<String> tools;

    @JsonProperty("timeout")
    @Nullable
    private final Integer timeout;

    @JsonProperty("command")
    private final String command;

    @JsonProperty("args")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    @Singular
    private final List<String> args;

    @JsonProperty("env")
    @Singular("envVar")
    private final Map<String, String> env;

    @JsonProperty("cwd")
    @Nullable
    private final String cwd;
}
