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
 * A custom agent definition registered with a session.
 */
@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CustomAgentConfig {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("displayName")
    @Nullable
    private final String displayName;

    @JsonProperty("description")
    @Nullable
    private final String description;

    /**
     * Tool names the agent may use; {@code null} allows all tools.
     */
    @JsonProperty("tools")
    @Nullable
    private final List<String> tools;

    @JsonProperty("prompt")
    private final String prompt;

    @JsonProperty("mcpServers")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @Singular
    private final Map<String, McpServerConfig> mcpServers;

    @JsonProperty("infer")
    @Nullable
    private final Boolean infer;
}
