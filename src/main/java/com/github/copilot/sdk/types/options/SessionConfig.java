package com.github.copilot.sdk.types.options;

import com.github.copilot.sdk.types.permissions.PermissionHandler;
import com.github.copilot.sdk.types.tools.Tool;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Configuration for creating a session.
 *
 * <p>Example:
 * <pre>{@code
 * SessionConfig config = SessionConfig.builder()
 *     .model("claude-sonnet-4.5")
 *     .streaming(true)
 *     .tool(Tool.builder().name("lookup").handler(this::lookup).build())
 *     .onPermissionRequest((request, invocation) ->
 *         CompletableFuture.completedFuture(PermissionRequestResult.approved()))
 *     .build();
 * }</pre>
 */
@Getter
@Builder(toBuilder = true)
public class SessionConfig {

    /**
     * Custom session id; the server assigns one when absent.
     */
    @Nullable
    private final String sessionId;

    @Nullable
    private final String model;

    @Nullable
    private final String configDir;

    @Singular
    private final List<Tool> tools;

    @Nullable
    private final SystemMessageConfig systemMessage;

    /**
     * Tool names to allow; takes precedence over {@link #excludedTools}.
     */
    @Singular
    private final List<String> availableTools;

    @Singular
    private final List<String> excludedTools;

    @Nullable
    private final PermissionHandler onPermissionRequest;

    /**
     * Emit {@code assistant.message_delta} and {@code assistant.reasoning_delta} events.
     */
    @Builder.Default
    private final boolean streaming = false;

    @Nullable
    private final ProviderConfig provider;

    @Singular("mcpServer")
    private final Map<String, McpServerConfig> mcpServers;

    @Singular
    private final List<CustomAgentConfig> customAgents;

    @Singular
    private final List<String> skillDirectories;

    @Singular
    private final List<String> disabledSkills;

    /**
     * Infinite-session policy; {@code null} leaves the server default (enabled).
     */
    @Nullable
    private final InfiniteSessionConfig infiniteSessions;

    /**
     * The subset of this configuration that applies when the session is resumed.
     */
    public ResumeSessionConfig toResumeConfig() {
        return ResumeSessionConfig.builder()
                .tools(tools)
                .provider(provider)
                .onPermissionRequest(onPermissionRequest)
                .streaming(streaming)
                .mcpServers(mcpServers)
                .customAgents(customAgents)
                .skillDirectories(skillDirectories)
                .disabledSkills(disabledSkills)
                .build();
    }
}
