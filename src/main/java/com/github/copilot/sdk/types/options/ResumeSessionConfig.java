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
 * Configuration applied when resuming an existing session. Handlers are never
 * persisted by the server, so tools and the permission handler must be supplied again.
 */
@Getter
@Builder(toBuilder = true)
public class ResumeSessionConfig {

    @Singular
    private final List<Tool> tools;

    @Nullable
    private final ProviderConfig provider;

    @Nullable
    private final PermissionHandler onPermissionRequest;

    @Builder.Default
    private final boolean streaming = false;

    @Singular("mcpServer")
    private final Map<String, McpServerConfig> mcpServers;

    @Singular
    private final List<CustomAgentConfig> customAgents;

    @Singular
    private final List<String> skillDirectories;

    @Singular
    private final List<String> disabledSkills;

    public static ResumeSessionConfig empty() {
        return ResumeSessionConfig.builder().build();
    }
}
