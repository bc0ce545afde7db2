package com.github.copilot.sdk.session;

import com.github.copilot.sdk.exceptions.ConfigurationException;
import com.github.copilot.sdk.types.options.Attachment;
import com.github.copilot.sdk.types.options.InfiniteSessionConfig;
import com.github.copilot.sdk.types.options.McpServerConfig;
import com.github.copilot.sdk.types.options.MessageOptions;
import com.github.copilot.sdk.types.options.ResumeSessionConfig;
import com.github.copilot.sdk.types.options.SessionConfig;
import com.github.copilot.sdk.types.options.SystemMessageConfig;
import com.github.copilot.sdk.types.options.SystemMessageMode;
import com.github.copilot.sdk.types.tools.Tool;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks session and message options before anything is sent to the server.
 */
public final class SessionConfigValidator {

    private static final Pattern TOOL_NAME = Pattern.compile("[A-Za-z0-9_.\\-]{1,64}");
    private static final Set<String> MCP_TYPES = new HashSet<>(Arrays.asList("local", "stdio", "http", "sse"));

    private SessionConfigValidator() {
    }

    public static void validate(SessionConfig config) {
        if (config.getModel() != null && config.getModel().isBlank()) {
            throw new ConfigurationException("model must not be blank");
        }
        if (config.getSessionId() != null && config.getSessionId().isBlank()) {
            throw new ConfigurationException("sessionId must not be blank");
        }
        validateSystemMessage(config.getSystemMessage());
        validateTools(config.getTools());
        validateToolNames("availableTools", config.getAvailableTools());
        validateToolNames("excludedTools", config.getExcludedTools());
        validateMcpServers(config.getMcpServers());
        validateInfiniteSessions(config.getInfiniteSessions());
    }

    public static void validateResume(String sessionId, ResumeSessionConfig config) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ConfigurationException("sessionId must not be blank");
        }
        validateTools(config.getTools());
        validateMcpServers(config.getMcpServers());
    }

    public static void validateMessage(MessageOptions options) {
        if (options.getPrompt() == null) {
            throw new ConfigurationException("prompt must not be null");
        }
        if (options.getMode() == null) {
            throw new ConfigurationException("mode must be enqueue or immediate");
        }
        for (Attachment attachment : options.getAttachments()) {
            if (attachment.getType() == null) {
                throw new ConfigurationException("Attachment type must be file or directory");
            }
            if (attachment.getPath() == null || attachment.getPath().isBlank()) {
                throw new ConfigurationException("Attachment path must not be blank");
            }
        }
    }

    private static void validateSystemMessage(SystemMessageConfig systemMessage) {
        if (systemMessage == null) {
            return;
        }
        if (systemMessage.getMode() == null) {
            throw new ConfigurationException("systemMessage mode must be append or replace");
        }
        if (systemMessage.getMode() == SystemMessageMode.REPLACE
                && (systemMessage.getContent() == null || systemMessage.getContent().isBlank())) {
            throw new ConfigurationException("systemMessage mode replace requires content");
        }
    }

    private static void validateTools(List<Tool> tools) {
        Set<String> seen = new HashSet<>();
        for (Tool tool : tools) {
            checkToolName("tool", tool.getName());
            if (!seen.add(tool.getName())) {
                throw new ConfigurationException("Duplicate tool name: " + tool.getName());
            }
            if (tool.getHandler() == null) {
                throw new ConfigurationException("Tool " + tool.getName() + " has no handler");
            }
        }
    }

    private static void validateToolNames(String field, List<String> names) {
        for (String name : names) {
            checkToolName(field, name);
        }
    }

    private static void checkToolName(String field, String name) {
        if (name == null || !TOOL_NAME.matcher(name).matches()) {
            throw new ConfigurationException("Invalid " + field + " name: " + name);
        }
    }

    private static void validateMcpServers(Map<String, McpServerConfig> servers) {
        for (Map.Entry<String, McpServerConfig> entry : servers.entrySet()) {
            String type = entry.getValue().getType();
            if (type == null || !MCP_TYPES.contains(type)) {
                throw new ConfigurationException("MCP server " + entry.getKey() + " has unsupported type: " + type);
            }
        }
    }

    private static void validateInfiniteSessions(InfiniteSessionConfig config) {
        if (config == null) {
            return;
        }
        double background = config.getBackgroundCompactionThreshold();
        double exhaustion = config.getBufferExhaustionThreshold();
        if (background < 0 || background > 1) {
            throw new ConfigurationException("backgroundCompactionThreshold must be between 0 and 1");
        }
        if (exhaustion < 0 || exhaustion > 1) {
            throw new ConfigurationException("bufferExhaustionThreshold must be between 0 and 1");
        }
        if (background > exhaustion) {
            throw new ConfigurationException(
                    "backgroundCompactionThreshold must not exceed bufferExhaustionThreshold");
        }
    }
}
