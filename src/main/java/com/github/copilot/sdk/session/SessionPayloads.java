package com.github.copilot.sdk.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.copilot.sdk.types.options.CustomAgentConfig;
import com.github.copilot.sdk.types.options.McpServerConfig;
import com.github.copilot.sdk.types.options.MessageOptions;
import com.github.copilot.sdk.types.options.ResumeSessionConfig;
import com.github.copilot.sdk.types.options.SessionConfig;
import com.github.copilot.sdk.types.tools.Tool;

import java.util.List;
import java.util.Map;

/**
 * Builds the params objects for session requests.
 */
final class SessionPayloads {

    private SessionPayloads() {
    }

    static ObjectNode create(ObjectMapper mapper, SessionConfig config) {
        ObjectNode params = mapper.createObjectNode();
        putIfPresent(params, "sessionId", config.getSessionId());
        putIfPresent(params, "model", config.getModel());
        putIfPresent(params, "configDir", config.getConfigDir());
        putTools(mapper, params, config.getTools());
        if (config.getSystemMessage() != null) {
            params.set("systemMessage", mapper.valueToTree(config.getSystemMessage()));
        }
        putStrings(params, "availableTools", config.getAvailableTools());
        putStrings(params, "excludedTools", config.getExcludedTools());
        if (config.getProvider() != null) {
            params.set("provider", mapper.valueToTree(config.getProvider()));
        }
        params.put("requestPermission", config.getOnPermissionRequest() != null);
        params.put("streaming", config.isStreaming());
        putMcpServers(mapper, params, config.getMcpServers());
        putCustomAgents(mapper, params, config.getCustomAgents());
        putStrings(params, "skillDirectories", config.getSkillDirectories());
        putStrings(params, "disabledSkills", config.getDisabledSkills());
        if (config.getInfiniteSessions() != null) {
            params.set("infiniteSessions", mapper.valueToTree(config.getInfiniteSessions()));
        }
        return params;
    }

    static ObjectNode resume(ObjectMapper mapper, String sessionId, ResumeSessionConfig config) {
        ObjectNode params = mapper.createObjectNode();
        params.put("sessionId", sessionId);
        putTools(mapper, params, config.getTools());
        if (config.getProvider() != null) {
            params.set("provider", mapper.valueToTree(config.getProvider()));
        }
        params.put("requestPermission", config.getOnPermissionRequest() != null);
        params.put("streaming", config.isStreaming());
        putMcpServers(mapper, params, config.getMcpServers());
        putCustomAgents(mapper, params, config.getCustomAgents());
        putStrings(params, "skillDirectories", config.getSkillDirectories());
        putStrings(params, "disabledSkills", config.getDisabledSkills());
        return params;
    }

    static ObjectNode send(ObjectMapper mapper, String sessionId, MessageOptions options) {
        ObjectNode params = mapper.createObjectNode();
        params.put("sessionId", sessionId);
        params.put("prompt", options.getPrompt());
        if (!options.getAttachments().isEmpty()) {
            params.set("attachments", mapper.valueToTree(options.getAttachments()));
        }
        params.put("mode", options.getMode().getValue());
        return params;
    }

    static ObjectNode sessionOnly(ObjectMapper mapper, String sessionId) {
        ObjectNode params = mapper.createObjectNode();
        params.put("sessionId", sessionId);
        return params;
    }

    private static void putTools(ObjectMapper mapper, ObjectNode params, List<Tool> tools) {
        if (tools.isEmpty()) {
            return;
        }
        ArrayNode array = params.putArray("tools");
        for (Tool tool : tools) {
            array.add(mapper.valueToTree(tool.toDefinition()));
        }
    }

    private static void putMcpServers(ObjectMapper mapper, ObjectNode params, Map<String, McpServerConfig> servers) {
        if (servers.isEmpty()) {
            return;
        }
        ObjectNode node = params.putObject("mcpServers");
        for (Map.Entry<String, McpServerConfig> entry : servers.entrySet()) {
            node.set(entry.getKey(), mapper.valueToTree(entry.getValue()));
        }
    }

    private static void putCustomAgents(ObjectMapper mapper, ObjectNode params, List<CustomAgentConfig> agents) {
        if (agents.isEmpty()) {
            return;
        }
        ArrayNode array = params.putArray("customAgents");
        for (CustomAgentConfig agent : agents) {
            array.add(mapper.valueToTree(agent));
        }
    }

    private static void putStrings(ObjectNode params, String field, List<String> values) {
        if (values.isEmpty()) {
            return;
        }
        ArrayNode array = params.putArray(field);
        values.forEach(array::add);
    }

    private static void putIfPresent(ObjectNode params, String field, String value) {
        if (value != null) {
            params.put(field, value);
        }
    }
}
