package com.github.copilot.sdk.types.tools;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A tool call initiated by the server.
 */
@Data
@AllArgsConstructor
public final class ToolInvocation {
    private final String sessionId;
    private final String toolCallId;
    private final String toolName;
    private final JsonNode arguments;
}
