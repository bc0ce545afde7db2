package com.github.copilot.sdk.types.options;

import java.util.List;

/**
 * Configuration of an MCP server made available to a session.
 */
public interface McpServerConfig {

    /**
     * Transport type understood by the server: {@code local}, {@code stdio}, {@code http} or {@code sse}.
     */
    String getType();

    /**
     * Tools to expose; an empty list exposes none and {@code "*"} exposes all.
     */
    List<String> getTools();
}
