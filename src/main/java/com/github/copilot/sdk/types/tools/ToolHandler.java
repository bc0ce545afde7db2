package com.github.copilot.sdk.types.tools;

import java.util.concurrent.CompletableFuture;

/**
 * Caller-supplied implementation of a tool.
 *
 * <p>A handler that throws or completes exceptionally produces a {@code failure} result;
 * the fault never reaches the connection.
 */
@FunctionalInterface
public interface ToolHandler {
    CompletableFuture<ToolResult> handle(ToolInvocation invocation);
}
