package com.github.copilot.sdk.types.permissions;

import java.util.concurrent.CompletableFuture;

/**
 * Callback deciding permission requests for a session.
 * Throwing or completing exceptionally counts as a denial.
 */
@FunctionalInterface
public interface PermissionHandler {
    CompletableFuture<PermissionRequestResult> handle(PermissionRequest request, PermissionInvocation invocation);
}
