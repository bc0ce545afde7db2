package com.github.copilot.sdk.types.permissions;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Context passed to permission handlers alongside the request.
 */
@Data
@AllArgsConstructor
public final class PermissionInvocation {
    private final String sessionId;
}
