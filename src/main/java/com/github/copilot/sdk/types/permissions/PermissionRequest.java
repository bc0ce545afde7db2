package com.github.copilot.sdk.types.permissions;

import lombok.AllArgsConstructor;
import lombok.Data;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Permission query sent by the server. Fields beyond {@code kind} and
 * {@code toolCallId} vary by kind and are kept in {@link #getExtra()}.
 */
@Data
@AllArgsConstructor
public final class PermissionRequest {
    private final PermissionKind kind;
    @Nullable
    private final String toolCallId;
    private final Map<String, Object> extra;
}
