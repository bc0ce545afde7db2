package com.github.copilot.sdk.types.responses;

import lombok.AllArgsConstructor;
import lombok.Data;

import javax.annotation.Nullable;

/**
 * A cleanup step that failed while stopping the client.
 */
@Data
@AllArgsConstructor
public final class StopError {
    private final String message;
    @Nullable
    private final Throwable cause;
}
