package com.github.copilot.sdk.session;

/**
 * Lifecycle of a {@link CopilotSession} as seen by the client.
 */
public enum SessionState {
    ACTIVE,
    /** Could not be resumed after the connection was re-established. Terminal. */
    FAILED,
    /** Disposed by the caller or by client shutdown. Terminal. */
    DESTROYED
}
