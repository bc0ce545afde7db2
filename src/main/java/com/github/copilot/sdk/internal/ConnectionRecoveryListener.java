package com.github.copilot.sdk.internal;

/**
 * Notified after the connection manager has tried to recover from an unexpected
 * connection loss.
 */
public interface ConnectionRecoveryListener {

    /**
     * A fresh connection is up; open sessions should be resumed.
     */
    void onReconnected();

    /**
     * The connection was lost and will not be re-established automatically.
     */
    void onRecoveryFailed(Throwable cause);
}
