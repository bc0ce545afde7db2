package com.github.copilot.sdk.exceptions;

/**
 * Raised for operations on a session that was destroyed or could not be resumed
 * after the connection was re-established.
 */
public class SessionFailedException extends CopilotSDKException {

    private final String sessionId;

    public SessionFailedException(String sessionId, String message) {
        super("Session " + sessionId + ": " + message);
        this.sessionId = sessionId;
    }

    public SessionFailedException(String sessionId, String message, Throwable cause) {
        super("Session " + sessionId + ": " + message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
