package com.github.copilot.sdk.exceptions;

/**
 * Raised when the connection to the CLI server is missing, lost or unusable.
 */
public class CLIConnectionException extends CopilotSDKException {

    public CLIConnectionException(String message) {
        super(message);
    }

    public CLIConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
