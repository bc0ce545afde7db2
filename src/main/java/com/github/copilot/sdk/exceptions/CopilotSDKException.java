package com.github.copilot.sdk.exceptions;

/**
 * Base exception for all errors raised by the SDK.
 */
public class CopilotSDKException extends RuntimeException {

    public CopilotSDKException(String message) {
        super(message);
    }

    public CopilotSDKException(String message, Throwable cause) {
        super(message, cause);
    }
}
