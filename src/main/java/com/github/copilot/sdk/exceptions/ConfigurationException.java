package com.github.copilot.sdk.exceptions;

/**
 * Raised when client or session options are invalid or conflict with each other.
 * Always thrown before any process or socket is touched.
 */
public class ConfigurationException extends CopilotSDKException {

    public ConfigurationException(String message) {
        super(message);
    }
}
