package com.github.copilot.sdk.exceptions;

/**
 * Raised when an inbound frame cannot be decoded into a protocol envelope.
 */
public class MessageParseException extends CopilotSDKException {

    private final String rawMessage;

    public MessageParseException(String message, String rawMessage) {
        super(message);
        this.rawMessage = rawMessage;
    }

    public MessageParseException(String message, String rawMessage, Throwable cause) {
        super(message, cause);
        this.rawMessage = rawMessage;
    }

    public String getRawMessage() {
        return rawMessage;
    }
}
