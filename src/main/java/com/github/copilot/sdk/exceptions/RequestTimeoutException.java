package com.github.copilot.sdk.exceptions;

import java.time.Duration;

/**
 * A request did not receive a response before its deadline.
 */
public class RequestTimeoutException extends CopilotSDKException {

    private final String method;
    private final Duration timeout;

    public RequestTimeoutException(String method, Duration timeout) {
        super("Request " + method + " timed out after " + timeout.toMillis() + "ms");
        this.method = method;
        this.timeout = timeout;
    }

    public String getMethod() {
        return method;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
