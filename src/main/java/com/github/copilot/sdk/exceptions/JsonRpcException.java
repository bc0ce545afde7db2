package com.github.copilot.sdk.exceptions;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;

/**
 * The server answered a request with a JSON-RPC error object.
 */
public class JsonRpcException extends CopilotSDKException {

    private final String method;
    private final int code;
    private final String errorMessage;
    @Nullable
    private final transient JsonNode data;

    public JsonRpcException(String method, int code, String message, @Nullable JsonNode data) {
        super(method + " failed: " + message + " (code " + code + ")");
        this.method = method;
        this.code = code;
        this.errorMessage = message;
        this.data = data;
    }

    public String getMethod() {
        return method;
    }

    public int getCode() {
        return code;
    }

    /**
     * The server's error message without the method and code decoration.
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Nullable
    public JsonNode getData() {
        return data;
    }
}
