package com.github.copilot.sdk.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;

import javax.annotation.Nullable;

/**
 * JSON-RPC error object carried by an error envelope.
 */
@Data
@AllArgsConstructor
public final class RpcError {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    private final int code;
    private final String message;
    @Nullable
    private final JsonNode data;

    public static RpcError of(int code, String message) {
        return new RpcError(code, message, null);
    }
}
