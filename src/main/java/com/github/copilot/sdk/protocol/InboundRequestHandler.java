package com.github.copilot.sdk.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Answers server-initiated requests. Complete the future exceptionally with a
 * {@link com.github.copilot.sdk.exceptions.JsonRpcException} to choose the error code;
 * any other failure is reported as an internal error.
 */
@FunctionalInterface
public interface InboundRequestHandler {

    CompletableFuture<JsonNode> handle(String method, JsonNode params);
}
