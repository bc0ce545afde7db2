package com.github.copilot.sdk.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.copilot.sdk.exceptions.MessageParseException;

/**
 * Converts between {@link Envelope}s and JSON-RPC 2.0 text.
 *
 * <p>{@link #decode(String)} never throws: every rejection is returned as a
 * {@link DecodeResult#failure(MessageParseException)}.
 */
public class MessageCodec {

    private static final String JSONRPC_VERSION = "2.0";

    private final ObjectMapper mapper;

    public MessageCodec() {
        this(new ObjectMapper());
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public String encode(Envelope envelope) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", JSONRPC_VERSION);
        if (envelope.getId() != null) {
            root.set("id", envelope.getId());
        }
        switch (envelope.getKind()) {
            case REQUEST:
            case EVENT:
                root.put("method", envelope.getMethod());
                if (envelope.getParams() != null) {
                    root.set("params", envelope.getParams());
                }
                break;
            case RESPONSE:
                if (envelope.getResult() != null) {
                    root.set("result", envelope.getResult());
                } else {
                    root.putNull("result");
                }
                break;
            case ERROR:
                RpcError error = envelope.getError();
                ObjectNode errorNode = root.putObject("error");
                errorNode.put("code", error.getCode());
                errorNode.put("message", error.getMessage());
                if (error.getData() != null) {
                    errorNode.set("data", error.getData());
                }
                break;
            default:
                throw new IllegalArgumentException("Unknown envelope kind: " + envelope.getKind());
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + envelope, e);
        }
    }

    public DecodeResult decode(String text) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            return DecodeResult.failure(new MessageParseException("Invalid JSON", text, e));
        }
        if (root == null || !root.isObject()) {
            return DecodeResult.failure(new MessageParseException("Message is not a JSON object", text));
        }

        JsonNode id = root.get("id");
        boolean hasId = id != null && !id.isNull();
        JsonNode method = root.get("method");

        if (method != null) {
            if (!method.isTextual() || method.asText().isEmpty()) {
                return DecodeResult.failure(new MessageParseException("Invalid method", text));
            }
            JsonNode params = root.get("params");
            if (hasId) {
                if (!id.isTextual() && !id.isIntegralNumber()) {
                    return DecodeResult.failure(new MessageParseException("Invalid request id", text));
                }
                return DecodeResult.ok(Envelope.request(id, method.asText(), params));
            }
            return DecodeResult.ok(Envelope.event(method.asText(), params));
        }

        if (root.has("error")) {
            if (!hasId) {
                return DecodeResult.failure(new MessageParseException("Error response without id", text));
            }
            JsonNode errorNode = root.get("error");
            if (!errorNode.isObject() || !errorNode.path("code").isInt()) {
                return DecodeResult.failure(new MessageParseException("Malformed error object", text));
            }
            RpcError error = new RpcError(
                    errorNode.get("code").asInt(),
                    errorNode.path("message").asText(""),
                    errorNode.get("data")
            );
            return DecodeResult.ok(Envelope.error(id, error));
        }

        if (root.has("result")) {
            if (!hasId) {
                return DecodeResult.failure(new MessageParseException("Response without id", text));
            }
            return DecodeResult.ok(Envelope.response(id, root.get("result")));
        }

        return DecodeResult.failure(new MessageParseException("Message has neither method nor result/error", text));
    }
}
