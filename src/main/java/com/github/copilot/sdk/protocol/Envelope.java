package com.github.copilot.sdk.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.LongNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * One protocol message: a request, its response or error, or a one-way event.
 *
 * <p>Ids are kept as JSON nodes so inbound string or numeric ids are echoed back verbatim.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Envelope {

    private final EnvelopeKind kind;
    @Nullable
    private final JsonNode id;
    @Nullable
    private final String method;
    @Nullable
    private final JsonNode params;
    @Nullable
    private final JsonNode result;
    @Nullable
    private final RpcError error;

    public static Envelope request(long id, String method, @Nullable JsonNode params) {
        return new Envelope(EnvelopeKind.REQUEST, LongNode.valueOf(id), method, params, null, null);
    }

    public static Envelope request(JsonNode id, String method, @Nullable JsonNode params) {
        return new Envelope(EnvelopeKind.REQUEST, id, method, params, null, null);
    }

    public static Envelope event(String method, @Nullable JsonNode params) {
        return new Envelope(EnvelopeKind.EVENT, null, method, params, null, null);
    }

    public static Envelope response(JsonNode id, @Nullable JsonNode result) {
        return new Envelope(EnvelopeKind.RESPONSE, id, null, null, result, null);
    }

    public static Envelope error(JsonNode id, RpcError error) {
        return new Envelope(EnvelopeKind.ERROR, id, null, null, null, error);
    }

    /**
     * Id in the form used as a pending-table key.
     */
    @Nullable
    public String idKey() {
        return id == null ? null : id.asText();
    }

    /**
     * The {@code sessionId} carried in the params, if any.
     */
    @Nullable
    public String sessionId() {
        if (params == null) {
            return null;
        }
        JsonNode sessionId = params.get("sessionId");
        return sessionId != null && sessionId.isTextual() ? sessionId.asText() : null;
    }

    @Override
    public String toString() {
        return kind + (method != null ? " " + method : "") + (id != null ? " id=" + id : "");
    }
}
