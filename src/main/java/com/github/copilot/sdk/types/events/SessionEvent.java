package com.github.copilot.sdk.types.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Data;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.UUID;

/**
 * An event emitted by the server for one session, or synthesised by the client
 * for connection-level changes (types prefixed with {@code client.}).
 */
@Data
@AllArgsConstructor
public final class SessionEvent {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("timestamp")
    @Nullable
    private final String timestamp;

    @JsonProperty("parentId")
    @Nullable
    private final String parentId;

    @JsonProperty("type")
    private final String type;

    @JsonProperty("data")
    private final JsonNode data;

    /**
     * Build an event from its wire form; missing fields become empty values.
     */
    public static SessionEvent fromJson(JsonNode node) {
        JsonNode data = node.get("data");
        return new SessionEvent(
                node.path("id").asText(""),
                textOrNull(node, "timestamp"),
                textOrNull(node, "parentId"),
                node.path("type").asText(""),
                data != null && !data.isNull() ? data : JsonNodeFactory.instance.objectNode()
        );
    }

    /**
     * Build a client-side event that never travelled over the wire.
     */
    public static SessionEvent synthetic(String type, ObjectNode data) {
        return new SessionEvent(UUID.randomUUID().toString(), Instant.now().toString(), null, type, data);
    }

    @Nullable
    public String getDataText(String field) {
        return textOrNull(data, field);
    }

    @Nullable
    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
