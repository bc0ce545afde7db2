package com.github.copilot.sdk.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MessageCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final MessageCodec codec = new MessageCodec(mapper);

    @Test
    void encodesRequestWithJsonRpcVersion() throws Exception {
        ObjectNode params = mapper.createObjectNode().put("sessionId", "s1");

        JsonNode encoded = mapper.readTree(codec.encode(Envelope.request(7, "session.send", params)));

        assertThat(encoded.path("jsonrpc").asText()).isEqualTo("2.0");
        assertThat(encoded.path("id").asLong()).isEqualTo(7);
        assertThat(encoded.path("method").asText()).isEqualTo("session.send");
        assertThat(encoded.path("params").path("sessionId").asText()).isEqualTo("s1");
    }

    @Test
    void encodesNullResultExplicitly() throws Exception {
        JsonNode encoded = mapper.readTree(codec.encode(Envelope.response(mapper.getNodeFactory().textNode("a"), null)));

        assertThat(encoded.has("result")).isTrue();
        assertThat(encoded.get("result").isNull()).isTrue();
    }

    @Test
    void encodesErrorObject() throws Exception {
        JsonNode encoded = mapper.readTree(codec.encode(Envelope.error(
                mapper.getNodeFactory().numberNode(3), RpcError.of(RpcError.METHOD_NOT_FOUND, "Method not found: x"))));

        assertThat(encoded.path("error").path("code").asInt()).isEqualTo(-32601);
        assertThat(encoded.path("error").path("message").asText()).isEqualTo("Method not found: x");
        assertThat(encoded.path("error").has("data")).isFalse();
    }

    @Test
    void classifiesInboundMessages() {
        assertThat(kindOf("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tool.call\",\"params\":{}}"))
                .isEqualTo(EnvelopeKind.REQUEST);
        assertThat(kindOf("{\"jsonrpc\":\"2.0\",\"method\":\"session.event\",\"params\":{}}"))
                .isEqualTo(EnvelopeKind.EVENT);
        assertThat(kindOf("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}"))
                .isEqualTo(EnvelopeKind.RESPONSE);
        assertThat(kindOf("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"boom\"}}"))
                .isEqualTo(EnvelopeKind.ERROR);
    }

    @Test
    void stringAndNumericIdsShareKeySpace() {
        Envelope numeric = codec.decode("{\"id\":5,\"result\":null}").getEnvelope();
        Envelope text = codec.decode("{\"id\":\"5\",\"result\":null}").getEnvelope();

        assertThat(numeric.idKey()).isEqualTo(text.idKey());
    }

    @Test
    void extractsSessionIdFromParams() {
        Envelope event = codec.decode(
                "{\"method\":\"session.event\",\"params\":{\"sessionId\":\"abc\",\"event\":{}}}").getEnvelope();

        assertThat(event.sessionId()).isEqualTo("abc");
    }

    @Test
    void rejectsWithoutThrowing() {
        assertRejected("not json", "Invalid JSON");
        assertRejected("[1,2]", "not a JSON object");
        assertRejected("{\"method\":42}", "Invalid method");
        assertRejected("{\"id\":{},\"method\":\"x\"}", "Invalid request id");
        assertRejected("{\"result\":{}}", "Response without id");
        assertRejected("{\"error\":{\"code\":1}}", "Error response without id");
        assertRejected("{\"id\":1,\"error\":{\"code\":\"bad\"}}", "Malformed error object");
        assertRejected("{\"id\":1}", "neither method nor result");
    }

    @Test
    void failureKeepsRawText() {
        DecodeResult result = codec.decode("{broken");

        assertThat(result.isOk()).isFalse();
        assertThat(result.getError().getRawMessage()).isEqualTo("{broken");
    }

    private EnvelopeKind kindOf(String text) {
        DecodeResult result = codec.decode(text);
        assertThat(result.isOk()).as("decode %s", text).isTrue();
        return result.getEnvelope().getKind();
    }

    private void assertRejected(String text, String reason) {
        DecodeResult result = codec.decode(text);
        assertThat(result.isOk()).as("decode %s", text).isFalse();
        assertThat(result.getError().getMessage()).contains(reason);
    }
}
