package com.github.copilot.sdk.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.copilot.sdk.types.events.SessionEvent;
import com.github.copilot.sdk.types.events.SessionEventType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StreamAssemblerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void concatenatesDeltasPerMessage() {
        StreamAssembler assembler = new StreamAssembler("s1", true);

        assembler.accept(delta("m1", "Hel"));
        assembler.accept(delta("m2", "Other"));
        assembler.accept(delta("m1", "lo"));

        assertThat(assembler.partialMessage("m1")).isEqualTo("Hello");
        assertThat(assembler.openBlocks()).isEqualTo(2);
        assertThat(assembler.accept(message("m1", "Hello"))).isEqualTo("Hello");
        assertThat(assembler.partialMessage("m1")).isNull();
        assertThat(assembler.openBlocks()).isEqualTo(1);
    }

    @Test
    void keepsReasoningSeparateFromMessages() {
        StreamAssembler assembler = new StreamAssembler("s1", true);
        ObjectNode reasoningDelta = mapper.createObjectNode()
                .put("reasoningId", "r1")
                .put("deltaContent", "thinking");

        assembler.accept(SessionEvent.synthetic(SessionEventType.ASSISTANT_REASONING_DELTA, reasoningDelta));
        assembler.accept(delta("r1", "answer"));

        String reasoning = assembler.accept(SessionEvent.synthetic(SessionEventType.ASSISTANT_REASONING,
                mapper.createObjectNode().put("reasoningId", "r1").put("content", "thinking")));
        assertThat(reasoning).isEqualTo("thinking");
        assertThat(assembler.partialMessage("r1")).isEqualTo("answer");
    }

    @Test
    void finalMessageWithoutDeltasYieldsNothing() {
        StreamAssembler assembler = new StreamAssembler("s1", true);

        assertThat(assembler.accept(message("m1", "Whole"))).isNull();
    }

    @Test
    void ignoresDeltasWhenNotStreaming() {
        StreamAssembler assembler = new StreamAssembler("s1", false);

        assembler.accept(delta("m1", "x"));

        assertThat(assembler.openBlocks()).isZero();
        assertThat(assembler.accept(message("m1", "x"))).isNull();
    }

    @Test
    void mismatchKeepsStreamedText() {
        StreamAssembler assembler = new StreamAssembler("s1", true);
        assembler.accept(delta("m1", "abc"));

        assertThat(assembler.accept(message("m1", "abcd"))).isEqualTo("abc");
    }

    @Test
    void resetDropsOpenBlocks() {
        StreamAssembler assembler = new StreamAssembler("s1", true);
        assembler.accept(delta("m1", "partial"));

        assembler.reset();

        assertThat(assembler.openBlocks()).isZero();
    }

    private SessionEvent delta(String messageId, String text) {
        return SessionEvent.synthetic(SessionEventType.ASSISTANT_MESSAGE_DELTA,
                mapper.createObjectNode().put("messageId", messageId).put("deltaContent", text));
    }

    private SessionEvent message(String messageId, String content) {
        return SessionEvent.synthetic(SessionEventType.ASSISTANT_MESSAGE,
                mapper.createObjectNode().put("messageId", messageId).put("content", content));
    }
}
