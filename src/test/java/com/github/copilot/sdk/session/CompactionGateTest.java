package com.github.copilot.sdk.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.copilot.sdk.exceptions.SessionFailedException;
import com.github.copilot.sdk.types.options.InfiniteSessionConfig;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompactionGateTest {

    @Test
    void startsOpen() {
        CompactionGate gate = new CompactionGate("s1", null);

        assertThat(gate.getState()).isEqualTo(CompactionState.NORMAL);
        assertThat(gate.admission()).isDone();
    }

    @Test
    void backgroundThresholdDoesNotBlock() {
        CompactionGate gate = new CompactionGate("s1", InfiniteSessionConfig.defaults());

        gate.onUsage(0.85);

        assertThat(gate.getState()).isEqualTo(CompactionState.BACKGROUND_COMPACTING);
        assertThat(gate.admission()).isDone();

        gate.onCompactionComplete();
        assertThat(gate.getState()).isEqualTo(CompactionState.NORMAL);
    }

    @Test
    void exhaustionBlocksUntilCompactionCompletes() {
        CompactionGate gate = new CompactionGate("s1", InfiniteSessionConfig.defaults());

        gate.onUsage(0.85);
        gate.onUsage(0.97);
        CompletableFuture<Void> admission = gate.admission();

        assertThat(gate.getState()).isEqualTo(CompactionState.BLOCKED_COMPACTING);
        assertThat(admission).isNotDone();

        gate.onUsage(0.99);
        assertThat(gate.admission()).isSameAs(admission);

        gate.onCompactionComplete();
        assertThat(admission).isCompleted();
        assertThat(gate.getState()).isEqualTo(CompactionState.NORMAL);
    }

    @Test
    void customThresholds() {
        CompactionGate gate = new CompactionGate("s1", InfiniteSessionConfig.builder()
                .backgroundCompactionThreshold(0.5)
                .bufferExhaustionThreshold(0.6)
                .build());

        gate.onUsage(0.55);
        assertThat(gate.getState()).isEqualTo(CompactionState.BACKGROUND_COMPACTING);
        gate.onUsage(0.6);
        assertThat(gate.getState()).isEqualTo(CompactionState.BLOCKED_COMPACTING);
    }

    @Test
    void disabledGateNeverBlocks() {
        CompactionGate gate = new CompactionGate("s1", InfiniteSessionConfig.disabled());

        gate.onUsage(1.0);
        gate.onCompactionStart();

        assertThat(gate.getState()).isEqualTo(CompactionState.NORMAL);
        assertThat(gate.admission()).isDone();
    }

    @Test
    void compactionStartEventEntersBackgroundState() {
        CompactionGate gate = new CompactionGate("s1", null);

        gate.onCompactionStart();

        assertThat(gate.getState()).isEqualTo(CompactionState.BACKGROUND_COMPACTING);
    }

    @Test
    void resetReleasesWaitingSendersWithoutCompletionEvent() {
        CompactionGate gate = new CompactionGate("s1", InfiniteSessionConfig.defaults());
        gate.onUsage(0.97);
        CompletableFuture<Void> waiting = gate.admission();
        assertThat(waiting).isNotDone();

        gate.reset();

        assertThat(gate.getState()).isEqualTo(CompactionState.NORMAL);
        assertThat(waiting).isCompleted();
        assertThat(gate.admission()).isDone();
    }

    @Test
    void abandonFailsWaitingSenders() {
        CompactionGate gate = new CompactionGate("s1", null);
        gate.onUsage(0.96);
        CompletableFuture<Void> admission = gate.admission();

        gate.abandon(new SessionFailedException("s1", "session destroyed"));

        assertThatThrownBy(admission::join).hasCauseInstanceOf(SessionFailedException.class);
    }

    @Test
    void utilizationFromRatioOrTokenCounts() {
        ObjectMapper mapper = new ObjectMapper();

        assertThat(CopilotSession.utilizationOf(mapper.createObjectNode().put("utilization", 0.42))).isEqualTo(0.42);
        assertThat(CopilotSession.utilizationOf(mapper.createObjectNode()
                .put("currentTokens", 90000).put("tokenLimit", 100000))).isEqualTo(0.9);
        assertThat(CopilotSession.utilizationOf(mapper.createObjectNode().put("tokenLimit", 0))).isNull();
    }
}
