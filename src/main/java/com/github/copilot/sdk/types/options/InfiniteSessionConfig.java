package com.github.copilot.sdk.types.options;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

/**
 * Infinite-session policy: automatic context compaction driven by the server.
 *
 * <p>Utilisation values are reported by the server; the client only compares them
 * against the two thresholds to decide whether sends must wait for compaction.
 */
@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InfiniteSessionConfig {

    public static final double DEFAULT_BACKGROUND_THRESHOLD = 0.80;
    public static final double DEFAULT_BUFFER_EXHAUSTION_THRESHOLD = 0.95;

    @JsonProperty("enabled")
    @Builder.Default
    private final boolean enabled = true;

    /**
     * Utilisation in [0,1] at which background compaction starts.
     */
    @JsonProperty("backgroundCompactionThreshold")
    @Builder.Default
    private final double backgroundCompactionThreshold = DEFAULT_BACKGROUND_THRESHOLD;

    /**
     * Utilisation in [0,1] at which the session blocks until compaction completes.
     */
    @JsonProperty("bufferExhaustionThreshold")
    @Builder.Default
    private final double bufferExhaustionThreshold = DEFAULT_BUFFER_EXHAUSTION_THRESHOLD;

    public static InfiniteSessionConfig defaults() {
        return InfiniteSessionConfig.builder().build();
    }

    public static InfiniteSessionConfig disabled() {
        return InfiniteSessionConfig.builder().enabled(false).build();
    }
}
