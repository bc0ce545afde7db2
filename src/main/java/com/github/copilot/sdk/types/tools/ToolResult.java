package com.github.copilot.sdk.types.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Result of a tool invocation, sent back to the server for the matching tool call id.
 */
@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ToolResult {

    @JsonProperty("textResultForLlm")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    @Builder.Default
    private final String textResultForLlm = "";

    @JsonProperty("binaryResultsForLlm")
    @Singular
    private final List<ToolBinaryResult> binaryResults;

    @JsonProperty("resultType")
    @Builder.Default
    private final ToolResultType resultType = ToolResultType.SUCCESS;

    @JsonProperty("error")
    @Nullable
    private final String error;

    @JsonProperty("sessionLog")
    @Nullable
    private final String sessionLog;

    @JsonProperty("toolTelemetry")
    @Singular("telemetryEntry")
    private final Map<String, Object> toolTelemetry;

    public static ToolResult success(String text) {
        return ToolResult.builder().textResultForLlm(text).build();
    }

    public static ToolResult failure(String error) {
        return ToolResult.builder()
                .textResultForLlm("Invoking this tool produced an error. Detailed information is not available.")
                .resultType(ToolResultType.FAILURE)
                .error(error)
                .build();
    }

    public static ToolResult rejected(String error) {
        return ToolResult.builder()
                .textResultForLlm(error)
                .resultType(ToolResultType.REJECTED)
                .error(error)
                .build();
    }
}
