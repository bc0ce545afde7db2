package com.github.copilot.sdk.types.responses;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.annotation.Nullable;

/**
 * Summary of a persisted session, as returned by {@code session.list}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionMetadata {
    private String sessionId;
    private String startTime;
    private String modifiedTime;
    @Nullable
    private String summary;
    @JsonProperty("isRemote")
    private boolean remote;
}
