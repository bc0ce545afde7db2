package com.github.copilot.sdk.types.responses;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.annotation.Nullable;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GetAuthStatusResponse {
    @JsonProperty("isAuthenticated")
    private boolean authenticated;
    @Nullable
    private String authType;
    @Nullable
    private String host;
    @Nullable
    private String login;
    @Nullable
    private String statusMessage;
}
