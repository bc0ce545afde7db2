package com.github.copilot.sdk.types.responses;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.annotation.Nullable;
import java.util.List;

/**
 * A model offered by the server, as returned by {@code models.list}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelInfo {
    private String id;
    private String name;
    private Capabilities capabilities;
    @Nullable
    private Policy policy;
    @Nullable
    private Billing billing;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Capabilities {
        private Supports supports;
        private Limits limits;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Supports {
        private boolean vision;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Limits {
        @JsonProperty("max_prompt_tokens")
        @Nullable
        private Integer maxPromptTokens;
        @JsonProperty("max_context_window_tokens")
        @Nullable
        private Integer maxContextWindowTokens;
        @Nullable
        private VisionLimits vision;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VisionLimits {
        @JsonProperty("supported_media_types")
        @Nullable
        private List<String> supportedMediaTypes;
        @JsonProperty("max_prompt_images")
        @Nullable
        private Integer maxPromptImages;
        @JsonProperty("max_prompt_image_size")
        @Nullable
        private Integer maxPromptImageSize;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Policy {
        /**
         * {@code enabled}, {@code disabled} or {@code unconfigured}.
         */
        private String state;
        private String terms;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Billing {
        private double multiplier;
    }
}
