package com.github.copilot.sdk.types.options;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import javax.annotation.Nullable;

/**
 * A file or directory attached to a prompt. The path is not checked client-side.
 */
@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Attachment {

    @JsonProperty("type")
    private final AttachmentType type;

    @JsonProperty("path")
    private final String path;

    @JsonProperty("displayName")
    @Nullable
    private final String displayName;

    public static Attachment file(String path) {
        return new Attachment(AttachmentType.FILE, path, null);
    }

    public static Attachment directory(String path) {
        return new Attachment(AttachmentType.DIRECTORY, path, null);
    }
}
