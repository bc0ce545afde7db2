package com.github.copilot.sdk.types.options;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * A prompt to send to a session.
 */
@Getter
@Builder(toBuilder = true)
public class MessageOptions {

    private final String prompt;

    @Singular
    private final List<Attachment> attachments;

    @Builder.Default
    private final MessageMode mode = MessageMode.ENQUEUE;

    public static MessageOptions of(String prompt) {
        return MessageOptions.builder().prompt(prompt).build();
    }
}
