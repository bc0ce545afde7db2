package com.github.copilot.sdk.protocol;

import lombok.Data;

@Data
public final class PendingKey {
    private final Direction direction;
    private final String id;
}
