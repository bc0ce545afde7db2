package com.github.copilot.sdk.types.tools;

import lombok.Builder;
import lombok.Getter;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/**
 * Definition of a caller-implemented tool exposed to the server.
 */
@Getter
@Builder
public class Tool {

    private final String name;
    @Nullable
    private final String description;

    /**
     * JSON schema describing the arguments.
     */
    @Nullable
    private final Map<String, Object> parameters;

    private final ToolHandler handler;

    /**
     * Wire form sent in session create/resume payloads. The handler stays client-side.
     */
    public Map<String, Object> toDefinition() {
        Map<String, Object> definition = new HashMap<>();
        definition.put("name", name);
        if (description != null) {
            definition.put("description", description);
        }
        if (parameters != null && !parameters.isEmpty()) {
            definition.put("parameters", parameters);
        }
        return definition;
    }
}
