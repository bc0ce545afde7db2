package com.github.copilot.sdk.types.permissions;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Collections;
import java.util.List;

/**
 * Answer to a permission request.
 */
@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class PermissionRequestResult {

    @JsonProperty("kind")
    private final PermissionResultKind kind;

    @JsonProperty("rules")
    private final List<Object> rules;

    public static PermissionRequestResult approved() {
        return new PermissionRequestResult(PermissionResultKind.APPROVED, Collections.emptyList());
    }

    public static PermissionRequestResult deniedByRules(List<Object> rules) {
        return new PermissionRequestResult(PermissionResultKind.DENIED_BY_RULES, rules);
    }

    public static PermissionRequestResult deniedInteractively() {
        return new PermissionRequestResult(PermissionResultKind.DENIED_INTERACTIVELY_BY_USER, Collections.emptyList());
    }

    /**
     * Outcome used when no handler is registered or the handler fails.
     */
    public static PermissionRequestResult deniedNoApprovalRule() {
        return new PermissionRequestResult(
                PermissionResultKind.DENIED_NO_APPROVAL_RULE_AND_COULD_NOT_REQUEST_FROM_USER,
                Collections.emptyList()
        );
    }
}
