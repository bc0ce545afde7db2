package com.github.copilot.sdk.exceptions;

import javax.annotation.Nullable;

/**
 * Raised when the Copilot CLI executable cannot be located.
 */
public class CLINotFoundException extends CLIConnectionException {

    @Nullable
    private final String cliPath;

    public CLINotFoundException(@Nullable String cliPath) {
        super(cliPath != null
                ? "Copilot CLI not found at: " + cliPath
                : "Copilot CLI not found. Install it or set cliPath / COPILOT_CLI_PATH.");
        this.cliPath = cliPath;
    }

    public CLINotFoundException(String message, Throwable cause) {
        super(message, cause);
        this.cliPath = null;
    }

    @Nullable
    public String getCliPath() {
        return cliPath;
    }
}
