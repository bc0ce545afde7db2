package com.github.copilot.sdk.exceptions;

import javax.annotation.Nullable;

/**
 * Raised when the spawned CLI process exits or misbehaves during startup.
 */
public class ProcessException extends CLIConnectionException {

    @Nullable
    private final Integer exitCode;
    @Nullable
    private final String stderr;

    public ProcessException(String message, @Nullable Integer exitCode, @Nullable String stderr) {
        super(buildMessage(message, exitCode, stderr));
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    @Nullable
    public Integer getExitCode() {
        return exitCode;
    }

    @Nullable
    public String getStderr() {
        return stderr;
    }

    private static String buildMessage(String message, @Nullable Integer exitCode, @Nullable String stderr) {
        StringBuilder sb = new StringBuilder(message);
        if (exitCode != null) {
            sb.append(" (exit code ").append(exitCode).append(')');
        }
        if (stderr != null && !stderr.isBlank()) {
            sb.append(": ").append(stderr.trim());
        }
        return sb.toString();
    }
}
