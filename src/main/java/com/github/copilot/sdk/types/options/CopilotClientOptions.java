package com.github.copilot.sdk.types.options;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Configuration options for {@link com.github.copilot.sdk.client.CopilotClient}.
 * Use {@link #builder()} to create instances.
 *
 * <p>Exactly one startup mode applies: spawn the CLI and talk over stdio (the default),
 * spawn the CLI in TCP mode ({@code useStdio(false)}), or attach to an already running
 * server ({@code cliUrl}). Conflicting combinations are rejected when the client is created.
 */
@Getter
@Builder(toBuilder = true)
public class CopilotClientOptions {

    /**
     * Path to the CLI executable. A {@code .js} path is launched through {@code node}.
     */
    @Nullable
    private final String cliPath;

    /**
     * Extra arguments placed before the SDK-managed ones.
     */
    @Singular
    private final List<String> cliArgs;

    @Nullable
    private final Path cwd;

    /**
     * Port for a spawned TCP-mode server; 0 lets the CLI pick one.
     */
    @Builder.Default
    private final int port = 0;

    /**
     * Stdio transport for a spawned server. {@code null} means "true unless cliUrl is set".
     */
    @Nullable
    private final Boolean useStdio;

    /**
     * Address of an existing server: {@code "port"}, {@code "host:port"} or {@code "http://host:port"}.
     */
    @Nullable
    private final String cliUrl;

    @Builder.Default
    private final LogLevel logLevel = LogLevel.INFO;

    @Builder.Default
    private final boolean autoStart = true;

    @Builder.Default
    private final boolean autoRestart = true;

    @Singular("envVar")
    private final Map<String, String> env;

    @Nullable
    private final String githubToken;

    @Nullable
    private final Boolean useLoggedInUser;

    @Builder.Default
    private final Duration requestTimeout = Duration.ofMinutes(5);

    @Builder.Default
    private final Duration pingTimeout = Duration.ofSeconds(10);

    /**
     * Interval between health pings; {@link Duration#ZERO} disables health checking.
     */
    @Builder.Default
    private final Duration healthCheckInterval = Duration.ofSeconds(30);

    @Builder.Default
    private final int maxRestartAttempts = 3;

    @Builder.Default
    private final Duration restartBackoff = Duration.ofMillis(500);

    @Builder.Default
    private final int maxConsecutiveDecodeFailures = 5;

    @Nullable
    private final Consumer<String> stderr;

    /**
     * Whether the client should spawn and talk over stdio, resolving the {@code null} default.
     */
    public boolean isStdioMode() {
        if (cliUrl != null) {
            return false;
        }
        return useStdio == null || useStdio;
    }

    /**
     * Whether the client attaches to a server it does not own.
     */
    public boolean isExternalServer() {
        return cliUrl != null;
    }

    /**
     * Effective logged-in-user flag: defaults to {@code false} when a token is supplied.
     */
    public boolean isLoggedInUserEnabled() {
        if (useLoggedInUser != null) {
            return useLoggedInUser;
        }
        return githubToken == null;
    }
}
