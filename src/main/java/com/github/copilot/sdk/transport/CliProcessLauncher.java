package com.github.copilot.sdk.transport;

import com.github.copilot.sdk.exceptions.CLIConnectionException;
import com.github.copilot.sdk.internal.CLIFinder;
import com.github.copilot.sdk.types.options.CopilotClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Builds the CLI server command line and environment, starts the process and
 * pumps its stderr.
 */
public class CliProcessLauncher {

    private static final Logger logger = LoggerFactory.getLogger(CliProcessLauncher.class);

    public static final String AUTH_TOKEN_ENV = "COPILOT_SDK_AUTH_TOKEN";
    private static final int STDERR_TAIL_LINES = 20;

    private final CopilotClientOptions options;
    private final Consumer<String> stderrConsumer;
    private final Deque<String> stderrTail = new ArrayDeque<>();

    public CliProcessLauncher(CopilotClientOptions options) {
        this.options = options;
        this.stderrConsumer = options.getStderr();
    }

    /**
     * Build the full command for the requested mode.
     *
     * @param cliPath resolved executable
     * @param stdio   {@code true} for {@code --stdio}, {@code false} for {@code --port}
     */
    public List<String> buildCommand(String cliPath, boolean stdio) {
        List<String> cmd = new ArrayList<>();
        if (cliPath.endsWith(".js")) {
            cmd.add("node");
        }
        cmd.add(cliPath);
        cmd.addAll(options.getCliArgs());
        cmd.add("--server");
        cmd.add("--log-level");
        cmd.add(options.getLogLevel().getValue());

        if (stdio) {
            cmd.add("--stdio");
        } else if (options.getPort() > 0) {
            cmd.add("--port");
            cmd.add(Integer.toString(options.getPort()));
        }

        if (options.getGithubToken() != null) {
            cmd.add("--auth-token-env");
            cmd.add(AUTH_TOKEN_ENV);
        }
        if (!options.isLoggedInUserEnabled()) {
            cmd.add("--no-auto-login");
        }
        return cmd;
    }

    /**
     * Start the CLI server process with piped stdio.
     */
    public Process start(boolean stdio) {
        String cliPath = options.getCliPath() != null ? options.getCliPath() : CLIFinder.findCLI();
        List<String> command = buildCommand(cliPath, stdio);
        ProcessBuilder pb = new ProcessBuilder(command);

        Map<String, String> env = pb.environment();
        env.putAll(options.getEnv());
        if (options.getGithubToken() != null) {
            env.put(AUTH_TOKEN_ENV, options.getGithubToken());
        }
        if (options.getCwd() != null) {
            pb.directory(options.getCwd().toFile());
        }

        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        pb.redirectOutput(ProcessBuilder.Redirect.PIPE);
        pb.redirectError(ProcessBuilder.Redirect.PIPE);

        try {
            logger.debug("Starting Copilot CLI: {}", String.join(" ", command));
            Process process = pb.start();
            Thread stderrThread = new Thread(() -> readStderr(process), "copilot-cli-stderr");
            stderrThread.setDaemon(true);
            stderrThread.start();
            logger.info("Copilot CLI started (pid {})", process.pid());
            return process;
        } catch (IOException e) {
            throw new CLIConnectionException("Failed to start Copilot CLI: " + cliPath, e);
        }
    }

    /**
     * Last lines the process wrote to stderr, for error reports.
     */
    public String stderrTail() {
        synchronized (stderrTail) {
            return String.join("\n", stderrTail);
        }
    }

    /**
     * Terminate the process: polite destroy first, forcibly after five seconds.
     */
    public static void terminate(Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        process.destroy();
        try {
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private void readStderr(Process process) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (stderrTail) {
                    stderrTail.addLast(line);
                    if (stderrTail.size() > STDERR_TAIL_LINES) {
                        stderrTail.removeFirst();
                    }
                }
                if (stderrConsumer != null) {
                    stderrConsumer.accept(line);
                } else {
                    logger.debug("CLI stderr: {}", line);
                }
            }
        } catch (IOException e) {
            if (process.isAlive()) {
                logger.error("Error reading CLI stderr", e);
            }
        }
    }
}
