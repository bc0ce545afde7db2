package com.github.copilot.sdk.transport;

import com.github.copilot.sdk.types.options.CopilotClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Spawns the CLI server and exchanges frames over its stdin/stdout.
 */
public class StdioTransport extends AbstractFramedTransport {

    private static final Logger logger = LoggerFactory.getLogger(StdioTransport.class);

    private final CliProcessLauncher launcher;
    private volatile Process process;

    public StdioTransport(CopilotClientOptions options) {
        this(new CliProcessLauncher(options));
    }

    public StdioTransport(CliProcessLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    public CompletableFuture<Void> connect() {
        return CompletableFuture.runAsync(() -> {
            process = launcher.start(true);
            attachStreams(process.getInputStream(), process.getOutputStream());
            logger.debug("Stdio transport connected to pid {}", process.pid());
        });
    }

    @Override
    public boolean ownsServer() {
        return true;
    }

    @Override
    public String describe() {
        Process p = process;
        return p != null ? "stdio:pid " + p.pid() : "stdio";
    }

    @Override
    protected void releaseResources() {
        CliProcessLauncher.terminate(process);
    }
}
