package com.github.copilot.sdk.transport;

import com.github.copilot.sdk.exceptions.CLIConnectionException;
import com.github.copilot.sdk.exceptions.ProcessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exchanges frames with the CLI server over TCP. Either attaches to a server that is
 * already running, or spawns one in port mode and connects once it reports its port.
 */
public class SocketTransport extends AbstractFramedTransport {

    private static final Logger logger = LoggerFactory.getLogger(SocketTransport.class);
    private static final Pattern LISTENING_PATTERN = Pattern.compile("listening on port (\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration PORT_ANNOUNCE_TIMEOUT = Duration.ofSeconds(10);

    @Nullable
    private final CliProcessLauncher launcher;
    private volatile ServerAddress address;
    private volatile Socket socket;
    private volatile Process process;

    private SocketTransport(@Nullable ServerAddress address, @Nullable CliProcessLauncher launcher) {
        this.address = address;
        this.launcher = launcher;
    }

    /**
     * Transport for a server this client does not own.
     */
    public static SocketTransport attach(ServerAddress address) {
        return new SocketTransport(address, null);
    }

    /**
     * Transport that spawns the server in TCP mode and owns its process.
     */
    public static SocketTransport spawn(CliProcessLauncher launcher) {
        return new SocketTransport(null, launcher);
    }

    @Override
    public CompletableFuture<Void> connect() {
        return CompletableFuture.runAsync(() -> {
            if (launcher != null) {
                process = launcher.start(false);
                address = new ServerAddress(ServerAddress.DEFAULT_HOST, awaitAnnouncedPort(process));
            }
            try {
                Socket s = new Socket();
                s.connect(new InetSocketAddress(address.getHost(), address.getPort()), (int) CONNECT_TIMEOUT.toMillis());
                s.setTcpNoDelay(true);
                socket = s;
                attachStreams(s.getInputStream(), s.getOutputStream());
                logger.info("Connected to Copilot CLI at {}", address);
            } catch (IOException e) {
                CliProcessLauncher.terminate(process);
                throw new CLIConnectionException("Failed to connect to Copilot CLI at " + address, e);
            }
        });
    }

    private int awaitAnnouncedPort(Process spawned) {
        CompletableFuture<Integer> announced = new CompletableFuture<>();
        Thread stdoutThread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(spawned.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (!announced.isDone()) {
                        Matcher matcher = LISTENING_PATTERN.matcher(line);
                        if (matcher.find()) {
                            announced.complete(Integer.parseInt(matcher.group(1)));
                            continue;
                        }
                    }
                    logger.debug("CLI stdout: {}", line);
                }
            } catch (IOException e) {
                logger.debug("CLI stdout closed: {}", e.getMessage());
            } finally {
                announced.completeExceptionally(new ProcessException(
                        "Copilot CLI exited before reporting its port",
                        spawned.isAlive() ? null : spawned.exitValue(),
                        launcher.stderrTail()));
            }
        }, "copilot-cli-stdout");
        stdoutThread.setDaemon(true);
        stdoutThread.start();

        try {
            return announced.get(PORT_ANNOUNCE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            CliProcessLauncher.terminate(spawned);
            throw new ProcessException("Timed out waiting for Copilot CLI to report its port", null, launcher.stderrTail());
        } catch (ExecutionException e) {
            CliProcessLauncher.terminate(spawned);
            if (e.getCause() instanceof ProcessException) {
                throw (ProcessException) e.getCause();
            }
            throw new CLIConnectionException("Failed to start Copilot CLI", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CliProcessLauncher.terminate(spawned);
            throw new CLIConnectionException("Interrupted while starting Copilot CLI", e);
        }
    }

    @Override
    public boolean ownsServer() {
        return launcher != null;
    }

    @Override
    public String describe() {
        ServerAddress a = address;
        return a != null ? "tcp:" + a : "tcp";
    }

    @Override
    protected void releaseResources() {
        Socket s = socket;
        if (s != null && !s.isClosed()) {
            try {
                s.close();
            } catch (IOException e) {
                logger.warn("Error closing socket to {}", address, e);
            }
        }
        CliProcessLauncher.terminate(process);
    }
}
