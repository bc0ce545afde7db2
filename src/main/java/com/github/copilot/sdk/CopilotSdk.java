package com.github.copilot.sdk;

import com.github.copilot.sdk.client.CopilotClient;
import com.github.copilot.sdk.session.CopilotSession;
import com.github.copilot.sdk.types.events.SessionEvent;
import com.github.copilot.sdk.types.options.CopilotClientOptions;
import com.github.copilot.sdk.types.options.MessageOptions;
import com.github.copilot.sdk.types.options.SessionConfig;

import javax.annotation.Nullable;
import java.time.Duration;

/**
 * Main entry point for the Copilot SDK.
 * <p>
 * Provides static helpers for one-shot prompts. For anything longer-lived use
 * {@link CopilotClient} directly.
 * <p>
 * Example:
 * <pre>{@code
 * String answer = CopilotSdk.ask("What is 2 + 2?");
 *
 * String review = CopilotSdk.ask("Review this diff",
 *     CopilotClientOptions.builder().cwd(Paths.get("/work/repo")).build(),
 *     SessionConfig.builder().model("claude-sonnet-4.5").build());
 * }</pre>
 */
public final class CopilotSdk {

    public static final String VERSION = "0.1.0";

    /**
     * Protocol version this SDK speaks; checked against the server's ping response.
     */
    public static final int PROTOCOL_VERSION = 2;

    private static final Duration DEFAULT_ASK_TIMEOUT = Duration.ofMinutes(5);

    private CopilotSdk() {
    }

    /**
     * Send one prompt in a fresh session with default options.
     *
     * @return the final assistant message, or {@code null} if the server sent none
     */
    @Nullable
    public static String ask(String prompt) {
        return ask(prompt, CopilotClientOptions.builder().build(), SessionConfig.builder().build());
    }

    /**
     * Start a client, send one prompt, wait for the session to go idle and shut everything down.
     */
    @Nullable
    public static String ask(String prompt, CopilotClientOptions options, SessionConfig config) {
        try (CopilotClient client = new CopilotClient(options)) {
            return ask(client, prompt, config);
        }
    }

    /**
     * Send one prompt in a fresh session on an existing client.
     */
    @Nullable
    public static String ask(CopilotClient client, String prompt, SessionConfig config) {
        try (CopilotSession session = client.createSession(config).join()) {
            SessionEvent reply = session.sendAndWait(MessageOptions.of(prompt), DEFAULT_ASK_TIMEOUT).join();
            return reply != null ? reply.getDataText("content") : null;
        }
    }
}
