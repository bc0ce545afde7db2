package com.github.copilot.sdk.transport;

import com.github.copilot.sdk.types.options.CopilotClientOptions;
import com.github.copilot.sdk.types.options.LogLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CliProcessLauncherTest {

    @Test
    void stdioCommandWithDefaults() {
        CliProcessLauncher launcher = new CliProcessLauncher(CopilotClientOptions.builder().build());

        List<String> command = launcher.buildCommand("/usr/bin/copilot", true);

        assertThat(command).containsExactly("/usr/bin/copilot", "--server", "--log-level", "info", "--stdio");
    }

    @Test
    void javascriptEntryPointRunsThroughNode() {
        CliProcessLauncher launcher = new CliProcessLauncher(CopilotClientOptions.builder().build());

        assertThat(launcher.buildCommand("/opt/copilot/index.js", true))
                .startsWith("node", "/opt/copilot/index.js");
    }

    @Test
    void tcpModeWithFixedPortAndExtraArgs() {
        CopilotClientOptions options = CopilotClientOptions.builder()
                .useStdio(false)
                .port(4100)
                .cliArg("--experimental")
                .logLevel(LogLevel.DEBUG)
                .build();

        List<String> command = new CliProcessLauncher(options).buildCommand("copilot", false);

        assertThat(command).containsExactly("copilot", "--experimental", "--server", "--log-level", "debug",
                "--port", "4100");
    }

    @Test
    void tcpModeWithoutPortLetsCliChoose() {
        CopilotClientOptions options = CopilotClientOptions.builder().useStdio(false).build();

        assertThat(new CliProcessLauncher(options).buildCommand("copilot", false))
                .doesNotContain("--port", "--stdio");
    }

    @Test
    void tokenIsPassedThroughEnvironmentNotArguments() {
        CopilotClientOptions options = CopilotClientOptions.builder().githubToken("ghp_secret").build();

        List<String> command = new CliProcessLauncher(options).buildCommand("copilot", true);

        assertThat(command).contains("--auth-token-env", CliProcessLauncher.AUTH_TOKEN_ENV, "--no-auto-login");
        assertThat(command).doesNotContain("ghp_secret");
    }

    @Test
    void tokenWithLoggedInUserKeepsAutoLogin() {
        CopilotClientOptions options = CopilotClientOptions.builder()
                .githubToken("ghp_secret")
                .useLoggedInUser(true)
                .build();

        assertThat(new CliProcessLauncher(options).buildCommand("copilot", true)).doesNotContain("--no-auto-login");
    }
}
