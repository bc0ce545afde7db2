package com.github.copilot.sdk.client;

import com.github.copilot.sdk.exceptions.ConfigurationException;
import com.github.copilot.sdk.types.options.CopilotClientOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientOptionsValidatorTest {

    @Test
    void defaultsAreValid() {
        assertThatCode(() -> ClientOptionsValidator.validate(CopilotClientOptions.builder().build()))
                .doesNotThrowAnyException();
    }

    @Test
    void cliUrlExcludesSpawnOptions() {
        assertInvalid(CopilotClientOptions.builder().cliUrl("localhost:8080").useStdio(true).build(),
                "cliUrl is mutually exclusive with useStdio and cliPath");
        assertInvalid(CopilotClientOptions.builder().cliUrl("8080").cliPath("/usr/bin/copilot").build(),
                "cliUrl is mutually exclusive with useStdio and cliPath");
    }

    @Test
    void cliUrlExcludesAuthOptions() {
        assertInvalid(CopilotClientOptions.builder().cliUrl("8080").githubToken("ghp_x").build(),
                "external server manages its own auth");
        assertInvalid(CopilotClientOptions.builder().cliUrl("8080").useLoggedInUser(false).build(),
                "external server manages its own auth");
    }

    @Test
    void cliUrlWithUseStdioFalseIsAllowed() {
        assertThatCode(() -> ClientOptionsValidator.validate(
                CopilotClientOptions.builder().cliUrl("http://localhost:8080").useStdio(false).build()))
                .doesNotThrowAnyException();
    }

    @Test
    void malformedCliUrl() {
        assertInvalid(CopilotClientOptions.builder().cliUrl("localhost").build(), "Invalid cliUrl format");
    }

    @Test
    void rangeChecks() {
        assertInvalid(CopilotClientOptions.builder().port(-1).build(), "port must be between 0 and 65535");
        assertInvalid(CopilotClientOptions.builder().requestTimeout(Duration.ZERO).build(),
                "requestTimeout must be positive");
        assertInvalid(CopilotClientOptions.builder().healthCheckInterval(Duration.ofSeconds(-1)).build(),
                "healthCheckInterval must not be negative");
        assertInvalid(CopilotClientOptions.builder().maxRestartAttempts(-1).build(),
                "maxRestartAttempts must not be negative");
        assertInvalid(CopilotClientOptions.builder().maxConsecutiveDecodeFailures(0).build(),
                "maxConsecutiveDecodeFailures must be at least 1");
    }

    @Test
    void clientConstructorValidates() {
        assertThatThrownBy(() -> new CopilotClient(CopilotClientOptions.builder()
                .cliUrl("localhost:8080")
                .githubToken("ghp_x")
                .build()))
                .isInstanceOf(ConfigurationException.class);
    }

    private static void assertInvalid(CopilotClientOptions options, String message) {
        assertThatThrownBy(() -> ClientOptionsValidator.validate(options))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining(message);
    }
}
