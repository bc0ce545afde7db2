package com.github.copilot.sdk.client;

import com.github.copilot.sdk.exceptions.ConfigurationException;
import com.github.copilot.sdk.transport.ServerAddress;
import com.github.copilot.sdk.types.options.CopilotClientOptions;

import java.time.Duration;

/**
 * Rejects conflicting or out-of-range client options before any process or socket is touched.
 */
final class ClientOptionsValidator {

    private ClientOptionsValidator() {
    }

    static void validate(CopilotClientOptions options) {
        if (options.getCliUrl() != null) {
            if (Boolean.TRUE.equals(options.getUseStdio()) || options.getCliPath() != null) {
                throw new ConfigurationException("cliUrl is mutually exclusive with useStdio and cliPath");
            }
            if (options.getGithubToken() != null || options.getUseLoggedInUser() != null) {
                throw new ConfigurationException("githubToken and useLoggedInUser cannot be used with cliUrl "
                        + "(external server manages its own auth)");
            }
            ServerAddress.parse(options.getCliUrl());
        }
        if (options.getPort() < 0 || options.getPort() > 65535) {
            throw new ConfigurationException("port must be between 0 and 65535: " + options.getPort());
        }
        if (options.getLogLevel() == null) {
            throw new ConfigurationException("logLevel must not be null");
        }
        requirePositive("requestTimeout", options.getRequestTimeout());
        requirePositive("pingTimeout", options.getPingTimeout());
        requirePositive("restartBackoff", options.getRestartBackoff());
        if (options.getHealthCheckInterval() == null || options.getHealthCheckInterval().isNegative()) {
            throw new ConfigurationException("healthCheckInterval must not be negative");
        }
        if (options.getMaxRestartAttempts() < 0) {
            throw new ConfigurationException("maxRestartAttempts must not be negative");
        }
        if (options.getMaxConsecutiveDecodeFailures() < 1) {
            throw new ConfigurationException("maxConsecutiveDecodeFailures must be at least 1");
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(name + " must be positive");
        }
    }
}
