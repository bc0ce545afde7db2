package com.github.copilot.sdk.transport;

import com.github.copilot.sdk.exceptions.ConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Host and port of an existing CLI server.
 */
@Data
@AllArgsConstructor
public final class ServerAddress {

    public static final String DEFAULT_HOST = "localhost";

    private final String host;
    private final int port;

    /**
     * Parse {@code "8080"}, {@code "host:8080"} or {@code "http://host:8080"}.
     *
     * @throws ConfigurationException if the value is not one of those forms or the port is out of range
     */
    public static ServerAddress parse(String url) {
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("Invalid cliUrl format: cliUrl is empty");
        }
        String value = url.trim();
        int schemeEnd = value.indexOf("://");
        if (schemeEnd >= 0) {
            value = value.substring(schemeEnd + 3);
        }
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }

        String host;
        String portText;
        int colon = value.lastIndexOf(':');
        if (colon >= 0) {
            host = value.substring(0, colon);
            portText = value.substring(colon + 1);
            if (host.isEmpty()) {
                host = DEFAULT_HOST;
            }
        } else if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            host = DEFAULT_HOST;
            portText = value;
        } else {
            throw new ConfigurationException("Invalid cliUrl format: " + url
                    + ". Expected \"host:port\", \"http://host:port\", or \"port\"");
        }

        int port;
        try {
            port = Integer.parseInt(portText);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid port in cliUrl: " + url);
        }
        if (port <= 0 || port > 65535) {
            throw new ConfigurationException("Invalid port in cliUrl: " + url);
        }
        return new ServerAddress(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
