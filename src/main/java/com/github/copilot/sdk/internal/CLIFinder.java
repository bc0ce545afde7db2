package com.github.copilot.sdk.internal;

import com.github.copilot.sdk.exceptions.CLINotFoundException;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Locates the Copilot CLI executable when no explicit path is configured.
 */
public final class CLIFinder {

    public static final String CLI_PATH_ENV = "COPILOT_CLI_PATH";
    private static final String CLI_NAME = "copilot";

    private CLIFinder() {
    }

    public static String findCLI() {
        return findCLI(System.getenv(), System.getProperty("user.home"));
    }

    /**
     * Resolution order: {@code COPILOT_CLI_PATH}, then {@code copilot} on {@code PATH},
     * then the usual npm install locations.
     */
    static String findCLI(Map<String, String> env, String homeDir) {
        String explicit = env.get(CLI_PATH_ENV);
        if (explicit != null && !explicit.isBlank()) {
            if (!Files.exists(Paths.get(explicit))) {
                throw new CLINotFoundException(explicit);
            }
            return explicit;
        }

        String pathVar = env.get("PATH");
        if (pathVar != null) {
            for (String dir : pathVar.split(File.pathSeparator)) {
                if (dir.isEmpty()) {
                    continue;
                }
                for (String name : candidateNames()) {
                    Path candidate = Paths.get(dir, name);
                    if (isExecutable(candidate)) {
                        return candidate.toString();
                    }
                }
            }
        }

        String[] possiblePaths = {
                homeDir + "/.npm-global/bin/copilot",
                "/usr/local/bin/copilot",
                homeDir + "/.local/bin/copilot",
                homeDir + "/node_modules/.bin/copilot"
        };
        for (String path : possiblePaths) {
            if (isExecutable(Paths.get(path))) {
                return path;
            }
        }

        throw new CLINotFoundException(null);
    }

    private static List<String> candidateNames() {
        List<String> names = new ArrayList<>();
        names.add(CLI_NAME);
        if (System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win")) {
            names.add(CLI_NAME + ".cmd");
            names.add(CLI_NAME + ".exe");
        }
        return names;
    }

    private static boolean isExecutable(Path p) {
        return Files.isRegularFile(p) && Files.isExecutable(p);
    }
}
