package io.reminor.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".reminor", "config.json");
    }

    public static Path resolveDataDir(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".reminor", "journal");
        }
        return expandHome(rawPath);
    }

    /** Resolves a leading {@code ~/} against the user's home directory. */
    public static Path expandHome(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
