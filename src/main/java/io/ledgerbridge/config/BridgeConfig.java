package io.ledgerbridge.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Filesystem layout of one engine data root.
 */
public final class BridgeConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "ledgerbridge-settings.json";

    private final Path rootDir;

    public BridgeConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static BridgeConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new BridgeConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("ledgerbridge.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
