package io.deskrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class DeskRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "deskrelay-settings.json";

    private final Path rootDir;
    private final Path storeFile;

    public DeskRelayConfig(Path rootDir, Path storeFile) {
        this.rootDir = rootDir;
        this.storeFile = storeFile;
    }

    public static DeskRelayConfig fromRoot(String root) {
        return fromRoot(root, null);
    }

    public static DeskRelayConfig fromRoot(String root, String storeFile) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        Path store = storeFile == null || storeFile.isBlank()
                ? base.resolve("deskrelay.db")
                : Paths.get(storeFile).toAbsolutePath().normalize();
        return new DeskRelayConfig(base, store);
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path storeFile() {
        return storeFile;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
