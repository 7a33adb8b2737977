package io.agentmail.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class AgentMailConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "agentmail-settings.json";
    public static final long DEFAULT_RESERVATION_TTL_MS = 60L * 60L * 1000L;
    public static final long DEFAULT_MAX_RESERVATION_TTL_MS = 7L * 24L * 60L * 60L * 1000L;
    public static final long RESERVATION_TTL_CEILING_MS = 365L * 24L * 60L * 60L * 1000L;
    public static final long DEFAULT_RESERVATION_RETENTION_MS = 7L * 24L * 60L * 60L * 1000L;
    public static final int DEFAULT_MAX_RECIPIENTS = 64;
    public static final int DEFAULT_MAX_ATTACHMENTS = 32;
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;

    private final Path rootDir;

    public AgentMailConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static AgentMailConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new AgentMailConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("agentmail.db");
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
