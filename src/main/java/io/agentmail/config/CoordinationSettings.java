package io.agentmail.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.agentmail.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables read from {@code agentmail-settings.json} in the data root.
 *
 * <p>Every field is optional in the file; missing or out-of-range values fall back to the
 * defaults in {@link AgentMailConfig}.
 */
public record CoordinationSettings(
        long defaultReservationTtlMs,
        long maxReservationTtlMs,
        long reservationRetentionMs,
        int maxRecipients,
        int maxAttachments,
        int busyTimeoutMs
) {
    public static CoordinationSettings defaults() {
        return new CoordinationSettings(
                AgentMailConfig.DEFAULT_RESERVATION_TTL_MS,
                AgentMailConfig.DEFAULT_MAX_RESERVATION_TTL_MS,
                AgentMailConfig.DEFAULT_RESERVATION_RETENTION_MS,
                AgentMailConfig.DEFAULT_MAX_RECIPIENTS,
                AgentMailConfig.DEFAULT_MAX_ATTACHMENTS,
                AgentMailConfig.DEFAULT_BUSY_TIMEOUT_MS
        );
    }

    public static CoordinationSettings load(Path file) {
        CoordinationSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
    }

    static CoordinationSettings fromFile(SettingsFile file, CoordinationSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long maxTtl = Math.min(
                sanitizeLong(file.maxReservationTtlMs(), defaults.maxReservationTtlMs(), 1_000L),
                AgentMailConfig.RESERVATION_TTL_CEILING_MS);
        long defaultTtl = sanitizeLong(file.defaultReservationTtlMs(), defaults.defaultReservationTtlMs(), 1_000L);
        if (defaultTtl > maxTtl) {
            defaultTtl = maxTtl;
        }
        return new CoordinationSettings(
                defaultTtl,
                maxTtl,
                sanitizeLong(file.reservationRetentionMs(), defaults.reservationRetentionMs(), 0L),
                sanitizeInt(file.maxRecipients(), defaults.maxRecipients(), 1),
                sanitizeInt(file.maxAttachments(), defaults.maxAttachments(), 0),
                sanitizeInt(file.busyTimeoutMs(), defaults.busyTimeoutMs(), 0)
        );
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long defaultReservationTtlMs,
            Long maxReservationTtlMs,
            Long reservationRetentionMs,
            Integer maxRecipients,
            Integer maxAttachments,
            Integer busyTimeoutMs
    ) {
    }
}
