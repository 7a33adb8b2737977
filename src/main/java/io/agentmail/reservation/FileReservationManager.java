package io.agentmail.reservation;

import io.agentmail.config.CoordinationSettings;
import io.agentmail.error.CoordinationException;
import io.agentmail.model.Agent;
import io.agentmail.model.FileReservation;
import io.agentmail.storage.Database;
import io.agentmail.storage.DirectoryStore;
import io.agentmail.storage.ReservationStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Grants, checks and releases path-pattern claims within a project.
 *
 * <p>Expiry is lazy: a reservation whose {@code expires_ts} has passed is simply ignored by every
 * query. Conflict checking and the insert run in one {@code IMMEDIATE} transaction, so two
 * concurrent requests for overlapping patterns cannot both see a free path.
 */
public final class FileReservationManager {
    public static final int MAX_PATTERN_LENGTH = 512;
    public static final int MAX_REASON_LENGTH = 512;

    private final Database database;
    private final DirectoryStore directoryStore;
    private final ReservationStore reservationStore;
    private final CoordinationSettings settings;

    public FileReservationManager(Database database, DirectoryStore directoryStore, ReservationStore reservationStore,
                                  CoordinationSettings settings) {
        this.database = database;
        this.directoryStore = directoryStore;
        this.reservationStore = reservationStore;
        this.settings = settings;
    }

    public ReservationGrant reserve(long agentId, long projectId, String pathPattern, boolean exclusive, long ttlMs,
                                    String reason, long nowMs) {
        String pattern = validatePattern(pathPattern);
        if (ttlMs <= 0L) {
            throw CoordinationException.validation("ttl must be positive, got " + ttlMs);
        }
        if (ttlMs > settings.maxReservationTtlMs()) {
            throw CoordinationException.validation(
                    "ttl " + ttlMs + "ms exceeds maximum " + settings.maxReservationTtlMs() + "ms");
        }
        if (nowMs > Long.MAX_VALUE - ttlMs) {
            throw CoordinationException.validation("ttl " + ttlMs + "ms is out of range");
        }
        String safeReason = reason == null ? "" : reason.trim();
        if (safeReason.length() > MAX_REASON_LENGTH) {
            throw CoordinationException.validation("reason longer than " + MAX_REASON_LENGTH + " characters");
        }
        return database.inTransaction("reserve " + pattern, c -> {
            Agent agent = requireActiveMember(c, agentId, projectId);
            List<FileReservation> conflicts = new ArrayList<>();
            List<FileReservation> ownOverlaps = new ArrayList<>();
            for (FileReservation existing : reservationStore.listActive(c, projectId, nowMs)) {
                if (!PathPatterns.overlaps(existing.pathPattern(), pattern)) {
                    continue;
                }
                if (existing.agentId() == agent.id()) {
                    ownOverlaps.add(existing);
                } else if (exclusive || existing.exclusive()) {
                    conflicts.add(existing);
                }
            }
            if (!conflicts.isEmpty()) {
                return ReservationGrant.conflict(conflicts);
            }
            FileReservation created = reservationStore.insert(
                    c, projectId, agent.id(), pattern, exclusive, safeReason, nowMs, nowMs + ttlMs);
            directoryStore.touchAgent(c, agent.id(), nowMs);
            return ReservationGrant.granted(created, ownOverlaps);
        });
    }

    public ReleaseOutcome release(long reservationId, long agentId, long nowMs) {
        return database.inTransaction("release reservation " + reservationId, c -> {
            FileReservation reservation = reservationStore.find(c, reservationId).orElse(null);
            if (reservation == null) {
                return ReleaseOutcome.notFound();
            }
            if (reservation.agentId() != agentId) {
                return ReleaseOutcome.notOwner(reservation);
            }
            if (!reservationStore.markReleased(c, reservationId, nowMs)) {
                return ReleaseOutcome.alreadyReleased(reservation);
            }
            directoryStore.touchAgent(c, agentId, nowMs);
            FileReservation released = reservationStore.find(c, reservationId).orElse(reservation);
            return ReleaseOutcome.released(released);
        });
    }

    /**
     * Active reservations in a project; with a pattern, only those overlapping it.
     */
    public List<FileReservation> listActive(long projectId, String pathPattern, long nowMs) {
        String filter = pathPattern == null || pathPattern.isBlank() ? null : validatePattern(pathPattern);
        return database.read("list active reservations", c -> {
            List<FileReservation> active = reservationStore.listActive(c, projectId, nowMs);
            if (filter == null) {
                return active;
            }
            List<FileReservation> out = new ArrayList<>();
            for (FileReservation r : active) {
                if (PathPatterns.overlaps(r.pathPattern(), filter)) {
                    out.add(r);
                }
            }
            return out;
        });
    }

    public List<FileReservation> listForAgent(long agentId, boolean includeInactive, long nowMs) {
        return database.read("list agent reservations",
                c -> reservationStore.listForAgent(c, agentId, includeInactive, nowMs));
    }

    /**
     * Deletes reservations that have been released or expired for longer than the retention window.
     * Active reservations are never touched.
     */
    public int compact(long retentionMs, long nowMs) {
        long cutoff = nowMs - Math.max(0L, retentionMs);
        return database.inTransaction("compact reservations", c -> reservationStore.deleteInactiveBefore(c, cutoff));
    }

    private Agent requireActiveMember(Connection c, long agentId, long projectId) throws SQLException {
        Agent agent = directoryStore.findAgent(c, agentId)
                .orElseThrow(() -> CoordinationException.unknownAgent(agentId));
        if (!agent.isActive()) {
            throw CoordinationException.inactiveAgent(agent.name());
        }
        if (agent.projectId() != projectId) {
            throw CoordinationException.unknownAgent(agent.name() + " in project " + projectId);
        }
        return agent;
    }

    private static String validatePattern(String raw) {
        String pattern = PathPatterns.normalize(raw);
        if (pattern.isEmpty()) {
            throw CoordinationException.validation("path pattern must not be empty");
        }
        if (pattern.length() > MAX_PATTERN_LENGTH) {
            throw CoordinationException.validation("path pattern longer than " + MAX_PATTERN_LENGTH + " characters");
        }
        return pattern;
    }
}
