package io.agentmail.storage;

import io.agentmail.model.FileReservation;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class ReservationStore {
    private static final String COLUMNS =
            "id,project_id,agent_id,path_pattern,exclusive,reason,created_ts,expires_ts,released_ts";

    public FileReservation insert(Connection c, long projectId, long agentId, String pathPattern, boolean exclusive,
                                  String reason, long createdTs, long expiresTs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO file_reservations(project_id,agent_id,path_pattern,exclusive,reason,created_ts,expires_ts)
                VALUES(?,?,?,?,?,?,?)
                """)) {
            ps.setLong(1, projectId);
            ps.setLong(2, agentId);
            ps.setString(3, pathPattern);
            ps.setInt(4, exclusive ? 1 : 0);
            ps.setString(5, reason);
            ps.setLong(6, createdTs);
            ps.setLong(7, expiresTs);
            ps.executeUpdate();
        }
        return new FileReservation(Rows.lastInsertId(c), projectId, agentId, pathPattern, exclusive, reason,
                createdTs, expiresTs, null);
    }

    public Optional<FileReservation> find(Connection c, long reservationId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM file_reservations WHERE id=?")) {
            ps.setLong(1, reservationId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Unreleased, unexpired reservations of a project at {@code nowMs}, oldest first.
     */
    public List<FileReservation> listActive(Connection c, long projectId, long nowMs) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM file_reservations "
                + "WHERE project_id=? AND released_ts IS NULL AND expires_ts>? ORDER BY created_ts, id";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, projectId);
            ps.setLong(2, nowMs);
            return collect(ps);
        }
    }

    public List<FileReservation> listForAgent(Connection c, long agentId, boolean includeInactive, long nowMs) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM file_reservations WHERE agent_id=?"
                + (includeInactive ? "" : " AND released_ts IS NULL AND expires_ts>?")
                + " ORDER BY created_ts, id";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, agentId);
            if (!includeInactive) {
                ps.setLong(2, nowMs);
            }
            return collect(ps);
        }
    }

    /**
     * Sets {@code released_ts} only when it is still null.
     *
     * @return true when this call released the row
     */
    public boolean markReleased(Connection c, long reservationId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE file_reservations SET released_ts=? WHERE id=? AND released_ts IS NULL")) {
            ps.setLong(1, nowMs);
            ps.setLong(2, reservationId);
            return ps.executeUpdate() > 0;
        }
    }

    public int releaseAllActiveForAgent(Connection c, long agentId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE file_reservations SET released_ts=? WHERE agent_id=? AND released_ts IS NULL AND expires_ts>?")) {
            ps.setLong(1, nowMs);
            ps.setLong(2, agentId);
            ps.setLong(3, nowMs);
            return ps.executeUpdate();
        }
    }

    /**
     * Deletes rows that stopped being active before {@code cutoffMs}.
     */
    public int deleteInactiveBefore(Connection c, long cutoffMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                DELETE FROM file_reservations
                WHERE (released_ts IS NOT NULL AND released_ts<?)
                   OR (released_ts IS NULL AND expires_ts<?)
                """)) {
            ps.setLong(1, cutoffMs);
            ps.setLong(2, cutoffMs);
            return ps.executeUpdate();
        }
    }

    private static List<FileReservation> collect(PreparedStatement ps) throws SQLException {
        List<FileReservation> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
        }
        return out;
    }

    private static FileReservation map(ResultSet rs) throws SQLException {
        return new FileReservation(
                rs.getLong("id"),
                rs.getLong("project_id"),
                rs.getLong("agent_id"),
                rs.getString("path_pattern"),
                rs.getInt("exclusive") == 1,
                rs.getString("reason"),
                rs.getLong("created_ts"),
                rs.getLong("expires_ts"),
                Rows.nullableLong(rs, "released_ts")
        );
    }
}
