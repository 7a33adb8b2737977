package io.agentmail.storage;

import io.agentmail.model.SiblingStatus;
import io.agentmail.model.SiblingSuggestion;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Project sibling suggestion rows. Callers pass pairs already ordered so {@code projectAId < projectBId}.
 */
public final class SiblingStore {
    private static final String COLUMNS =
            "id,project_a_id,project_b_id,score,status,rationale,created_ts,evaluated_ts,confirmed_ts,dismissed_ts";

    public Optional<SiblingSuggestion> findPair(Connection c, long projectAId, long projectBId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM project_sibling_suggestions WHERE project_a_id=? AND project_b_id=?")) {
            ps.setLong(1, projectAId);
            ps.setLong(2, projectBId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    public Optional<SiblingSuggestion> find(Connection c, long suggestionId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM project_sibling_suggestions WHERE id=?")) {
            ps.setLong(1, suggestionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    public SiblingSuggestion insert(Connection c, long projectAId, long projectBId, double score, String rationale,
                                    long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO project_sibling_suggestions(project_a_id,project_b_id,score,status,rationale,created_ts,evaluated_ts)
                VALUES(?,?,?,?,?,?,?)
                """)) {
            ps.setLong(1, projectAId);
            ps.setLong(2, projectBId);
            ps.setDouble(3, score);
            ps.setString(4, SiblingStatus.SUGGESTED.wireValue());
            ps.setString(5, rationale);
            ps.setLong(6, nowMs);
            ps.setLong(7, nowMs);
            ps.executeUpdate();
        }
        return new SiblingSuggestion(Rows.lastInsertId(c), projectAId, projectBId, score, SiblingStatus.SUGGESTED,
                rationale, nowMs, nowMs, null, null);
    }

    public void refreshEvaluation(Connection c, long suggestionId, double score, String rationale, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE project_sibling_suggestions SET score=?,rationale=?,evaluated_ts=? WHERE id=? AND status=?")) {
            ps.setDouble(1, score);
            ps.setString(2, rationale);
            ps.setLong(3, nowMs);
            ps.setLong(4, suggestionId);
            ps.setString(5, SiblingStatus.SUGGESTED.wireValue());
            ps.executeUpdate();
        }
    }

    public boolean updateStatus(Connection c, long suggestionId, SiblingStatus next, long nowMs) throws SQLException {
        String tsColumn = next == SiblingStatus.CONFIRMED ? "confirmed_ts" : "dismissed_ts";
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE project_sibling_suggestions SET status=?," + tsColumn + "=? WHERE id=? AND status=?")) {
            ps.setString(1, next.wireValue());
            ps.setLong(2, nowMs);
            ps.setLong(3, suggestionId);
            ps.setString(4, SiblingStatus.SUGGESTED.wireValue());
            return ps.executeUpdate() > 0;
        }
    }

    public List<SiblingSuggestion> listForProject(Connection c, long projectId) throws SQLException {
        List<SiblingSuggestion> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM project_sibling_suggestions WHERE project_a_id=? OR project_b_id=? "
                        + "ORDER BY score DESC, id")) {
            ps.setLong(1, projectId);
            ps.setLong(2, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
        }
        return out;
    }

    private static SiblingSuggestion map(ResultSet rs) throws SQLException {
        return new SiblingSuggestion(
                rs.getLong("id"),
                rs.getLong("project_a_id"),
                rs.getLong("project_b_id"),
                rs.getDouble("score"),
                SiblingStatus.fromStored(rs.getString("status")),
                rs.getString("rationale"),
                rs.getLong("created_ts"),
                rs.getLong("evaluated_ts"),
                Rows.nullableLong(rs, "confirmed_ts"),
                Rows.nullableLong(rs, "dismissed_ts")
        );
    }
}
