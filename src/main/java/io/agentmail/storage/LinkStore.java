package io.agentmail.storage;

import io.agentmail.model.AgentLink;
import io.agentmail.model.LinkStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class LinkStore {
    private static final String COLUMNS =
            "id,a_project_id,a_agent_id,b_project_id,b_agent_id,status,reason,created_ts,updated_ts,expires_ts";

    /**
     * The link in exactly the direction {@code fromAgentId -> toAgentId}.
     */
    public Optional<AgentLink> findDirected(Connection c, long fromAgentId, long toAgentId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM agent_links WHERE a_agent_id=? AND b_agent_id=?")) {
            ps.setLong(1, fromAgentId);
            ps.setLong(2, toAgentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    public Optional<AgentLink> find(Connection c, long linkId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM agent_links WHERE id=?")) {
            ps.setLong(1, linkId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    public AgentLink insertPending(Connection c, long aProjectId, long aAgentId, long bProjectId, long bAgentId,
                                   String reason, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO agent_links(a_project_id,a_agent_id,b_project_id,b_agent_id,status,reason,created_ts,updated_ts)
                VALUES(?,?,?,?,?,?,?,?)
                """)) {
            ps.setLong(1, aProjectId);
            ps.setLong(2, aAgentId);
            ps.setLong(3, bProjectId);
            ps.setLong(4, bAgentId);
            ps.setString(5, LinkStatus.PENDING.wireValue());
            ps.setString(6, reason);
            ps.setLong(7, nowMs);
            ps.setLong(8, nowMs);
            ps.executeUpdate();
        }
        return new AgentLink(Rows.lastInsertId(c), aProjectId, aAgentId, bProjectId, bAgentId,
                LinkStatus.PENDING, reason, nowMs, nowMs, null);
    }

    /**
     * Compare-and-set on status so a concurrent writer that already moved the link is not overwritten.
     */
    public boolean updateStatus(Connection c, long linkId, LinkStatus expected, LinkStatus next, Long expiresTs,
                                long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE agent_links SET status=?,expires_ts=?,updated_ts=? WHERE id=? AND status=?")) {
            ps.setString(1, next.wireValue());
            Rows.setNullableLong(ps, 2, expiresTs);
            ps.setLong(3, nowMs);
            ps.setLong(4, linkId);
            ps.setString(5, expected.wireValue());
            return ps.executeUpdate() > 0;
        }
    }

    public List<AgentLink> listForAgent(Connection c, long agentId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM agent_links WHERE a_agent_id=? OR b_agent_id=? ORDER BY created_ts, id";
        List<AgentLink> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, agentId);
            ps.setLong(2, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
        }
        return out;
    }

    private static AgentLink map(ResultSet rs) throws SQLException {
        return new AgentLink(
                rs.getLong("id"),
                rs.getLong("a_project_id"),
                rs.getLong("a_agent_id"),
                rs.getLong("b_project_id"),
                rs.getLong("b_agent_id"),
                LinkStatus.fromStored(rs.getString("status")),
                rs.getString("reason"),
                rs.getLong("created_ts"),
                rs.getLong("updated_ts"),
                Rows.nullableLong(rs, "expires_ts")
        );
    }
}
