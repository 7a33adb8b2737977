package io.agentmail.storage;

import io.agentmail.model.Agent;
import io.agentmail.model.AgentState;
import io.agentmail.model.AttachmentsPolicy;
import io.agentmail.model.ContactPolicy;
import io.agentmail.model.Product;
import io.agentmail.model.Project;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rows for projects, products, product membership and agents.
 */
public final class DirectoryStore {
    private static final String AGENT_COLUMNS = """
            id,project_id,name,program,model,task_description,inception_ts,last_active_ts,
            attachments_policy,contact_policy,deregistered_ts
            """;

    public Optional<Project> findProjectBySlug(Connection c, String slug) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT id,slug,human_key,created_at FROM projects WHERE slug=?")) {
            ps.setString(1, slug);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapProject(rs)) : Optional.empty();
            }
        }
    }

    public Optional<Project> findProject(Connection c, long projectId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT id,slug,human_key,created_at FROM projects WHERE id=?")) {
            ps.setLong(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapProject(rs)) : Optional.empty();
            }
        }
    }

    public Project insertProject(Connection c, String slug, String humanKey, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("INSERT INTO projects(slug,human_key,created_at) VALUES(?,?,?)")) {
            ps.setString(1, slug);
            ps.setString(2, humanKey);
            ps.setLong(3, nowMs);
            ps.executeUpdate();
        }
        return new Project(Rows.lastInsertId(c), slug, humanKey, nowMs);
    }

    public Optional<Product> findProductByName(Connection c, String name) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT id,product_uid,name,created_at FROM products WHERE name=?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapProduct(rs)) : Optional.empty();
            }
        }
    }

    public Optional<Product> findProduct(Connection c, long productId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT id,product_uid,name,created_at FROM products WHERE id=?")) {
            ps.setLong(1, productId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapProduct(rs)) : Optional.empty();
            }
        }
    }

    public Product insertProduct(Connection c, String productUid, String name, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("INSERT INTO products(product_uid,name,created_at) VALUES(?,?,?)")) {
            ps.setString(1, productUid);
            ps.setString(2, name);
            ps.setLong(3, nowMs);
            ps.executeUpdate();
        }
        return new Product(Rows.lastInsertId(c), productUid, name, nowMs);
    }

    /**
     * @return true when a new membership row was written
     */
    public boolean linkProductProject(Connection c, long productId, long projectId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR IGNORE INTO product_project_links(product_id,project_id,created_at) VALUES(?,?,?)")) {
            ps.setLong(1, productId);
            ps.setLong(2, projectId);
            ps.setLong(3, nowMs);
            return ps.executeUpdate() > 0;
        }
    }

    public List<Project> listProductProjects(Connection c, long productId) throws SQLException {
        String sql = """
                SELECT p.id,p.slug,p.human_key,p.created_at
                FROM projects p
                JOIN product_project_links l ON l.project_id=p.id
                WHERE l.product_id=?
                ORDER BY p.slug
                """;
        List<Project> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, productId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapProject(rs));
                }
            }
        }
        return out;
    }

    public Optional<Agent> findAgent(Connection c, long agentId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + AGENT_COLUMNS + " FROM agents WHERE id=?")) {
            ps.setLong(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapAgent(rs)) : Optional.empty();
            }
        }
    }

    public Optional<Agent> findAgentByName(Connection c, long projectId, String name) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + AGENT_COLUMNS + " FROM agents WHERE project_id=? AND name=?")) {
            ps.setLong(1, projectId);
            ps.setString(2, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapAgent(rs)) : Optional.empty();
            }
        }
    }

    public List<Agent> listAgents(Connection c, long projectId, boolean includeDeregistered) throws SQLException {
        String sql = "SELECT " + AGENT_COLUMNS + " FROM agents WHERE project_id=?"
                + (includeDeregistered ? "" : " AND deregistered_ts IS NULL")
                + " ORDER BY name";
        List<Agent> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapAgent(rs));
                }
            }
        }
        return out;
    }

    public Agent insertAgent(Connection c, AgentRegistration r, long nowMs) throws SQLException {
        String sql = """
                INSERT INTO agents(project_id,name,program,model,task_description,inception_ts,last_active_ts,
                                   attachments_policy,contact_policy)
                VALUES(?,?,?,?,?,?,?,?,?)
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, r.projectId());
            ps.setString(2, r.name());
            ps.setString(3, r.program());
            ps.setString(4, r.model());
            ps.setString(5, r.taskDescription());
            ps.setLong(6, nowMs);
            ps.setLong(7, nowMs);
            ps.setString(8, r.attachmentsPolicy().wireValue());
            ps.setString(9, r.contactPolicy().wireValue());
            ps.executeUpdate();
        }
        long id = Rows.lastInsertId(c);
        return findAgent(c, id).orElseThrow(() -> new SQLException("agent vanished after insert: " + id));
    }

    public void updateAgentProfile(Connection c, long agentId, AgentRegistration r, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE agents SET program=?,model=?,task_description=?,attachments_policy=?,contact_policy=?,last_active_ts=?
                WHERE id=?
                """)) {
            ps.setString(1, r.program());
            ps.setString(2, r.model());
            ps.setString(3, r.taskDescription());
            ps.setString(4, r.attachmentsPolicy().wireValue());
            ps.setString(5, r.contactPolicy().wireValue());
            ps.setLong(6, nowMs);
            ps.setLong(7, agentId);
            ps.executeUpdate();
        }
    }

    public boolean updateContactPolicy(Connection c, long agentId, ContactPolicy policy, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE agents SET contact_policy=?,last_active_ts=? WHERE id=?")) {
            ps.setString(1, policy.wireValue());
            ps.setLong(2, nowMs);
            ps.setLong(3, agentId);
            return ps.executeUpdate() > 0;
        }
    }

    /**
     * Sets {@code deregistered_ts} once; a second call leaves the original marker in place.
     */
    public boolean markDeregistered(Connection c, long agentId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE agents SET deregistered_ts=?,last_active_ts=? WHERE id=? AND deregistered_ts IS NULL")) {
            ps.setLong(1, nowMs);
            ps.setLong(2, nowMs);
            ps.setLong(3, agentId);
            return ps.executeUpdate() > 0;
        }
    }

    public void touchAgent(Connection c, long agentId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE agents SET last_active_ts=MAX(last_active_ts, ?) WHERE id=?")) {
            ps.setLong(1, nowMs);
            ps.setLong(2, agentId);
            ps.executeUpdate();
        }
    }

    private static Project mapProject(ResultSet rs) throws SQLException {
        return new Project(
                rs.getLong("id"),
                rs.getString("slug"),
                rs.getString("human_key"),
                rs.getLong("created_at")
        );
    }

    private static Product mapProduct(ResultSet rs) throws SQLException {
        return new Product(
                rs.getLong("id"),
                rs.getString("product_uid"),
                rs.getString("name"),
                rs.getLong("created_at")
        );
    }

    static Agent mapAgent(ResultSet rs) throws SQLException {
        Long deregisteredTs = Rows.nullableLong(rs, "deregistered_ts");
        return new Agent(
                rs.getLong("id"),
                rs.getLong("project_id"),
                rs.getString("name"),
                rs.getString("program"),
                rs.getString("model"),
                rs.getString("task_description"),
                rs.getLong("inception_ts"),
                rs.getLong("last_active_ts"),
                AttachmentsPolicy.fromString(rs.getString("attachments_policy")),
                ContactPolicy.fromString(rs.getString("contact_policy")),
                deregisteredTs,
                deregisteredTs == null ? AgentState.ACTIVE : AgentState.DEREGISTERED
        );
    }

    public record AgentRegistration(
            long projectId,
            String name,
            String program,
            String model,
            String taskDescription,
            AttachmentsPolicy attachmentsPolicy,
            ContactPolicy contactPolicy
    ) {
    }
}
