package io.agentmail.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.agentmail.model.Attachment;
import io.agentmail.model.Importance;
import io.agentmail.model.InboxEntry;
import io.agentmail.model.Message;
import io.agentmail.model.MessageRecipient;
import io.agentmail.model.RecipientKind;
import io.agentmail.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class MessageStore {
    private static final TypeReference<List<Attachment>> ATTACHMENT_LIST = new TypeReference<>() {
    };
    private static final String MESSAGE_COLUMNS =
            "m.id,m.project_id,m.sender_id,m.thread_id,m.subject,m.body_md,m.importance,m.ack_required,m.created_ts,m.attachments";

    public Message insertMessage(Connection c, NewMessage m) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO messages(project_id,sender_id,thread_id,subject,body_md,importance,ack_required,created_ts,attachments)
                VALUES(?,?,?,?,?,?,?,?,?)
                """)) {
            ps.setLong(1, m.projectId());
            ps.setLong(2, m.senderId());
            ps.setString(3, m.threadId());
            ps.setString(4, m.subject());
            ps.setString(5, m.bodyMd());
            ps.setString(6, m.importance().wireValue());
            ps.setInt(7, m.ackRequired() ? 1 : 0);
            ps.setLong(8, m.createdTs());
            ps.setString(9, writeAttachments(m.attachments()));
            ps.executeUpdate();
        }
        return new Message(Rows.lastInsertId(c), m.projectId(), m.senderId(), m.threadId(), m.subject(), m.bodyMd(),
                m.importance(), m.ackRequired(), m.createdTs(), List.copyOf(m.attachments()));
    }

    public MessageRecipient insertRecipient(Connection c, long messageId, long agentId, RecipientKind kind) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO message_recipients(message_id,agent_id,kind) VALUES(?,?,?)")) {
            ps.setLong(1, messageId);
            ps.setLong(2, agentId);
            ps.setString(3, kind.wireValue());
            ps.executeUpdate();
        }
        return new MessageRecipient(messageId, agentId, kind, null, null);
    }

    public Optional<Message> findMessage(Connection c, long messageId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + MESSAGE_COLUMNS + " FROM messages m WHERE m.id=?")) {
            ps.setLong(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapMessage(rs)) : Optional.empty();
            }
        }
    }

    public Optional<MessageRecipient> findRecipient(Connection c, long messageId, long agentId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT message_id,agent_id,kind,read_ts,ack_ts FROM message_recipients WHERE message_id=? AND agent_id=?")) {
            ps.setLong(1, messageId);
            ps.setLong(2, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRecipient(rs)) : Optional.empty();
            }
        }
    }

    public List<MessageRecipient> listRecipients(Connection c, long messageId) throws SQLException {
        List<MessageRecipient> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT message_id,agent_id,kind,read_ts,ack_ts FROM message_recipients WHERE message_id=? ORDER BY agent_id")) {
            ps.setLong(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRecipient(rs));
                }
            }
        }
        return out;
    }

    /**
     * Sets {@code read_ts} if it is still null. Never moves an existing timestamp.
     */
    public boolean setReadIfUnset(Connection c, long messageId, long agentId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE message_recipients SET read_ts=? WHERE message_id=? AND agent_id=? AND read_ts IS NULL")) {
            ps.setLong(1, nowMs);
            ps.setLong(2, messageId);
            ps.setLong(3, agentId);
            return ps.executeUpdate() > 0;
        }
    }

    public boolean setAckIfUnset(Connection c, long messageId, long agentId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE message_recipients SET ack_ts=? WHERE message_id=? AND agent_id=? AND ack_ts IS NULL")) {
            ps.setLong(1, nowMs);
            ps.setLong(2, messageId);
            ps.setLong(3, agentId);
            return ps.executeUpdate() > 0;
        }
    }

    public List<InboxEntry> inbox(Connection c, long agentId, Long sinceTs, boolean urgentOnly, int limit) throws SQLException {
        StringBuilder sql = new StringBuilder()
                .append("SELECT ").append(MESSAGE_COLUMNS).append(",r.agent_id,r.kind,r.read_ts,r.ack_ts ")
                .append("FROM message_recipients r JOIN messages m ON m.id=r.message_id ")
                .append("WHERE r.agent_id=?");
        if (sinceTs != null) {
            sql.append(" AND m.created_ts>?");
        }
        if (urgentOnly) {
            sql.append(" AND m.importance IN (?,?)");
        }
        sql.append(" ORDER BY m.created_ts DESC, m.id DESC LIMIT ?");
        try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int idx = 1;
            ps.setLong(idx++, agentId);
            if (sinceTs != null) {
                ps.setLong(idx++, sinceTs);
            }
            if (urgentOnly) {
                ps.setString(idx++, Importance.HIGH.wireValue());
                ps.setString(idx++, Importance.URGENT.wireValue());
            }
            ps.setInt(idx, Math.max(1, limit));
            return collectInbox(ps);
        }
    }

    public List<InboxEntry> pendingAcks(Connection c, long agentId, int limit) throws SQLException {
        String sql = "SELECT " + MESSAGE_COLUMNS + ",r.agent_id,r.kind,r.read_ts,r.ack_ts "
                + "FROM message_recipients r JOIN messages m ON m.id=r.message_id "
                + "WHERE r.agent_id=? AND m.ack_required=1 AND r.ack_ts IS NULL "
                + "ORDER BY m.created_ts, m.id LIMIT ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, agentId);
            ps.setInt(2, Math.max(1, limit));
            return collectInbox(ps);
        }
    }

    /**
     * Messages of one thread in a project, oldest first. A numeric key also matches the root message,
     * which is stored without a {@code thread_id}.
     */
    public List<Message> thread(Connection c, long projectId, String threadKey) throws SQLException {
        Long rootId = parseId(threadKey);
        String sql = "SELECT " + MESSAGE_COLUMNS + " FROM messages m WHERE m.project_id=? AND (m.thread_id=?"
                + (rootId == null ? "" : " OR (m.thread_id IS NULL AND m.id=?)")
                + ") ORDER BY m.created_ts, m.id";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, projectId);
            ps.setString(2, threadKey);
            if (rootId != null) {
                ps.setLong(3, rootId);
            }
            return collectMessages(ps);
        }
    }

    /**
     * Inbox of every agent named {@code agentName} across the given projects.
     */
    public List<InboxEntry> inboxByNameAcrossProjects(Connection c, List<Long> projectIds, String agentName, int limit) throws SQLException {
        if (projectIds.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT " + MESSAGE_COLUMNS + ",r.agent_id,r.kind,r.read_ts,r.ack_ts "
                + "FROM message_recipients r JOIN messages m ON m.id=r.message_id JOIN agents a ON a.id=r.agent_id "
                + "WHERE a.name=? AND a.project_id IN (" + Rows.placeholders(projectIds.size()) + ") "
                + "ORDER BY m.created_ts DESC, m.id DESC LIMIT ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            ps.setString(idx++, agentName);
            for (Long projectId : projectIds) {
                ps.setLong(idx++, projectId);
            }
            ps.setInt(idx, Math.max(1, limit));
            return collectInbox(ps);
        }
    }

    public List<Message> search(Connection c, List<Long> projectIds, String query, int limit) throws SQLException {
        if (projectIds.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT " + MESSAGE_COLUMNS + " FROM messages m "
                + "WHERE m.project_id IN (" + Rows.placeholders(projectIds.size()) + ") "
                + "AND (LOWER(m.subject) LIKE LOWER(?) ESCAPE '\\' OR LOWER(m.body_md) LIKE LOWER(?) ESCAPE '\\') "
                + "ORDER BY m.created_ts DESC, m.id DESC LIMIT ?";
        String like = Rows.likePattern(query);
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            for (Long projectId : projectIds) {
                ps.setLong(idx++, projectId);
            }
            ps.setString(idx++, like);
            ps.setString(idx++, like);
            ps.setInt(idx, Math.max(1, limit));
            return collectMessages(ps);
        }
    }

    public int countMessages(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM messages");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    public int countRecipients(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM message_recipients");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static Long parseId(String threadKey) {
        try {
            return Long.parseLong(threadKey.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<Message> collectMessages(PreparedStatement ps) throws SQLException {
        List<Message> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapMessage(rs));
            }
        }
        return out;
    }

    private static List<InboxEntry> collectInbox(PreparedStatement ps) throws SQLException {
        List<InboxEntry> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new InboxEntry(
                        mapMessage(rs),
                        rs.getLong("agent_id"),
                        RecipientKind.fromString(rs.getString("kind")),
                        Rows.nullableLong(rs, "read_ts"),
                        Rows.nullableLong(rs, "ack_ts")
                ));
            }
        }
        return out;
    }

    private static Message mapMessage(ResultSet rs) throws SQLException {
        return new Message(
                rs.getLong("id"),
                rs.getLong("project_id"),
                rs.getLong("sender_id"),
                rs.getString("thread_id"),
                rs.getString("subject"),
                rs.getString("body_md"),
                Importance.fromString(rs.getString("importance")),
                rs.getInt("ack_required") == 1,
                rs.getLong("created_ts"),
                readAttachments(rs.getString("attachments"))
        );
    }

    private static MessageRecipient mapRecipient(ResultSet rs) throws SQLException {
        return new MessageRecipient(
                rs.getLong("message_id"),
                rs.getLong("agent_id"),
                RecipientKind.fromString(rs.getString("kind")),
                Rows.nullableLong(rs, "read_ts"),
                Rows.nullableLong(rs, "ack_ts")
        );
    }

    private static String writeAttachments(List<Attachment> attachments) throws SQLException {
        try {
            return Jsons.compactMapper().writeValueAsString(attachments == null ? List.of() : attachments);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to serialize attachments", e);
        }
    }

    private static List<Attachment> readAttachments(String raw) throws SQLException {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(Jsons.compactMapper().readValue(raw, ATTACHMENT_LIST));
        } catch (JsonProcessingException e) {
            throw new SQLException("Malformed attachments column: " + raw, e);
        }
    }

    public record NewMessage(
            long projectId,
            long senderId,
            String threadId,
            String subject,
            String bodyMd,
            Importance importance,
            boolean ackRequired,
            long createdTs,
            List<Attachment> attachments
    ) {
    }
}
