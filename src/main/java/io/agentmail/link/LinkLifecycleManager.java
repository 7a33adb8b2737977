package io.agentmail.link;

import io.agentmail.error.CoordinationException;
import io.agentmail.error.ErrorKind;
import io.agentmail.model.Agent;
import io.agentmail.model.AgentLink;
import io.agentmail.model.LinkStatus;
import io.agentmail.storage.Database;
import io.agentmail.storage.DirectoryStore;
import io.agentmail.storage.LinkStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Request/approve/block workflow for directed contact links.
 *
 * <p>pending to approved (target only), pending to blocked and approved to blocked (either party).
 * Blocked is terminal.
 */
public final class LinkLifecycleManager {
    public static final int MAX_REASON_LENGTH = 512;

    private final Database database;
    private final DirectoryStore directoryStore;
    private final LinkStore linkStore;

    public LinkLifecycleManager(Database database, DirectoryStore directoryStore, LinkStore linkStore) {
        this.database = database;
        this.directoryStore = directoryStore;
        this.linkStore = linkStore;
    }

    /**
     * Idempotent for an existing pending or approved link in the same direction.
     */
    public AgentLink requestLink(long fromAgentId, long toAgentId, String reason, long nowMs) {
        if (fromAgentId == toAgentId) {
            throw CoordinationException.validation("an agent cannot link to itself");
        }
        String safeReason = reason == null ? "" : reason.trim();
        if (safeReason.length() > MAX_REASON_LENGTH) {
            throw CoordinationException.validation("reason longer than " + MAX_REASON_LENGTH + " characters");
        }
        return database.inTransaction("request link", c -> {
            Agent from = requireActive(c, fromAgentId);
            Agent to = requireActive(c, toAgentId);
            Optional<AgentLink> existing = linkStore.findDirected(c, from.id(), to.id());
            if (existing.isPresent()) {
                AgentLink link = existing.get();
                if (link.isBlocked()) {
                    throw linkBlocked(link);
                }
                return link;
            }
            AgentLink created = linkStore.insertPending(c, from.projectId(), from.id(), to.projectId(), to.id(), safeReason, nowMs);
            directoryStore.touchAgent(c, from.id(), nowMs);
            return created;
        });
    }

    /**
     * Approves a pending link; only the target agent may. Approving an approved link refreshes its
     * expiry. {@code ttlMs} of null or zero means the approval does not expire.
     */
    public AgentLink approve(long linkId, long approverId, Long ttlMs, long nowMs) {
        if (ttlMs != null && ttlMs < 0L) {
            throw CoordinationException.validation("ttl must not be negative");
        }
        Long expiresTs = ttlMs == null || ttlMs == 0L ? null : expiryAfter(nowMs, ttlMs);
        return database.inTransaction("approve link " + linkId, c -> {
            AgentLink link = requireLink(c, linkId);
            if (link.bAgentId() != approverId) {
                throw notParty(linkId, approverId, "only the target agent may approve");
            }
            if (link.isBlocked()) {
                throw linkBlocked(link);
            }
            if (!linkStore.updateStatus(c, linkId, link.status(), LinkStatus.APPROVED, expiresTs, nowMs)) {
                throw CoordinationException.conflict("link " + linkId + " changed concurrently");
            }
            directoryStore.touchAgent(c, approverId, nowMs);
            return requireLink(c, linkId);
        });
    }

    /**
     * Blocks a link; either endpoint may. Blocking a blocked link returns it unchanged.
     */
    public AgentLink block(long linkId, long actorId, long nowMs) {
        return database.inTransaction("block link " + linkId, c -> {
            AgentLink link = requireLink(c, linkId);
            if (link.aAgentId() != actorId && link.bAgentId() != actorId) {
                throw notParty(linkId, actorId, "only a party to the link may block it");
            }
            if (link.isBlocked()) {
                return link;
            }
            if (!link.status().canTransitionTo(LinkStatus.BLOCKED)
                    || !linkStore.updateStatus(c, linkId, link.status(), LinkStatus.BLOCKED, link.expiresTs(), nowMs)) {
                throw CoordinationException.illegalTransition("link " + linkId, link.status(), LinkStatus.BLOCKED);
            }
            directoryStore.touchAgent(c, actorId, nowMs);
            return requireLink(c, linkId);
        });
    }

    public List<AgentLink> listLinks(long agentId) {
        return database.read("list links", c -> linkStore.listForAgent(c, agentId));
    }

    private Agent requireActive(Connection c, long agentId) throws SQLException {
        Agent agent = directoryStore.findAgent(c, agentId)
                .orElseThrow(() -> CoordinationException.unknownAgent(agentId));
        if (!agent.isActive()) {
            throw CoordinationException.inactiveAgent(agent.name());
        }
        return agent;
    }

    private AgentLink requireLink(Connection c, long linkId) throws SQLException {
        return linkStore.find(c, linkId).orElseThrow(() -> CoordinationException.notFound("Link", linkId));
    }

    private static CoordinationException linkBlocked(AgentLink link) {
        return new CoordinationException(
                ErrorKind.LINK_BLOCKED,
                "Link " + link.aAgentId() + " -> " + link.bAgentId() + " is blocked",
                Map.of("link_id", link.id())
        );
    }

    private static CoordinationException notParty(long linkId, long agentId, String message) {
        return new CoordinationException(
                ErrorKind.NOT_OWNER,
                message + " (link " + linkId + ", agent " + agentId + ")",
                Map.of("link_id", linkId, "agent_id", agentId)
        );
    }

    private static long expiryAfter(long nowMs, long ttlMs) {
        try {
            return Math.addExact(nowMs, ttlMs);
        } catch (ArithmeticException e) {
            throw CoordinationException.validation("ttl " + ttlMs + "ms is out of range");
        }
    }
}
