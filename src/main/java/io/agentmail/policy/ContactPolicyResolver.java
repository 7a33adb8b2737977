package io.agentmail.policy;

import io.agentmail.error.CoordinationException;
import io.agentmail.model.Agent;
import io.agentmail.model.AgentLink;
import io.agentmail.storage.DirectoryStore;
import io.agentmail.storage.LinkStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Decides whether a sender may deliver to a recipient.
 *
 * <p>Rules, first match wins:
 *
 * <ol>
 *   <li>deregistered recipient: deny;</li>
 *   <li>same project: allow, whatever the recipient's policy;</li>
 *   <li>{@code block_all}: deny;</li>
 *   <li>blocked link sender to recipient: deny;</li>
 *   <li>{@code open}: allow;</li>
 *   <li>{@code auto}: allow unless the recipient blocked the sender, then an approved link is required;</li>
 *   <li>{@code contacts_only}: allow only with an approved, unexpired link sender to recipient.</li>
 * </ol>
 *
 * <p>The resolver never writes. Callers run it inside the transaction that persists delivery so the
 * decision and the insert observe the same link state.
 */
public final class ContactPolicyResolver {
    private final DirectoryStore directoryStore;
    private final LinkStore linkStore;

    public ContactPolicyResolver(DirectoryStore directoryStore, LinkStore linkStore) {
        this.directoryStore = directoryStore;
        this.linkStore = linkStore;
    }

    public ContactDecision canDeliver(Connection c, long senderId, long recipientId, long nowMs) throws SQLException {
        Agent sender = directoryStore.findAgent(c, senderId)
                .orElseThrow(() -> CoordinationException.unknownAgent(senderId));
        Agent recipient = directoryStore.findAgent(c, recipientId)
                .orElseThrow(() -> CoordinationException.unknownAgent(recipientId));
        return canDeliver(c, sender, recipient, nowMs);
    }

    public ContactDecision canDeliver(Connection c, Agent sender, Agent recipient, long nowMs) throws SQLException {
        if (!sender.isActive()) {
            throw CoordinationException.inactiveAgent(sender.name());
        }
        if (!recipient.isActive() || sender.projectId() == recipient.projectId()) {
            return evaluate(sender, recipient, Optional.empty(), Optional.empty(), nowMs);
        }
        Optional<AgentLink> forward = linkStore.findDirected(c, sender.id(), recipient.id());
        Optional<AgentLink> reverse = linkStore.findDirected(c, recipient.id(), sender.id());
        return evaluate(sender, recipient, forward, reverse, nowMs);
    }

    /**
     * Pure rule evaluation over already-loaded records.
     */
    public static ContactDecision evaluate(Agent sender, Agent recipient, Optional<AgentLink> forward,
                                           Optional<AgentLink> reverse, long nowMs) {
        if (!recipient.isActive()) {
            return ContactDecision.deny(ContactDecision.RECIPIENT_INACTIVE);
        }
        if (sender.projectId() == recipient.projectId()) {
            return ContactDecision.allow("same project");
        }
        boolean forwardBlocked = forward.map(AgentLink::isBlocked).orElse(false);
        boolean forwardApproved = forward.map(l -> l.isApprovedAt(nowMs)).orElse(false);
        switch (recipient.contactPolicy()) {
            case BLOCK_ALL:
                return ContactDecision.deny(ContactDecision.RECIPIENT_BLOCKS_ALL);
            case OPEN:
                return forwardBlocked
                        ? ContactDecision.deny(ContactDecision.LINK_BLOCKED)
                        : ContactDecision.allow("open policy");
            case AUTO:
                if (forwardBlocked) {
                    return ContactDecision.deny(ContactDecision.LINK_BLOCKED);
                }
                boolean recipientBlockedSender = reverse.map(AgentLink::isBlocked).orElse(false);
                if (!recipientBlockedSender || forwardApproved) {
                    return ContactDecision.allow(forwardApproved ? "approved link" : "auto policy");
                }
                return ContactDecision.deny(ContactDecision.NO_CONTACT_PATH);
            case CONTACTS_ONLY:
                if (forwardBlocked) {
                    return ContactDecision.deny(ContactDecision.LINK_BLOCKED);
                }
                return forwardApproved
                        ? ContactDecision.allow("approved link")
                        : ContactDecision.deny(ContactDecision.NO_CONTACT_PATH);
            default:
                return ContactDecision.deny(ContactDecision.NO_CONTACT_PATH);
        }
    }
}
