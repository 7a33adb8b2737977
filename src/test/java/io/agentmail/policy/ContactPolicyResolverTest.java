package io.agentmail.policy;

import io.agentmail.model.Agent;
import io.agentmail.model.AgentLink;
import io.agentmail.model.AgentState;
import io.agentmail.model.AttachmentsPolicy;
import io.agentmail.model.ContactPolicy;
import io.agentmail.model.LinkStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Optional;

final class ContactPolicyResolverTest {
    private static final long NOW = 1_800_000_000_000L;

    @Test
    void sameProjectAlwaysDelivers() {
        Agent sender = agent(1L, 10L, ContactPolicy.AUTO, true);
        Agent recipient = agent(2L, 10L, ContactPolicy.BLOCK_ALL, true);
        ContactDecision decision = ContactPolicyResolver.evaluate(sender, recipient, Optional.empty(), Optional.empty(), NOW);
        Assertions.assertTrue(decision.allowed());
    }

    @Test
    void inactiveRecipientIsDeniedFirst() {
        Agent sender = agent(1L, 10L, ContactPolicy.AUTO, true);
        Agent recipient = agent(2L, 10L, ContactPolicy.OPEN, false);
        ContactDecision decision = ContactPolicyResolver.evaluate(sender, recipient, Optional.empty(), Optional.empty(), NOW);
        Assertions.assertFalse(decision.allowed());
        Assertions.assertEquals(ContactDecision.RECIPIENT_INACTIVE, decision.reason());
    }

    @Test
    void blockAllDeniesEvenWithApprovedLink() {
        Agent sender = agent(1L, 10L, ContactPolicy.AUTO, true);
        Agent recipient = agent(2L, 20L, ContactPolicy.BLOCK_ALL, true);
        ContactDecision decision = ContactPolicyResolver.evaluate(
                sender, recipient, Optional.of(link(1L, 2L, LinkStatus.APPROVED, null)), Optional.empty(), NOW);
        Assertions.assertFalse(decision.allowed());
        Assertions.assertEquals(ContactDecision.RECIPIENT_BLOCKS_ALL, decision.reason());
    }

    @Test
    void openAllowsUnlessForwardLinkBlocked() {
        Agent sender = agent(1L, 10L, ContactPolicy.AUTO, true);
        Agent recipient = agent(2L, 20L, ContactPolicy.OPEN, true);
        Assertions.assertTrue(ContactPolicyResolver.evaluate(
                sender, recipient, Optional.empty(), Optional.empty(), NOW).allowed());

        ContactDecision blocked = ContactPolicyResolver.evaluate(
                sender, recipient, Optional.of(link(1L, 2L, LinkStatus.BLOCKED, null)), Optional.empty(), NOW);
        Assertions.assertFalse(blocked.allowed());
        Assertions.assertEquals(ContactDecision.LINK_BLOCKED, blocked.reason());
    }

    @Test
    void autoRequiresApprovedLinkOnlyAfterRecipientBlockedSender() {
        Agent sender = agent(1L, 10L, ContactPolicy.AUTO, true);
        Agent recipient = agent(2L, 20L, ContactPolicy.AUTO, true);
        Assertions.assertTrue(ContactPolicyResolver.evaluate(
                sender, recipient, Optional.empty(), Optional.empty(), NOW).allowed());

        Optional<AgentLink> reverseBlocked = Optional.of(link(2L, 1L, LinkStatus.BLOCKED, null));
        ContactDecision denied = ContactPolicyResolver.evaluate(sender, recipient, Optional.empty(), reverseBlocked, NOW);
        Assertions.assertFalse(denied.allowed());
        Assertions.assertEquals(ContactDecision.NO_CONTACT_PATH, denied.reason());

        ContactDecision viaLink = ContactPolicyResolver.evaluate(
                sender, recipient, Optional.of(link(1L, 2L, LinkStatus.APPROVED, null)), reverseBlocked, NOW);
        Assertions.assertTrue(viaLink.allowed());
    }

    @Test
    void contactsOnlyNeedsApprovedUnexpiredForwardLink() {
        Agent sender = agent(1L, 10L, ContactPolicy.AUTO, true);
        Agent recipient = agent(3L, 20L, ContactPolicy.CONTACTS_ONLY, true);

        Assertions.assertFalse(ContactPolicyResolver.evaluate(
                sender, recipient, Optional.empty(), Optional.empty(), NOW).allowed());
        Assertions.assertFalse(ContactPolicyResolver.evaluate(
                sender, recipient, Optional.of(link(1L, 3L, LinkStatus.PENDING, null)), Optional.empty(), NOW).allowed());
        Assertions.assertTrue(ContactPolicyResolver.evaluate(
                sender, recipient, Optional.of(link(1L, 3L, LinkStatus.APPROVED, NOW + 1L)), Optional.empty(), NOW).allowed());
        Assertions.assertFalse(ContactPolicyResolver.evaluate(
                sender, recipient, Optional.of(link(1L, 3L, LinkStatus.APPROVED, NOW)), Optional.empty(), NOW).allowed());
        // A link in the other direction does not open this one.
        Assertions.assertFalse(ContactPolicyResolver.evaluate(
                sender, recipient, Optional.empty(), Optional.of(link(3L, 1L, LinkStatus.APPROVED, null)), NOW).allowed());
    }

    private static Agent agent(long id, long projectId, ContactPolicy policy, boolean active) {
        return new Agent(
                id,
                projectId,
                "agent" + id,
                "test",
                "model",
                "",
                NOW - 10_000L,
                NOW - 10_000L,
                AttachmentsPolicy.AUTO,
                policy,
                active ? null : NOW - 1L,
                active ? AgentState.ACTIVE : AgentState.DEREGISTERED
        );
    }

    private static AgentLink link(long from, long to, LinkStatus status, Long expiresTs) {
        return new AgentLink(100L + from * 10L + to, 10L, from, 20L, to, status, "", NOW - 5_000L, NOW - 5_000L, expiresTs);
    }
}
