package io.agentmail.link;

import io.agentmail.config.AgentMailConfig;
import io.agentmail.directory.AgentDirectory;
import io.agentmail.error.CoordinationException;
import io.agentmail.error.ErrorKind;
import io.agentmail.model.Agent;
import io.agentmail.model.AgentLink;
import io.agentmail.model.ContactPolicy;
import io.agentmail.model.LinkStatus;
import io.agentmail.model.Project;
import io.agentmail.storage.Database;
import io.agentmail.storage.DirectoryStore;
import io.agentmail.storage.LinkStore;
import io.agentmail.storage.ReservationStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class LinkLifecycleManagerTest {
    private static final long NOW = 1_800_000_000_000L;

    private Path root;
    private AgentDirectory directory;
    private LinkLifecycleManager links;
    private Agent alice;
    private Agent carol;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createTempDirectory("agentmail-test-links-");
        Database db = new Database(AgentMailConfig.fromRoot(root.toString()));
        db.init();
        DirectoryStore directoryStore = new DirectoryStore();
        directory = new AgentDirectory(db, directoryStore, new ReservationStore());
        links = new LinkLifecycleManager(db, directoryStore, new LinkStore());
        Project backend = directory.ensureProject("/work/backend", NOW);
        Project frontend = directory.ensureProject("/work/frontend", NOW);
        alice = directory.registerAgent(AgentDirectory.Registration.of(backend.id(), "alice", ContactPolicy.AUTO), NOW);
        carol = directory.registerAgent(AgentDirectory.Registration.of(frontend.id(), "carol", ContactPolicy.CONTACTS_ONLY), NOW);
    }

    @AfterEach
    void tearDown() throws IOException {
        deleteRecursively(root);
    }

    @Test
    void requestIsIdempotentPerDirection() {
        AgentLink first = links.requestLink(alice.id(), carol.id(), "api contract", NOW);
        Assertions.assertEquals(LinkStatus.PENDING, first.status());
        Assertions.assertEquals(alice.id(), first.aAgentId());
        Assertions.assertEquals(carol.id(), first.bAgentId());

        AgentLink again = links.requestLink(alice.id(), carol.id(), "second ask", NOW + 1L);
        Assertions.assertEquals(first.id(), again.id());

        AgentLink reverse = links.requestLink(carol.id(), alice.id(), "", NOW + 2L);
        Assertions.assertNotEquals(first.id(), reverse.id());
        Assertions.assertEquals(2, links.listLinks(alice.id()).size());
    }

    @Test
    void onlyTargetApprovesAndExpiryIsRecorded() {
        AgentLink link = links.requestLink(alice.id(), carol.id(), "", NOW);

        CoordinationException notOwner = Assertions.assertThrows(CoordinationException.class,
                () -> links.approve(link.id(), alice.id(), null, NOW + 1L));
        Assertions.assertEquals(ErrorKind.NOT_OWNER, notOwner.kind());

        AgentLink approved = links.approve(link.id(), carol.id(), 60_000L, NOW + 2L);
        Assertions.assertEquals(LinkStatus.APPROVED, approved.status());
        Assertions.assertEquals(NOW + 60_002L, approved.expiresTs());
        Assertions.assertTrue(approved.isApprovedAt(NOW + 60_001L));
        Assertions.assertFalse(approved.isApprovedAt(NOW + 60_002L));

        AgentLink refreshed = links.approve(link.id(), carol.id(), null, NOW + 100_000L);
        Assertions.assertNull(refreshed.expiresTs());
        Assertions.assertTrue(refreshed.isApprovedAt(NOW + 10_000_000L));
    }

    @Test
    void blockIsTerminal() {
        AgentLink link = links.requestLink(alice.id(), carol.id(), "", NOW);
        links.approve(link.id(), carol.id(), null, NOW + 1L);

        AgentLink blocked = links.block(link.id(), carol.id(), NOW + 2L);
        Assertions.assertEquals(LinkStatus.BLOCKED, blocked.status());
        Assertions.assertEquals(LinkStatus.BLOCKED, links.block(link.id(), alice.id(), NOW + 3L).status());

        CoordinationException approve = Assertions.assertThrows(CoordinationException.class,
                () -> links.approve(link.id(), carol.id(), null, NOW + 4L));
        Assertions.assertEquals(ErrorKind.LINK_BLOCKED, approve.kind());

        CoordinationException request = Assertions.assertThrows(CoordinationException.class,
                () -> links.requestLink(alice.id(), carol.id(), "please", NOW + 5L));
        Assertions.assertEquals(ErrorKind.LINK_BLOCKED, request.kind());
    }

    @Test
    void invalidRequestsAreRejected() {
        CoordinationException self = Assertions.assertThrows(CoordinationException.class,
                () -> links.requestLink(alice.id(), alice.id(), "", NOW));
        Assertions.assertEquals(ErrorKind.VALIDATION, self.kind());

        AgentLink link = links.requestLink(alice.id(), carol.id(), "", NOW);
        Agent mallory = directory.registerAgent(
                AgentDirectory.Registration.of(alice.projectId(), "mallory", ContactPolicy.OPEN), NOW);
        CoordinationException outsider = Assertions.assertThrows(CoordinationException.class,
                () -> links.block(link.id(), mallory.id(), NOW + 1L));
        Assertions.assertEquals(ErrorKind.NOT_OWNER, outsider.kind());

        directory.deregisterAgent(carol.id(), NOW + 2L);
        CoordinationException inactive = Assertions.assertThrows(CoordinationException.class,
                () -> links.requestLink(mallory.id(), carol.id(), "", NOW + 3L));
        Assertions.assertEquals(ErrorKind.UNKNOWN_AGENT, inactive.kind());

        CoordinationException missing = Assertions.assertThrows(CoordinationException.class,
                () -> links.approve(999_999L, carol.id(), null, NOW));
        Assertions.assertEquals(ErrorKind.NOT_FOUND, missing.kind());
    }

    @Test
    void approvalTtlBeyondClockRangeIsRejectedAndLinkStaysPending() {
        AgentLink link = links.requestLink(alice.id(), carol.id(), "", NOW);
        CoordinationException overflow = Assertions.assertThrows(CoordinationException.class,
                () -> links.approve(link.id(), carol.id(), Long.MAX_VALUE, NOW + 1L));
        Assertions.assertEquals(ErrorKind.VALIDATION, overflow.kind());
        Assertions.assertEquals(LinkStatus.PENDING, links.listLinks(carol.id()).get(0).status());

        AgentLink approved = links.approve(link.id(), carol.id(), Long.MAX_VALUE - NOW - 2L, NOW + 2L);
        Assertions.assertEquals(Long.MAX_VALUE, approved.expiresTs());
        Assertions.assertTrue(approved.isApprovedAt(NOW + 3L));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
