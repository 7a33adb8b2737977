package io.agentmail.reservation;

import io.agentmail.config.AgentMailConfig;
import io.agentmail.config.CoordinationSettings;
import io.agentmail.directory.AgentDirectory;
import io.agentmail.error.CoordinationException;
import io.agentmail.error.ErrorKind;
import io.agentmail.model.Agent;
import io.agentmail.model.ContactPolicy;
import io.agentmail.model.FileReservation;
import io.agentmail.model.Project;
import io.agentmail.model.ReservationState;
import io.agentmail.storage.Database;
import io.agentmail.storage.DirectoryStore;
import io.agentmail.storage.ReservationStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class FileReservationManagerTest {
    private static final long NOW = 1_800_000_000_000L;
    private static final long HOUR = 3_600_000L;

    private Path root;
    private AgentDirectory directory;
    private FileReservationManager manager;
    private Project project;
    private Agent alice;
    private Agent bob;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createTempDirectory("agentmail-test-reservations-");
        Database db = new Database(AgentMailConfig.fromRoot(root.toString()));
        db.init();
        DirectoryStore directoryStore = new DirectoryStore();
        ReservationStore reservationStore = new ReservationStore();
        directory = new AgentDirectory(db, directoryStore, reservationStore);
        manager = new FileReservationManager(db, directoryStore, reservationStore, CoordinationSettings.defaults());
        project = directory.ensureProject("/work/backend", NOW);
        alice = directory.registerAgent(AgentDirectory.Registration.of(project.id(), "alice", ContactPolicy.AUTO), NOW);
        bob = directory.registerAgent(AgentDirectory.Registration.of(project.id(), "bob", ContactPolicy.AUTO), NOW);
    }

    @AfterEach
    void tearDown() throws IOException {
        deleteRecursively(root);
    }

    @Test
    void exclusiveReservationBlocksOverlapUntilReleased() {
        ReservationGrant aliceGrant = manager.reserve(alice.id(), project.id(), "src/**", true, HOUR, "refactor", NOW);
        Assertions.assertTrue(aliceGrant.granted());
        long aliceReservation = aliceGrant.reservation().id();

        ReservationGrant bobConflict = manager.reserve(bob.id(), project.id(), "src/api/users.py", true, HOUR, "", NOW + 1L);
        Assertions.assertFalse(bobConflict.granted());
        Assertions.assertEquals(1, bobConflict.conflicts().size());
        Assertions.assertEquals(aliceReservation, bobConflict.conflicts().get(0).id());

        ReservationGrant bobShared = manager.reserve(bob.id(), project.id(), "src/api/users.py", false, HOUR, "", NOW + 2L);
        Assertions.assertFalse(bobShared.granted());

        Assertions.assertTrue(manager.reserve(bob.id(), project.id(), "docs/**", true, HOUR, "", NOW + 3L).granted());

        ReleaseOutcome released = manager.release(aliceReservation, alice.id(), NOW + 4L);
        Assertions.assertEquals(ReleaseOutcome.Status.RELEASED, released.status());
        Assertions.assertEquals(NOW + 4L, released.reservation().releasedTs());

        Assertions.assertTrue(manager.reserve(bob.id(), project.id(), "src/api/users.py", true, HOUR, "", NOW + 5L).granted());
    }

    @Test
    void releaseReportsOwnershipAndIsIdempotent() {
        long id = manager.reserve(alice.id(), project.id(), "src/a.py", true, HOUR, "", NOW).reservation().id();

        Assertions.assertEquals(ReleaseOutcome.Status.NOT_OWNER, manager.release(id, bob.id(), NOW + 1L).status());
        Assertions.assertEquals(ReleaseOutcome.Status.RELEASED, manager.release(id, alice.id(), NOW + 2L).status());

        ReleaseOutcome again = manager.release(id, alice.id(), NOW + 3L);
        Assertions.assertEquals(ReleaseOutcome.Status.ALREADY_RELEASED, again.status());
        Assertions.assertEquals(NOW + 2L, again.reservation().releasedTs());

        Assertions.assertEquals(ReleaseOutcome.Status.NOT_FOUND, manager.release(999_999L, alice.id(), NOW).status());
    }

    @Test
    void sameAgentOverlapIsGrantedAndReported() {
        long first = manager.reserve(alice.id(), project.id(), "src/**", true, HOUR, "", NOW).reservation().id();
        ReservationGrant second = manager.reserve(alice.id(), project.id(), "src/a.py", true, HOUR, "", NOW + 1L);
        Assertions.assertTrue(second.granted());
        Assertions.assertEquals(1, second.ownOverlaps().size());
        Assertions.assertEquals(first, second.ownOverlaps().get(0).id());
        Assertions.assertEquals(2, manager.listActive(project.id(), null, NOW + 2L).size());
    }

    @Test
    void sharedReservationsCoexist() {
        Assertions.assertTrue(manager.reserve(alice.id(), project.id(), "src/**", false, HOUR, "", NOW).granted());
        Assertions.assertTrue(manager.reserve(bob.id(), project.id(), "src/a.py", false, HOUR, "", NOW + 1L).granted());
        Assertions.assertFalse(manager.reserve(bob.id(), project.id(), "src/b.py", true, HOUR, "", NOW + 2L).granted());
    }

    @Test
    void expiryIsEvaluatedLazily() {
        FileReservation brief = manager.reserve(alice.id(), project.id(), "src/**", true, 1_000L, "", NOW).reservation();
        Assertions.assertEquals(NOW + 1_000L, brief.expiresTs());
        Assertions.assertEquals(ReservationState.ACTIVE, brief.stateAt(NOW + 999L));
        Assertions.assertEquals(ReservationState.EXPIRED, brief.stateAt(NOW + 1_000L));
        Assertions.assertFalse(manager.reserve(bob.id(), project.id(), "src/x.py", true, HOUR, "", NOW + 999L).granted());
        Assertions.assertTrue(manager.reserve(bob.id(), project.id(), "src/x.py", true, HOUR, "", NOW + 1_000L).granted());

        List<FileReservation> active = manager.listActive(project.id(), "src/**", NOW + 1_000L);
        Assertions.assertEquals(1, active.size());
        Assertions.assertEquals(bob.id(), active.get(0).agentId());

        Assertions.assertEquals(ReleaseOutcome.Status.RELEASED, manager.release(brief.id(), alice.id(), NOW + 2_000L).status());
    }

    @Test
    void invalidRequestsAreRejectedBeforeAnyWrite() {
        assertValidation(() -> manager.reserve(alice.id(), project.id(), "src/**", true, 0L, "", NOW));
        assertValidation(() -> manager.reserve(alice.id(), project.id(), "src/**", true,
                CoordinationSettings.defaults().maxReservationTtlMs() + 1L, "", NOW));
        assertValidation(() -> manager.reserve(alice.id(), project.id(), " / ", true, HOUR, "", NOW));
        assertValidation(() -> manager.reserve(alice.id(), project.id(), "src/" + "a".repeat(600), true, HOUR, "", NOW));
        Assertions.assertTrue(manager.listActive(project.id(), null, NOW).isEmpty());

        CoordinationException unknown = Assertions.assertThrows(CoordinationException.class,
                () -> manager.reserve(424_242L, project.id(), "src/**", true, HOUR, "", NOW));
        Assertions.assertEquals(ErrorKind.UNKNOWN_AGENT, unknown.kind());
    }

    @Test
    void compactDeletesOnlyInactiveRowsPastRetention() {
        long released = manager.reserve(alice.id(), project.id(), "a/**", true, HOUR, "", NOW).reservation().id();
        manager.release(released, alice.id(), NOW + 10L);
        manager.reserve(alice.id(), project.id(), "b/**", true, 1_000L, "", NOW);
        manager.reserve(bob.id(), project.id(), "c/**", true, HOUR * 24L, "", NOW);

        Assertions.assertEquals(0, manager.compact(HOUR, NOW + 1_000L));
        Assertions.assertEquals(2, manager.compact(HOUR, NOW + 2L * HOUR));
        Assertions.assertEquals(1, manager.listForAgent(bob.id(), true, NOW + 2L * HOUR).size());
        Assertions.assertTrue(manager.listForAgent(alice.id(), true, NOW + 2L * HOUR).isEmpty());
    }

    @Test
    void concurrentOverlappingExclusiveReservesGrantExactlyOne() throws Exception {
        int workers = 4;
        List<Agent> agents = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            agents.add(directory.registerAgent(
                    AgentDirectory.Registration.of(project.id(), "worker-" + i, ContactPolicy.AUTO), NOW));
        }
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ReservationGrant>> futures = new ArrayList<>();
            for (Agent agent : agents) {
                Callable<ReservationGrant> task = () -> {
                    start.await();
                    return manager.reserve(agent.id(), project.id(), "shared/**", true, HOUR, "", NOW + 1L);
                };
                futures.add(pool.submit(task));
            }
            start.countDown();
            int granted = 0;
            for (Future<ReservationGrant> future : futures) {
                if (future.get(30, TimeUnit.SECONDS).granted()) {
                    granted++;
                }
            }
            Assertions.assertEquals(1, granted);
            Assertions.assertEquals(1, manager.listActive(project.id(), "shared/x", NOW + 2L).size());
        } finally {
            pool.shutdownNow();
        }
    }

    private static void assertValidation(Executable call) {
        CoordinationException e = Assertions.assertThrows(CoordinationException.class, call);
        Assertions.assertEquals(ErrorKind.VALIDATION, e.kind());
    }

    @Test
    void ttlThatOverflowsTheClockIsAValidationError() {
        Database db = new Database(AgentMailConfig.fromRoot(root.toString()));
        CoordinationSettings unbounded = new CoordinationSettings(HOUR, Long.MAX_VALUE, HOUR, 8, 8, 5_000);
        FileReservationManager lenient = new FileReservationManager(db, new DirectoryStore(), new ReservationStore(), unbounded);

        CoordinationException overflow = Assertions.assertThrows(CoordinationException.class,
                () -> lenient.reserve(alice.id(), project.id(), "src/**", true, Long.MAX_VALUE, "", NOW));
        Assertions.assertEquals(ErrorKind.VALIDATION, overflow.kind());
        Assertions.assertTrue(manager.listActive(project.id(), null, NOW).isEmpty());
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
