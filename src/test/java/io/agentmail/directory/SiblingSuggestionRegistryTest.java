package io.agentmail.directory;

import io.agentmail.config.AgentMailConfig;
import io.agentmail.error.CoordinationException;
import io.agentmail.error.ErrorKind;
import io.agentmail.model.Project;
import io.agentmail.model.SiblingStatus;
import io.agentmail.model.SiblingSuggestion;
import io.agentmail.storage.Database;
import io.agentmail.storage.DirectoryStore;
import io.agentmail.storage.ReservationStore;
import io.agentmail.storage.SiblingStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class SiblingSuggestionRegistryTest {
    private static final long NOW = 1_800_000_000_000L;

    @Test
    void suggestionsAreUniquePerUnorderedPair() throws Exception {
        Path root = Files.createTempDirectory("agentmail-test-siblings-");
        try {
            Database db = new Database(AgentMailConfig.fromRoot(root.toString()));
            db.init();
            DirectoryStore directoryStore = new DirectoryStore();
            AgentDirectory directory = new AgentDirectory(db, directoryStore, new ReservationStore());
            SiblingSuggestionRegistry registry = new SiblingSuggestionRegistry(db, directoryStore, new SiblingStore());
            Project backend = directory.ensureProject("/work/backend", NOW);
            Project frontend = directory.ensureProject("/work/frontend", NOW);

            SiblingSuggestion first = registry.suggest(frontend.id(), backend.id(), 0.4, "shared api", NOW);
            Assertions.assertEquals(Math.min(backend.id(), frontend.id()), first.projectAId());
            Assertions.assertEquals(Math.max(backend.id(), frontend.id()), first.projectBId());
            Assertions.assertEquals(SiblingStatus.SUGGESTED, first.status());

            SiblingSuggestion rescored = registry.suggest(backend.id(), frontend.id(), 0.9, "shared types", NOW + 1L);
            Assertions.assertEquals(first.id(), rescored.id());
            Assertions.assertEquals(0.9, rescored.score(), 1e-9);
            Assertions.assertEquals(NOW + 1L, rescored.evaluatedTs());

            SiblingSuggestion confirmed = registry.confirm(first.id(), NOW + 2L);
            Assertions.assertEquals(SiblingStatus.CONFIRMED, confirmed.status());
            Assertions.assertEquals(NOW + 2L, confirmed.confirmedTs());

            SiblingSuggestion untouched = registry.suggest(backend.id(), frontend.id(), 0.1, "", NOW + 3L);
            Assertions.assertEquals(0.9, untouched.score(), 1e-9);

            CoordinationException dismiss = Assertions.assertThrows(CoordinationException.class,
                    () -> registry.dismiss(first.id(), NOW + 4L));
            Assertions.assertEquals(ErrorKind.ILLEGAL_TRANSITION, dismiss.kind());

            CoordinationException self = Assertions.assertThrows(CoordinationException.class,
                    () -> registry.suggest(backend.id(), backend.id(), 1.0, "", NOW));
            Assertions.assertEquals(ErrorKind.VALIDATION, self.kind());

            Assertions.assertEquals(1, registry.listForProject(frontend.id()).size());
        } finally {
            deleteRecursively(root);
        }
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
