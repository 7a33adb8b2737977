package io.agentmail.storage;

import io.agentmail.config.AgentMailConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class DatabaseTest {
    private static final long NOW = 1_800_000_000_000L;

    @Test
    void initIsRepeatableAndRecordsMigrationsOnce() throws Exception {
        Path root = Files.createTempDirectory("agentmail-test-db-");
        try {
            AgentMailConfig config = AgentMailConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            db.init();
            Assertions.assertTrue(Files.exists(config.dbFile()));

            List<Database.SchemaMigrationRow> rows = db.listSchemaMigrations(10);
            Assertions.assertEquals(2, rows.size());
            Assertions.assertTrue(rows.stream().allMatch(Database.SchemaMigrationRow::success));
            Assertions.assertTrue(rows.stream().anyMatch(r -> r.version().equals("20261019_001_agent_links_expiry")));
            Assertions.assertEquals(64, rows.get(0).checksum().length());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void agentsTableDeclaresPolicyColumns() throws Exception {
        Path root = Files.createTempDirectory("agentmail-test-db-");
        try {
            Database db = new Database(AgentMailConfig.fromRoot(root.toString()));
            db.init();
            List<String> columns = db.read("agent columns", c -> {
                List<String> out = new ArrayList<>();
                try (Statement st = c.createStatement();
                     ResultSet rs = st.executeQuery("PRAGMA table_info(agents)")) {
                    while (rs.next()) {
                        out.add(rs.getString("name"));
                    }
                }
                return out;
            });
            Assertions.assertTrue(columns.containsAll(List.of("attachments_policy", "contact_policy", "deregistered_ts")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedWorkRollsBackAndIsWrapped() throws Exception {
        Path root = Files.createTempDirectory("agentmail-test-db-");
        try {
            Database db = new Database(AgentMailConfig.fromRoot(root.toString()));
            db.init();
            DirectoryStore store = new DirectoryStore();
            db.inTransaction("create project", c -> store.insertProject(c, "alpha", "/alpha", NOW));

            RuntimeException duplicate = Assertions.assertThrows(RuntimeException.class,
                    () -> db.inTransaction("create duplicate", c -> {
                        store.insertProject(c, "beta", "/beta", NOW);
                        return store.insertProject(c, "alpha", "/alpha-again", NOW);
                    }));
            Assertions.assertEquals("Failed to create duplicate", duplicate.getMessage());
            Assertions.assertTrue(duplicate.getCause() instanceof SQLException);

            Assertions.assertTrue(db.read("find", c -> store.findProjectBySlug(c, "alpha")).isPresent());
            Assertions.assertTrue(db.read("find", c -> store.findProjectBySlug(c, "beta")).isEmpty());
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
