package io.agentmail.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmail.config.AgentMailConfig;
import io.agentmail.model.FileReservation;
import io.agentmail.model.Project;
import io.agentmail.runtime.AgentMailRuntime;
import io.agentmail.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Operator commands over a data root. Agents talk to the runtime through their own transport;
 * nothing here sends mail or takes reservations.
 */
@Command(
        name = "agentmail",
        mixinStandardHelpOptions = true,
        description = "Agent mail coordination store administration",
        subcommands = {
                AgentMailCommand.InitCommand.class,
                AgentMailCommand.SchemaMigrationsCommand.class,
                AgentMailCommand.ReservationsCommand.class,
                AgentMailCommand.CompactCommand.class,
                AgentMailCommand.AuditTailCommand.class,
                AgentMailCommand.AuditVerifyCommand.class
        }
)
public final class AgentMailCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | schema-migrations | reservations | compact | audit-tail | audit-verify");
    }

    AgentMailRuntime runtime() {
        AgentMailRuntime runtime = new AgentMailRuntime(AgentMailConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AgentMailCommand parent;

        @Override
        public Integer call() {
            AgentMailRuntime runtime = parent.runtime();
            System.out.println("Initialized agent mail store at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migration versions")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        AgentMailCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().schemaMigrations(limit)));
            return 0;
        }
    }

    @Command(name = "reservations", description = "List active file reservations of a project")
    static final class ReservationsCommand implements Callable<Integer> {
        @ParentCommand
        AgentMailCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project slug")
        String project;

        @Option(names = {"--pattern"}, description = "Only reservations overlapping this glob")
        String pattern;

        @Override
        public Integer call() {
            AgentMailRuntime runtime = parent.runtime();
            Optional<Project> found = runtime.findProject(project);
            if (found.isEmpty()) {
                System.out.println("{\"error\":\"project not found\"}");
                return 1;
            }
            List<FileReservation> active = runtime.listActiveReservations(found.get().id(), pattern);
            System.out.println(Jsons.toJson(active));
            return 0;
        }
    }

    @Command(name = "compact", description = "Delete released or expired reservations past the retention window")
    static final class CompactCommand implements Callable<Integer> {
        @ParentCommand
        AgentMailCommand parent;

        @Override
        public Integer call() {
            AgentMailRuntime runtime = parent.runtime();
            int deleted = runtime.compactReservations();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("deleted", deleted);
            out.put("retentionMs", runtime.settings().reservationRetentionMs());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        AgentMailCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest rows")
        int lines;

        @Override
        public Integer call() {
            for (JsonNode row : parent.runtime().auditTail(lines)) {
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        AgentMailCommand parent;

        @Override
        public Integer call() {
            try {
                int rows = parent.runtime().verifyAuditChain();
                System.out.println("{\"ok\":true,\"rows\":" + rows + "}");
                return 0;
            } catch (IllegalStateException e) {
                System.out.println(Jsons.toCompactJson(Map.of("ok", false, "error", e.getMessage())));
                return 2;
            }
        }
    }
}
