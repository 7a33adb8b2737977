package io.agentmail.directory;

import io.agentmail.error.CoordinationException;
import io.agentmail.model.Agent;
import io.agentmail.model.AttachmentsPolicy;
import io.agentmail.model.ContactPolicy;
import io.agentmail.model.Project;
import io.agentmail.storage.Database;
import io.agentmail.storage.DirectoryStore;
import io.agentmail.storage.ReservationStore;
import io.agentmail.util.Slugs;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Projects and the agents registered in them.
 */
public final class AgentDirectory {
    private static final Pattern AGENT_NAME = Pattern.compile("[A-Za-z0-9_-]{1,128}");
    private static final int MAX_PROFILE_FIELD = 128;
    private static final int MAX_TASK_DESCRIPTION = 2048;

    private final Database database;
    private final DirectoryStore directoryStore;
    private final ReservationStore reservationStore;

    public AgentDirectory(Database database, DirectoryStore directoryStore, ReservationStore reservationStore) {
        this.database = database;
        this.directoryStore = directoryStore;
        this.reservationStore = reservationStore;
    }

    /**
     * Returns the project for {@code humanKey}, creating it on first use.
     */
    public Project ensureProject(String humanKey, long nowMs) {
        if (humanKey == null || humanKey.isBlank()) {
            throw CoordinationException.validation("project key must not be blank");
        }
        String key = humanKey.trim();
        String slug;
        try {
            slug = Slugs.slugify(key);
        } catch (IllegalArgumentException e) {
            throw CoordinationException.validation(e.getMessage());
        }
        return database.inTransaction("ensure project " + slug, c -> {
            Optional<Project> existing = directoryStore.findProjectBySlug(c, slug);
            if (existing.isPresent()) {
                return existing.get();
            }
            return directoryStore.insertProject(c, slug, key, nowMs);
        });
    }

    public Optional<Project> findProject(String slug) {
        return database.read("find project", c -> directoryStore.findProjectBySlug(c, slug));
    }

    public Project requireProject(long projectId) {
        return database.read("find project", c -> directoryStore.findProject(c, projectId))
                .orElseThrow(() -> CoordinationException.notFound("Project", projectId));
    }

    /**
     * Registers a new agent, or refreshes the profile of an active agent with the same name.
     * A name retired by deregistration cannot be registered again.
     */
    public Agent registerAgent(Registration registration, long nowMs) {
        String name = registration.name() == null ? "" : registration.name().trim();
        if (!AGENT_NAME.matcher(name).matches()) {
            throw CoordinationException.validation("agent name must match " + AGENT_NAME.pattern() + ": " + registration.name());
        }
        DirectoryStore.AgentRegistration row = new DirectoryStore.AgentRegistration(
                registration.projectId(),
                name,
                clip(registration.program(), MAX_PROFILE_FIELD, "program"),
                clip(registration.model(), MAX_PROFILE_FIELD, "model"),
                clip(registration.taskDescription(), MAX_TASK_DESCRIPTION, "task description"),
                registration.attachmentsPolicy() == null ? AttachmentsPolicy.AUTO : registration.attachmentsPolicy(),
                registration.contactPolicy() == null ? ContactPolicy.AUTO : registration.contactPolicy()
        );
        return database.inTransaction("register agent " + name, c -> {
            directoryStore.findProject(c, row.projectId())
                    .orElseThrow(() -> CoordinationException.notFound("Project", row.projectId()));
            Optional<Agent> existing = directoryStore.findAgentByName(c, row.projectId(), name);
            if (existing.isEmpty()) {
                return directoryStore.insertAgent(c, row, nowMs);
            }
            Agent agent = existing.get();
            if (!agent.isActive()) {
                throw CoordinationException.conflict("agent name " + name + " was deregistered and cannot be reused");
            }
            directoryStore.updateAgentProfile(c, agent.id(), row, nowMs);
            return directoryStore.findAgent(c, agent.id()).orElseThrow();
        });
    }

    /**
     * Soft-deletes an agent and releases its active reservations in the same transaction.
     *
     * @return number of reservations released
     */
    public int deregisterAgent(long agentId, long nowMs) {
        return database.inTransaction("deregister agent " + agentId, c -> {
            Agent agent = directoryStore.findAgent(c, agentId)
                    .orElseThrow(() -> CoordinationException.unknownAgent(agentId));
            if (!agent.isActive()) {
                return 0;
            }
            directoryStore.markDeregistered(c, agentId, nowMs);
            return reservationStore.releaseAllActiveForAgent(c, agentId, nowMs);
        });
    }

    public Agent setContactPolicy(long agentId, ContactPolicy policy, long nowMs) {
        if (policy == null) {
            throw CoordinationException.validation("contact policy is required");
        }
        return database.inTransaction("set contact policy", c -> {
            Agent agent = directoryStore.findAgent(c, agentId)
                    .orElseThrow(() -> CoordinationException.unknownAgent(agentId));
            if (!agent.isActive()) {
                throw CoordinationException.inactiveAgent(agent.name());
            }
            directoryStore.updateContactPolicy(c, agentId, policy, nowMs);
            return directoryStore.findAgent(c, agentId).orElseThrow();
        });
    }

    public Optional<Agent> findAgent(long agentId) {
        return database.read("find agent", c -> directoryStore.findAgent(c, agentId));
    }

    public Optional<Agent> findAgent(long projectId, String name) {
        return database.read("find agent", c -> directoryStore.findAgentByName(c, projectId, name));
    }

    public Agent requireAgent(long projectId, String name) {
        return findAgent(projectId, name).orElseThrow(() -> CoordinationException.unknownAgent(name));
    }

    public List<Agent> listAgents(long projectId, boolean includeDeregistered) {
        return database.read("list agents", c -> directoryStore.listAgents(c, projectId, includeDeregistered));
    }

    private static String clip(String value, int max, String field) {
        String v = value == null ? "" : value.trim();
        if (v.length() > max) {
            throw CoordinationException.validation(field + " longer than " + max + " characters");
        }
        return v;
    }

    public record Registration(
            long projectId,
            String name,
            String program,
            String model,
            String taskDescription,
            AttachmentsPolicy attachmentsPolicy,
            ContactPolicy contactPolicy
    ) {
        public static Registration of(long projectId, String name, ContactPolicy contactPolicy) {
            return new Registration(projectId, name, "", "", "", AttachmentsPolicy.AUTO, contactPolicy);
        }
    }
}
