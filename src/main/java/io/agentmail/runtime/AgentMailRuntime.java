package io.agentmail.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmail.config.AgentMailConfig;
import io.agentmail.config.CoordinationSettings;
import io.agentmail.directory.AgentDirectory;
import io.agentmail.directory.ProductCatalog;
import io.agentmail.directory.SiblingSuggestionRegistry;
import io.agentmail.error.CoordinationException;
import io.agentmail.error.DeliveryDeniedException;
import io.agentmail.link.LinkLifecycleManager;
import io.agentmail.messaging.DeliveredMessage;
import io.agentmail.messaging.MessageDispatcher;
import io.agentmail.messaging.OutgoingMessage;
import io.agentmail.model.Agent;
import io.agentmail.model.AgentLink;
import io.agentmail.model.ContactPolicy;
import io.agentmail.model.FileReservation;
import io.agentmail.model.InboxEntry;
import io.agentmail.model.Message;
import io.agentmail.model.MessageRecipient;
import io.agentmail.model.Product;
import io.agentmail.model.Project;
import io.agentmail.model.SiblingSuggestion;
import io.agentmail.observability.AuditLogger;
import io.agentmail.policy.ContactDecision;
import io.agentmail.policy.ContactPolicyResolver;
import io.agentmail.reservation.FileReservationManager;
import io.agentmail.reservation.ReleaseOutcome;
import io.agentmail.reservation.ReservationGrant;
import io.agentmail.storage.Database;
import io.agentmail.storage.DirectoryStore;
import io.agentmail.storage.LinkStore;
import io.agentmail.storage.MessageStore;
import io.agentmail.storage.ReservationStore;
import io.agentmail.storage.SiblingStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class AgentMailRuntime {
    public static final int DEFAULT_INBOX_LIMIT = 20;

    private final AgentMailConfig config;
    private final Clock clock;
    private final CoordinationSettings settings;
    private final Database database;
    private final DirectoryStore directoryStore;
    private final AgentDirectory directory;
    private final ProductCatalog productCatalog;
    private final SiblingSuggestionRegistry siblings;
    private final ContactPolicyResolver resolver;
    private final FileReservationManager reservations;
    private final MessageDispatcher dispatcher;
    private final LinkLifecycleManager links;
    private final AuditLogger auditLogger;

    public AgentMailRuntime(AgentMailConfig config) {
        this(config, Clock.systemUTC());
    }

    public AgentMailRuntime(AgentMailConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.settings = CoordinationSettings.load(config.settingsFile());
        this.database = new Database(config, settings.busyTimeoutMs());
        this.directoryStore = new DirectoryStore();
        ReservationStore reservationStore = new ReservationStore();
        LinkStore linkStore = new LinkStore();
        this.directory = new AgentDirectory(database, directoryStore, reservationStore);
        this.productCatalog = new ProductCatalog(database, directoryStore);
        this.siblings = new SiblingSuggestionRegistry(database, directoryStore, new SiblingStore());
        this.resolver = new ContactPolicyResolver(directoryStore, linkStore);
        this.reservations = new FileReservationManager(database, directoryStore, reservationStore, settings);
        this.dispatcher = new MessageDispatcher(database, directoryStore, new MessageStore(), resolver, settings);
        this.links = new LinkLifecycleManager(database, directoryStore, linkStore);
        this.auditLogger = new AuditLogger(config.auditFile(), clock);
    }

    public void init() {
        database.init();
    }

    public AgentMailConfig config() {
        return config;
    }

    public CoordinationSettings settings() {
        return settings;
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    // Projects and agents

    public Project ensureProject(String humanKey) {
        Project project = directory.ensureProject(humanKey, nowMs());
        audit("project.ensure", "operator", "project/" + project.slug(), Map.of("human_key", project.humanKey()));
        return project;
    }

    public Optional<Project> findProject(String slug) {
        return directory.findProject(slug);
    }

    public Agent registerAgent(AgentDirectory.Registration registration) {
        Agent agent = directory.registerAgent(registration, nowMs());
        audit("agent.register", agentActor(agent.id()), "agent/" + agent.name(), Map.of(
                "project_id", agent.projectId(),
                "program", agent.program(),
                "model", agent.model(),
                "contact_policy", agent.contactPolicy().wireValue()
        ));
        return agent;
    }

    public int deregisterAgent(long agentId) {
        int released = directory.deregisterAgent(agentId, nowMs());
        audit("agent.deregister", agentActor(agentId), "agent/" + agentId, Map.of("reservations_released", released));
        return released;
    }

    public Agent setContactPolicy(long agentId, ContactPolicy policy) {
        Agent agent = directory.setContactPolicy(agentId, policy, nowMs());
        audit("agent.contact_policy", agentActor(agentId), "agent/" + agent.name(),
                Map.of("contact_policy", policy.wireValue()));
        return agent;
    }

    public Optional<Agent> findAgent(long agentId) {
        return directory.findAgent(agentId);
    }

    public Agent requireAgent(long projectId, String name) {
        return directory.requireAgent(projectId, name);
    }

    public List<Agent> listAgents(long projectId, boolean includeDeregistered) {
        return directory.listAgents(projectId, includeDeregistered);
    }

    // Products

    public Product ensureProduct(String name) {
        Product product = productCatalog.ensureProduct(name, nowMs());
        audit("product.ensure", "operator", "product/" + product.productUid(), Map.of("name", product.name()));
        return product;
    }

    public boolean linkProjectToProduct(long productId, long projectId) {
        boolean linked = productCatalog.linkProject(productId, projectId, nowMs());
        audit("product.link_project", "operator", "product/" + productId,
                Map.of("project_id", projectId, "created", linked));
        return linked;
    }

    public List<Project> productProjects(long productId) {
        return productCatalog.listProjects(productId);
    }

    public List<InboxEntry> productInbox(String productName, String agentName, int limit) {
        return dispatcher.productInbox(requireProductProjects(productName), agentName, limit);
    }

    public List<Message> searchProduct(String productName, String query, int limit) {
        return dispatcher.searchProjects(requireProductProjects(productName), query, limit);
    }

    public List<Message> searchProject(long projectId, String query, int limit) {
        return dispatcher.searchProjects(List.of(directory.requireProject(projectId)), query, limit);
    }

    // Contact policy

    public ContactDecision canDeliver(long senderId, long recipientId) {
        long now = nowMs();
        return database.read("resolve contact policy", c -> resolver.canDeliver(c, senderId, recipientId, now));
    }

    // File reservations

    /**
     * @param ttlMs null for the configured default
     */
    public ReservationGrant reserve(long agentId, long projectId, String pathPattern, boolean exclusive, Long ttlMs,
                                    String reason) {
        long ttl = ttlMs == null ? settings.defaultReservationTtlMs() : ttlMs;
        ReservationGrant grant = reservations.reserve(agentId, projectId, pathPattern, exclusive, ttl, reason, nowMs());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("project_id", projectId);
        details.put("path_pattern", pathPattern);
        details.put("exclusive", exclusive);
        if (grant.granted()) {
            details.put("reservation_id", grant.reservation().id());
            details.put("expires_ts", grant.reservation().expiresTs());
            audit("reservation.reserve", agentActor(agentId), "project/" + projectId, details);
        } else {
            details.put("conflicting_ids", reservationIds(grant.conflicts()));
            auditLogger.log(AuditLogger.AuditEvent.denied(
                    "reservation.reserve", agentActor(agentId), "project/" + projectId, details));
        }
        return grant;
    }

    public ReleaseOutcome release(long reservationId, long agentId) {
        ReleaseOutcome outcome = reservations.release(reservationId, agentId, nowMs());
        auditLogger.log(new AuditLogger.AuditEvent(
                "reservation.release",
                agentActor(agentId),
                "reservation/" + reservationId,
                outcome.status().name().toLowerCase(Locale.ROOT),
                Map.of()
        ));
        return outcome;
    }

    public List<FileReservation> listActiveReservations(long projectId, String pathPattern) {
        return reservations.listActive(projectId, pathPattern, nowMs());
    }

    public List<FileReservation> listAgentReservations(long agentId, boolean includeInactive) {
        return reservations.listForAgent(agentId, includeInactive, nowMs());
    }

    /**
     * Deletes inactive reservations older than the configured retention window.
     */
    public int compactReservations() {
        int deleted = reservations.compact(settings.reservationRetentionMs(), nowMs());
        audit("reservation.compact", "operator", "reservations",
                Map.of("deleted", deleted, "retention_ms", settings.reservationRetentionMs()));
        return deleted;
    }

    // Messaging

    public DeliveredMessage send(OutgoingMessage message) {
        try {
            DeliveredMessage delivered = dispatcher.send(message, nowMs());
            List<Long> recipientIds = new ArrayList<>();
            for (MessageRecipient r : delivered.recipients()) {
                recipientIds.add(r.agentId());
            }
            audit("message.send", agentActor(message.senderId()), "message/" + delivered.message().id(), Map.of(
                    "thread", delivered.message().threadKey(),
                    "recipients", recipientIds,
                    "importance", delivered.message().importance().wireValue(),
                    "attachments", delivered.message().attachments()
            ));
            return delivered;
        } catch (DeliveryDeniedException e) {
            List<Map<String, Object>> denied = new ArrayList<>();
            for (DeliveryDeniedException.DeniedRecipient r : e.deniedRecipients()) {
                denied.add(Map.of("agent_id", r.agentId(), "reason", r.reason()));
            }
            auditLogger.log(AuditLogger.AuditEvent.denied(
                    "message.send", agentActor(message.senderId()), "project/" + message.projectId(),
                    Map.of("denied", denied)));
            throw e;
        }
    }

    public long markRead(long messageId, long agentId) {
        long readTs = dispatcher.markRead(messageId, agentId, nowMs());
        audit("message.read", agentActor(agentId), "message/" + messageId, Map.of("read_ts", readTs));
        return readTs;
    }

    public long markAck(long messageId, long agentId) {
        long ackTs = dispatcher.markAck(messageId, agentId, nowMs());
        audit("message.ack", agentActor(agentId), "message/" + messageId, Map.of("ack_ts", ackTs));
        return ackTs;
    }

    public List<InboxEntry> fetchInbox(long agentId, Long sinceTs, int limit, boolean urgentOnly) {
        return dispatcher.fetchInbox(agentId, sinceTs, limit <= 0 ? DEFAULT_INBOX_LIMIT : limit, urgentOnly);
    }

    public List<InboxEntry> listPendingAcks(long agentId, int limit) {
        return dispatcher.listPendingAcks(agentId, limit <= 0 ? DEFAULT_INBOX_LIMIT : limit);
    }

    public List<Message> listThread(long projectId, String threadKey) {
        return dispatcher.listThread(projectId, threadKey);
    }

    public List<MessageRecipient> listRecipients(long messageId) {
        return dispatcher.listRecipients(messageId);
    }

    // Links

    public AgentLink requestLink(long fromAgentId, long toAgentId, String reason) {
        AgentLink link = links.requestLink(fromAgentId, toAgentId, reason, nowMs());
        audit("link.request", agentActor(fromAgentId), "link/" + link.id(),
                Map.of("to_agent_id", toAgentId, "status", link.status().wireValue()));
        return link;
    }

    public AgentLink approveLink(long linkId, long approverId, Long ttlMs) {
        AgentLink link = links.approve(linkId, approverId, ttlMs, nowMs());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expires_ts", link.expiresTs());
        audit("link.approve", agentActor(approverId), "link/" + linkId, details);
        return link;
    }

    public AgentLink blockLink(long linkId, long actorId) {
        AgentLink link = links.block(linkId, actorId, nowMs());
        audit("link.block", agentActor(actorId), "link/" + linkId, Map.of());
        return link;
    }

    public List<AgentLink> listLinks(long agentId) {
        return links.listLinks(agentId);
    }

    // Sibling suggestions

    public SiblingSuggestion suggestSiblings(long projectId, long otherProjectId, double score, String rationale) {
        SiblingSuggestion s = siblings.suggest(projectId, otherProjectId, score, rationale, nowMs());
        audit("sibling.suggest", "operator", "sibling/" + s.id(), Map.of("score", s.score()));
        return s;
    }

    public SiblingSuggestion confirmSiblings(long suggestionId) {
        SiblingSuggestion s = siblings.confirm(suggestionId, nowMs());
        audit("sibling.confirm", "operator", "sibling/" + suggestionId, Map.of());
        return s;
    }

    public SiblingSuggestion dismissSiblings(long suggestionId) {
        SiblingSuggestion s = siblings.dismiss(suggestionId, nowMs());
        audit("sibling.dismiss", "operator", "sibling/" + suggestionId, Map.of());
        return s;
    }

    public List<SiblingSuggestion> listSiblingSuggestions(long projectId) {
        return siblings.listForProject(projectId);
    }

    // Audit

    public List<JsonNode> auditTail(int limit) {
        return auditLogger.tail(limit);
    }

    public int verifyAuditChain() {
        return auditLogger.verifyChain();
    }

    private List<Project> requireProductProjects(String productName) {
        Product product = productCatalog.findProduct(productName)
                .orElseThrow(() -> CoordinationException.notFound("Product", productName));
        return productCatalog.listProjects(product.id());
    }

    private void audit(String action, String actor, String resource, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.ok(action, actor, resource, details));
    }

    private long nowMs() {
        return clock.millis();
    }

    private static String agentActor(long agentId) {
        return "agent/" + agentId;
    }

    private static List<Long> reservationIds(List<FileReservation> rows) {
        List<Long> ids = new ArrayList<>(rows.size());
        for (FileReservation r : rows) {
            ids.add(r.id());
        }
        return ids;
    }
}
