package io.agentmail.messaging;

import io.agentmail.config.CoordinationSettings;
import io.agentmail.error.CoordinationException;
import io.agentmail.error.DeliveryDeniedException;
import io.agentmail.error.ErrorKind;
import io.agentmail.model.Agent;
import io.agentmail.model.Attachment;
import io.agentmail.model.InboxEntry;
import io.agentmail.model.Message;
import io.agentmail.model.MessageRecipient;
import io.agentmail.model.Project;
import io.agentmail.model.RecipientKind;
import io.agentmail.policy.ContactDecision;
import io.agentmail.policy.ContactPolicyResolver;
import io.agentmail.storage.Database;
import io.agentmail.storage.DirectoryStore;
import io.agentmail.storage.MessageStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates messages, fans them out to recipients and tracks per-recipient read/ack state.
 *
 * <p>A send is all-or-nothing: every recipient is checked by the {@link ContactPolicyResolver}
 * inside the same transaction that writes the message, and a single denial rolls the whole send
 * back.
 */
public final class MessageDispatcher {
    public static final int MAX_SUBJECT_LENGTH = 512;
    public static final int MAX_THREAD_ID_LENGTH = 128;

    private final Database database;
    private final DirectoryStore directoryStore;
    private final MessageStore messageStore;
    private final ContactPolicyResolver resolver;
    private final CoordinationSettings settings;

    public MessageDispatcher(Database database, DirectoryStore directoryStore, MessageStore messageStore,
                             ContactPolicyResolver resolver, CoordinationSettings settings) {
        this.database = database;
        this.directoryStore = directoryStore;
        this.messageStore = messageStore;
        this.resolver = resolver;
        this.settings = settings;
    }

    public DeliveredMessage send(OutgoingMessage out, long nowMs) {
        validate(out);
        Map<Long, RecipientKind> distinct = distinctRecipients(out.recipients());
        List<Attachment> attachments = assignAttachmentIds(out.attachments());
        String threadId = out.threadId() == null || out.threadId().isBlank() ? null : out.threadId().trim();
        return database.inTransaction("send message", c -> {
            Agent sender = directoryStore.findAgent(c, out.senderId())
                    .orElseThrow(() -> CoordinationException.unknownAgent(out.senderId()));
            if (!sender.isActive()) {
                throw CoordinationException.inactiveAgent(sender.name());
            }
            if (sender.projectId() != out.projectId()) {
                throw CoordinationException.unknownAgent(sender.name() + " in project " + out.projectId());
            }

            List<DeliveryDeniedException.DeniedRecipient> denied = new ArrayList<>();
            for (Long recipientId : distinct.keySet()) {
                Agent recipient = directoryStore.findAgent(c, recipientId)
                        .orElseThrow(() -> CoordinationException.unknownAgent(recipientId));
                ContactDecision decision = resolver.canDeliver(c, sender, recipient, nowMs);
                if (!decision.allowed()) {
                    denied.add(new DeliveryDeniedException.DeniedRecipient(recipient.id(), recipient.name(), decision.reason()));
                }
            }
            if (!denied.isEmpty()) {
                throw new DeliveryDeniedException(denied);
            }

            Message message = messageStore.insertMessage(c, new MessageStore.NewMessage(
                    out.projectId(),
                    sender.id(),
                    threadId,
                    out.subject().trim(),
                    out.bodyMd() == null ? "" : out.bodyMd(),
                    out.importance(),
                    out.ackRequired(),
                    nowMs,
                    attachments
            ));
            List<MessageRecipient> recipients = new ArrayList<>(distinct.size());
            for (Map.Entry<Long, RecipientKind> entry : distinct.entrySet()) {
                recipients.add(messageStore.insertRecipient(c, message.id(), entry.getKey(), entry.getValue()));
            }
            directoryStore.touchAgent(c, sender.id(), nowMs);
            return new DeliveredMessage(message, List.copyOf(recipients));
        });
    }

    /**
     * Records that {@code agentId} read the message. The first call wins; later calls return the
     * stored timestamp unchanged.
     */
    public long markRead(long messageId, long agentId, long nowMs) {
        return database.inTransaction("mark message read", c -> {
            requireRecipient(c, messageId, agentId);
            messageStore.setReadIfUnset(c, messageId, agentId, nowMs);
            directoryStore.touchAgent(c, agentId, nowMs);
            return messageStore.findRecipient(c, messageId, agentId).orElseThrow().readTs();
        });
    }

    /**
     * Records an acknowledgement, and a read if none was recorded yet. Allowed whether or not the
     * message asked for one.
     */
    public long markAck(long messageId, long agentId, long nowMs) {
        return database.inTransaction("acknowledge message", c -> {
            requireRecipient(c, messageId, agentId);
            messageStore.setReadIfUnset(c, messageId, agentId, nowMs);
            messageStore.setAckIfUnset(c, messageId, agentId, nowMs);
            directoryStore.touchAgent(c, agentId, nowMs);
            return messageStore.findRecipient(c, messageId, agentId).orElseThrow().ackTs();
        });
    }

    public List<InboxEntry> fetchInbox(long agentId, Long sinceTs, int limit, boolean urgentOnly) {
        return database.read("fetch inbox", c -> {
            directoryStore.findAgent(c, agentId).orElseThrow(() -> CoordinationException.unknownAgent(agentId));
            return messageStore.inbox(c, agentId, sinceTs, urgentOnly, limit);
        });
    }

    public List<InboxEntry> listPendingAcks(long agentId, int limit) {
        return database.read("list pending acks", c -> messageStore.pendingAcks(c, agentId, limit));
    }

    public List<Message> listThread(long projectId, String threadKey) {
        if (threadKey == null || threadKey.isBlank()) {
            throw CoordinationException.validation("thread key must not be blank");
        }
        return database.read("list thread", c -> messageStore.thread(c, projectId, threadKey.trim()));
    }

    public List<MessageRecipient> listRecipients(long messageId) {
        return database.read("list recipients", c -> {
            messageStore.findMessage(c, messageId).orElseThrow(() -> CoordinationException.notFound("Message", messageId));
            return messageStore.listRecipients(c, messageId);
        });
    }

    /**
     * Inbox for an agent name across all projects of a product.
     */
    public List<InboxEntry> productInbox(List<Project> projects, String agentName, int limit) {
        List<Long> ids = projectIds(projects);
        return database.read("fetch product inbox", c -> messageStore.inboxByNameAcrossProjects(c, ids, agentName, limit));
    }

    public List<Message> searchProjects(List<Project> projects, String query, int limit) {
        if (query == null || query.isBlank()) {
            throw CoordinationException.validation("search query must not be blank");
        }
        List<Long> ids = projectIds(projects);
        return database.read("search messages", c -> messageStore.search(c, ids, query.trim(), limit));
    }

    private void requireRecipient(Connection c, long messageId, long agentId) throws SQLException {
        messageStore.findMessage(c, messageId).orElseThrow(() -> CoordinationException.notFound("Message", messageId));
        if (messageStore.findRecipient(c, messageId, agentId).isEmpty()) {
            throw new CoordinationException(
                    ErrorKind.NOT_RECIPIENT,
                    "Agent " + agentId + " is not a recipient of message " + messageId,
                    Map.of("message_id", messageId, "agent_id", agentId)
            );
        }
    }

    private void validate(OutgoingMessage out) {
        if (out.recipients().isEmpty()) {
            throw CoordinationException.validation("at least one recipient is required");
        }
        if (out.recipients().size() > settings.maxRecipients()) {
            throw CoordinationException.validation(
                    "too many recipients: " + out.recipients().size() + " > " + settings.maxRecipients());
        }
        if (out.subject() == null || out.subject().isBlank()) {
            throw CoordinationException.validation("subject must not be blank");
        }
        if (out.subject().trim().length() > MAX_SUBJECT_LENGTH) {
            throw CoordinationException.validation("subject longer than " + MAX_SUBJECT_LENGTH + " characters");
        }
        if (out.threadId() != null && out.threadId().trim().length() > MAX_THREAD_ID_LENGTH) {
            throw CoordinationException.validation("thread id longer than " + MAX_THREAD_ID_LENGTH + " characters");
        }
        if (out.attachments().size() > settings.maxAttachments()) {
            throw CoordinationException.validation(
                    "too many attachments: " + out.attachments().size() + " > " + settings.maxAttachments());
        }
        for (Attachment attachment : out.attachments()) {
            if (attachment.kind() == null) {
                throw CoordinationException.validation("attachment kind is required");
            }
            if (attachment.pointer() == null || attachment.pointer().isBlank()) {
                throw CoordinationException.validation("attachment pointer must not be blank");
            }
        }
    }

    /**
     * Collapses duplicate recipients in caller order; a {@code to} entry outranks a {@code cc} one.
     */
    static Map<Long, RecipientKind> distinctRecipients(List<RecipientSpec> specs) {
        Map<Long, RecipientKind> out = new LinkedHashMap<>();
        for (RecipientSpec spec : specs) {
            RecipientKind kind = spec.kind() == null ? RecipientKind.TO : spec.kind();
            RecipientKind previous = out.get(spec.agentId());
            if (previous == null || kind == RecipientKind.TO) {
                out.put(spec.agentId(), kind);
            }
        }
        return out;
    }

    private static List<Attachment> assignAttachmentIds(List<Attachment> attachments) {
        List<Attachment> out = new ArrayList<>(attachments.size());
        for (int i = 0; i < attachments.size(); i++) {
            Attachment a = attachments.get(i);
            out.add(a.id() == null || a.id().isBlank() ? a.withId("att-" + (i + 1)) : a);
        }
        return out;
    }

    private static List<Long> projectIds(List<Project> projects) {
        List<Long> ids = new ArrayList<>(projects.size());
        for (Project p : projects) {
            ids.add(p.id());
        }
        return ids;
    }
}
