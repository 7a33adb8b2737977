package io.agentmail.messaging;

import io.agentmail.model.Attachment;
import io.agentmail.model.Importance;

import java.util.List;

/**
 * Everything a sender supplies for one send. {@code threadId} is null to start a new thread.
 */
public record OutgoingMessage(
        long senderId,
        long projectId,
        List<RecipientSpec> recipients,
        String subject,
        String bodyMd,
        Importance importance,
        boolean ackRequired,
        List<Attachment> attachments,
        String threadId
) {
    public OutgoingMessage {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        importance = importance == null ? Importance.NORMAL : importance;
    }
}
