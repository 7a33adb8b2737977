package io.agentmail.model;

public record InboxEntry(
        Message message,
        long recipientId,
        RecipientKind kind,
        Long readTs,
        Long ackTs
) {
}
