package io.agentmail.model;

public record MessageRecipient(
        long messageId,
        long agentId,
        RecipientKind kind,
        Long readTs,
        Long ackTs
) {
}
