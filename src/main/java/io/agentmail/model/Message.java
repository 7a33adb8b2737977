package io.agentmail.model;

import java.util.List;

public record Message(
        long id,
        long projectId,
        long senderId,
        String threadId,
        String subject,
        String bodyMd,
        Importance importance,
        boolean ackRequired,
        long createdTs,
        List<Attachment> attachments
) {
    /**
     * Thread this message belongs to. A message stored without {@code thread_id} roots its own thread.
     */
    public String threadKey() {
        return threadId == null ? String.valueOf(id) : threadId;
    }
}
