package io.agentmail.model;

public record AgentLink(
        long id,
        long aProjectId,
        long aAgentId,
        long bProjectId,
        long bAgentId,
        LinkStatus status,
        String reason,
        long createdTs,
        long updatedTs,
        Long expiresTs
) {
    public boolean isApprovedAt(long nowMs) {
        return status == LinkStatus.APPROVED && (expiresTs == null || expiresTs > nowMs);
    }

    public boolean isBlocked() {
        return status == LinkStatus.BLOCKED;
    }
}
