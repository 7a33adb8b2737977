package io.agentmail.model;

public record FileReservation(
        long id,
        long projectId,
        long agentId,
        String pathPattern,
        boolean exclusive,
        String reason,
        long createdTs,
        long expiresTs,
        Long releasedTs
) {
    /**
     * Lifecycle state at {@code nowMs}. Expiry is evaluated here, lazily; nothing sweeps expired rows.
     */
    public ReservationState stateAt(long nowMs) {
        if (releasedTs != null) {
            return ReservationState.RELEASED;
        }
        if (expiresTs <= nowMs) {
            return ReservationState.EXPIRED;
        }
        return ReservationState.ACTIVE;
    }
}
