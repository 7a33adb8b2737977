package io.agentmail.reservation;

import io.agentmail.model.FileReservation;

import java.util.List;

/**
 * Outcome of a reserve request.
 *
 * @param reservation  the new reservation, null on conflict
 * @param conflicts    active reservations of other agents that block the request
 * @param ownOverlaps  the caller's own active reservations overlapping the new one; they stay active
 */
public record ReservationGrant(FileReservation reservation, List<FileReservation> conflicts, List<FileReservation> ownOverlaps) {
    public static ReservationGrant granted(FileReservation reservation, List<FileReservation> ownOverlaps) {
        return new ReservationGrant(reservation, List.of(), List.copyOf(ownOverlaps));
    }

    public static ReservationGrant conflict(List<FileReservation> conflicts) {
        return new ReservationGrant(null, List.copyOf(conflicts), List.of());
    }

    public boolean granted() {
        return reservation != null;
    }
}
