package io.agentmail.reservation;

import io.agentmail.model.FileReservation;

public record ReleaseOutcome(Status status, FileReservation reservation) {
    public enum Status { RELEASED, ALREADY_RELEASED, NOT_OWNER, NOT_FOUND }

    public static ReleaseOutcome released(FileReservation reservation) {
        return new ReleaseOutcome(Status.RELEASED, reservation);
    }

    public static ReleaseOutcome alreadyReleased(FileReservation reservation) {
        return new ReleaseOutcome(Status.ALREADY_RELEASED, reservation);
    }

    public static ReleaseOutcome notOwner(FileReservation reservation) {
        return new ReleaseOutcome(Status.NOT_OWNER, reservation);
    }

    public static ReleaseOutcome notFound() {
        return new ReleaseOutcome(Status.NOT_FOUND, null);
    }

    public boolean released() {
        return status == Status.RELEASED;
    }
}
