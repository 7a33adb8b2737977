package io.agentmail.model;

public enum ReservationState {
    ACTIVE,
    RELEASED,
    EXPIRED
}
