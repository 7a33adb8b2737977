package io.agentmail.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Directed contact-link state. {@link #BLOCKED} is terminal.
 */
public enum LinkStatus {
    PENDING,
    APPROVED,
    BLOCKED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean canTransitionTo(LinkStatus next) {
        return switch (this) {
            case PENDING -> next == APPROVED || next == BLOCKED;
            case APPROVED -> next == BLOCKED;
            case BLOCKED -> false;
        };
    }

    public static LinkStatus fromStored(String raw) {
        return LinkStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
