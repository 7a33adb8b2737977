package io.agentmail.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SiblingStatus {
    SUGGESTED,
    CONFIRMED,
    DISMISSED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean canTransitionTo(SiblingStatus next) {
        return this == SUGGESTED && (next == CONFIRMED || next == DISMISSED);
    }

    public static SiblingStatus fromStored(String raw) {
        return SiblingStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
