package io.agentmail.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.agentmail.error.CoordinationException;

public enum ContactPolicy {
    OPEN("open"),
    AUTO("auto"),
    CONTACTS_ONLY("contacts_only"),
    BLOCK_ALL("block_all");

    private final String wireValue;

    ContactPolicy(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ContactPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO;
        }
        String v = raw.trim();
        for (ContactPolicy value : values()) {
            if (value.name().equalsIgnoreCase(v) || value.wireValue.equalsIgnoreCase(v)) {
                return value;
            }
        }
        throw CoordinationException.validation("Unknown contact policy: " + raw);
    }
}
