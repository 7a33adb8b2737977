package io.agentmail.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.agentmail.error.CoordinationException;

public enum Importance {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    URGENT("urgent");

    private final String wireValue;

    Importance(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static Importance fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        String v = raw.trim();
        for (Importance value : values()) {
            if (value.name().equalsIgnoreCase(v) || value.wireValue.equalsIgnoreCase(v)) {
                return value;
            }
        }
        throw CoordinationException.validation("Unknown importance: " + raw);
    }
}
