package io.agentmail.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.agentmail.error.CoordinationException;

public enum RecipientKind {
    TO("to"),
    CC("cc");

    private final String wireValue;

    RecipientKind(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static RecipientKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return TO;
        }
        String v = raw.trim();
        for (RecipientKind value : values()) {
            if (value.name().equalsIgnoreCase(v) || value.wireValue.equalsIgnoreCase(v)) {
                return value;
            }
        }
        throw CoordinationException.validation("Unknown recipient kind: " + raw);
    }
}
