package io.agentmail.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.agentmail.error.CoordinationException;

public enum AttachmentKind {
    FILE("file"),
    INLINE("inline"),
    URL("url");

    private final String wireValue;

    AttachmentKind(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static AttachmentKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return FILE;
        }
        String v = raw.trim();
        for (AttachmentKind value : values()) {
            if (value.name().equalsIgnoreCase(v) || value.wireValue.equalsIgnoreCase(v)) {
                return value;
            }
        }
        throw CoordinationException.validation("Unknown attachment kind: " + raw);
    }
}
