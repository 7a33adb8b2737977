package io.agentmail.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.agentmail.error.CoordinationException;

public enum AttachmentsPolicy {
    AUTO("auto"),
    INLINE("inline"),
    FILE("file");

    private final String wireValue;

    AttachmentsPolicy(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static AttachmentsPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO;
        }
        String v = raw.trim();
        for (AttachmentsPolicy value : values()) {
            if (value.name().equalsIgnoreCase(v) || value.wireValue.equalsIgnoreCase(v)) {
                return value;
            }
        }
        throw CoordinationException.validation("Unknown attachments policy: " + raw);
    }
}
