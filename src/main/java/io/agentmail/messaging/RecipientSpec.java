package io.agentmail.messaging;

import io.agentmail.model.RecipientKind;

public record RecipientSpec(long agentId, RecipientKind kind) {
    public static RecipientSpec to(long agentId) {
        return new RecipientSpec(agentId, RecipientKind.TO);
    }

    public static RecipientSpec cc(long agentId) {
        return new RecipientSpec(agentId, RecipientKind.CC);
    }
}
