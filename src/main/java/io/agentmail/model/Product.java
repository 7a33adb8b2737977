package io.agentmail.model;

public record Product(
        long id,
        String productUid,
        String name,
        long createdAt
) {
}
