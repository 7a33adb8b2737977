package io.agentmail.model;

public record Project(
        long id,
        String slug,
        String humanKey,
        long createdAt
) {
}
