package io.agentmail.model;

public record SiblingSuggestion(
        long id,
        long projectAId,
        long projectBId,
        double score,
        SiblingStatus status,
        String rationale,
        long createdTs,
        long evaluatedTs,
        Long confirmedTs,
        Long dismissedTs
) {
}
