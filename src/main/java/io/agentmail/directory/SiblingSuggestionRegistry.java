package io.agentmail.directory;

import io.agentmail.error.CoordinationException;
import io.agentmail.model.SiblingStatus;
import io.agentmail.model.SiblingSuggestion;
import io.agentmail.storage.Database;
import io.agentmail.storage.DirectoryStore;
import io.agentmail.storage.SiblingStore;

import java.util.List;
import java.util.Optional;

/**
 * Bookkeeping for sibling-project suggestions produced elsewhere. Pairs are unordered: (a, b) and
 * (b, a) address the same row.
 */
public final class SiblingSuggestionRegistry {
    private static final int MAX_RATIONALE_LENGTH = 4096;

    private final Database database;
    private final DirectoryStore directoryStore;
    private final SiblingStore siblingStore;

    public SiblingSuggestionRegistry(Database database, DirectoryStore directoryStore, SiblingStore siblingStore) {
        this.database = database;
        this.directoryStore = directoryStore;
        this.siblingStore = siblingStore;
    }

    public SiblingSuggestion suggest(long projectId, long otherProjectId, double score, String rationale, long nowMs) {
        if (projectId == otherProjectId) {
            throw CoordinationException.validation("a project cannot be its own sibling");
        }
        String safeRationale = rationale == null ? "" : rationale.trim();
        if (safeRationale.length() > MAX_RATIONALE_LENGTH) {
            throw CoordinationException.validation("rationale longer than " + MAX_RATIONALE_LENGTH + " characters");
        }
        long low = Math.min(projectId, otherProjectId);
        long high = Math.max(projectId, otherProjectId);
        return database.inTransaction("suggest sibling projects", c -> {
            directoryStore.findProject(c, low).orElseThrow(() -> CoordinationException.notFound("Project", low));
            directoryStore.findProject(c, high).orElseThrow(() -> CoordinationException.notFound("Project", high));
            Optional<SiblingSuggestion> existing = siblingStore.findPair(c, low, high);
            if (existing.isEmpty()) {
                return siblingStore.insert(c, low, high, score, safeRationale, nowMs);
            }
            SiblingSuggestion current = existing.get();
            if (current.status() == SiblingStatus.SUGGESTED) {
                siblingStore.refreshEvaluation(c, current.id(), score, safeRationale, nowMs);
                return siblingStore.find(c, current.id()).orElseThrow();
            }
            return current;
        });
    }

    public SiblingSuggestion confirm(long suggestionId, long nowMs) {
        return transition(suggestionId, SiblingStatus.CONFIRMED, nowMs);
    }

    public SiblingSuggestion dismiss(long suggestionId, long nowMs) {
        return transition(suggestionId, SiblingStatus.DISMISSED, nowMs);
    }

    public List<SiblingSuggestion> listForProject(long projectId) {
        return database.read("list sibling suggestions", c -> siblingStore.listForProject(c, projectId));
    }

    private SiblingSuggestion transition(long suggestionId, SiblingStatus next, long nowMs) {
        return database.inTransaction("update sibling suggestion " + suggestionId, c -> {
            SiblingSuggestion current = siblingStore.find(c, suggestionId)
                    .orElseThrow(() -> CoordinationException.notFound("Sibling suggestion", suggestionId));
            if (!current.status().canTransitionTo(next) || !siblingStore.updateStatus(c, suggestionId, next, nowMs)) {
                throw CoordinationException.illegalTransition("sibling suggestion " + suggestionId, current.status(), next);
            }
            return siblingStore.find(c, suggestionId).orElseThrow();
        });
    }
}
