package dev.upgrader.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Result of one catalog cycle. {@code selectedIds} are the keys that were tagged
 * (movie IDs or episode-file IDs); {@code searchedIds} are the IDs sent in the search
 * command.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CycleOutcome(CatalogKind kind, CycleState state, List<Integer> selectedIds,
                           List<Integer> searchedIds, String error) {

    public static CycleOutcome disabled(CatalogKind kind) {
        return new CycleOutcome(kind, CycleState.DISABLED, List.of(), List.of(), null);
    }

    public static CycleOutcome fullCycle(CatalogKind kind) {
        return new CycleOutcome(kind, CycleState.FULL_CYCLE, List.of(), List.of(), null);
    }

    public static CycleOutcome noCandidates(CatalogKind kind) {
        return new CycleOutcome(kind, CycleState.NO_CANDIDATES, List.of(), List.of(), null);
    }

    public static CycleOutcome upgraded(CatalogKind kind, List<Integer> selectedIds, List<Integer> searchedIds) {
        return new CycleOutcome(kind, CycleState.HAS_CANDIDATES, List.copyOf(selectedIds), List.copyOf(searchedIds), null);
    }

    public static CycleOutcome failed(CatalogKind kind, Throwable error) {
        return new CycleOutcome(kind, CycleState.FAILED, List.of(), List.of(),
                error.getClass().getSimpleName() + ": " + error.getMessage());
    }

    public boolean isFailed() {
        return state == CycleState.FAILED;
    }
}
