package io.doncoin.indexer.event;

import java.util.List;
import java.util.UUID;

/**
 * Mutations planned for one event, plus the proposal/round the raw event row links to.
 * A non-null {@code warning} marks the event inconsistent; it then carries no mutations.
 */
public record HandlerResult(
    List<ProjectionMutation> mutations,
    UUID proposalId,
    UUID roundId,
    String warning
) {
    public HandlerResult {
        mutations = List.copyOf(mutations);
    }

    public static HandlerResult none() {
        return new HandlerResult(List.of(), null, null, null);
    }

    public static HandlerResult inconsistent(String warning) {
        return new HandlerResult(List.of(), null, null, warning);
    }

    public boolean inconsistent() {
        return warning != null;
    }
}
