package io.doncoin.indexer.event;

import java.util.Optional;
import java.util.UUID;

public interface EventStore {

    boolean exists(String txHash, long logIndex, UUID sessionId);

    /**
     * Inserts {@code rawEvent}, plans mutations against the state visible in the same transaction and
     * applies them, all atomically. Returns empty when the raw event already existed, in which case
     * the planner is not called.
     *
     * @throws EventPersistenceException if the transaction could not be committed
     */
    Optional<HandlerResult> apply(RawEvent rawEvent, ProjectionPlanner planner);

    @FunctionalInterface
    interface ProjectionPlanner {
        HandlerResult plan(ProjectionView view);
    }
}
