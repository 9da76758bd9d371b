package io.doncoin.indexer.event;

/**
 * Plans projection mutations for one event type. Implementations only read through {@code view};
 * every write is returned as a {@link ProjectionMutation}.
 */
public interface EventHandler<E extends ChainEvent> {

    HandlerResult handle(E event, EventContext context, ProjectionView view);
}
