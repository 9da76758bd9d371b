package io.doncoin.indexer.event;

public interface ChainEvent {

    EventType type();
}
