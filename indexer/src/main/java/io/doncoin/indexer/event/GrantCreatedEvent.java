package io.doncoin.indexer.event;

import java.util.Locale;

public record GrantCreatedEvent(long grantId, String owner, String metadata) implements ChainEvent {

    public GrantCreatedEvent {
        owner = owner.toLowerCase(Locale.ROOT);
        metadata = metadata == null ? "" : metadata;
    }

    @Override
    public EventType type() {
        return EventType.GRANT_CREATED;
    }
}
