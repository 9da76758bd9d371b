package io.doncoin.indexer.config;

import io.doncoin.indexer.eth.AbiEventDefinition;
import java.util.List;
import java.util.Locale;

public record WatchedContract(
    String name,
    String address,
    List<AbiEventDefinition> events
) {
    public WatchedContract {
        name = name == null ? "" : name.trim();
        address = address == null ? "" : address.trim().toLowerCase(Locale.ROOT);
        events = events == null ? List.of() : List.copyOf(events);
    }

    public boolean isWatched() {
        return !events.isEmpty();
    }
}
