package io.doncoin.indexer.store;

import java.util.Optional;
import java.util.UUID;

public interface CursorStore extends AutoCloseable {

    Optional<Long> loadLastProcessedBlock(UUID sessionId);

    void saveLastProcessedBlock(UUID sessionId, long blockNumber);

    @Override
    default void close() {
    }
}
