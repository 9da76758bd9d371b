package io.doncoin.indexer.event;

import java.time.Instant;
import java.util.UUID;

public record EventContext(UUID sessionId, String txHash, long logIndex, long blockNumber, Instant blockTimestamp) {
}
