package io.doncoin.indexer.event;

import java.time.Instant;
import java.util.UUID;

public record RawEvent(
    UUID sessionId,
    String eventType,
    String contractAddress,
    String txHash,
    long logIndex,
    long blockNumber,
    String blockHash,
    Instant blockTimestamp,
    String decodedArgsJson,
    Instant observedAt
) {
}
