package io.doncoin.indexer.session;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

public record ChainSession(
    UUID sessionId,
    String contractAddress,
    long deploymentBlockNumber,
    String deploymentBlockHash,
    Instant createdAt
) {
    public ChainSession {
        contractAddress = contractAddress.trim().toLowerCase(Locale.ROOT);
        deploymentBlockHash = deploymentBlockHash.trim().toLowerCase(Locale.ROOT);
    }
}
