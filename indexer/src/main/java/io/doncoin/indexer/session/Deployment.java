package io.doncoin.indexer.session;

import java.util.Locale;

public record Deployment(long blockNumber, String blockHash) {
    public Deployment {
        if (blockNumber < 0) {
            throw new IllegalArgumentException("blockNumber must be >= 0");
        }
        blockHash = blockHash == null ? "" : blockHash.trim().toLowerCase(Locale.ROOT);
        if (blockHash.isEmpty()) {
            throw new IllegalArgumentException("blockHash is required");
        }
    }
}
