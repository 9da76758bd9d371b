package io.doncoin.indexer.eth;

import java.time.Instant;

public record BlockHeader(long number, String hash, Instant timestamp) {
}
