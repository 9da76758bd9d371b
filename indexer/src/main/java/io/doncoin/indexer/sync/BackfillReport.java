package io.doncoin.indexer.sync;

import io.doncoin.indexer.event.BatchResult;
import java.util.List;

public record BackfillReport(
    long fromBlock,
    long toBlock,
    int chunks,
    List<ChunkFailure> failures,
    BatchResult outcomes
) {
    public BackfillReport {
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public record ChunkFailure(long fromBlock, long toBlock, String error) {
    }
}
