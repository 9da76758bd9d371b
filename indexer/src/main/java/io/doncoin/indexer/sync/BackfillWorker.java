package io.doncoin.indexer.sync;

import io.doncoin.indexer.eth.EventLog;
import io.doncoin.indexer.event.BatchResult;
import io.doncoin.indexer.event.EventPersistenceException;
import io.doncoin.indexer.event.EventProcessor;
import io.doncoin.indexer.metrics.IndexerMetrics;
import io.doncoin.indexer.session.ChainSession;
import io.doncoin.indexer.sync.BackfillReport.ChunkFailure;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes an explicit block range in fixed-size chunks. A failed chunk is reported and skipped;
 * the live cursor is never read or written.
 */
public class BackfillWorker {

    private static final Logger log = LoggerFactory.getLogger(BackfillWorker.class);

    private final ChainSession session;
    private final LogFetcher logFetcher;
    private final EventProcessor eventProcessor;
    private final IndexerMetrics metrics;
    private final int chunkSize;

    public BackfillWorker(
        ChainSession session,
        LogFetcher logFetcher,
        EventProcessor eventProcessor,
        IndexerMetrics metrics,
        int chunkSize
    ) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        this.session = session;
        this.logFetcher = logFetcher;
        this.eventProcessor = eventProcessor;
        this.metrics = metrics;
        this.chunkSize = chunkSize;
    }

    public BackfillReport run(long fromBlock, long toBlock) {
        if (fromBlock < 0) {
            throw new IllegalArgumentException("fromBlock must be >= 0");
        }
        if (fromBlock > toBlock) {
            throw new IllegalArgumentException("fromBlock must be <= toBlock (from=" + fromBlock + ", to=" + toBlock + ")");
        }

        log.info("Backfill started. sessionId={}, from={}, to={}, chunkSize={}", session.sessionId(), fromBlock, toBlock, chunkSize);

        BatchResult outcomes = new BatchResult();
        List<ChunkFailure> failures = new ArrayList<>();
        int chunks = 0;

        for (long chunkStart = fromBlock; chunkStart <= toBlock; chunkStart += chunkSize) {
            long chunkEnd = Math.min(toBlock, chunkStart + chunkSize - 1L);
            chunks++;
            try {
                List<EventLog> logs = logFetcher.fetch(chunkStart, chunkEnd);
                BatchResult result = eventProcessor.processBatch(session, logs);
                outcomes.merge(result);
                log.info("Backfill chunk done from={} to={} logs={} outcomes={}", chunkStart, chunkEnd, logs.size(), result);
            } catch (Exception e) {
                log.error("Backfill chunk failed from={} to={}", chunkStart, chunkEnd, e);
                if (!(e instanceof EventPersistenceException)) {
                    metrics.recordError(IndexerMetrics.STAGE_CHUNK);
                }
                failures.add(new ChunkFailure(chunkStart, chunkEnd, String.valueOf(e.getMessage())));
            }
        }

        BackfillReport report = new BackfillReport(fromBlock, toBlock, chunks, failures, outcomes);
        log.info(
            "Backfill finished. from={}, to={}, chunks={}, failedChunks={}, outcomes={}",
            fromBlock,
            toBlock,
            chunks,
            failures.size(),
            outcomes
        );
        return report;
    }
}
