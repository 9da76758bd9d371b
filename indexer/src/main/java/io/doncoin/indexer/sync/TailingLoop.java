package io.doncoin.indexer.sync;

import io.doncoin.indexer.config.IndexerConfig;
import io.doncoin.indexer.eth.ChainRpcClient;
import io.doncoin.indexer.eth.EventLog;
import io.doncoin.indexer.event.BatchResult;
import io.doncoin.indexer.event.EventPersistenceException;
import io.doncoin.indexer.event.EventProcessor;
import io.doncoin.indexer.metrics.IndexerMetrics;
import io.doncoin.indexer.session.ChainSession;
import io.doncoin.indexer.store.CursorStore;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TailingLoop {

    private static final Logger log = LoggerFactory.getLogger(TailingLoop.class);

    private final IndexerConfig config;
    private final ChainSession session;
    private final ChainRpcClient rpcClient;
    private final LogFetcher logFetcher;
    private final EventProcessor eventProcessor;
    private final CursorStore cursorStore;
    private final IndexerMetrics metrics;
    private final Sleeper sleeper;

    public TailingLoop(
        IndexerConfig config,
        ChainSession session,
        ChainRpcClient rpcClient,
        LogFetcher logFetcher,
        EventProcessor eventProcessor,
        CursorStore cursorStore,
        IndexerMetrics metrics,
        Sleeper sleeper
    ) {
        this.config = config;
        this.session = session;
        this.rpcClient = rpcClient;
        this.logFetcher = logFetcher;
        this.eventProcessor = eventProcessor;
        this.cursorStore = cursorStore;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    public void run() {
        log.info(
            "Tailing loop started. sessionId={}, confirmations={}, maxBlockRange={}, startLastProcessedBlock={}",
            session.sessionId(),
            config.confirmations(),
            config.maxBlockRange(),
            lastProcessedBlock()
        );

        while (!Thread.currentThread().isInterrupted()) {
            boolean idle;
            try {
                idle = tick();
            } catch (Exception e) {
                log.error("Tail tick failed, retrying the same window. sessionId={}", session.sessionId(), e);
                // the processor has already counted its own persistence failures
                if (!(e instanceof EventPersistenceException)) {
                    metrics.recordError(IndexerMetrics.STAGE_TICK);
                }
                idle = true;
            }
            if (idle) {
                pause();
            }
        }
        log.info("Tailing loop stopped. sessionId={}", session.sessionId());
    }

    private void pause() {
        try {
            sleeper.sleep(config.pollIntervalMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Processes at most one window. Returns true when the cursor has reached the safe head.
     */
    public boolean tick() throws IOException {
        long lastProcessed = lastProcessedBlock();
        long safeHead = rpcClient.currentBlockHeight() - config.confirmations();
        if (safeHead <= lastProcessed) {
            return true;
        }

        long fromBlock = lastProcessed + 1;
        long toBlock = Math.min(safeHead, lastProcessed + config.maxBlockRange());

        List<EventLog> logs = logFetcher.fetch(fromBlock, toBlock);
        BatchResult result = eventProcessor.processBatch(session, logs);

        cursorStore.saveLastProcessedBlock(session.sessionId(), toBlock);
        metrics.setLastProcessedBlock(toBlock);

        log.info(
            "Checkpoint advanced to block {} (processedLogs={}, from={}, to={}, outcomes={})",
            toBlock,
            logs.size(),
            fromBlock,
            toBlock,
            result
        );
        return toBlock >= safeHead;
    }

    long lastProcessedBlock() {
        return cursorStore.loadLastProcessedBlock(session.sessionId())
            .orElseGet(this::initialLastProcessedBlock);
    }

    private long initialLastProcessedBlock() {
        long startBlock = config.startBlock() >= 0 ? config.startBlock() : session.deploymentBlockNumber();
        return startBlock - 1L;
    }
}
