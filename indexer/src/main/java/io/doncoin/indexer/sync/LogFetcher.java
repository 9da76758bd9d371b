package io.doncoin.indexer.sync;

import io.doncoin.indexer.config.WatchedContract;
import io.doncoin.indexer.eth.AbiEventDefinition;
import io.doncoin.indexer.eth.BlockHeader;
import io.doncoin.indexer.eth.ChainRpcClient;
import io.doncoin.indexer.eth.EventLog;
import io.doncoin.indexer.eth.RpcException;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LogFetcher {

    private static final Logger log = LoggerFactory.getLogger(LogFetcher.class);

    private final ChainRpcClient rpcClient;
    private final List<WatchedContract> contracts;
    private int activeMaxRange;

    public LogFetcher(ChainRpcClient rpcClient, List<WatchedContract> contracts, int maxBlockRange) {
        if (maxBlockRange <= 0) {
            throw new IllegalArgumentException("maxBlockRange must be > 0");
        }
        this.rpcClient = rpcClient;
        this.contracts = List.copyOf(contracts);
        this.activeMaxRange = maxBlockRange;
    }

    public List<EventLog> fetch(long fromBlock, long toBlock) throws IOException {
        if (fromBlock > toBlock) {
            return List.of();
        }

        List<EventLog> logs = new ArrayList<>();
        long windowStart = fromBlock;
        while (windowStart <= toBlock) {
            long windowEnd = Math.min(toBlock, windowStart + activeMaxRange - 1L);
            try {
                logs.addAll(fetchWindow(windowStart, windowEnd));
                windowStart = windowEnd + 1;
            } catch (RpcException e) {
                if (e.isRangeTooLarge() && activeMaxRange > 1) {
                    activeMaxRange = Math.max(1, activeMaxRange / 2);
                    log.warn("eth_getLogs window too large; reducing block range to {}", activeMaxRange);
                    continue;
                }
                throw e;
            }
        }

        Map<Long, Instant> timestampCache = new HashMap<>();
        List<EventLog> stamped = new ArrayList<>(logs.size());
        for (EventLog eventLog : logs) {
            stamped.add(eventLog.withBlockTimestamp(resolveBlockTimestamp(eventLog.blockNumber(), timestampCache)));
        }
        stamped.sort(Comparator.comparingLong(EventLog::blockNumber).thenComparingLong(EventLog::logIndex));
        return stamped;
    }

    int activeMaxRange() {
        return activeMaxRange;
    }

    private List<EventLog> fetchWindow(long fromBlock, long toBlock) throws IOException {
        List<EventLog> logs = new ArrayList<>();
        for (WatchedContract contract : contracts) {
            for (AbiEventDefinition event : contract.events()) {
                logs.addAll(rpcClient.getEventLogs(contract.name(), contract.address(), event, fromBlock, toBlock));
            }
        }
        return logs;
    }

    private Instant resolveBlockTimestamp(long blockNumber, Map<Long, Instant> cache) throws IOException {
        Instant cached = cache.get(blockNumber);
        if (cached != null) {
            return cached;
        }
        BlockHeader block = rpcClient.getBlock(blockNumber);
        cache.put(blockNumber, block.timestamp());
        return block.timestamp();
    }
}
