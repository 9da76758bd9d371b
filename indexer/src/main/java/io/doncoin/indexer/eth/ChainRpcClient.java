package io.doncoin.indexer.eth;

import java.io.IOException;
import java.util.List;

public interface ChainRpcClient extends AutoCloseable {

    long currentBlockHeight() throws IOException;

    byte[] getCode(String address, long blockNumber) throws IOException;

    BlockHeader getBlock(long blockNumber) throws IOException;

    /**
     * Returns logs for one event in ascending {@code (blockNumber, logIndex)} order.
     */
    List<EventLog> getEventLogs(
        String contractName,
        String contractAddress,
        AbiEventDefinition event,
        long fromBlock,
        long toBlock
    ) throws IOException;

    @Override
    default void close() {
    }
}
