package io.doncoin.indexer.session;

import io.doncoin.indexer.eth.BlockHeader;
import io.doncoin.indexer.eth.ChainRpcClient;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DeploymentDetector {

    private static final Logger log = LoggerFactory.getLogger(DeploymentDetector.class);

    private final ChainRpcClient rpcClient;

    public DeploymentDetector(ChainRpcClient rpcClient) {
        this.rpcClient = rpcClient;
    }

    /**
     * Returns empty when the address has no code at the current head.
     */
    public Optional<Deployment> detect(String contractAddress) throws IOException {
        long head = rpcClient.currentBlockHeight();
        if (!hasCode(contractAddress, head)) {
            return Optional.empty();
        }

        long low = 0L;
        long high = head;
        int codeLookups = 1;
        while (low < high) {
            long mid = low + (high - low) / 2;
            codeLookups++;
            if (hasCode(contractAddress, mid)) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }

        BlockHeader block = rpcClient.getBlock(low);
        log.info(
            "Deployment detected address={} block={} hash={} head={} codeLookups={}",
            contractAddress,
            low,
            block.hash(),
            head,
            codeLookups
        );
        return Optional.of(new Deployment(low, block.hash()));
    }

    public boolean hasCodeAtHead(String contractAddress) throws IOException {
        return hasCode(contractAddress, rpcClient.currentBlockHeight());
    }

    private boolean hasCode(String contractAddress, long blockNumber) throws IOException {
        byte[] code = rpcClient.getCode(contractAddress, blockNumber);
        return code != null && code.length > 0;
    }
}
