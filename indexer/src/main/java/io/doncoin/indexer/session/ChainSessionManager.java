package io.doncoin.indexer.session;

import io.doncoin.indexer.config.DeploymentManifest;
import io.doncoin.indexer.config.WatchedContract;
import java.io.IOException;
import java.time.Clock;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the session the process indexes under. The manifest's anchor contract defines the
 * session key; other watched contracts are only checked for code at head.
 */
public class ChainSessionManager {

    private static final Logger log = LoggerFactory.getLogger(ChainSessionManager.class);

    private final DeploymentDetector deploymentDetector;
    private final ChainSessionRepository repository;
    private final Clock clock;

    public ChainSessionManager(
        DeploymentDetector deploymentDetector,
        ChainSessionRepository repository,
        Clock clock
    ) {
        this.deploymentDetector = deploymentDetector;
        this.repository = repository;
        this.clock = clock;
    }

    public ChainSession resolve(DeploymentManifest manifest, boolean verifyWatchedContracts) throws IOException {
        WatchedContract anchor = manifest.anchor();
        if (verifyWatchedContracts) {
            verifyWatchedContracts(manifest);
        }
        return getOrCreateSession(anchor.name(), anchor.address());
    }

    public ChainSession getOrCreateSession(String contractAddress) throws IOException {
        return getOrCreateSession("contract", contractAddress);
    }

    public void verifyWatchedContracts(DeploymentManifest manifest) throws IOException {
        for (WatchedContract contract : manifest.watchedContracts()) {
            if (!deploymentDetector.hasCodeAtHead(contract.address())) {
                throw new DeploymentNotFoundException(contract.name(), contract.address());
            }
        }
    }

    private ChainSession getOrCreateSession(String contractName, String contractAddress) throws IOException {
        String address = contractAddress.trim().toLowerCase(Locale.ROOT);
        Deployment deployment = deploymentDetector.detect(address)
            .orElseThrow(() -> new DeploymentNotFoundException(contractName, address));

        ChainSession candidate = new ChainSession(
            UUID.randomUUID(),
            address,
            deployment.blockNumber(),
            deployment.blockHash(),
            clock.instant()
        );
        SessionResolution resolution = repository.getOrCreate(candidate);
        ChainSession session = resolution.session();
        log.info(
            "Chain session {} sessionId={} address={} deploymentBlock={} deploymentHash={}",
            resolution.created() ? "created" : "reused",
            session.sessionId(),
            session.contractAddress(),
            session.deploymentBlockNumber(),
            session.deploymentBlockHash()
        );
        return session;
    }
}
