package io.doncoin.indexer.config;

import java.util.List;
import java.util.Map;

public record DeploymentManifest(
    String network,
    String anchorContract,
    Map<String, WatchedContract> contracts
) {
    public DeploymentManifest {
        contracts = Map.copyOf(contracts);
    }

    public WatchedContract anchor() {
        WatchedContract anchor = contracts.get(anchorContract);
        if (anchor == null) {
            throw new IllegalStateException("Anchor contract missing from manifest: " + anchorContract);
        }
        return anchor;
    }

    public List<WatchedContract> watchedContracts() {
        return contracts.values().stream()
            .filter(WatchedContract::isWatched)
            .sorted((left, right) -> left.name().compareTo(right.name()))
            .toList();
    }
}
