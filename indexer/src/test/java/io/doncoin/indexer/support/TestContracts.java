package io.doncoin.indexer.support;

import io.doncoin.indexer.config.WatchedContract;
import io.doncoin.indexer.eth.AbiEventDefinition;
import io.doncoin.indexer.eth.AbiEventInput;
import java.util.List;
import org.web3j.crypto.Hash;

public final class TestContracts {

    private TestContracts() {
    }

    public static AbiEventDefinition grantCreated() {
        return event("GrantCreated", List.of(
            new AbiEventInput("id", "uint256", true),
            new AbiEventInput("owner", "address", true),
            new AbiEventInput("metadata", "string", false)
        ));
    }

    public static AbiEventDefinition donationReceived() {
        return event("DonationReceived", List.of(
            new AbiEventInput("donor", "address", true),
            new AbiEventInput("token", "address", true),
            new AbiEventInput("amount", "uint256", false),
            new AbiEventInput("roundId", "uint256", false),
            new AbiEventInput("grantId", "uint256", false)
        ));
    }

    public static AbiEventDefinition roundStarted() {
        return event("RoundStarted", List.of(
            new AbiEventInput("roundId", "uint256", true),
            new AbiEventInput("startTime", "uint256", false)
        ));
    }

    public static List<WatchedContract> watched() {
        return List.of(
            new WatchedContract("DonationVault", TestLogs.DONATION_VAULT, List.of(donationReceived())),
            new WatchedContract("GrantRegistry", TestLogs.GRANT_REGISTRY, List.of(grantCreated())),
            new WatchedContract("RoundManager", TestLogs.ROUND_MANAGER, List.of(roundStarted()))
        );
    }

    private static AbiEventDefinition event(String name, List<AbiEventInput> inputs) {
        String signature = name + "(" + String.join(",", inputs.stream().map(AbiEventInput::type).toList()) + ")";
        return new AbiEventDefinition(name, inputs, signature, Hash.sha3String(signature));
    }
}
