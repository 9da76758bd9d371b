package io.doncoin.indexer.support;

import io.doncoin.indexer.eth.EventLog;
import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class TestLogs {

    public static final String GRANT_REGISTRY = "0x5fbdb2315678afecb367f032d93f642f64180aa3";
    public static final String DONATION_VAULT = "0xcf7ed3acca5a467e9e704c703e8d87f634fb0fc9";
    public static final String ROUND_MANAGER = "0x9fe46736679d2d9a65f0992f2272de9f3c7fa6e0";
    public static final String OWNER = "0x70997970c51812dc3a010c7d01b50e0d17dc79c8";
    public static final String DONOR = "0x3c44cdddb6a900fa2b585dd299e03d12fa4293bc";
    public static final String TOKEN = "0x0000000000000000000000000000000000000000";

    private TestLogs() {
    }

    public static String txHash(int n) {
        return String.format("0x%064x", n);
    }

    public static EventLog grantCreated(String txHash, long logIndex, long blockNumber, long grantId, String metadata) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("id", BigInteger.valueOf(grantId));
        args.put("owner", OWNER);
        args.put("metadata", metadata);
        return log("GrantRegistry", "GrantCreated", GRANT_REGISTRY, txHash, logIndex, blockNumber, args);
    }

    public static EventLog donation(String txHash, long logIndex, long blockNumber, long grantId, BigInteger amountWei) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("donor", DONOR);
        args.put("token", TOKEN);
        args.put("amount", amountWei);
        args.put("roundId", BigInteger.ONE);
        args.put("grantId", BigInteger.valueOf(grantId));
        return log("DonationVault", "DonationReceived", DONATION_VAULT, txHash, logIndex, blockNumber, args);
    }

    public static EventLog roundStarted(String txHash, long logIndex, long blockNumber) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("roundId", BigInteger.TWO);
        args.put("startTime", BigInteger.valueOf(1_700_000_000L));
        return log("RoundManager", "RoundStarted", ROUND_MANAGER, txHash, logIndex, blockNumber, args);
    }

    public static EventLog log(
        String contractName,
        String eventName,
        String address,
        String txHash,
        long logIndex,
        long blockNumber,
        Map<String, Object> args
    ) {
        return new EventLog(
            contractName,
            eventName,
            address,
            txHash,
            logIndex,
            blockNumber,
            String.format("0x%064x", blockNumber + 1_000_000L),
            Instant.ofEpochSecond(1_700_000_000L + blockNumber * 12L),
            args
        );
    }

    public static BigInteger ether(String amount) {
        return new java.math.BigDecimal(amount).movePointRight(18).toBigIntegerExact();
    }
}
