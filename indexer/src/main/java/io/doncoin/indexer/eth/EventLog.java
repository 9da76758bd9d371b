package io.doncoin.indexer.eth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One decoded log entry. {@code blockTimestamp} stays null until the fetcher resolves it.
 * {@code decodeError} is non-null when the ABI payload could not be decoded; {@code decodedArgs}
 * is then empty.
 */
public record EventLog(
    String contractName,
    String eventName,
    String contractAddress,
    String txHash,
    long logIndex,
    long blockNumber,
    String blockHash,
    Instant blockTimestamp,
    Map<String, Object> decodedArgs,
    String decodeError
) {
    public EventLog {
        contractAddress = normalize(contractAddress);
        txHash = normalize(txHash);
        blockHash = normalize(blockHash);
        decodedArgs = decodedArgs == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(decodedArgs));
    }

    public EventLog(
        String contractName,
        String eventName,
        String contractAddress,
        String txHash,
        long logIndex,
        long blockNumber,
        String blockHash,
        Instant blockTimestamp,
        Map<String, Object> decodedArgs
    ) {
        this(contractName, eventName, contractAddress, txHash, logIndex, blockNumber, blockHash, blockTimestamp, decodedArgs, null);
    }

    public boolean decoded() {
        return decodeError == null;
    }

    public String qualifiedEventName() {
        return contractName + "." + eventName;
    }

    public EventLog withBlockTimestamp(Instant timestamp) {
        return new EventLog(
            contractName,
            eventName,
            contractAddress,
            txHash,
            logIndex,
            blockNumber,
            blockHash,
            timestamp,
            decodedArgs,
            decodeError
        );
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
