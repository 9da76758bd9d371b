package io.doncoin.indexer.config;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

public record IndexerConfig(
    String rpcUrl,
    long rpcTimeoutMs,
    Path manifestPath,
    long pollIntervalMs,
    int maxBlockRange,
    int backfillChunkSize,
    int confirmations,
    long startBlock,
    UnknownEventPolicy unknownEventPolicy,
    boolean verifyWatchedContracts,
    CursorStoreType cursorStoreType,
    Path cursorDir,
    String dbUrl,
    String dbUser,
    String dbPassword,
    int dbPoolSize,
    int metricsPort
) {

    public static IndexerConfig fromEnv(Map<String, String> env) {
        String rpcUrl = envOrDefault(env, "RPC_URL", "http://127.0.0.1:8545");
        long rpcTimeoutMs = parseLong(envOrDefault(env, "RPC_TIMEOUT_MS", "30000"), "RPC_TIMEOUT_MS");
        Path manifestPath = Path.of(envOrDefault(env, "DEPLOYMENT_MANIFEST_PATH", "./deployments/manifest.json"));
        long pollIntervalMs = parseLong(envOrDefault(env, "POLL_INTERVAL_MS", "2000"), "POLL_INTERVAL_MS");
        int maxBlockRange = parseInt(envOrDefault(env, "MAX_BLOCK_RANGE", "2000"), "MAX_BLOCK_RANGE");
        int backfillChunkSize = parseInt(envOrDefault(env, "BACKFILL_CHUNK_SIZE", "1000"), "BACKFILL_CHUNK_SIZE");
        int confirmations = parseInt(envOrDefault(env, "CONFIRMATIONS", "0"), "CONFIRMATIONS");
        long startBlock = parseLong(envOrDefault(env, "START_BLOCK", "-1"), "START_BLOCK");
        UnknownEventPolicy unknownEventPolicy = UnknownEventPolicy.parse(env.get("UNKNOWN_EVENT_POLICY"));
        boolean verifyWatchedContracts = Boolean.parseBoolean(envOrDefault(env, "VERIFY_WATCHED_CONTRACTS", "true"));
        CursorStoreType cursorStoreType = parseCursorStoreType(envOrDefault(env, "CURSOR_STORE", "postgres"));
        Path cursorDir = Path.of(envOrDefault(env, "CURSOR_DIR", "./state"));
        String dbUrl = envOrDefault(env, "DB_URL", "jdbc:postgresql://localhost:5432/doncoin");
        String dbUser = envOrDefault(env, "DB_USER", "doncoin");
        String dbPassword = env.getOrDefault("DB_PASSWORD", "");
        int dbPoolSize = parseInt(envOrDefault(env, "DB_POOL_SIZE", "4"), "DB_POOL_SIZE");
        int metricsPort = parseInt(envOrDefault(env, "METRICS_PORT", "0"), "METRICS_PORT");

        if (rpcTimeoutMs <= 0) {
            throw new IllegalArgumentException("RPC_TIMEOUT_MS must be > 0");
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("POLL_INTERVAL_MS must be > 0");
        }
        if (maxBlockRange <= 0) {
            throw new IllegalArgumentException("MAX_BLOCK_RANGE must be > 0");
        }
        if (backfillChunkSize <= 0) {
            throw new IllegalArgumentException("BACKFILL_CHUNK_SIZE must be > 0");
        }
        if (confirmations < 0) {
            throw new IllegalArgumentException("CONFIRMATIONS must be >= 0");
        }
        if (startBlock < -1) {
            throw new IllegalArgumentException("START_BLOCK must be >= 0, or -1 for the deployment block");
        }
        if (dbPoolSize <= 0) {
            throw new IllegalArgumentException("DB_POOL_SIZE must be > 0");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalArgumentException("METRICS_PORT must be between 0 and 65535");
        }

        return new IndexerConfig(
            rpcUrl,
            rpcTimeoutMs,
            manifestPath,
            pollIntervalMs,
            maxBlockRange,
            backfillChunkSize,
            confirmations,
            startBlock,
            unknownEventPolicy,
            verifyWatchedContracts,
            cursorStoreType,
            cursorDir,
            dbUrl,
            dbUser,
            dbPassword,
            dbPoolSize,
            metricsPort
        );
    }

    public IndexerConfig withRpcUrl(String value) {
        return new IndexerConfig(
            value,
            rpcTimeoutMs,
            manifestPath,
            pollIntervalMs,
            maxBlockRange,
            backfillChunkSize,
            confirmations,
            startBlock,
            unknownEventPolicy,
            verifyWatchedContracts,
            cursorStoreType,
            cursorDir,
            dbUrl,
            dbUser,
            dbPassword,
            dbPoolSize,
            metricsPort
        );
    }

    public IndexerConfig withManifestPath(Path value) {
        return new IndexerConfig(
            rpcUrl,
            rpcTimeoutMs,
            value,
            pollIntervalMs,
            maxBlockRange,
            backfillChunkSize,
            confirmations,
            startBlock,
            unknownEventPolicy,
            verifyWatchedContracts,
            cursorStoreType,
            cursorDir,
            dbUrl,
            dbUser,
            dbPassword,
            dbPoolSize,
            metricsPort
        );
    }

    private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }

    private static long parseLong(String value, String key) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be numeric");
        }
    }

    private static int parseInt(String value, String key) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be numeric");
        }
    }

    private static CursorStoreType parseCursorStoreType(String value) {
        try {
            return CursorStoreType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("CURSOR_STORE must be one of: postgres, file");
        }
    }

    public enum CursorStoreType {
        POSTGRES,
        FILE
    }
}
