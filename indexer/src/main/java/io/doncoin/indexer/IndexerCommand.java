package io.doncoin.indexer;

import io.doncoin.indexer.config.IndexerConfig;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Parsed command line. {@code toBlock} is null for {@code --to latest} or when omitted.
 */
public record IndexerCommand(
    Mode mode,
    String rpcUrl,
    Path manifestPath,
    Long fromBlock,
    Long toBlock
) {
    public static final String USAGE = """
        usage:
          indexer tail [--rpc-url URL] [--manifest PATH]
          indexer backfill --from N [--to N|latest] [--rpc-url URL] [--manifest PATH]
        """;

    public enum Mode {
        TAIL,
        BACKFILL
    }

    public static IndexerCommand parse(String[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException("missing command");
        }

        Mode mode = switch (args[0].toLowerCase(Locale.ROOT)) {
            case "tail" -> Mode.TAIL;
            case "backfill" -> Mode.BACKFILL;
            default -> throw new IllegalArgumentException("unknown command: " + args[0]);
        };

        String rpcUrl = null;
        Path manifestPath = null;
        Long fromBlock = null;
        Long toBlock = null;

        for (int i = 1; i < args.length; i += 2) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("missing value for " + flag);
            }
            String value = args[i + 1].trim();
            switch (flag) {
                case "--rpc-url" -> rpcUrl = value;
                case "--manifest" -> manifestPath = Path.of(value);
                case "--from" -> fromBlock = parseBlock(flag, value);
                case "--to" -> toBlock = "latest".equalsIgnoreCase(value) ? null : parseBlock(flag, value);
                default -> throw new IllegalArgumentException("unknown option: " + flag);
            }
        }

        if (mode == Mode.BACKFILL && fromBlock == null) {
            throw new IllegalArgumentException("backfill requires --from");
        }
        if (mode == Mode.TAIL && (fromBlock != null || toBlock != null)) {
            throw new IllegalArgumentException("--from/--to only apply to backfill");
        }
        if (fromBlock != null && toBlock != null && fromBlock > toBlock) {
            throw new IllegalArgumentException("--from must be <= --to");
        }
        return new IndexerCommand(mode, rpcUrl, manifestPath, fromBlock, toBlock);
    }

    public IndexerConfig applyTo(IndexerConfig config) {
        IndexerConfig result = config;
        if (rpcUrl != null && !rpcUrl.isBlank()) {
            result = result.withRpcUrl(rpcUrl);
        }
        if (manifestPath != null) {
            result = result.withManifestPath(manifestPath);
        }
        return result;
    }

    private static long parseBlock(String flag, String value) {
        try {
            long block = Long.parseLong(value);
            if (block < 0) {
                throw new IllegalArgumentException(flag + " must be >= 0");
            }
            return block;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " must be a block number");
        }
    }
}
