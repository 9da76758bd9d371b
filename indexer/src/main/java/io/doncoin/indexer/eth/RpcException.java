package io.doncoin.indexer.eth;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

public class RpcException extends IOException {

    // EIP-1474 "limit exceeded"
    static final long LIMIT_EXCEEDED = -32005L;

    // providers that answer oversized eth_getLogs queries with a generic -32000 or -32602
    private static final List<String> RANGE_HINTS = List.of(
        "query returned more than",
        "block range",
        "too many results",
        "response size exceeded"
    );

    private final long code;
    private final String providerMessage;

    public RpcException(String method, long code, String message) {
        super(method + " failed(code=" + code + "): " + message);
        this.code = code;
        this.providerMessage = message == null ? "" : message;
    }

    public long code() {
        return code;
    }

    /**
     * True when the provider refused a log query because its block range or result set was too large.
     */
    public boolean isRangeTooLarge() {
        if (code == LIMIT_EXCEEDED) {
            return true;
        }
        String normalized = providerMessage.toLowerCase(Locale.ROOT);
        return RANGE_HINTS.stream().anyMatch(normalized::contains);
    }
}
