package io.doncoin.indexer.config;

import java.util.Locale;

public enum UnknownEventPolicy {
    RECORD,
    SKIP;

    public static UnknownEventPolicy parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return RECORD;
        }
        try {
            return UnknownEventPolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("UNKNOWN_EVENT_POLICY must be one of: record, skip");
        }
    }
}
