package io.doncoin.indexer.event;

public enum ProcessingOutcome {
    APPLIED,
    RECORDED_UNHANDLED,
    SKIPPED_UNHANDLED,
    DUPLICATE_SKIPPED,
    INCONSISTENT,
    DECODE_FAILED
}
