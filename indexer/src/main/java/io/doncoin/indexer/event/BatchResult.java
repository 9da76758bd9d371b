package io.doncoin.indexer.event;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public final class BatchResult {

    private final EnumMap<ProcessingOutcome, Integer> counts = new EnumMap<>(ProcessingOutcome.class);

    public void record(ProcessingOutcome outcome) {
        counts.merge(outcome, 1, Integer::sum);
    }

    public BatchResult merge(BatchResult other) {
        other.counts.forEach((outcome, count) -> counts.merge(outcome, count, Integer::sum));
        return this;
    }

    public int count(ProcessingOutcome outcome) {
        return counts.getOrDefault(outcome, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<ProcessingOutcome, Integer> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
