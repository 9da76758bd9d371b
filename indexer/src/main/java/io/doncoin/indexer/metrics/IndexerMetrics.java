package io.doncoin.indexer.metrics;

import io.doncoin.indexer.event.ProcessingOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public class IndexerMetrics {

    public static final String STAGE_DECODE = "decode";
    public static final String STAGE_PERSISTENCE = "persistence";
    public static final String STAGE_TICK = "tick";
    public static final String STAGE_CHUNK = "chunk";
    public static final List<String> STAGES = List.of(STAGE_DECODE, STAGE_PERSISTENCE, STAGE_TICK, STAGE_CHUNK);

    private final MeterRegistry meterRegistry;

    private final Map<String, Counter> errorCounters;
    private final Counter processedCounter;
    private final Counter duplicateCounter;
    private final Counter inconsistentCounter;
    private final Timer processingTimer;
    private final AtomicLong lastProcessedBlock = new AtomicLong(-1L);

    public IndexerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.processedCounter = Counter.builder("events.processed")
            .description("Events persisted to contract_events")
            .register(meterRegistry);

        this.duplicateCounter = Counter.builder("events.duplicate")
            .description("Events skipped because they were already stored for the session")
            .register(meterRegistry);

        this.inconsistentCounter = Counter.builder("events.inconsistent")
            .description("Events referencing projection rows unknown to the session")
            .register(meterRegistry);

        this.processingTimer = Timer.builder("event.processing.duration")
            .description("Time to process a single log entry")
            .publishPercentileHistogram()
            .register(meterRegistry);

        Map<String, Counter> errors = new HashMap<>();
        for (String stage : STAGES) {
            errors.put(stage, Counter.builder("events.error")
                .description("Failures by the stage that raised them")
                .tag("stage", stage)
                .register(meterRegistry));
        }
        this.errorCounters = Map.copyOf(errors);

        Gauge.builder("last.processed.block", lastProcessedBlock, AtomicLong::get)
            .description("Last block the tail loop checkpointed")
            .register(meterRegistry);
    }

    public void recordOutcome(ProcessingOutcome outcome) {
        switch (outcome) {
            case APPLIED, RECORDED_UNHANDLED -> processedCounter.increment();
            case INCONSISTENT -> {
                processedCounter.increment();
                inconsistentCounter.increment();
            }
            case DUPLICATE_SKIPPED -> duplicateCounter.increment();
            case DECODE_FAILED -> recordError(STAGE_DECODE);
            case SKIPPED_UNHANDLED -> {
            }
        }
    }

    public void recordError(String stage) {
        Counter counter = errorCounters.get(stage);
        if (counter == null) {
            throw new IllegalArgumentException("Unknown error stage: " + stage);
        }
        counter.increment();
    }

    public void setLastProcessedBlock(long blockNumber) {
        lastProcessedBlock.set(blockNumber);
    }

    public long lastProcessedBlock() {
        return lastProcessedBlock.get();
    }

    public Timer.Sample startProcessing() {
        return Timer.start(meterRegistry);
    }

    public void recordProcessing(Timer.Sample sample) {
        sample.stop(processingTimer);
    }
}
