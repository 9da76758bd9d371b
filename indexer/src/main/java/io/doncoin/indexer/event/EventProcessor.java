package io.doncoin.indexer.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.doncoin.indexer.config.UnknownEventPolicy;
import io.doncoin.indexer.eth.EventLog;
import io.doncoin.indexer.metrics.IndexerMetrics;
import io.doncoin.indexer.session.ChainSession;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class EventProcessor {

    private static final Logger log = LoggerFactory.getLogger(EventProcessor.class);

    private final EventStore eventStore;
    private final EventDecoder decoder;
    private final GrantCreatedHandler grantCreatedHandler;
    private final DonationReceivedHandler donationReceivedHandler;
    private final UnknownEventPolicy unknownEventPolicy;
    private final IndexerMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EventProcessor(
        EventStore eventStore,
        EventDecoder decoder,
        GrantCreatedHandler grantCreatedHandler,
        DonationReceivedHandler donationReceivedHandler,
        UnknownEventPolicy unknownEventPolicy,
        IndexerMetrics metrics,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.eventStore = eventStore;
        this.decoder = decoder;
        this.grantCreatedHandler = grantCreatedHandler;
        this.donationReceivedHandler = donationReceivedHandler;
        this.unknownEventPolicy = unknownEventPolicy;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Processes {@code logs} in list order. A persistence failure stops the batch and propagates.
     */
    public BatchResult processBatch(ChainSession session, List<EventLog> logs) {
        BatchResult result = new BatchResult();
        for (EventLog eventLog : logs) {
            result.record(process(session, eventLog));
        }
        return result;
    }

    public ProcessingOutcome process(ChainSession session, EventLog eventLog) {
        Timer.Sample sample = metrics.startProcessing();
        try {
            ProcessingOutcome outcome = doProcess(session, eventLog);
            metrics.recordOutcome(outcome);
            return outcome;
        } catch (EventPersistenceException e) {
            metrics.recordError(IndexerMetrics.STAGE_PERSISTENCE);
            throw e;
        } finally {
            metrics.recordProcessing(sample);
        }
    }

    private ProcessingOutcome doProcess(ChainSession session, EventLog eventLog) {
        if (eventStore.exists(eventLog.txHash(), eventLog.logIndex(), session.sessionId())) {
            logDuplicate(eventLog);
            return ProcessingOutcome.DUPLICATE_SKIPPED;
        }

        Optional<EventType> eventType = EventType.resolve(eventLog.contractName(), eventLog.eventName());
        if (eventType.isEmpty()) {
            return processUnhandled(session, eventLog);
        }

        Optional<ChainEvent> decoded = decode(eventType.get(), eventLog);
        if (decoded.isEmpty()) {
            return ProcessingOutcome.DECODE_FAILED;
        }
        ChainEvent event = decoded.get();

        EventContext context = new EventContext(
            session.sessionId(),
            eventLog.txHash(),
            eventLog.logIndex(),
            eventLog.blockNumber(),
            eventLog.blockTimestamp()
        );
        Optional<HandlerResult> applied = eventStore.apply(
            toRawEvent(session, eventLog),
            view -> dispatch(event, context, view)
        );
        if (applied.isEmpty()) {
            logDuplicate(eventLog);
            return ProcessingOutcome.DUPLICATE_SKIPPED;
        }

        HandlerResult result = applied.get();
        if (result.inconsistent()) {
            log.warn(
                "Inconsistent event type={} tx={} logIndex={} block={}: {}",
                eventLog.qualifiedEventName(),
                eventLog.txHash(),
                eventLog.logIndex(),
                eventLog.blockNumber(),
                result.warning()
            );
            return ProcessingOutcome.INCONSISTENT;
        }

        log.info(
            "New event type={} tx={} logIndex={} block={} proposalId={}",
            eventLog.qualifiedEventName(),
            eventLog.txHash(),
            eventLog.logIndex(),
            eventLog.blockNumber(),
            result.proposalId()
        );
        return ProcessingOutcome.APPLIED;
    }

    private Optional<ChainEvent> decode(EventType eventType, EventLog eventLog) {
        try {
            return Optional.of(decoder.decode(eventType, eventLog));
        } catch (EventDecodeException e) {
            log.warn(
                "Skipping undecodable event type={} tx={} logIndex={} block={}: {}",
                eventLog.qualifiedEventName(),
                eventLog.txHash(),
                eventLog.logIndex(),
                eventLog.blockNumber(),
                e.getMessage()
            );
            return Optional.empty();
        }
    }

    private ProcessingOutcome processUnhandled(ChainSession session, EventLog eventLog) {
        if (unknownEventPolicy == UnknownEventPolicy.SKIP) {
            log.debug("Skipping unhandled event type={} tx={}", eventLog.qualifiedEventName(), eventLog.txHash());
            return ProcessingOutcome.SKIPPED_UNHANDLED;
        }
        Optional<HandlerResult> applied = eventStore.apply(toRawEvent(session, eventLog), view -> HandlerResult.none());
        if (applied.isEmpty()) {
            logDuplicate(eventLog);
            return ProcessingOutcome.DUPLICATE_SKIPPED;
        }
        log.info(
            "Recorded unhandled event type={} tx={} logIndex={} block={}",
            eventLog.qualifiedEventName(),
            eventLog.txHash(),
            eventLog.logIndex(),
            eventLog.blockNumber()
        );
        return ProcessingOutcome.RECORDED_UNHANDLED;
    }

    private HandlerResult dispatch(ChainEvent event, EventContext context, ProjectionView view) {
        return switch (event.type()) {
            case GRANT_CREATED -> grantCreatedHandler.handle((GrantCreatedEvent) event, context, view);
            case DONATION_RECEIVED -> donationReceivedHandler.handle((DonationReceivedEvent) event, context, view);
        };
    }

    private RawEvent toRawEvent(ChainSession session, EventLog eventLog) {
        return new RawEvent(
            session.sessionId(),
            eventLog.qualifiedEventName(),
            eventLog.contractAddress(),
            eventLog.txHash(),
            eventLog.logIndex(),
            eventLog.blockNumber(),
            eventLog.blockHash(),
            eventLog.blockTimestamp(),
            toJson(eventLog),
            clock.instant()
        );
    }

    private String toJson(EventLog eventLog) {
        try {
            return objectMapper.writeValueAsString(eventLog.decodedArgs());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize decoded args for tx=" + eventLog.txHash(), e);
        }
    }

    private void logDuplicate(EventLog eventLog) {
        log.debug(
            "Duplicate event skipped type={} tx={} logIndex={}",
            eventLog.qualifiedEventName(),
            eventLog.txHash(),
            eventLog.logIndex()
        );
    }
}
