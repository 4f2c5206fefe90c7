package kz.qazmarka.e2k.kafka.producer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Счётчики доставки. Обновляются из рабочих потоков без блокировок ({@link LongAdder}),
 * читаются снимком {@link #snapshot()} для JMX и логов.
 */
public final class DeliveryMetrics {

    public static final String EVENTS_ENCODED = "events.encoded";
    public static final String EVENTS_FAILED = "events.failed";
    public static final String RECORDS_SUBMITTED = "records.submitted";
    public static final String RECORDS_DELIVERED = "records.delivered";
    public static final String RECORDS_FAILED = "records.failed";
    public static final String RECORDS_DROPPED = "records.dropped";
    public static final String ROUNDS_TOTAL = "rounds.total";
    public static final String RETRIES_TOTAL = "retries.total";
    public static final String BATCHES_DONE = "batches.done";
    public static final String BATCHES_ABANDONED = "batches.abandoned";
    public static final String BATCHES_INTERRUPTED = "batches.interrupted";
    public static final String LAST_ABANDON_EPOCH_MS = "batches.last.abandoned.epoch.ms";

    private final LongAdder eventsEncoded = new LongAdder();
    private final LongAdder eventsFailed = new LongAdder();
    private final LongAdder recordsSubmitted = new LongAdder();
    private final LongAdder recordsDelivered = new LongAdder();
    private final LongAdder recordsFailed = new LongAdder();
    private final LongAdder recordsDropped = new LongAdder();
    private final LongAdder roundsTotal = new LongAdder();
    private final LongAdder retriesTotal = new LongAdder();
    private final LongAdder batchesDone = new LongAdder();
    private final LongAdder batchesAbandoned = new LongAdder();
    private final LongAdder batchesInterrupted = new LongAdder();
    private final AtomicLong lastAbandonAt = new AtomicLong(0L);

    public void eventEncoded() {
        eventsEncoded.increment();
    }

    public void eventFailed() {
        eventsFailed.increment();
    }

    void round(int submitted, int failed, boolean retry) {
        roundsTotal.increment();
        if (retry) {
            retriesTotal.increment();
        }
        recordsSubmitted.add(submitted);
        recordsDelivered.add((long) submitted - failed);
        recordsFailed.add(failed);
    }

    void drained(DrainResult result) {
        switch (result.status()) {
            case DONE:
                batchesDone.increment();
                break;
            case ABANDONED:
                batchesAbandoned.increment();
                recordsDropped.add(result.dropped());
                lastAbandonAt.set(System.currentTimeMillis());
                break;
            case INTERRUPTED:
            default:
                batchesInterrupted.increment();
                break;
        }
    }

    public long recordsDropped() {
        return recordsDropped.sum();
    }

    public long eventsFailed() {
        return eventsFailed.sum();
    }

    public long batchesAbandoned() {
        return batchesAbandoned.sum();
    }

    /** @return неизменяемый снимок всех счётчиков в стабильном порядке ключей */
    public Map<String, Long> snapshot() {
        Map<String, Long> out = new LinkedHashMap<>(16);
        out.put(EVENTS_ENCODED, eventsEncoded.sum());
        out.put(EVENTS_FAILED, eventsFailed.sum());
        out.put(RECORDS_SUBMITTED, recordsSubmitted.sum());
        out.put(RECORDS_DELIVERED, recordsDelivered.sum());
        out.put(RECORDS_FAILED, recordsFailed.sum());
        out.put(RECORDS_DROPPED, recordsDropped.sum());
        out.put(ROUNDS_TOTAL, roundsTotal.sum());
        out.put(RETRIES_TOTAL, retriesTotal.sum());
        out.put(BATCHES_DONE, batchesDone.sum());
        out.put(BATCHES_ABANDONED, batchesAbandoned.sum());
        out.put(BATCHES_INTERRUPTED, batchesInterrupted.sum());
        out.put(LAST_ABANDON_EPOCH_MS, lastAbandonAt.get());
        return Collections.unmodifiableMap(out);
    }
}
