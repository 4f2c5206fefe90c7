package kz.qazmarka.e2k.kafka.producer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import kz.qazmarka.e2k.config.E2kConfigBuilder;
import kz.qazmarka.e2k.config.RetrySettings;
import kz.qazmarka.e2k.config.RetrySettings.BackoffMode;
import kz.qazmarka.e2k.kafka.producer.DrainResult.Status;
import kz.qazmarka.e2k.kafka.producer.batch.WorkerId;
import kz.qazmarka.e2k.kafka.record.AddressedRecord;

/**
 * Слив пачки с повторами: бюджет, пауза, отказ от пачки и остановка.
 */
class RetryControllerTest {

    private static final WorkerId WORKER = WorkerId.of("worker-1");
    private static final long MS = 1_000_000L;

    private final DeliveryMetrics metrics = new DeliveryMetrics();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private static RetrySettings retries(Integer budget) {
        return settings(budget, 100L, BackoffMode.FIXED);
    }

    private static RetrySettings settings(Integer budget, long backoffMs, BackoffMode mode) {
        return new E2kConfigBuilder()
                .topic().id("t").done()
                .retry().retries(budget).backoffMs(backoffMs).backoffMode(mode).done()
                .build()
                .getRetrySettings();
    }

    private RetryController controller(ProducerClient client, RetrySettings settings, Sleeper sleeper) {
        return new RetryController(new DispatchEngine(client), settings, sleeper, metrics, shutdown::get);
    }

    private static List<AddressedRecord> batch(int size) {
        List<AddressedRecord> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(new AddressedRecord("t", "k" + i, new byte[] {(byte) i}));
        }
        return out;
    }

    @Test
    @DisplayName("Бюджет 0, все отправки падают: одна попытка, пачка отброшена целиком")
    void zeroBudgetAllFail() {
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_FAIL);
        RecordingSleeper sleeper = new RecordingSleeper();
        List<AddressedRecord> records = batch(3);

        DrainResult result = controller(client, retries(0), sleeper).drain(WORKER, records);

        assertEquals(Status.ABANDONED, result.status());
        assertEquals(1, result.rounds());
        assertEquals(3, result.dropped());
        assertEquals(0, result.delivered());
        assertEquals(0, sleeper.count(), "Перед отказом от пачки пауза не нужна");
        assertEquals(3, client.submitted().size());
        Map<String, Long> snap = metrics.snapshot();
        assertEquals(3L, snap.get(DeliveryMetrics.RECORDS_DROPPED));
        assertEquals(1L, snap.get(DeliveryMetrics.BATCHES_ABANDONED));
        assertTrue(snap.get(DeliveryMetrics.LAST_ABANDON_EPOCH_MS) > 0L);
    }

    @Test
    @DisplayName("Бюджет 2, первый раунд падает целиком, второй успешен: 2 раунда без потерь")
    void budgetTwoRecoversOnSecondRound() {
        ScriptedProducerClient client = ScriptedProducerClient.failingFirst(1);
        RecordingSleeper sleeper = new RecordingSleeper();

        DrainResult result = controller(client, retries(2), sleeper).drain(WORKER, batch(3));

        assertEquals(Status.DONE, result.status());
        assertEquals(2, result.rounds());
        assertEquals(0, result.dropped());
        assertEquals(3, result.delivered());
        assertEquals(6, result.submitted());
        assertEquals(1, sleeper.count());
        assertEquals(0L, metrics.batchesAbandoned());
    }

    @Test
    @DisplayName("Без ограничений: два неудачных раунда, третий успешен, ровно две паузы")
    void unlimitedRecoversOnThirdRound() {
        ScriptedProducerClient client = ScriptedProducerClient.failingFirst(2);
        RecordingSleeper sleeper = new RecordingSleeper();

        DrainResult result = controller(client, retries(null), sleeper).drain(WORKER, batch(4));

        assertEquals(Status.DONE, result.status());
        assertEquals(3, result.rounds());
        assertEquals(2, result.sleeps());
        assertEquals(Arrays.asList(100 * MS, 100 * MS), sleeper.sleeps(), "Пауза фиксированная и не растёт");
        assertEquals(0L, metrics.recordsDropped());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 3, 7})
    @DisplayName("Конечный бюджет R при постоянных отказах даёт ровно R + 1 раундов")
    void boundedRetry(int budget) {
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_FAIL);
        RecordingSleeper sleeper = new RecordingSleeper();
        List<AddressedRecord> records = batch(2);

        DrainResult result = controller(client, retries(budget), sleeper).drain(WORKER, records);

        assertEquals(Status.ABANDONED, result.status());
        assertEquals(budget + 1, result.rounds());
        assertEquals(budget, sleeper.count());
        for (AddressedRecord r : records) {
            assertEquals(budget + 1, client.attemptsOf(r));
        }
    }

    @Test
    @DisplayName("Неограниченный бюджет повторяет, пока сценарий не даст успех")
    void unlimitedEventuallySucceeds() {
        ScriptedProducerClient client = ScriptedProducerClient.failingFirst(25);
        RecordingSleeper sleeper = new RecordingSleeper();

        DrainResult result = controller(client, retries(null), sleeper).drain(WORKER, batch(2));

        assertEquals(Status.DONE, result.status());
        assertEquals(26, result.rounds());
    }

    @Test
    @DisplayName("Повторяются только неудачные записи, каждая ровно один раз за раунд")
    void onlyFailedRecordsAreRetried() {
        List<AddressedRecord> records = batch(4);
        AddressedRecord flaky = records.get(2);
        ScriptedProducerClient client = new ScriptedProducerClient((record, attempt) ->
                record == flaky && attempt < 3
                        ? SendOutcome.failure(new IllegalStateException("timeout"))
                        : SendOutcome.success());

        DrainResult result = controller(client, retries(5), new RecordingSleeper()).drain(WORKER, records);

        assertEquals(Status.DONE, result.status());
        assertEquals(3, result.rounds());
        assertEquals(4, result.delivered());
        assertEquals(3, client.attemptsOf(flaky));
        assertEquals(1, client.attemptsOf(records.get(0)));
        assertEquals(1, client.attemptsOf(records.get(3)));
        assertEquals(6, result.submitted());
    }

    @Test
    @DisplayName("Пустая пачка не отправляется и не учитывается в метриках")
    void emptyBatch() {
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_FAIL);

        DrainResult result = controller(client, retries(0), new RecordingSleeper())
                .drain(WORKER, Collections.<AddressedRecord>emptyList());

        assertSame(DrainResult.empty(), result);
        assertEquals(0, result.rounds());
        assertTrue(client.journal().isEmpty());
        assertEquals(0L, metrics.snapshot().get(DeliveryMetrics.BATCHES_DONE));
    }

    @Test
    @DisplayName("Запрошенная остановка до первого раунда: ничего не отправляется")
    void shutdownBeforeFirstRound() {
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_OK);
        shutdown.set(true);

        DrainResult result = controller(client, retries(null), new RecordingSleeper()).drain(WORKER, batch(2));

        assertEquals(Status.INTERRUPTED, result.status());
        assertEquals(0, result.rounds());
        assertEquals(2, result.dropped());
        assertTrue(client.submitted().isEmpty());
        assertEquals(1L, metrics.snapshot().get(DeliveryMetrics.BATCHES_INTERRUPTED));
    }

    @Test
    @DisplayName("Остановка во время паузы обрывает неограниченные повторы")
    void shutdownDuringBackoff() {
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_FAIL);
        RecordingSleeper sleeper = new RecordingSleeper().onSleep(() -> shutdown.set(true));

        DrainResult result = controller(client, retries(null), sleeper).drain(WORKER, batch(3));

        assertEquals(Status.INTERRUPTED, result.status());
        assertEquals(1, result.rounds());
        assertEquals(1, sleeper.count());
        assertEquals(3, result.dropped());
        assertEquals(0L, metrics.recordsDropped(), "Прерывание не считается явной потерей данных");
    }

    @Test
    @DisplayName("Прерывание потока в паузе даёт INTERRUPTED и восстанавливает флаг прерывания")
    void interruptDuringBackoff() {
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_FAIL);
        Sleeper interrupting = nanos -> {
            throw new InterruptedException("shutdown");
        };

        DrainResult result;
        try {
            result = controller(client, retries(null), interrupting).drain(WORKER, batch(1));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }

        assertEquals(Status.INTERRUPTED, result.status());
        assertEquals(1, result.rounds());
        assertFalse(result.isDone());
    }

    @Test
    @DisplayName("Режим legacy_reciprocal спит 1/backoffMs секунд")
    void legacyReciprocalBackoff() {
        ScriptedProducerClient client = ScriptedProducerClient.failingFirst(1);
        RecordingSleeper sleeper = new RecordingSleeper();

        controller(client, settings(null, 100L, BackoffMode.LEGACY_RECIPROCAL), sleeper).drain(WORKER, batch(1));

        assertEquals(Collections.singletonList(10 * MS), sleeper.sleeps());
    }

    @Test
    @DisplayName("Метрики раундов: повторы учитываются отдельно от первого раунда")
    void roundMetrics() {
        ScriptedProducerClient client = ScriptedProducerClient.failingFirst(2);

        controller(client, retries(null), new RecordingSleeper()).drain(WORKER, batch(2));

        Map<String, Long> snap = metrics.snapshot();
        assertEquals(3L, snap.get(DeliveryMetrics.ROUNDS_TOTAL));
        assertEquals(2L, snap.get(DeliveryMetrics.RETRIES_TOTAL));
        assertEquals(6L, snap.get(DeliveryMetrics.RECORDS_SUBMITTED));
        assertEquals(2L, snap.get(DeliveryMetrics.RECORDS_DELIVERED));
        assertEquals(4L, snap.get(DeliveryMetrics.RECORDS_FAILED));
        assertEquals(1L, snap.get(DeliveryMetrics.BATCHES_DONE));
    }
}
