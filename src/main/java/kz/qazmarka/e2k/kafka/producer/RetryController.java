package kz.qazmarka.e2k.kafka.producer;

import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.e2k.config.RetrySettings;
import kz.qazmarka.e2k.kafka.producer.DrainResult.Status;
import kz.qazmarka.e2k.kafka.producer.batch.WorkerId;
import kz.qazmarka.e2k.kafka.record.AddressedRecord;

/**
 * Сливает пачку через {@link DispatchEngine} до полной доставки, исчерпания бюджета или остановки.
 *
 * Раунд за раундом:
 *  - все неудачные записи раунда целиком уходят в следующий раунд (без выборочных повторов);
 *  - перед повтором списывается единица конечного бюджета и выполняется пауза {@link BackoffPolicy};
 *  - при исчерпанном бюджете остаток отбрасывается с WARN и счётчиком {@code records.dropped};
 *  - флаг остановки проверяется перед каждым раундом, прерывание потока обрывает ожидание и паузу.
 *
 * Бюджет {@code R} даёт не более {@code R + 1} раундов. Поток вызывающего блокируется на всё время слива.
 */
public final class RetryController {

    private static final Logger LOG = LoggerFactory.getLogger(RetryController.class);

    private final DispatchEngine engine;
    private final RetrySettings settings;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final DeliveryMetrics metrics;
    private final BooleanSupplier shutdownRequested;

    public RetryController(DispatchEngine engine,
                           RetrySettings settings,
                           Sleeper sleeper,
                           DeliveryMetrics metrics,
                           BooleanSupplier shutdownRequested) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.backoff = BackoffPolicy.from(settings);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.shutdownRequested = Objects.requireNonNull(shutdownRequested, "shutdownRequested");
    }

    /**
     * @param worker владелец пачки (для логов)
     * @param batch  записи в порядке накопления
     * @return итог слива; исключений наружу не бросает, прерывание отражается статусом и флагом потока
     */
    public DrainResult drain(WorkerId worker, List<AddressedRecord> batch) {
        if (batch.isEmpty()) {
            return DrainResult.empty();
        }
        Drain drain = new Drain(worker, batch);
        DrainResult result = drain.run();
        metrics.drained(result);
        return result;
    }

    private final class Drain {
        private final WorkerId worker;
        private final int batchSize;
        private final RetryBudget budget = RetryBudget.from(settings);
        private List<AddressedRecord> pending;
        private int rounds;
        private int submitted;
        private int delivered;
        private int sleeps;

        Drain(WorkerId worker, List<AddressedRecord> batch) {
            this.worker = worker;
            this.batchSize = batch.size();
            this.pending = batch;
        }

        DrainResult run() {
            while (true) {
                if (shutdownRequested.getAsBoolean()) {
                    return interrupted("остановка выхода");
                }
                List<AddressedRecord> failed;
                try {
                    failed = engine.send(pending);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return interrupted("поток прерван во время ожидания подтверждений");
                }
                rounds++;
                submitted += pending.size();
                delivered += pending.size() - failed.size();
                metrics.round(pending.size(), failed.size(), rounds > 1);
                if (failed.isEmpty()) {
                    return finish(Status.DONE, 0);
                }
                if (!budget.tryConsume()) {
                    return abandon(failed);
                }
                if (LOG.isInfoEnabled()) {
                    LOG.info("Отправка пачки в Kafka не удалась, повтор после паузы: рабочий={}, размер={}, ошибок={}, пауза_нс={}, бюджет={}",
                            worker, pending.size(), failed.size(), backoff.baseNanos(), budget);
                }
                pending = failed;
                try {
                    sleeper.sleepNanos(backoff.nextDelayNanos());
                    sleeps++;
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return interrupted("поток прерван во время паузы");
                }
            }
        }

        private DrainResult abandon(List<AddressedRecord> failed) {
            LOG.warn("Исчерпан заданный бюджет повторов отправки в Kafka, события отброшены: рабочий={}, max_retries={}, drop_count={}",
                    worker, settings.getRetries(), failed.size());
            return finish(Status.ABANDONED, failed.size());
        }

        private DrainResult interrupted(String reason) {
            int undelivered = batchSize - delivered;
            if (LOG.isDebugEnabled()) {
                LOG.debug("Слив пачки прерван ({}): рабочий={}, раундов={}, недоставлено={}",
                        reason, worker, rounds, undelivered);
            }
            return finish(Status.INTERRUPTED, undelivered);
        }

        private DrainResult finish(Status status, int dropped) {
            return new DrainResult(status, rounds, submitted, delivered, dropped, sleeps);
        }
    }
}
