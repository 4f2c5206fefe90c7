package kz.qazmarka.e2k.output;

import java.util.Objects;

import kz.qazmarka.e2k.codec.EventCodec;
import kz.qazmarka.e2k.config.E2kConfig;
import kz.qazmarka.e2k.kafka.producer.DeliveryMetrics;
import kz.qazmarka.e2k.kafka.producer.DispatchEngine;
import kz.qazmarka.e2k.kafka.producer.ProducerClient;
import kz.qazmarka.e2k.kafka.producer.RetryController;
import kz.qazmarka.e2k.kafka.producer.Sleeper;
import kz.qazmarka.e2k.kafka.producer.batch.BatchStore;
import kz.qazmarka.e2k.kafka.record.RecordBuilder;

/**
 * Компоновка рабочих компонентов выхода: кодек, сборщик записей, накопитель пачек,
 * движок отправки и контроллер повторов над одним {@link ProducerClient}.
 * Закрытие освобождает клиент ровно один раз.
 */
final class OutputResources implements AutoCloseable {

    private final ProducerClient client;
    private final EventCodec codec;
    private final RecordBuilder recordBuilder;
    private final BatchStore batchStore;
    private final RetryController retryController;
    private final DeliveryMetrics metrics;

    private OutputResources(ProducerClient client,
                            EventCodec codec,
                            RecordBuilder recordBuilder,
                            BatchStore batchStore,
                            RetryController retryController,
                            DeliveryMetrics metrics) {
        this.client = client;
        this.codec = codec;
        this.recordBuilder = recordBuilder;
        this.batchStore = batchStore;
        this.retryController = retryController;
        this.metrics = metrics;
    }

    static OutputResources create(E2kConfig config,
                                  ProducerClient client,
                                  EventCodec codec,
                                  Sleeper sleeper,
                                  KafkaEventOutput owner) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(sleeper, "sleeper");
        Objects.requireNonNull(owner, "owner");
        try {
            DeliveryMetrics metrics = new DeliveryMetrics();
            RecordBuilder builder = new RecordBuilder(config.getTopicSettings());
            RetryController controller = new RetryController(
                    new DispatchEngine(client),
                    config.getRetrySettings(),
                    sleeper,
                    metrics,
                    owner::isShutdownRequested);
            return new OutputResources(client, codec, builder, new BatchStore(), controller, metrics);
        } catch (RuntimeException ex) {
            client.close();
            throw ex;
        }
    }

    ProducerClient client() {
        return client;
    }

    EventCodec codec() {
        return codec;
    }

    RecordBuilder recordBuilder() {
        return recordBuilder;
    }

    BatchStore batchStore() {
        return batchStore;
    }

    RetryController retryController() {
        return retryController;
    }

    DeliveryMetrics metrics() {
        return metrics;
    }

    @Override
    public void close() {
        client.close();
    }
}
