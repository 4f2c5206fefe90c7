package kz.qazmarka.e2k.kafka.producer;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.e2k.kafka.record.AddressedRecord;

/**
 * {@link ProducerClient} поверх Kafka {@link Producer}: строковый ключ и значение {@code byte[]}.
 *
 * Принимает любой {@link Producer}, поэтому в тестах подставляется {@code MockProducer}.
 */
public final class KafkaProducerClient implements ProducerClient {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaProducerClient.class);

    private final Producer<String, byte[]> producer;
    private final Duration closeTimeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public KafkaProducerClient(Producer<String, byte[]> producer) {
        this(producer, Duration.ofSeconds(30));
    }

    public KafkaProducerClient(Producer<String, byte[]> producer, Duration closeTimeout) {
        this.producer = Objects.requireNonNull(producer, "producer");
        this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout");
    }

    @Override
    public SendHandle submit(AddressedRecord record) {
        Objects.requireNonNull(record, "record");
        if (closed.get()) {
            throw new IllegalStateException("Kafka-продьюсер уже закрыт");
        }
        Future<RecordMetadata> future = producer.send(
                new ProducerRecord<>(record.topic(), record.key(), record.payload()));
        return new FutureHandle(future);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Повторное закрытие Kafka-продьюсера проигнорировано");
            }
            return;
        }
        try {
            producer.close(closeTimeout);
        } catch (RuntimeException ex) {
            LOG.warn("Ошибка при закрытии Kafka-продьюсера: {}", ex.getMessage());
            if (LOG.isDebugEnabled()) {
                LOG.debug("Трассировка ошибки закрытия Kafka-продьюсера", ex);
            }
        }
    }

    private static final class FutureHandle implements SendHandle {
        private final Future<RecordMetadata> future;

        FutureHandle(Future<RecordMetadata> future) {
            this.future = future;
        }

        @Override
        public SendOutcome await() throws InterruptedException {
            try {
                future.get();
                return SendOutcome.success();
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                return SendOutcome.failure(cause);
            } catch (CancellationException ex) {
                return SendOutcome.failure(ex);
            }
        }
    }
}
