package kz.qazmarka.e2k.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.apache.hadoop.conf.Configuration;

import kz.qazmarka.e2k.config.ProducerSettings.AckMode;
import kz.qazmarka.e2k.config.ProducerSettings.Compression;
import kz.qazmarka.e2k.util.Parsers;

/**
 * Секция параметров Kafka Producer, которые выход передаёт клиенту без интерпретации.
 */
final class ProducerSection {
    /**
     * Ключи {@code e2k.producer.*}, разобранные явно; в pass-through они не попадают.
     * Сериализаторы фиксированы: строковый ключ и уже закодированные байты в значении.
     */
    private static final Set<String> EXPLICIT_KEYS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "batch.size",
            "buffer.memory",
            "compression.type",
            "client.id",
            "linger.ms",
            "max.request.size",
            "reconnect.backoff.ms",
            "request.timeout.ms",
            "send.buffer.bytes",
            "receive.buffer.bytes",
            "metadata.max.age.ms",
            "key.serializer",
            "value.serializer"
    )));

    final AckMode acks;
    final int batchSize;
    final long bufferMemory;
    final Compression compression;
    final String clientId;
    final long lingerMs;
    final int maxRequestSize;
    final long reconnectBackoffMs;
    final Integer requestTimeoutMs;
    final int sendBufferBytes;
    final int receiveBufferBytes;
    final long metadataMaxAgeMs;
    final Map<String, String> passThrough;

    private ProducerSection(Configuration cfg) {
        this.acks = AckMode.parse(Parsers.readStringOrDefault(cfg, E2kConfig.K_ACKS, E2kConfig.DEFAULT_ACKS));
        this.batchSize = Parsers.readIntMin(cfg, E2kConfig.K_PRODUCER_BATCH_SIZE, E2kConfig.DEFAULT_BATCH_SIZE, 0);
        this.bufferMemory = Parsers.readLong(cfg, E2kConfig.K_PRODUCER_BUFFER_MEMORY, E2kConfig.DEFAULT_BUFFER_MEMORY);
        this.compression = Compression.parse(Parsers.readStringOrDefault(cfg, E2kConfig.K_PRODUCER_COMPRESSION, "none"));
        this.clientId = cfg.getTrimmed(E2kConfig.K_PRODUCER_CLIENT_ID);
        this.lingerMs = Parsers.readLong(cfg, E2kConfig.K_PRODUCER_LINGER_MS, E2kConfig.DEFAULT_LINGER_MS);
        this.maxRequestSize = Parsers.readIntMin(cfg, E2kConfig.K_PRODUCER_MAX_REQUEST_SIZE,
                E2kConfig.DEFAULT_MAX_REQUEST_SIZE, 1);
        this.reconnectBackoffMs = Parsers.readLong(cfg, E2kConfig.K_PRODUCER_RECONNECT_BACKOFF_MS,
                E2kConfig.DEFAULT_RECONNECT_BACKOFF_MS);
        Integer timeout;
        try {
            timeout = Parsers.readOptionalInt(cfg, E2kConfig.K_PRODUCER_REQUEST_TIMEOUT_MS);
        } catch (NumberFormatException ex) {
            throw new ConfigurationException("Некорректное значение " + E2kConfig.K_PRODUCER_REQUEST_TIMEOUT_MS, ex);
        }
        this.requestTimeoutMs = timeout;
        this.sendBufferBytes = Parsers.readIntMin(cfg, E2kConfig.K_PRODUCER_SEND_BUFFER, E2kConfig.DEFAULT_SEND_BUFFER, -1);
        this.receiveBufferBytes = Parsers.readIntMin(cfg, E2kConfig.K_PRODUCER_RECEIVE_BUFFER,
                E2kConfig.DEFAULT_RECEIVE_BUFFER, -1);
        this.metadataMaxAgeMs = Parsers.readLong(cfg, E2kConfig.K_PRODUCER_METADATA_MAX_AGE_MS,
                E2kConfig.DEFAULT_METADATA_MAX_AGE_MS);
        Map<String, String> rest = Parsers.readWithPrefix(cfg, E2kConfig.Keys.PRODUCER_PREFIX);
        rest.keySet().removeAll(EXPLICIT_KEYS);
        this.passThrough = rest;
    }

    static ProducerSection from(Configuration cfg) {
        return new ProducerSection(cfg);
    }
}
