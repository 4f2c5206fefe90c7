package kz.qazmarka.e2k.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import kz.qazmarka.e2k.util.Parsers;

/**
 * Настройки Kafka Producer, которые ядро передаёт клиенту «как есть» при его создании.
 * Сам движок доставки их не интерпретирует.
 */
public final class ProducerSettings {

    /**
     * Режим подтверждений записи брокером.
     */
    public enum AckMode {
        /** acks=0: не ждать подтверждения. */
        NONE("0"),
        /** acks=1: достаточно записи лидером. */
        LEADER("1"),
        /** acks=all: ждать весь набор in-sync реплик. */
        ALL("all");

        private final String kafkaValue;

        AckMode(String kafkaValue) {
            this.kafkaValue = kafkaValue;
        }

        public String kafkaValue() {
            return kafkaValue;
        }

        static AckMode parse(String raw) {
            String v = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
            for (AckMode mode : values()) {
                if (mode.kafkaValue.equals(v)) {
                    return mode;
                }
            }
            throw new ConfigurationException("Недопустимое значение " + E2kConfig.K_ACKS + "='" + raw
                    + "': допустимы 0, 1, all");
        }
    }

    /**
     * Поддерживаемые алгоритмы сжатия.
     */
    public enum Compression {
        NONE, GZIP, SNAPPY, LZ4;

        public String kafkaValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        static Compression parse(String raw) {
            String v = Parsers.up(raw);
            for (Compression c : values()) {
                if (c.name().equals(v)) {
                    return c;
                }
            }
            throw new ConfigurationException("Недопустимое значение " + E2kConfig.K_PRODUCER_COMPRESSION + "='" + raw
                    + "': допустимы none, gzip, snappy, lz4");
        }
    }

    private final AckMode acks;
    private final int batchSize;
    private final long bufferMemory;
    private final Compression compression;
    private final String clientId;
    private final long lingerMs;
    private final int maxRequestSize;
    private final long reconnectBackoffMs;
    private final Integer requestTimeoutMs;
    private final int sendBufferBytes;
    private final int receiveBufferBytes;
    private final long metadataMaxAgeMs;
    private final Map<String, String> passThrough;

    ProducerSettings(AckMode acks,
                     Limits limits,
                     Compression compression,
                     String clientId,
                     Network network,
                     Map<String, String> passThrough) {
        this.acks = acks;
        this.batchSize = limits.batchSize;
        this.bufferMemory = limits.bufferMemory;
        this.maxRequestSize = limits.maxRequestSize;
        this.lingerMs = limits.lingerMs;
        this.compression = compression;
        this.clientId = clientId;
        this.reconnectBackoffMs = network.reconnectBackoffMs;
        this.requestTimeoutMs = network.requestTimeoutMs;
        this.sendBufferBytes = network.sendBufferBytes;
        this.receiveBufferBytes = network.receiveBufferBytes;
        this.metadataMaxAgeMs = network.metadataMaxAgeMs;
        this.passThrough = Collections.unmodifiableMap(new HashMap<>(passThrough));
    }

    public AckMode getAcks() {
        return acks;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public long getBufferMemory() {
        return bufferMemory;
    }

    public Compression getCompression() {
        return compression;
    }

    /** @return явный client.id либо {@code null} */
    public String getClientId() {
        return clientId;
    }

    public long getLingerMs() {
        return lingerMs;
    }

    public int getMaxRequestSize() {
        return maxRequestSize;
    }

    public long getReconnectBackoffMs() {
        return reconnectBackoffMs;
    }

    /** @return request.timeout.ms либо {@code null}, если оставляем дефолт клиента */
    public Integer getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public int getSendBufferBytes() {
        return sendBufferBytes;
    }

    public int getReceiveBufferBytes() {
        return receiveBufferBytes;
    }

    public long getMetadataMaxAgeMs() {
        return metadataMaxAgeMs;
    }

    /** Прочие {@code e2k.producer.*} ключи без префикса; по списку Kafka их фильтрует фабрика свойств. */
    public Map<String, String> getPassThrough() {
        return passThrough;
    }

    /** Лимиты батчинга и памяти клиента. */
    static final class Limits {
        final int batchSize;
        final long bufferMemory;
        final int maxRequestSize;
        final long lingerMs;

        Limits(int batchSize, long bufferMemory, int maxRequestSize, long lingerMs) {
            this.batchSize = batchSize;
            this.bufferMemory = bufferMemory;
            this.maxRequestSize = maxRequestSize;
            this.lingerMs = lingerMs;
        }
    }

    /** Сетевые параметры клиента. */
    static final class Network {
        final long reconnectBackoffMs;
        final Integer requestTimeoutMs;
        final int sendBufferBytes;
        final int receiveBufferBytes;
        final long metadataMaxAgeMs;

        Network(long reconnectBackoffMs,
                Integer requestTimeoutMs,
                int sendBufferBytes,
                int receiveBufferBytes,
                long metadataMaxAgeMs) {
            this.reconnectBackoffMs = reconnectBackoffMs;
            this.requestTimeoutMs = requestTimeoutMs;
            this.sendBufferBytes = sendBufferBytes;
            this.receiveBufferBytes = receiveBufferBytes;
            this.metadataMaxAgeMs = metadataMaxAgeMs;
        }
    }
}
