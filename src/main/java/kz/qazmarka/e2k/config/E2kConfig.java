package kz.qazmarka.e2k.config;

import java.util.Objects;

import org.apache.hadoop.conf.Configuration;

/**
 * Иммутабельная конфигурация выхода, прочитанная один раз из Hadoop {@link Configuration}.
 *
 * Содержит:
 *  - адреса Kafka и шаблоны адресации (топик, ключ партиционирования);
 *  - бюджет повторов и паузу между раундами: единственные параметры, которые ядро доставки
 *    использует напрямую;
 *  - параметры Kafka Producer (acks, лимиты батчинга/памяти, сжатие, сеть) и безопасности (SSL/SASL),
 *    которые передаются клиенту без интерпретации;
 *  - выбор кодека событий и флаг JMX-метрик.
 *
 * Все поля неизменяемые; валидация выполняется билдером {@link E2kConfigBuilder#build()}.
 */
public final class E2kConfig {

    // ==== Ключи конфигурации ====
    static final String K_BOOTSTRAP = "e2k.kafka.bootstrap.servers";
    static final String K_TOPIC_ID = "e2k.topic.id";
    static final String K_MESSAGE_KEY = "e2k.message.key";
    static final String K_TEMPLATE_STRICT = "e2k.template.strict";
    static final String K_ACKS = "e2k.acks";
    static final String K_RETRIES = "e2k.retries";
    static final String K_RETRY_BACKOFF_MS = "e2k.retry.backoff.ms";
    static final String K_RETRY_BACKOFF_MODE = "e2k.retry.backoff.mode";
    static final String K_RETRY_BACKOFF_JITTER = "e2k.retry.backoff.jitter.percent";
    static final String K_PRODUCER_BATCH_SIZE = "e2k.producer.batch.size";
    static final String K_PRODUCER_BUFFER_MEMORY = "e2k.producer.buffer.memory";
    static final String K_PRODUCER_COMPRESSION = "e2k.producer.compression.type";
    static final String K_PRODUCER_CLIENT_ID = "e2k.producer.client.id";
    static final String K_PRODUCER_LINGER_MS = "e2k.producer.linger.ms";
    static final String K_PRODUCER_MAX_REQUEST_SIZE = "e2k.producer.max.request.size";
    static final String K_PRODUCER_RECONNECT_BACKOFF_MS = "e2k.producer.reconnect.backoff.ms";
    static final String K_PRODUCER_REQUEST_TIMEOUT_MS = "e2k.producer.request.timeout.ms";
    static final String K_PRODUCER_SEND_BUFFER = "e2k.producer.send.buffer.bytes";
    static final String K_PRODUCER_RECEIVE_BUFFER = "e2k.producer.receive.buffer.bytes";
    static final String K_PRODUCER_METADATA_MAX_AGE_MS = "e2k.producer.metadata.max.age.ms";
    static final String K_SECURITY_PROTOCOL = "e2k.security.protocol";
    static final String K_SSL_ENABLED = "e2k.ssl.enabled";
    static final String K_SSL_TRUSTSTORE_TYPE = "e2k.ssl.truststore.type";
    static final String K_SSL_TRUSTSTORE_LOCATION = "e2k.ssl.truststore.location";
    static final String K_SSL_TRUSTSTORE_PASSWORD = "e2k.ssl.truststore.password";
    static final String K_SSL_KEYSTORE_TYPE = "e2k.ssl.keystore.type";
    static final String K_SSL_KEYSTORE_LOCATION = "e2k.ssl.keystore.location";
    static final String K_SSL_KEYSTORE_PASSWORD = "e2k.ssl.keystore.password";
    static final String K_SSL_KEY_PASSWORD = "e2k.ssl.key.password";
    static final String K_SASL_MECHANISM = "e2k.sasl.mechanism";
    static final String K_SASL_KERBEROS_SERVICE_NAME = "e2k.sasl.kerberos.service.name";
    static final String K_SASL_JAAS_CONFIG = "e2k.sasl.jaas.config";
    static final String K_SASL_JAAS_PATH = "e2k.sasl.jaas.path";
    static final String K_KERBEROS_CONFIG = "e2k.kerberos.config";
    static final String K_CODEC = "e2k.codec";
    static final String K_CODEC_PLAIN_FORMAT = "e2k.codec.plain.format";
    static final String K_JMX_ENABLED = "e2k.jmx.enabled";

    // ==== Значения по умолчанию ====
    static final String DEFAULT_BOOTSTRAP = "localhost:9092";
    static final String DEFAULT_ACKS = "1";
    static final long DEFAULT_RETRY_BACKOFF_MS = 100L;
    static final int DEFAULT_JITTER_PERCENT = 0;
    static final int DEFAULT_BATCH_SIZE = 16384;
    static final long DEFAULT_BUFFER_MEMORY = 33554432L;
    static final int DEFAULT_MAX_REQUEST_SIZE = 1048576;
    static final long DEFAULT_LINGER_MS = 0L;
    static final long DEFAULT_RECONNECT_BACKOFF_MS = 10L;
    static final int DEFAULT_SEND_BUFFER = 131072;
    static final int DEFAULT_RECEIVE_BUFFER = 32768;
    static final long DEFAULT_METADATA_MAX_AGE_MS = 300000L;
    static final String DEFAULT_SASL_MECHANISM = SecuritySettings.MECHANISM_GSSAPI;
    static final String DEFAULT_PLAIN_FORMAT = "%{message}";
    static final boolean DEFAULT_TEMPLATE_STRICT = false;
    static final boolean DEFAULT_JMX_ENABLED = true;

    /**
     * Публичные ключи конфигурации для использования в других пакетах проекта.
     */
    public static final class Keys {
        /** Адреса Kafka bootstrap.servers. Формат: host:port[,host2:port2]. */
        public static final String BOOTSTRAP = K_BOOTSTRAP;
        /** Шаблон топика назначения (обязательный). */
        public static final String TOPIC_ID = K_TOPIC_ID;
        /** Бюджет повторов; отсутствие ключа означает «повторять бесконечно». */
        public static final String RETRIES = K_RETRIES;
        /** Префикс для переопределения любых свойств Kafka Producer (например, e2k.producer.max.block.ms). */
        public static final String PRODUCER_PREFIX = "e2k.producer.";
        public static final String JMX_ENABLED = K_JMX_ENABLED;

        private Keys() {}
    }

    private final String bootstrap;
    private final TopicSettings topicSettings;
    private final RetrySettings retrySettings;
    private final ProducerSettings producerSettings;
    private final SecuritySettings securitySettings;
    private final CodecSettings codecSettings;
    private final boolean jmxEnabled;

    E2kConfig(String bootstrap, Sections sections) {
        this.bootstrap = Objects.requireNonNull(bootstrap, "Адреса bootstrap не могут быть null");
        Objects.requireNonNull(sections, "Секции конфигурации не могут быть null");
        this.topicSettings = Objects.requireNonNull(sections.topic, "Секция topic не может быть null");
        this.retrySettings = Objects.requireNonNull(sections.retry, "Секция retry не может быть null");
        this.producerSettings = Objects.requireNonNull(sections.producer, "Секция producer не может быть null");
        this.securitySettings = Objects.requireNonNull(sections.security, "Секция security не может быть null");
        this.codecSettings = Objects.requireNonNull(sections.codec, "Секция codec не может быть null");
        this.jmxEnabled = sections.jmxEnabled;
    }

    /**
     * Строит {@link E2kConfig} из Hadoop {@link Configuration}: читает ключи {@code e2k.*},
     * подставляет значения по умолчанию и проверяет инварианты.
     *
     * @param cfg конфигурация с параметрами вида e2k.*
     * @return полностью инициализированная иммутабельная конфигурация
     * @throws ConfigurationException если конфигурация противоречива (отрицательные повторы,
     *                                SSL без truststore, GSSAPI без имени сервиса и т.п.)
     */
    public static E2kConfig from(Configuration cfg) {
        return new E2kConfigLoader().load(cfg);
    }

    public String getBootstrap() {
        return bootstrap;
    }

    public TopicSettings getTopicSettings() {
        return topicSettings;
    }

    public RetrySettings getRetrySettings() {
        return retrySettings;
    }

    public ProducerSettings getProducerSettings() {
        return producerSettings;
    }

    public SecuritySettings getSecuritySettings() {
        return securitySettings;
    }

    public CodecSettings getCodecSettings() {
        return codecSettings;
    }

    public boolean isJmxEnabled() {
        return jmxEnabled;
    }

    /** Набор собранных секций, передаваемый билдером в конструктор. */
    static final class Sections {
        final TopicSettings topic;
        final RetrySettings retry;
        final ProducerSettings producer;
        final SecuritySettings security;
        final CodecSettings codec;
        final boolean jmxEnabled;

        Sections(TopicSettings topic,
                 RetrySettings retry,
                 ProducerSettings producer,
                 SecuritySettings security,
                 CodecSettings codec,
                 boolean jmxEnabled) {
            this.topic = topic;
            this.retry = retry;
            this.producer = producer;
            this.security = security;
            this.codec = codec;
            this.jmxEnabled = jmxEnabled;
        }
    }
}
