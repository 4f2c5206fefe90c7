package kz.qazmarka.e2k.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import kz.qazmarka.e2k.config.CodecSettings.CodecType;
import kz.qazmarka.e2k.config.ProducerSettings.AckMode;
import kz.qazmarka.e2k.config.ProducerSettings.Compression;
import kz.qazmarka.e2k.config.RetrySettings.BackoffMode;
import kz.qazmarka.e2k.config.SecuritySettings.Protocol;
import kz.qazmarka.e2k.event.EventTemplate;

/**
 * Отдельный билдер для сборки итогового {@link E2kConfig} без жёсткой связности.
 * Используется загрузчиком конфигурации и тестами для декларативной настройки секций.
 *
 * Все проверки согласованности собраны в {@link #build()}: ошибка конфигурации обнаруживается
 * до создания продьюсера и до первой отправки.
 */
public final class E2kConfigBuilder {
    private String bootstrap = E2kConfig.DEFAULT_BOOTSTRAP;
    private String topicTemplate;
    private String keyTemplate;
    private boolean strictTemplates = E2kConfig.DEFAULT_TEMPLATE_STRICT;
    private Integer retries;
    private long backoffMs = E2kConfig.DEFAULT_RETRY_BACKOFF_MS;
    private BackoffMode backoffMode = BackoffMode.FIXED;
    private int jitterPercent = E2kConfig.DEFAULT_JITTER_PERCENT;
    private AckMode acks = AckMode.LEADER;
    private int batchSize = E2kConfig.DEFAULT_BATCH_SIZE;
    private long bufferMemory = E2kConfig.DEFAULT_BUFFER_MEMORY;
    private Compression compression = Compression.NONE;
    private String clientId;
    private long lingerMs = E2kConfig.DEFAULT_LINGER_MS;
    private int maxRequestSize = E2kConfig.DEFAULT_MAX_REQUEST_SIZE;
    private long reconnectBackoffMs = E2kConfig.DEFAULT_RECONNECT_BACKOFF_MS;
    private Integer requestTimeoutMs;
    private int sendBufferBytes = E2kConfig.DEFAULT_SEND_BUFFER;
    private int receiveBufferBytes = E2kConfig.DEFAULT_RECEIVE_BUFFER;
    private long metadataMaxAgeMs = E2kConfig.DEFAULT_METADATA_MAX_AGE_MS;
    private Map<String, String> passThrough = Collections.emptyMap();
    private Protocol protocol = Protocol.PLAINTEXT;
    private String truststoreType;
    private String truststoreLocation;
    private String truststorePassword;
    private String keystoreType;
    private String keystoreLocation;
    private String keystorePassword;
    private String keyPassword;
    private String saslMechanism = E2kConfig.DEFAULT_SASL_MECHANISM;
    private String kerberosServiceName;
    private String jaasConfig;
    private String jaasPath;
    private String kerberosConfig;
    private CodecType codecType = CodecType.JSON;
    private String plainFormat = E2kConfig.DEFAULT_PLAIN_FORMAT;
    private boolean jmxEnabled = E2kConfig.DEFAULT_JMX_ENABLED;

    public E2kConfigBuilder bootstrap(String servers) {
        this.bootstrap = servers;
        return this;
    }

    public E2kConfigBuilder jmxEnabled(boolean enabled) {
        this.jmxEnabled = enabled;
        return this;
    }

    public TopicOptions topic() {
        return new TopicOptions();
    }

    public RetryOptions retry() {
        return new RetryOptions();
    }

    public ProducerOptions producer() {
        return new ProducerOptions();
    }

    public SecurityOptions security() {
        return new SecurityOptions();
    }

    public CodecOptions codec() {
        return new CodecOptions();
    }

    /**
     * Проверяет инварианты и собирает иммутабельную конфигурацию.
     *
     * @return готовая конфигурация
     * @throws ConfigurationException при любом нарушении инвариантов
     */
    public E2kConfig build() {
        String servers = requireNonBlank(bootstrap, E2kConfig.K_BOOTSTRAP);
        String topic = requireNonBlank(topicTemplate, E2kConfig.K_TOPIC_ID);
        validateRetry();
        validateSecurity();
        validateTemplate(E2kConfig.K_TOPIC_ID, topic);
        validateTemplate(E2kConfig.K_MESSAGE_KEY, blankToNull(keyTemplate));
        if (codecType == CodecType.PLAIN) {
            validateTemplate(E2kConfig.K_CODEC_PLAIN_FORMAT, plainFormat);
        }

        TopicSettings topicSettings = new TopicSettings(topic, blankToNull(keyTemplate), strictTemplates);
        RetrySettings retrySettings = new RetrySettings(retries, backoffMs, backoffMode, jitterPercent);
        ProducerSettings producerSettings = new ProducerSettings(
                acks,
                new ProducerSettings.Limits(batchSize, bufferMemory, maxRequestSize, lingerMs),
                compression,
                blankToNull(clientId),
                new ProducerSettings.Network(reconnectBackoffMs,
                        requestTimeoutMs,
                        sendBufferBytes,
                        receiveBufferBytes,
                        metadataMaxAgeMs),
                passThrough == null ? Collections.<String, String>emptyMap() : new HashMap<>(passThrough));
        SecuritySettings securitySettings = new SecuritySettings(
                protocol,
                new SecuritySettings.Ssl(truststoreType,
                        truststoreLocation,
                        truststorePassword,
                        keystoreType,
                        keystoreLocation,
                        keystorePassword,
                        keyPassword),
                new SecuritySettings.Sasl(saslMechanism,
                        kerberosServiceName,
                        jaasConfig,
                        jaasPath,
                        kerberosConfig));
        CodecSettings codecSettings = new CodecSettings(codecType, plainFormat);

        E2kConfig.Sections sections = new E2kConfig.Sections(
                topicSettings,
                retrySettings,
                producerSettings,
                securitySettings,
                codecSettings,
                jmxEnabled);
        return new E2kConfig(servers, sections);
    }

    private void validateRetry() {
        if (retries != null && retries < 0) {
            throw new ConfigurationException("Отрицательное число повторов (" + retries + ") недопустимо ("
                    + E2kConfig.K_RETRIES + "): значение должно быть >= 0");
        }
        if (backoffMs <= 0L) {
            throw new ConfigurationException("Пауза между повторами должна быть > 0 мс ("
                    + E2kConfig.K_RETRY_BACKOFF_MS + "=" + backoffMs + ")");
        }
        if (jitterPercent < 0 || jitterPercent > 100) {
            throw new ConfigurationException("Джиттер backoff должен быть в диапазоне 0..100 ("
                    + E2kConfig.K_RETRY_BACKOFF_JITTER + "=" + jitterPercent + ")");
        }
    }

    private void validateSecurity() {
        if (protocol.usesSsl() && blankToNull(truststoreLocation) == null) {
            throw new ConfigurationException(E2kConfig.K_SSL_TRUSTSTORE_LOCATION
                    + " должен быть задан при включённом SSL (" + E2kConfig.K_SECURITY_PROTOCOL + "=" + protocol + ")");
        }
        if (protocol.usesSasl()
                && SecuritySettings.MECHANISM_GSSAPI.equals(saslMechanism)
                && blankToNull(kerberosServiceName) == null) {
            throw new ConfigurationException(E2kConfig.K_SASL_KERBEROS_SERVICE_NAME
                    + " должен быть задан для механизма SASL GSSAPI");
        }
    }

    /** Шаблон компилируется заранее, чтобы ошибка в {@code %{+...}} не всплыла после создания продьюсера. */
    private static void validateTemplate(String key, String template) {
        if (template == null) {
            return;
        }
        try {
            EventTemplate.compile(template, false);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Некорректный шаблон " + key + "='" + template + "': "
                    + ex.getMessage(), ex);
        }
    }

    private static String requireNonBlank(String value, String key) {
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException("Отсутствует обязательный параметр конфигурации: " + key);
        }
        return value.trim();
    }

    private static String blankToNull(String value) {
        return (value == null || value.isEmpty()) ? null : value;
    }

    public final class TopicOptions {
        public TopicOptions id(String template) {
            topicTemplate = template;
            return this;
        }

        public TopicOptions messageKey(String template) {
            keyTemplate = template;
            return this;
        }

        public TopicOptions strictTemplates(boolean strict) {
            strictTemplates = strict;
            return this;
        }

        public E2kConfigBuilder done() {
            return E2kConfigBuilder.this;
        }
    }

    public final class RetryOptions {
        /** @param value число дополнительных попыток; {@code null} означает отсутствие ограничений */
        public RetryOptions retries(Integer value) {
            retries = value;
            return this;
        }

        public RetryOptions unlimited() {
            retries = null;
            return this;
        }

        public RetryOptions backoffMs(long value) {
            backoffMs = value;
            return this;
        }

        public RetryOptions backoffMode(BackoffMode mode) {
            backoffMode = (mode == null) ? BackoffMode.FIXED : mode;
            return this;
        }

        public RetryOptions jitterPercent(int value) {
            jitterPercent = value;
            return this;
        }

        public E2kConfigBuilder done() {
            return E2kConfigBuilder.this;
        }
    }

    public final class ProducerOptions {
        public ProducerOptions acks(AckMode mode) {
            acks = (mode == null) ? AckMode.LEADER : mode;
            return this;
        }

        public ProducerOptions batchSize(int value) {
            batchSize = value;
            return this;
        }

        public ProducerOptions bufferMemory(long value) {
            bufferMemory = value;
            return this;
        }

        public ProducerOptions compression(Compression value) {
            compression = (value == null) ? Compression.NONE : value;
            return this;
        }

        public ProducerOptions clientId(String value) {
            clientId = value;
            return this;
        }

        public ProducerOptions lingerMs(long value) {
            lingerMs = value;
            return this;
        }

        public ProducerOptions maxRequestSize(int value) {
            maxRequestSize = value;
            return this;
        }

        public ProducerOptions reconnectBackoffMs(long value) {
            reconnectBackoffMs = value;
            return this;
        }

        public ProducerOptions requestTimeoutMs(Integer value) {
            requestTimeoutMs = value;
            return this;
        }

        public ProducerOptions sendBufferBytes(int value) {
            sendBufferBytes = value;
            return this;
        }

        public ProducerOptions receiveBufferBytes(int value) {
            receiveBufferBytes = value;
            return this;
        }

        public ProducerOptions metadataMaxAgeMs(long value) {
            metadataMaxAgeMs = value;
            return this;
        }

        public ProducerOptions passThrough(Map<String, String> props) {
            passThrough = props;
            return this;
        }

        public E2kConfigBuilder done() {
            return E2kConfigBuilder.this;
        }
    }

    public final class SecurityOptions {
        public SecurityOptions protocol(Protocol value) {
            protocol = (value == null) ? Protocol.PLAINTEXT : value;
            return this;
        }

        public SecurityOptions truststore(String type, String location, String password) {
            truststoreType = type;
            truststoreLocation = location;
            truststorePassword = password;
            return this;
        }

        public SecurityOptions keystore(String type, String location, String password, String keyPass) {
            keystoreType = type;
            keystoreLocation = location;
            keystorePassword = password;
            keyPassword = keyPass;
            return this;
        }

        public SecurityOptions saslMechanism(String mechanism) {
            saslMechanism = (mechanism == null || mechanism.trim().isEmpty())
                    ? E2kConfig.DEFAULT_SASL_MECHANISM
                    : mechanism.trim();
            return this;
        }

        public SecurityOptions kerberosServiceName(String name) {
            kerberosServiceName = name;
            return this;
        }

        public SecurityOptions jaasConfig(String inlineConfig) {
            jaasConfig = inlineConfig;
            return this;
        }

        public SecurityOptions jaasPath(String path) {
            jaasPath = path;
            return this;
        }

        public SecurityOptions kerberosConfig(String path) {
            kerberosConfig = path;
            return this;
        }

        public E2kConfigBuilder done() {
            return E2kConfigBuilder.this;
        }
    }

    public final class CodecOptions {
        public CodecOptions type(CodecType type) {
            codecType = (type == null) ? CodecType.JSON : type;
            return this;
        }

        public CodecOptions plainFormat(String format) {
            plainFormat = (format == null || format.isEmpty()) ? E2kConfig.DEFAULT_PLAIN_FORMAT : format;
            return this;
        }

        public E2kConfigBuilder done() {
            return E2kConfigBuilder.this;
        }
    }
}
