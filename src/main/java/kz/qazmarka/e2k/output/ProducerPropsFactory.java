package kz.qazmarka.e2k.output;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;

import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.config.SslConfigs;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

import kz.qazmarka.e2k.config.E2kConfig;
import kz.qazmarka.e2k.config.ProducerSettings;
import kz.qazmarka.e2k.config.RetrySettings;
import kz.qazmarka.e2k.config.SecuritySettings;

/**
 * Построитель настроек Kafka Producer из {@link E2kConfig}.
 *
 * Порядок заполнения:
 *  - обязательные параметры (bootstrap, строковый ключ, байты кодека в значении);
 *  - явные параметры {@code e2k.*} (acks, повторы клиента, лимиты, сетевые буферы);
 *  - безопасность: SSL и SASL по протоколу;
 *  - {@code client.id}: заданный явно либо префикс + hostname + короткий случайный суффикс;
 *  - pass-through: валидные ключи продьюсера из {@code e2k.producer.*}, если не заданы выше.
 */
final class ProducerPropsFactory {

    static final String DEFAULT_CLIENT_ID_PREFIX = "e2k-output";
    private static final String STRING_SERIALIZER = StringSerializer.class.getName();
    private static final String BYTE_ARRAY_SERIALIZER = ByteArraySerializer.class.getName();

    private ProducerPropsFactory() {
    }

    static Properties build(E2kConfig config) {
        Properties props = createBaseProperties(config.getBootstrap());
        applyProducerSettings(props, config.getProducerSettings());
        applyRetrySettings(props, config.getRetrySettings());
        applySecuritySettings(props, config.getSecuritySettings());
        props.put(ProducerConfig.CLIENT_ID_CONFIG, computeClientId(config.getProducerSettings().getClientId()));
        applyPassThroughSettings(props, config.getProducerSettings().getPassThrough());
        return props;
    }

    private static Properties createBaseProperties(String bootstrap) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, STRING_SERIALIZER);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, BYTE_ARRAY_SERIALIZER);
        return props;
    }

    private static void applyProducerSettings(Properties props, ProducerSettings producer) {
        props.put(ProducerConfig.ACKS_CONFIG, producer.getAcks().kafkaValue());
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, String.valueOf(producer.getBatchSize()));
        props.put(ProducerConfig.BUFFER_MEMORY_CONFIG, String.valueOf(producer.getBufferMemory()));
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, producer.getCompression().kafkaValue());
        props.put(ProducerConfig.LINGER_MS_CONFIG, String.valueOf(producer.getLingerMs()));
        props.put(ProducerConfig.MAX_REQUEST_SIZE_CONFIG, String.valueOf(producer.getMaxRequestSize()));
        props.put(ProducerConfig.RECONNECT_BACKOFF_MS_CONFIG, String.valueOf(producer.getReconnectBackoffMs()));
        if (producer.getRequestTimeoutMs() != null) {
            props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, String.valueOf(producer.getRequestTimeoutMs()));
        }
        props.put(ProducerConfig.SEND_BUFFER_CONFIG, String.valueOf(producer.getSendBufferBytes()));
        props.put(ProducerConfig.RECEIVE_BUFFER_CONFIG, String.valueOf(producer.getReceiveBufferBytes()));
        props.put(ProducerConfig.METADATA_MAX_AGE_CONFIG, String.valueOf(producer.getMetadataMaxAgeMs()));
    }

    /**
     * Бюджет повторов и пауза передаются и самому клиенту Kafka: он повторяет запросы внутри,
     * а выход добавляет повторы уровня пачки поверх.
     */
    private static void applyRetrySettings(Properties props, RetrySettings retry) {
        if (!retry.isUnlimited()) {
            props.put(ProducerConfig.RETRIES_CONFIG, String.valueOf(retry.getRetries()));
        }
        props.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, String.valueOf(retry.getBackoffMs()));
    }

    private static void applySecuritySettings(Properties props, SecuritySettings security) {
        SecuritySettings.Protocol protocol = security.getProtocol();
        props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, protocol.name());
        if (protocol.usesSsl()) {
            SecuritySettings.Ssl ssl = security.getSsl();
            putIfNotNull(props, SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, ssl.getTruststoreType());
            putIfNotNull(props, SslConfigs.SSL_TRUSTSTORE_LOCATION_CONFIG, ssl.getTruststoreLocation());
            putIfNotNull(props, SslConfigs.SSL_TRUSTSTORE_PASSWORD_CONFIG, ssl.getTruststorePassword());
            putIfNotNull(props, SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, ssl.getKeystoreType());
            putIfNotNull(props, SslConfigs.SSL_KEYSTORE_LOCATION_CONFIG, ssl.getKeystoreLocation());
            putIfNotNull(props, SslConfigs.SSL_KEYSTORE_PASSWORD_CONFIG, ssl.getKeystorePassword());
            putIfNotNull(props, SslConfigs.SSL_KEY_PASSWORD_CONFIG, ssl.getKeyPassword());
        }
        if (protocol.usesSasl()) {
            SecuritySettings.Sasl sasl = security.getSasl();
            props.put(SaslConfigs.SASL_MECHANISM, sasl.getMechanism());
            putIfNotNull(props, SaslConfigs.SASL_KERBEROS_SERVICE_NAME, sasl.getKerberosServiceName());
            putIfNotNull(props, SaslConfigs.SASL_JAAS_CONFIG, sasl.getJaasConfig());
        }
    }

    private static void putIfNotNull(Properties props, String key, String value) {
        if (value != null) {
            props.put(key, value);
        }
    }

    static String computeClientId(String configured) {
        if (configured != null && !configured.isEmpty()) {
            return configured;
        }
        String randomSuffix = UUID.randomUUID().toString().substring(0, 8);
        return buildDefaultClientId() + '-' + randomSuffix;
    }

    private static String buildDefaultClientId() {
        try {
            String host = InetAddress.getLocalHost().getHostName();
            if (host == null || host.isEmpty()) {
                return DEFAULT_CLIENT_ID_PREFIX;
            }
            return DEFAULT_CLIENT_ID_PREFIX + '-' + host;
        } catch (UnknownHostException ex) {
            return DEFAULT_CLIENT_ID_PREFIX;
        }
    }

    private static void applyPassThroughSettings(Properties props, Map<String, String> passThrough) {
        Set<String> kafkaKeys = ProducerConfig.configNames();
        for (Map.Entry<String, String> entry : passThrough.entrySet()) {
            if (kafkaKeys.contains(entry.getKey())) {
                props.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
    }
}
