package kz.qazmarka.e2k.config;

import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.e2k.config.CodecSettings.CodecType;
import kz.qazmarka.e2k.util.Parsers;

/**
 * Загружает {@link E2kConfig} из Hadoop {@link Configuration}, инкапсулируя логику парсинга.
 */
final class E2kConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(E2kConfigLoader.class);

    /**
     * Формирует {@link E2kConfig}, объединяя секции {@code e2k.*} из конфигурации.
     *
     * @param cfg исходная конфигурация
     * @return иммутабельная конфигурация, готовая к передаче в рабочие компоненты
     * @throws ConfigurationException при нарушении инвариантов конфигурации
     */
    E2kConfig load(Configuration cfg) {
        if (cfg == null) {
            throw new ConfigurationException("Конфигурация не может быть null");
        }
        ConfigSections sections = ConfigSections.collect(cfg);
        E2kConfigBuilder builder = new E2kConfigBuilder()
                .bootstrap(Parsers.readStringOrDefault(cfg, E2kConfig.K_BOOTSTRAP, E2kConfig.DEFAULT_BOOTSTRAP))
                .jmxEnabled(Parsers.readBoolean(cfg, E2kConfig.K_JMX_ENABLED, E2kConfig.DEFAULT_JMX_ENABLED));
        applyTopicSection(builder, sections.topic);
        applyRetrySection(builder, sections.retry);
        applyProducerSection(builder, sections.producer);
        applySecuritySection(builder, sections.security);
        applyCodec(builder, cfg);
        E2kConfig config = builder.build();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Конфигурация e2k загружена: bootstrap={}, топик={}, ключ={}, повторы={}, backoff_мс={}",
                    config.getBootstrap(),
                    config.getTopicSettings().getTopicTemplate(),
                    config.getTopicSettings().getKeyTemplate(),
                    config.getRetrySettings().isUnlimited() ? "без ограничений" : config.getRetrySettings().getRetries(),
                    config.getRetrySettings().getBackoffMs());
        }
        return config;
    }

    private static void applyTopicSection(E2kConfigBuilder builder, TopicSection topic) {
        builder.topic()
                .id(topic.topicTemplate)
                .messageKey(topic.keyTemplate)
                .strictTemplates(topic.strict)
                .done();
    }

    private static void applyRetrySection(E2kConfigBuilder builder, RetrySection retry) {
        builder.retry()
                .retries(retry.retries)
                .backoffMs(retry.backoffMs)
                .backoffMode(retry.backoffMode)
                .jitterPercent(retry.jitterPercent)
                .done();
    }

    private static void applyProducerSection(E2kConfigBuilder builder, ProducerSection producer) {
        builder.producer()
                .acks(producer.acks)
                .batchSize(producer.batchSize)
                .bufferMemory(producer.bufferMemory)
                .compression(producer.compression)
                .clientId(producer.clientId)
                .lingerMs(producer.lingerMs)
                .maxRequestSize(producer.maxRequestSize)
                .reconnectBackoffMs(producer.reconnectBackoffMs)
                .requestTimeoutMs(producer.requestTimeoutMs)
                .sendBufferBytes(producer.sendBufferBytes)
                .receiveBufferBytes(producer.receiveBufferBytes)
                .metadataMaxAgeMs(producer.metadataMaxAgeMs)
                .passThrough(producer.passThrough)
                .done();
    }

    private static void applySecuritySection(E2kConfigBuilder builder, SecuritySection security) {
        builder.security()
                .protocol(security.protocol)
                .truststore(security.truststoreType, security.truststoreLocation, security.truststorePassword)
                .keystore(security.keystoreType, security.keystoreLocation, security.keystorePassword,
                        security.keyPassword)
                .saslMechanism(security.saslMechanism)
                .kerberosServiceName(security.kerberosServiceName)
                .jaasConfig(security.jaasConfig)
                .jaasPath(security.jaasPath)
                .kerberosConfig(security.kerberosConfig)
                .done();
    }

    private static void applyCodec(E2kConfigBuilder builder, Configuration cfg) {
        String rawType = cfg.getTrimmed(E2kConfig.K_CODEC);
        CodecType type = (rawType == null || rawType.isEmpty()) ? CodecType.JSON : CodecType.parse(rawType);
        builder.codec()
                .type(type)
                .plainFormat(Parsers.readRawOrNull(cfg, E2kConfig.K_CODEC_PLAIN_FORMAT))
                .done();
    }

    private static final class ConfigSections {
        final TopicSection topic;
        final RetrySection retry;
        final ProducerSection producer;
        final SecuritySection security;

        private ConfigSections(TopicSection topic,
                               RetrySection retry,
                               ProducerSection producer,
                               SecuritySection security) {
            this.topic = topic;
            this.retry = retry;
            this.producer = producer;
            this.security = security;
        }

        static ConfigSections collect(Configuration cfg) {
            return new ConfigSections(
                    TopicSection.from(cfg),
                    RetrySection.from(cfg),
                    ProducerSection.from(cfg),
                    SecuritySection.from(cfg));
        }
    }
}
