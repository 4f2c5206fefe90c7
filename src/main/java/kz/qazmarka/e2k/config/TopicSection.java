package kz.qazmarka.e2k.config;

import org.apache.hadoop.conf.Configuration;

import kz.qazmarka.e2k.util.Parsers;

/**
 * Секция адресации: шаблон топика, шаблон ключа и режим строгой подстановки.
 */
final class TopicSection {
    final String topicTemplate;
    final String keyTemplate;
    final boolean strict;

    private TopicSection(String topicTemplate, String keyTemplate, boolean strict) {
        this.topicTemplate = topicTemplate;
        this.keyTemplate = keyTemplate;
        this.strict = strict;
    }

    /**
     * Шаблоны читаются без обрезки пробелов: пробел в формате ключа может быть значимым.
     *
     * @param cfg конфигурация Hadoop с ключами {@code e2k.topic.*}, {@code e2k.message.key}
     * @return секция (иммутабельная); обязательность топика проверяет билдер
     */
    static TopicSection from(Configuration cfg) {
        String topic = Parsers.readRawOrNull(cfg, E2kConfig.K_TOPIC_ID);
        String key = Parsers.readRawOrNull(cfg, E2kConfig.K_MESSAGE_KEY);
        boolean strict = Parsers.readBoolean(cfg, E2kConfig.K_TEMPLATE_STRICT, E2kConfig.DEFAULT_TEMPLATE_STRICT);
        return new TopicSection(topic, key, strict);
    }
}
