package kz.qazmarka.e2k.kafka.record;

import java.util.Objects;

import kz.qazmarka.e2k.config.TopicSettings;
import kz.qazmarka.e2k.event.Event;
import kz.qazmarka.e2k.event.EventTemplate;

/**
 * Собирает {@link AddressedRecord} из события и закодированного payload,
 * подставляя поля события в шаблоны топика и ключа.
 *
 * Шаблоны компилируются один раз в конструкторе. Потокобезопасен.
 */
public final class RecordBuilder {

    private final EventTemplate topicTemplate;
    private final EventTemplate keyTemplate;

    public RecordBuilder(TopicSettings settings) {
        this(Objects.requireNonNull(settings, "Настройки топика не могут быть null").getTopicTemplate(),
                settings.getKeyTemplate(),
                settings.isStrictTemplates());
    }

    /**
     * @param topicTemplate шаблон имени топика (обязателен)
     * @param keyTemplate   шаблон ключа либо {@code null}
     * @param strict        строгий режим подстановки
     */
    public RecordBuilder(String topicTemplate, String keyTemplate, boolean strict) {
        this.topicTemplate = EventTemplate.compile(
                Objects.requireNonNull(topicTemplate, "Шаблон топика не может быть null"), strict);
        this.keyTemplate = keyTemplate == null ? null : EventTemplate.compile(keyTemplate, strict);
    }

    /**
     * @param event   событие-источник значений для шаблонов
     * @param payload закодированное событие
     * @return адресованная запись
     * @throws kz.qazmarka.e2k.event.TemplateException в строгом режиме при нераскрытой ссылке
     * @throws IllegalArgumentException если топик раскрылся в пустую строку
     */
    public AddressedRecord build(Event event, byte[] payload) {
        String topic = topicTemplate.render(event);
        if (topic.isEmpty()) {
            throw new IllegalArgumentException("Шаблон топика '" + topicTemplate.source()
                    + "' дал пустое имя для события " + event);
        }
        String key = keyTemplate == null ? null : keyTemplate.render(event);
        return new AddressedRecord(topic, key, payload);
    }

    public boolean hasKey() {
        return keyTemplate != null;
    }
}
