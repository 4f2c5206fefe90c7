package kz.qazmarka.e2k.config;

import java.util.Objects;

/**
 * Настройки адресации записей: шаблон топика, необязательный шаблон ключа партиционирования
 * и режим строгой подстановки полей.
 */
public final class TopicSettings {

    private final String topicTemplate;
    private final String keyTemplate;
    private final boolean strictTemplates;

    TopicSettings(String topicTemplate, String keyTemplate, boolean strictTemplates) {
        this.topicTemplate = Objects.requireNonNull(topicTemplate, "Шаблон топика не может быть null");
        this.keyTemplate = keyTemplate;
        this.strictTemplates = strictTemplates;
    }

    public String getTopicTemplate() {
        return topicTemplate;
    }

    /** @return шаблон ключа либо {@code null}, если ключ не задан (брокер партиционирует по умолчанию) */
    public String getKeyTemplate() {
        return keyTemplate;
    }

    public boolean hasKeyTemplate() {
        return keyTemplate != null;
    }

    /** При {@code true} нераскрытая ссылка на поле считается ошибкой события, иначе подставляется пустая строка. */
    public boolean isStrictTemplates() {
        return strictTemplates;
    }
}
