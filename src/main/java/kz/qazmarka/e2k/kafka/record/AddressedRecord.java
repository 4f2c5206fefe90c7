package kz.qazmarka.e2k.kafka.record;

import java.util.Objects;

/**
 * Адресованная запись, готовая к отправке: топик, необязательный ключ и полезная нагрузка.
 *
 * Экземпляр неизменяем; массив {@code payload} не копируется и после создания записи не должен меняться.
 */
public final class AddressedRecord {

    private final String topic;
    private final String key;
    private final byte[] payload;

    public AddressedRecord(String topic, String key, byte[] payload) {
        this.topic = Objects.requireNonNull(topic, "Топик не может быть null");
        if (topic.isEmpty()) {
            throw new IllegalArgumentException("Топик не может быть пустым");
        }
        this.key = key;
        this.payload = Objects.requireNonNull(payload, "Payload не может быть null");
    }

    public String topic() {
        return topic;
    }

    /** @return ключ сообщения либо {@code null}, если шаблон ключа не настроен */
    public String key() {
        return key;
    }

    public byte[] payload() {
        return payload;
    }

    @Override
    public String toString() {
        return "AddressedRecord{topic=" + topic + ", key=" + key + ", bytes=" + payload.length + '}';
    }
}
