package kz.qazmarka.e2k.codec;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import kz.qazmarka.e2k.event.Event;
import kz.qazmarka.e2k.event.EventTemplate;

/**
 * Текстовый кодек: событие форматируется шаблоном {@link EventTemplate} (например, {@code %{message}})
 * и кодируется в UTF-8. Нераскрытые ссылки дают пустую строку.
 */
public final class PlainEventCodec implements EventCodec {

    private final EventTemplate format;

    public PlainEventCodec(String format) {
        this.format = EventTemplate.compile(Objects.requireNonNull(format, "Формат не может быть null"), false);
    }

    @Override
    public void encode(Event event, EncodedEventListener listener) {
        Objects.requireNonNull(event, "Событие не может быть null");
        Objects.requireNonNull(listener, "Получатель не может быть null");
        listener.onEncoded(event, format.render(event).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String name() {
        return "plain(" + format.source() + ')';
    }
}
