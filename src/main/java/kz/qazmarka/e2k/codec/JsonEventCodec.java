package kz.qazmarka.e2k.codec;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import kz.qazmarka.e2k.event.Event;
import kz.qazmarka.e2k.event.EventJson;

/**
 * JSON-кодек по умолчанию: событие печатается одним JSON-объектом в UTF-8,
 * первым полем идёт {@code @timestamp} в ISO-8601.
 */
public final class JsonEventCodec implements EventCodec {

    @Override
    public void encode(Event event, EncodedEventListener listener) {
        Objects.requireNonNull(event, "Событие не может быть null");
        Objects.requireNonNull(listener, "Получатель не может быть null");
        listener.onEncoded(event, EventJson.toJson(event).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String name() {
        return "json";
    }
}
