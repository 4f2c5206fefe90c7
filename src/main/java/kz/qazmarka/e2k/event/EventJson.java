package kz.qazmarka.e2k.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;

/**
 * Общий экземпляр {@link Gson} для печати событий и их фрагментов.
 * {@link Instant} печатается в ISO-8601 (рефлексия по {@code java.time} на JDK 17 закрыта).
 */
public final class EventJson {

    private static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .serializeNulls()
            .registerTypeAdapter(Instant.class,
                    (JsonSerializer<Instant>) (src, type, ctx) -> new JsonPrimitive(src.toString()))
            .create();

    private EventJson() {}

    public static Gson gson() {
        return GSON;
    }

    /**
     * Печатает событие целиком: {@code @timestamp} первым полем, затем поля в порядке вставки.
     */
    public static String toJson(Event event) {
        Map<String, Object> out = new LinkedHashMap<>(event.getFields().size() + 1);
        out.put(Event.TIMESTAMP_FIELD, event.getTimestamp());
        out.putAll(event.getFields());
        return GSON.toJson(out);
    }

    /** Печатает произвольное значение (карта, коллекция, скаляр) в JSON. */
    public static String toJson(Object value) {
        return GSON.toJson(value);
    }
}
