package kz.qazmarka.e2k.event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Структурированное событие, поступающее в выход: вложенная карта полей и отметка времени.
 *
 * Ссылка на поле задаётся именем верхнего уровня ({@code message}) или путём в скобочной нотации
 * ({@code [host][name]}). Поле {@code @timestamp} всегда доступно и берётся из {@link #getTimestamp()}.
 *
 * Экземпляр неизменяем на уровне верхней карты; вложенные значения не копируются глубоко,
 * поэтому вызывающая сторона не должна менять их после передачи события в выход.
 */
public final class Event {

    /** Имя поля с отметкой времени события. */
    public static final String TIMESTAMP_FIELD = "@timestamp";

    /**
     * Сигнальное событие остановки конвейера: встретив его в пачке, выход прекращает кодирование
     * оставшихся событий этого вызова.
     */
    public static final Event SHUTDOWN = new Event(Instant.EPOCH, Collections.<String, Object>emptyMap());

    private final Instant timestamp;
    private final Map<String, Object> fields;

    public Event(Map<String, ?> fields) {
        this(Instant.now(), fields);
    }

    public Event(Instant timestamp, Map<String, ?> fields) {
        this.timestamp = Objects.requireNonNull(timestamp, "Отметка времени события не может быть null");
        Objects.requireNonNull(fields, "Поля события не могут быть null");
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        this.fields = Collections.unmodifiableMap(copy);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /** @return неизменяемое представление полей верхнего уровня (без {@code @timestamp}) */
    public Map<String, Object> getFields() {
        return fields;
    }

    public boolean isShutdownSignal() {
        return this == SHUTDOWN;
    }

    /**
     * Возвращает значение по ссылке на поле.
     *
     * @param reference {@code name} или {@code [a][b]}
     * @return значение либо {@code null}, если путь не разрешается
     */
    public Object get(String reference) {
        List<String> path = parseReference(reference);
        if (path.isEmpty()) {
            return null;
        }
        if (path.size() == 1 && TIMESTAMP_FIELD.equals(path.get(0)) && !fields.containsKey(TIMESTAMP_FIELD)) {
            return timestamp;
        }
        Object current = fields;
        for (String segment : path) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Разбирает ссылку на поле в список сегментов пути.
     * Некорректная скобочная нотация ({@code [a}, {@code a]b}) трактуется как имя поля целиком.
     */
    static List<String> parseReference(String reference) {
        if (reference == null) {
            return Collections.emptyList();
        }
        String ref = reference.trim();
        if (ref.isEmpty()) {
            return Collections.emptyList();
        }
        if (ref.charAt(0) != '[') {
            return Collections.singletonList(ref);
        }
        List<String> out = new ArrayList<>(4);
        int i = 0;
        while (i < ref.length()) {
            if (ref.charAt(i) != '[') {
                return Collections.singletonList(ref);
            }
            int close = ref.indexOf(']', i + 1);
            if (close < 0) {
                return Collections.singletonList(ref);
            }
            String segment = ref.substring(i + 1, close);
            if (segment.isEmpty()) {
                return Collections.singletonList(ref);
            }
            out.add(segment);
            i = close + 1;
        }
        return out;
    }

    @Override
    public String toString() {
        if (isShutdownSignal()) {
            return "Event{SHUTDOWN}";
        }
        return "Event{" + TIMESTAMP_FIELD + '=' + timestamp + ", fields=" + fields.keySet() + '}';
    }
}
