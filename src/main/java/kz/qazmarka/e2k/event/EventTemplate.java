package kz.qazmarka.e2k.event;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Предкомпилированный шаблон строки с подстановкой полей события.
 *
 * Синтаксис:
 *  - {@code %{field}} и {@code %{[a][b]}}: значение поля (см. {@link Event#get(String)});
 *  - {@code %{+yyyy.MM.dd}}: отметка времени события в UTC по шаблону {@link DateTimeFormatter}
 *    ({@code YYYY} понимается как календарный год);
 *  - {@code %{+%s}}: отметка времени в секундах эпохи;
 *  - незакрытая {@code %{} остаётся литералом.
 *
 * Нераскрытая ссылка в мягком режиме даёт пустую строку, в строгом режиме {@link TemplateException}.
 * Карты и коллекции печатаются как JSON.
 *
 * Потокобезопасность: экземпляр неизменяем и может разделяться между потоками.
 */
public final class EventTemplate {

    private static final String EPOCH_SECONDS = "%s";

    private final String source;
    private final boolean strict;
    private final List<Part> parts;
    private final boolean literal;

    private EventTemplate(String source, boolean strict, List<Part> parts) {
        this.source = source;
        this.strict = strict;
        this.parts = parts;
        this.literal = parts.size() == 1 && parts.get(0) instanceof Literal;
    }

    /**
     * Компилирует шаблон.
     *
     * @param source исходная строка шаблона
     * @param strict бросать ли {@link TemplateException} при нераскрытой ссылке
     * @return шаблон, готовый к многократному применению
     * @throws IllegalArgumentException если шаблон времени {@code %{+...}} некорректен
     */
    public static EventTemplate compile(String source, boolean strict) {
        Objects.requireNonNull(source, "Шаблон не может быть null");
        return new EventTemplate(source, strict, parse(source));
    }

    public String source() {
        return source;
    }

    /** @return {@code true}, если шаблон не содержит ссылок на поля */
    public boolean isLiteral() {
        return literal || parts.isEmpty();
    }

    /**
     * Подставляет поля события в шаблон.
     *
     * @param event событие-источник значений
     * @return итоговая строка
     * @throws TemplateException в строгом режиме, если ссылка не разрешилась
     */
    public String render(Event event) {
        if (parts.isEmpty()) {
            return "";
        }
        if (literal) {
            return ((Literal) parts.get(0)).text;
        }
        StringBuilder sb = new StringBuilder(source.length() + 16);
        for (Part part : parts) {
            part.appendTo(sb, event, this);
        }
        return sb.toString();
    }

    private static List<Part> parse(String source) {
        List<Part> out = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int i = 0;
        final int len = source.length();
        while (i < len) {
            int open = source.indexOf("%{", i);
            if (open < 0) {
                text.append(source, i, len);
                break;
            }
            int close = source.indexOf('}', open + 2);
            if (close < 0) {
                text.append(source, i, len);
                break;
            }
            text.append(source, i, open);
            String body = source.substring(open + 2, close);
            if (text.length() > 0) {
                out.add(new Literal(text.toString()));
                text.setLength(0);
            }
            out.add(body.startsWith("+") ? TimeFormat.of(body.substring(1)) : new FieldRef(body));
            i = close + 1;
        }
        if (text.length() > 0) {
            out.add(new Literal(text.toString()));
        }
        return Collections.unmodifiableList(out);
    }

    static String stringify(Object value) {
        if (value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof Map || value instanceof Collection) {
            return EventJson.toJson(value);
        }
        if (value instanceof Instant) {
            return value.toString();
        }
        return String.valueOf(value);
    }

    private interface Part {
        void appendTo(StringBuilder sb, Event event, EventTemplate owner);
    }

    private static final class Literal implements Part {
        final String text;

        Literal(String text) {
            this.text = text;
        }

        @Override
        public void appendTo(StringBuilder sb, Event event, EventTemplate owner) {
            sb.append(text);
        }
    }

    private static final class FieldRef implements Part {
        final String reference;

        FieldRef(String reference) {
            this.reference = reference;
        }

        @Override
        public void appendTo(StringBuilder sb, Event event, EventTemplate owner) {
            Object value = event.get(reference);
            if (value == null) {
                if (owner.strict) {
                    throw new TemplateException(owner.source, reference);
                }
                return;
            }
            sb.append(stringify(value));
        }
    }

    private static final class TimeFormat implements Part {
        final DateTimeFormatter formatter;

        private TimeFormat(DateTimeFormatter formatter) {
            this.formatter = formatter;
        }

        static TimeFormat of(String pattern) {
            if (EPOCH_SECONDS.equals(pattern)) {
                return new TimeFormat(null);
            }
            return new TimeFormat(DateTimeFormatter.ofPattern(javaTimePattern(pattern)).withZone(ZoneOffset.UTC));
        }

        /**
         * Шаблоны времени пишутся в нотации Joda: {@code Y} там означает год эры, а в {@code java.time}
         * это год по неделям ISO. Вне кавычек {@code Y} заменяется на {@code y}.
         */
        static String javaTimePattern(String pattern) {
            StringBuilder sb = new StringBuilder(pattern.length());
            boolean quoted = false;
            for (int i = 0; i < pattern.length(); i++) {
                char ch = pattern.charAt(i);
                if (ch == '\'') {
                    quoted = !quoted;
                }
                sb.append(!quoted && ch == 'Y' ? 'y' : ch);
            }
            return sb.toString();
        }

        @Override
        public void appendTo(StringBuilder sb, Event event, EventTemplate owner) {
            if (formatter == null) {
                sb.append(event.getTimestamp().getEpochSecond());
            } else {
                formatter.formatTo(event.getTimestamp(), sb);
            }
        }
    }
}
