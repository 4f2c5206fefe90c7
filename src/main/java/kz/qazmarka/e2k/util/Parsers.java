package kz.qazmarka.e2k.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.hadoop.conf.Configuration;

/**
 * Набор утилит для чтения и нормализации конфигурации {@code e2k.*}.
 *
 * Класс не хранит состояния, все методы статические и thread‑safe при передаче неизменяемых аргументов.
 * Методы {@code read*} не бросают исключений на «грязном» вводе: некорректные значения заменяются
 * дефолтом. Строгая проверка (отрицательные повторы и т.п.) выполняется в билдере конфигурации.
 */
public final class Parsers {

    /**
     * Значения, которые трактуем как {@code true} при разборе конфигурации.
     */
    private static final Set<String> TRUE_TOKENS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "true", "1", "yes", "on"
    )));
    /**
     * Значения, которые трактуем как {@code false} при разборе конфигурации.
     */
    private static final Set<String> FALSE_TOKENS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "false", "0", "no", "off"
    )));

    private Parsers() {}

    /**
     * Считывает {@code int} из {@link Configuration} с дефолтом и нижней границей.
     *
     * @param cfg     конфигурация Hadoop
     * @param key     ключ
     * @param defVal  значение по умолчанию
     * @param minVal  минимально допустимое значение (включительно)
     * @return значение из конфигурации, но не меньше {@code minVal}
     */
    public static int readIntMin(Configuration cfg, String key, int defVal, int minVal) {
        int v = parseIntSafe(cfg.getTrimmed(key), defVal);
        if (v < minVal) return minVal;
        return v;
    }

    /**
     * Считывает {@code long} из {@link Configuration} с мягкой деградацией.
     *
     * @param cfg    конфигурация Hadoop
     * @param key    ключ
     * @param defVal значение по умолчанию при {@code null}/некорректном вводе
     * @return валидное {@code long} значение либо {@code defVal}
     */
    public static long readLong(Configuration cfg, String key, long defVal) {
        String v = cfg.getTrimmed(key);
        if (v == null || v.isEmpty()) return defVal;
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException nfe) {
            return defVal;
        }
    }

    /**
     * Читает необязательное целое: отсутствующий или пустой ключ даёт {@code null}.
     * Некорректное число не маскируется дефолтом: вызывающий код получает {@link NumberFormatException}
     * и сам решает, как сообщить об ошибке.
     *
     * @param cfg конфигурация Hadoop
     * @param key ключ
     * @return значение либо {@code null}, если ключ не задан
     * @throws NumberFormatException если значение задано, но не является целым числом
     */
    public static Integer readOptionalInt(Configuration cfg, String key) {
        String v = cfg.getTrimmed(key);
        if (v == null || v.isEmpty()) return null;
        return Integer.valueOf(v);
    }

    /**
     * Читает булево значение из {@link Configuration}, поддерживая распространённые алиасы.
     * Принимаются {@code true/false/1/0/yes/no/on/off} в любом регистре.
     *
     * @param cfg    конфигурация Hadoop
     * @param key    ключ
     * @param defVal значение по умолчанию, если ключ отсутствует или формат не распознан
     * @return boolean значение, либо {@code defVal}, если распознать не удалось
     */
    public static boolean readBoolean(Configuration cfg, String key, boolean defVal) {
        String raw = cfg.getTrimmed(key);
        if (raw == null) {
            return defVal;
        }
        return parseBoolean(raw, defVal);
    }

    private static boolean parseBoolean(String value, boolean defVal) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(normalized)) {
            return true;
        }
        if (FALSE_TOKENS.contains(normalized)) {
            return false;
        }
        return defVal;
    }

    /**
     * Возвращает строку из {@link Configuration} или значение по умолчанию, если она пустая.
     */
    public static String readStringOrDefault(Configuration cfg, String key, String defVal) {
        String v = cfg.getTrimmed(key);
        return (v == null || v.isEmpty()) ? defVal : v;
    }

    /**
     * Возвращает строку без обрезки пробелов (для шаблонов форматирования) либо {@code null}.
     */
    public static String readRawOrNull(Configuration cfg, String key) {
        String v = cfg.getRaw(key);
        return (v == null || v.isEmpty()) ? null : v;
    }

    /**
     * Обобщённое чтение пары ключ/значение по заданному префиксу конфигурации.
     * Возвращает карту без префикса в ключах. Пустые ключи/значения игнорируются.
     *
     * Пример: {@code e2k.producer.max.block.ms=5000} → {@code {"max.block.ms" → "5000"}}.
     *
     * @param cfg    конфигурация Hadoop
     * @param prefix строковый префикс ключей (например, {@code "e2k.producer."})
     * @return новая изменяемая {@link java.util.HashMap} с нормализованными ключами без префикса
     */
    public static Map<String, String> readWithPrefix(Configuration cfg, String prefix) {
        Map<String, String> out = new HashMap<>();
        for (Map.Entry<String, String> e : cfg) {
            String k = e.getKey();
            if (k != null && k.startsWith(prefix)) {
                String real = k.substring(prefix.length()).trim();
                if (!real.isEmpty()) {
                    String v = cfg.getTrimmed(k);
                    if (v != null && !v.isEmpty()) {
                        out.put(real, v);
                    }
                }
            }
        }
        return out;
    }

    /**
     * Нормализует токен перечисления: {@code trim()} и верхний регистр {@link Locale#ROOT}.
     *
     * @param s исходная строка (может быть {@code null})
     * @return нормализованная строка; для {@code null} пустая строка
     */
    public static String up(String s) {
        return (s == null) ? "" : s.trim().toUpperCase(Locale.ROOT);
    }

    private static int parseIntSafe(String s, int defVal) {
        if (s == null || s.isEmpty()) return defVal;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException ex) {
            return defVal;
        }
    }
}
