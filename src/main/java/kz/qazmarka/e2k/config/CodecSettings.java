package kz.qazmarka.e2k.config;

import java.util.Objects;

import kz.qazmarka.e2k.util.Parsers;

/**
 * Выбор кодека событий и его параметры.
 */
public final class CodecSettings {

    /** Встроенные кодеки. */
    public enum CodecType {
        JSON, PLAIN;

        static CodecType parse(String raw) {
            String v = Parsers.up(raw);
            for (CodecType t : values()) {
                if (t.name().equals(v)) {
                    return t;
                }
            }
            throw new ConfigurationException("Неизвестный кодек '" + raw + "' (" + E2kConfig.K_CODEC
                    + "): допустимы json, plain");
        }
    }

    private final CodecType type;
    private final String plainFormat;

    CodecSettings(CodecType type, String plainFormat) {
        this.type = Objects.requireNonNull(type, "Тип кодека не может быть null");
        this.plainFormat = Objects.requireNonNull(plainFormat, "Формат plain-кодека не может быть null");
    }

    public CodecType getType() {
        return type;
    }

    public String getPlainFormat() {
        return plainFormat;
    }
}
