package kz.qazmarka.e2k.codec;

import java.util.Objects;

import kz.qazmarka.e2k.config.CodecSettings;

/**
 * Выбор встроенного кодека по настройкам {@code e2k.codec.*}.
 */
public final class EventCodecs {

    private EventCodecs() {
    }

    public static EventCodec fromSettings(CodecSettings settings) {
        Objects.requireNonNull(settings, "Настройки кодека не могут быть null");
        switch (settings.getType()) {
            case PLAIN:
                return new PlainEventCodec(settings.getPlainFormat());
            case JSON:
            default:
                return new JsonEventCodec();
        }
    }
}
