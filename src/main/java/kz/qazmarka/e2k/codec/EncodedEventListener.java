package kz.qazmarka.e2k.codec;

import kz.qazmarka.e2k.event.Event;

/**
 * Получатель результата кодирования: вызывается кодеком для каждого закодированного события.
 */
@FunctionalInterface
public interface EncodedEventListener {

    /**
     * @param event   исходное событие
     * @param payload закодированное представление (не {@code null})
     */
    void onEncoded(Event event, byte[] payload);
}
