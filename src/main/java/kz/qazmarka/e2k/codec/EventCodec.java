package kz.qazmarka.e2k.codec;

import kz.qazmarka.e2k.event.Event;

/**
 * Кодек событий: превращает {@link Event} в байты и передаёт их получателю.
 *
 * Контракт: на одно событие получатель вызывается не более одного раза и в потоке вызывающего.
 * Ошибка кодирования пробрасывается как {@link RuntimeException}; получатель при этом не вызывается.
 * Реализации должны быть потокобезопасны: один кодек разделяется всеми рабочими потоками выхода.
 */
public interface EventCodec {

    void encode(Event event, EncodedEventListener listener);

    /** Короткое имя кодека для логов. */
    String name();
}
