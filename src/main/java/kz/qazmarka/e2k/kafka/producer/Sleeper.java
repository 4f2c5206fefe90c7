package kz.qazmarka.e2k.kafka.producer;

import java.util.concurrent.TimeUnit;

/**
 * Блокирующая пауза между раундами повторов. Выделена в интерфейс, чтобы тесты не спали по-настоящему.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = TimeUnit.NANOSECONDS::sleep;

    void sleepNanos(long nanos) throws InterruptedException;
}
