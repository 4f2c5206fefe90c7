package kz.qazmarka.e2k.kafka.producer;

/**
 * Дескриптор асинхронной отправки одной записи.
 */
public interface SendHandle {

    /**
     * Блокирующе дожидается подтверждения брокера.
     *
     * @return итог отправки; ошибки брокера возвращаются как {@link SendOutcome#failure(Throwable)}, а не бросаются
     * @throws InterruptedException если поток прерван во время ожидания
     */
    SendOutcome await() throws InterruptedException;

    /** Уже завершённый дескриптор. */
    static SendHandle completed(SendOutcome outcome) {
        return () -> outcome;
    }
}
