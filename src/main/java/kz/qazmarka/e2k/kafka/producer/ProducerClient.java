package kz.qazmarka.e2k.kafka.producer;

import kz.qazmarka.e2k.kafka.record.AddressedRecord;

/**
 * Граница с клиентом брокера: асинхронная отправка записи и однократное закрытие.
 *
 * Реализации обязаны допускать конкурентные вызовы {@link #submit} из нескольких рабочих потоков.
 */
public interface ProducerClient extends AutoCloseable {

    /**
     * Ставит запись в отправку и сразу возвращает дескриптор.
     *
     * @throws IllegalStateException если клиент уже закрыт
     */
    SendHandle submit(AddressedRecord record);

    /** Закрывает клиент. Повторные вызовы ничего не делают. */
    @Override
    void close();
}
