package kz.qazmarka.e2k.kafka.producer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.e2k.kafka.record.AddressedRecord;

/**
 * Один раунд отправки пачки: сначала все записи ставятся в отправку, затем дескрипторы
 * ожидаются по порядку. Неудачные записи возвращаются в исходном относительном порядке.
 *
 * Сам по себе повторов не делает. Состояния не хранит, поэтому разделяется всеми рабочими.
 */
public final class DispatchEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DispatchEngine.class);

    private final ProducerClient client;

    public DispatchEngine(ProducerClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * @param batch записи раунда
     * @return неудачные записи (пустой список, если доставлено всё)
     * @throws InterruptedException если поток прерван во время ожидания подтверждений
     */
    public List<AddressedRecord> send(List<AddressedRecord> batch) throws InterruptedException {
        if (batch.isEmpty()) {
            return Collections.emptyList();
        }
        List<SendHandle> handles = new ArrayList<>(batch.size());
        for (AddressedRecord record : batch) {
            handles.add(submitOne(record));
        }
        List<AddressedRecord> failed = null;
        for (int i = 0; i < handles.size(); i++) {
            SendOutcome outcome = handles.get(i).await();
            if (outcome.isSuccess()) {
                continue;
            }
            AddressedRecord record = batch.get(i);
            if (LOG.isDebugEnabled()) {
                LOG.debug("Отправка записи не удалась: топик={}, ключ={}, причина={}",
                        record.topic(), record.key(), outcome.error().toString());
            }
            if (failed == null) {
                failed = new ArrayList<>();
            }
            failed.add(record);
        }
        return failed == null ? Collections.<AddressedRecord>emptyList() : failed;
    }

    private SendHandle submitOne(AddressedRecord record) {
        try {
            return client.submit(record);
        } catch (RuntimeException ex) {
            // синхронный отказ клиента засчитывается как неудача записи в этом раунде
            return SendHandle.completed(SendOutcome.failure(ex));
        }
    }
}
