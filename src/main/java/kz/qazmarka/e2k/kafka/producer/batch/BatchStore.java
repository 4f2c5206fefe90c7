package kz.qazmarka.e2k.kafka.producer.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import kz.qazmarka.e2k.kafka.record.AddressedRecord;

/**
 * Накопитель пачек по рабочим: у каждого {@link WorkerId} свой список записей.
 *
 * Список создаётся лениво при первом {@link #append} и далее переиспользуется:
 * {@link #drainIfNonEmpty} отдаёт копию и очищает список, не удаляя его.
 *
 * Потокобезопасность: карта рабочих разделяемая; сам список конкретного рабочего
 * трогает только его владелец, поэтому дополнительная синхронизация не нужна.
 */
public final class BatchStore {

    private static final int INITIAL_CAPACITY = 64;

    private final ConcurrentMap<WorkerId, List<AddressedRecord>> batches = new ConcurrentHashMap<>();

    public void append(WorkerId worker, AddressedRecord record) {
        Objects.requireNonNull(worker, "worker");
        Objects.requireNonNull(record, "record");
        batches.computeIfAbsent(worker, w -> new ArrayList<>(INITIAL_CAPACITY)).add(record);
    }

    /**
     * Забирает накопленные записи рабочего.
     *
     * @return копия пачки в порядке добавления либо пусто, если записей нет
     */
    public Optional<List<AddressedRecord>> drainIfNonEmpty(WorkerId worker) {
        Objects.requireNonNull(worker, "worker");
        List<AddressedRecord> pending = batches.get(worker);
        if (pending == null || pending.isEmpty()) {
            return Optional.empty();
        }
        List<AddressedRecord> out = Collections.unmodifiableList(new ArrayList<>(pending));
        pending.clear();
        return Optional.of(out);
    }

    /**
     * Число накопленных записей рабочего. Вызывается только потоком-владельцем этого рабочего:
     * список не синхронизирован, из чужого потока значение может быть устаревшим.
     */
    public int pendingCount(WorkerId worker) {
        List<AddressedRecord> pending = batches.get(worker);
        return pending == null ? 0 : pending.size();
    }

    /** Число рабочих, для которых уже создан список. */
    public int workerCount() {
        return batches.size();
    }

    /**
     * Удаляет список рабочего целиком. Несброшенные записи теряются.
     *
     * @return число потерянных записей
     */
    public int forget(WorkerId worker) {
        List<AddressedRecord> removed = batches.remove(worker);
        return removed == null ? 0 : removed.size();
    }
}
