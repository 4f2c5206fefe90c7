package kz.qazmarka.e2k.kafka.producer.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import kz.qazmarka.e2k.kafka.record.AddressedRecord;

final class BatchStoreTest {

    private static AddressedRecord rec(String worker, int i) {
        return new AddressedRecord("t", worker + '-' + i, new byte[] {(byte) i});
    }

    @Test
    @DisplayName("Слив отдаёт записи в порядке добавления и очищает пачку")
    void drainReturnsInOrderAndClears() {
        BatchStore store = new BatchStore();
        WorkerId w = WorkerId.of("w1");
        AddressedRecord r1 = rec("w1", 1);
        AddressedRecord r2 = rec("w1", 2);
        store.append(w, r1);
        store.append(w, r2);

        Optional<List<AddressedRecord>> drained = store.drainIfNonEmpty(w);

        assertTrue(drained.isPresent());
        assertEquals(2, drained.get().size());
        assertSame(r1, drained.get().get(0));
        assertSame(r2, drained.get().get(1));
        assertEquals(0, store.pendingCount(w));
        assertEquals(1, store.workerCount(), "Список рабочего переиспользуется, а не удаляется");
    }

    @Test
    @DisplayName("Слив пустой пачки ничего не делает, повторный слив тоже")
    void drainEmptyIsNoop() {
        BatchStore store = new BatchStore();
        WorkerId w = WorkerId.of("w1");

        assertFalse(store.drainIfNonEmpty(w).isPresent());
        assertEquals(0, store.workerCount(), "Без append список не создаётся");

        store.append(w, rec("w1", 1));
        assertTrue(store.drainIfNonEmpty(w).isPresent());
        assertFalse(store.drainIfNonEmpty(w).isPresent());
        assertFalse(store.drainIfNonEmpty(w).isPresent());
    }

    @Test
    @DisplayName("Записи одного рабочего не попадают в пачку другого")
    void workersAreIsolated() {
        BatchStore store = new BatchStore();
        WorkerId a = WorkerId.of("a");
        WorkerId b = WorkerId.of("b");
        store.append(a, rec("a", 1));
        store.append(b, rec("b", 1));
        store.append(a, rec("a", 2));

        List<AddressedRecord> drainedA = store.drainIfNonEmpty(a).get();

        assertEquals(2, drainedA.size());
        for (AddressedRecord r : drainedA) {
            assertTrue(r.key().startsWith("a-"));
        }
        assertEquals(1, store.pendingCount(b));
    }

    @Test
    @DisplayName("Параллельные рабочие видят только свои записи")
    void concurrentWorkersAreIsolated() throws Exception {
        final int workers = 8;
        final int perWorker = 500;
        BatchStore store = new BatchStore();
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<List<AddressedRecord>>> results = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                final String name = "w" + w;
                results.add(pool.submit(() -> {
                    WorkerId id = WorkerId.of(name);
                    start.await();
                    for (int i = 0; i < perWorker; i++) {
                        store.append(id, rec(name, i));
                    }
                    return store.drainIfNonEmpty(id).get();
                }));
            }
            start.countDown();
            for (int w = 0; w < workers; w++) {
                List<AddressedRecord> drained = results.get(w).get(10, TimeUnit.SECONDS);
                assertEquals(perWorker, drained.size());
                for (int i = 0; i < perWorker; i++) {
                    assertEquals("w" + w + '-' + i, drained.get(i).key());
                }
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(workers, store.workerCount());
    }

    @Test
    @DisplayName("forget() удаляет список рабочего и сообщает число потерянных записей")
    void forget() {
        BatchStore store = new BatchStore();
        WorkerId w = WorkerId.of("w");
        store.append(w, rec("w", 1));

        assertEquals(1, store.forget(w));
        assertEquals(0, store.workerCount());
        assertEquals(0, store.forget(w));
    }

    @Test
    @DisplayName("WorkerId: равенство по имени, пустое имя запрещено")
    void workerId() {
        assertEquals(WorkerId.of("x"), WorkerId.of("x"));
        assertEquals(WorkerId.of("x").hashCode(), WorkerId.of("x").hashCode());
        assertThrows(IllegalArgumentException.class, () -> WorkerId.of(" "));
    }
}
