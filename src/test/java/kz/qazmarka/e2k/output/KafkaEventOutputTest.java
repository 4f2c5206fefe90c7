package kz.qazmarka.e2k.output;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import javax.management.ObjectName;

import org.apache.hadoop.conf.Configuration;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import kz.qazmarka.e2k.codec.EncodedEventListener;
import kz.qazmarka.e2k.codec.EventCodec;
import kz.qazmarka.e2k.codec.JsonEventCodec;
import kz.qazmarka.e2k.config.CodecSettings;
import kz.qazmarka.e2k.config.ConfigurationException;
import kz.qazmarka.e2k.config.E2kConfig;
import kz.qazmarka.e2k.config.E2kConfigBuilder;
import kz.qazmarka.e2k.config.SecuritySettings.Protocol;
import kz.qazmarka.e2k.event.Event;
import kz.qazmarka.e2k.kafka.producer.DeliveryMetrics;
import kz.qazmarka.e2k.kafka.producer.DrainResult;
import kz.qazmarka.e2k.kafka.producer.RecordingSleeper;
import kz.qazmarka.e2k.kafka.producer.ScriptedProducerClient;
import kz.qazmarka.e2k.kafka.producer.batch.WorkerId;

/**
 * Сквозные сценарии выхода: кодирование, адресация, слив пачки и жизненный цикл.
 */
class KafkaEventOutputTest {

    private static final WorkerId W1 = WorkerId.of("worker-1");

    private static E2kConfigBuilder builder() {
        return new E2kConfigBuilder()
                .topic().id("logs-%{type}").messageKey("%{host}").done()
                .jmxEnabled(false);
    }

    private static MockProducer<String, byte[]> mockProducer() {
        return new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    }

    private static Event event(String type, String host, String message) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", type);
        fields.put("host", host);
        fields.put("message", message);
        return new Event(Instant.parse("2024-03-01T10:15:30Z"), fields);
    }

    @Test
    @DisplayName("Пачка кодируется в JSON, адресуется шаблонами и доставляется целиком")
    void deliversBatchThroughMockProducer() {
        MockProducer<String, byte[]> producer = mockProducer();
        try (KafkaEventOutput output = new KafkaEventOutput(builder().build(), producer)) {
            DrainResult result = output.submitBatch(W1, Arrays.asList(
                    event("nginx", "web-1", "GET /"),
                    event("app", "app-7", "started")));

            assertTrue(result.isDone());
            assertEquals(1, result.rounds());
            assertEquals(2, result.delivered());
            assertEquals(0, output.pendingCount(W1));

            List<ProducerRecord<String, byte[]>> history = producer.history();
            assertEquals(2, history.size());
            assertEquals("logs-nginx", history.get(0).topic());
            assertEquals("web-1", history.get(0).key());
            assertEquals("logs-app", history.get(1).topic());
            String json = new String(history.get(0).value(), StandardCharsets.UTF_8);
            assertTrue(json.startsWith("{\"@timestamp\":\"2024-03-01T10:15:30Z\""), json);
            assertTrue(json.contains("\"message\":\"GET /\""), json);

            DeliveryMetrics metrics = output.metrics();
            assertEquals(2L, metrics.snapshot().get(DeliveryMetrics.EVENTS_ENCODED));
            assertEquals(2L, metrics.snapshot().get(DeliveryMetrics.RECORDS_DELIVERED));
            assertEquals(1L, metrics.snapshot().get(DeliveryMetrics.BATCHES_DONE));
        }
        assertTrue(producer.closed());
    }

    @Test
    @DisplayName("Пустой вызов и вызов из одних null ничего не отправляют")
    void emptyBatch() {
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_OK);
        try (KafkaEventOutput output = new KafkaEventOutput(builder().build(), client,
                new JsonEventCodec(), new RecordingSleeper())) {
            assertSame(DrainResult.empty(), output.submitBatch(W1, Collections.<Event>emptyList()));
            assertSame(DrainResult.empty(), output.submitBatch(W1, Arrays.asList((Event) null, null)));
            assertTrue(client.submitted().isEmpty());
        }
    }

    @Test
    @DisplayName("Ошибка кодека пропускает одно событие, остальные доставляются")
    void codecFailureSkipsEvent() {
        EventCodec failing = new EventCodec() {
            private final JsonEventCodec delegate = new JsonEventCodec();

            @Override
            public void encode(Event event, EncodedEventListener listener) {
                if ("bad".equals(event.get("type"))) {
                    throw new IllegalStateException("не сериализуется");
                }
                delegate.encode(event, listener);
            }

            @Override
            public String name() {
                return "failing-json";
            }
        };
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_OK);
        try (KafkaEventOutput output = new KafkaEventOutput(builder().build(), client, failing,
                new RecordingSleeper())) {
            DrainResult result = output.submitBatch(W1, Arrays.asList(
                    event("ok", "h1", "a"),
                    event("bad", "h2", "b"),
                    event("ok", "h3", "c")));

            assertTrue(result.isDone());
            assertEquals(2, result.delivered());
            assertEquals(1L, output.metrics().eventsFailed());
            assertEquals(2, client.submitted().size());
        }
    }

    @Test
    @DisplayName("Строгий шаблон: событие без поля ключа пропускается, пачка не падает")
    void strictTemplateSkipsUnresolved() {
        E2kConfig config = builder().topic().strictTemplates(true).done().build();
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_OK);
        Map<String, Object> noHost = new LinkedHashMap<>();
        noHost.put("type", "nginx");
        try (KafkaEventOutput output = new KafkaEventOutput(config, client, new JsonEventCodec(),
                new RecordingSleeper())) {
            DrainResult result = output.submitBatch(W1, Arrays.asList(
                    new Event(noHost),
                    event("nginx", "web-1", "x")));

            assertEquals(1, result.delivered());
            assertEquals(1L, output.metrics().eventsFailed());
            assertEquals("web-1", client.submitted().get(0).key());
        }
    }

    @Test
    @DisplayName("Мягкий шаблон: отсутствующее поле ключа даёт пустой ключ")
    void lenientTemplateRendersEmptyKey() {
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_OK);
        Map<String, Object> noHost = new LinkedHashMap<>();
        noHost.put("type", "nginx");
        try (KafkaEventOutput output = new KafkaEventOutput(builder().build(), client, new JsonEventCodec(),
                new RecordingSleeper())) {
            output.submitBatch(W1, Collections.singletonList(new Event(noHost)));

            assertEquals("", client.submitted().get(0).key());
            assertEquals("logs-nginx", client.submitted().get(0).topic());
        }
    }

    @Test
    @DisplayName("Без шаблона ключа запись уходит с ключом null")
    void noKeyTemplate() {
        E2kConfig config = new E2kConfigBuilder().topic().id("plain").done().jmxEnabled(false).build();
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_OK);
        try (KafkaEventOutput output = new KafkaEventOutput(config, client, new JsonEventCodec(),
                new RecordingSleeper())) {
            output.submitBatch(W1, Collections.singletonList(event("x", "h", "m")));
            assertNull(client.submitted().get(0).key());
        }
    }

    @Test
    @DisplayName("Сигнал остановки прекращает кодирование, накопленное до него сливается")
    void shutdownSentinelStopsEncoding() {
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_OK);
        try (KafkaEventOutput output = new KafkaEventOutput(builder().build(), client, new JsonEventCodec(),
                new RecordingSleeper())) {
            DrainResult result = output.submitBatch(W1, Arrays.asList(
                    event("a", "h1", "1"),
                    Event.SHUTDOWN,
                    event("b", "h2", "2")));

            assertEquals(1, result.delivered());
            assertEquals(1, client.submitted().size());
            assertEquals("h1", client.submitted().get(0).key());
        }
    }

    @Test
    @DisplayName("Кодек plain печатает сообщение по формату")
    void plainCodecFromSettings() {
        E2kConfig config = builder().codec().type(CodecSettings.CodecType.PLAIN).plainFormat("%{host}: %{message}")
                .done().build();
        MockProducer<String, byte[]> producer = mockProducer();
        try (KafkaEventOutput output = new KafkaEventOutput(config, producer)) {
            output.submitBatch(W1, Collections.singletonList(event("app", "app-7", "started")));
        }
        assertArrayEquals("app-7: started".getBytes(StandardCharsets.UTF_8), producer.history().get(0).value());
    }

    @Test
    @DisplayName("Конечный бюджет: после R+1 неудачных раундов пачка отбрасывается и учитывается")
    void finiteBudgetAbandonsBatch() {
        E2kConfig config = builder().retry().retries(2).backoffMs(50L).done().build();
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_FAIL);
        RecordingSleeper sleeper = new RecordingSleeper();
        try (KafkaEventOutput output = new KafkaEventOutput(config, client, new JsonEventCodec(), sleeper)) {
            DrainResult result = output.submitBatch(W1, Arrays.asList(
                    event("a", "h1", "1"),
                    event("a", "h2", "2")));

            assertEquals(DrainResult.Status.ABANDONED, result.status());
            assertEquals(3, result.rounds());
            assertEquals(2, result.dropped());
            assertEquals(2, sleeper.count());
            assertEquals(6, client.submitted().size());
            assertEquals(2L, output.metrics().recordsDropped());
            assertEquals(1L, output.metrics().batchesAbandoned());
            assertEquals(0, output.pendingCount(W1), "Отброшенная пачка не остаётся в хранилище");
        }
    }

    @Test
    @DisplayName("Без бюджета пачка повторяется до полной доставки")
    void unlimitedRetriesEventuallyDeliver() {
        ScriptedProducerClient client = ScriptedProducerClient.failingFirst(3);
        RecordingSleeper sleeper = new RecordingSleeper();
        try (KafkaEventOutput output = new KafkaEventOutput(builder().build(), client, new JsonEventCodec(),
                sleeper)) {
            DrainResult result = output.submitBatch(W1, Collections.singletonList(event("a", "h1", "1")));

            assertTrue(result.isDone());
            assertEquals(4, result.rounds());
            assertEquals(3, sleeper.count());
            assertEquals(0L, output.metrics().recordsDropped());
        }
    }

    @Test
    @DisplayName("close идемпотентен, последующий вызов не отправляет ничего")
    void closeIsIdempotent() {
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_OK);
        KafkaEventOutput output = new KafkaEventOutput(builder().build(), client, new JsonEventCodec(),
                new RecordingSleeper());
        output.close();
        output.close();

        assertEquals(1, client.closeCalls());
        assertTrue(output.isShutdownRequested());

        DrainResult result = output.submitBatch(W1, Collections.singletonList(event("a", "h1", "1")));
        assertEquals(DrainResult.Status.INTERRUPTED, result.status());
        assertEquals(0, result.rounds());
        assertTrue(client.submitted().isEmpty());
    }

    @Test
    @DisplayName("Остановка во время паузы прерывает бесконечный повтор")
    void shutdownDuringBackoff() {
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_FAIL);
        RecordingSleeper sleeper = new RecordingSleeper();
        try (KafkaEventOutput output = new KafkaEventOutput(builder().build(), client, new JsonEventCodec(),
                sleeper)) {
            sleeper.onSleep(output::requestShutdown);

            DrainResult result = output.submitBatch(W1, Collections.singletonList(event("a", "h1", "1")));

            assertEquals(DrainResult.Status.INTERRUPTED, result.status());
            assertEquals(1, result.rounds());
            assertEquals(1, result.dropped());
            assertEquals(0L, output.metrics().recordsDropped(), "Прерванная пачка не считается отброшенной");
        }
    }

    @Test
    @DisplayName("Рабочие сливают свои пачки параллельно и не видят чужих записей")
    void concurrentWorkers() throws Exception {
        MockProducer<String, byte[]> producer = mockProducer();
        int workers = 4;
        int perWorker = 50;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try (KafkaEventOutput output = new KafkaEventOutput(builder().build(), producer)) {
            List<Callable<DrainResult>> tasks = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                final WorkerId id = WorkerId.of("w" + w);
                tasks.add(() -> {
                    List<Event> batch = new ArrayList<>(perWorker);
                    for (int i = 0; i < perWorker; i++) {
                        batch.add(event("t", id.name(), "m" + i));
                    }
                    return output.submitBatch(id, batch);
                });
            }
            for (Future<DrainResult> f : pool.invokeAll(tasks)) {
                DrainResult result = f.get(10, TimeUnit.SECONDS);
                assertTrue(result.isDone());
                assertEquals(perWorker, result.delivered());
            }
            assertEquals((long) workers * perWorker, output.metrics().snapshot().get(DeliveryMetrics.RECORDS_DELIVERED));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(workers * perWorker, producer.history().size());
    }

    @Test
    @DisplayName("retireWorker сообщает число неслитых записей")
    void retireWorker() {
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_OK);
        try (KafkaEventOutput output = new KafkaEventOutput(builder().build(), client, new JsonEventCodec(),
                new RecordingSleeper())) {
            output.submitBatch(W1, Collections.singletonList(event("a", "h1", "1")));
            assertEquals(0, output.retireWorker(W1));
            assertEquals(0, output.retireWorker(WorkerId.of("never-seen")));
        }
    }

    @Test
    @DisplayName("JMX-метрики регистрируются при старте и снимаются при close")
    void jmxLifecycle() {
        E2kConfig config = builder().jmxEnabled(true).build();
        KafkaEventOutput output = new KafkaEventOutput(config, mockProducer());
        ObjectName name = output.jmxName();
        assertNotNull(name);
        assertTrue(ManagementFactory.getPlatformMBeanServer().isRegistered(name));

        output.close();

        assertNull(output.jmxName());
        assertFalse(ManagementFactory.getPlatformMBeanServer().isRegistered(name));
    }

    @Test
    @DisplayName("Отрицательный бюджет повторов отвергается до создания продьюсера")
    void negativeRetriesRejected() {
        Configuration cfg = new Configuration(false);
        cfg.set(E2kConfig.Keys.TOPIC_ID, "logs");
        cfg.set(E2kConfig.Keys.RETRIES, "-1");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> KafkaEventOutput.create(cfg));
        assertTrue(ex.getMessage().contains(E2kConfig.Keys.RETRIES), ex.getMessage());
    }

    @Test
    @DisplayName("Ошибка в шаблоне времени топика отвергается до создания продьюсера")
    void badTopicTimePatternRejected() {
        Configuration cfg = new Configuration(false);
        cfg.set(E2kConfig.Keys.TOPIC_ID, "logs-%{+yyyy-MM-dd'}");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> KafkaEventOutput.create(cfg));
        assertTrue(ex.getMessage().contains(E2kConfig.Keys.TOPIC_ID), ex.getMessage());
    }

    @Test
    @DisplayName("Сбой инициализации после создания ресурсов закрывает продьюсер")
    void failedInitClosesProducer() {
        E2kConfig config = builder()
                .security()
                .protocol(Protocol.SASL_PLAINTEXT)
                .kerberosServiceName("kafka")
                .jaasPath("/etc/kafka/jaas.conf")
                .done()
                .build();
        ScriptedProducerClient client = new ScriptedProducerClient(ScriptedProducerClient.ALWAYS_OK);
        JvmSecurityCheck brokenCheck = new JvmSecurityCheck(key -> {
            throw new SecurityException("доступ к свойствам запрещён");
        });

        assertThrows(SecurityException.class, () -> new KafkaEventOutput(config, client, new JsonEventCodec(),
                new RecordingSleeper(), brokenCheck));
        assertEquals(1, client.closeCalls());
    }

    @Test
    @DisplayName("Отсутствующий топик отвергается")
    void missingTopicRejected() {
        assertThrows(ConfigurationException.class, () -> KafkaEventOutput.create(new Configuration(false)));
    }
}
