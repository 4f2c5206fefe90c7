package kz.qazmarka.e2k.output;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.management.ObjectName;

import org.apache.hadoop.conf.Configuration;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.e2k.codec.EventCodec;
import kz.qazmarka.e2k.codec.EventCodecs;
import kz.qazmarka.e2k.config.ConfigurationException;
import kz.qazmarka.e2k.config.E2kConfig;
import kz.qazmarka.e2k.config.RetrySettings;
import kz.qazmarka.e2k.event.Event;
import kz.qazmarka.e2k.kafka.producer.DeliveryMetrics;
import kz.qazmarka.e2k.kafka.producer.DrainResult;
import kz.qazmarka.e2k.kafka.producer.KafkaProducerClient;
import kz.qazmarka.e2k.kafka.producer.ProducerClient;
import kz.qazmarka.e2k.kafka.producer.Sleeper;
import kz.qazmarka.e2k.kafka.producer.batch.WorkerId;
import kz.qazmarka.e2k.kafka.record.AddressedRecord;
import kz.qazmarka.e2k.output.metrics.E2kMetricsJmx;

/**
 * Выход событий в Kafka с пачками по рабочим и повторами уровня пачки.
 *
 * Назначение
 *  - Принимать пачки событий от рабочих потоков конвейера и надёжно публиковать их в Kafka.
 *  - Гарантия «хотя бы один раз»: вызов {@link #submitBatch} не возвращается, пока пачка
 *    не доставлена целиком, не исчерпан явно заданный бюджет повторов или не запрошена остановка.
 *
 * Поток обработки одного вызова
 *  - кодек превращает событие в байты → сборщик раскрывает шаблоны топика и ключа →
 *    запись добавляется в пачку рабочего;
 *  - в конце вызова непустая пачка сливается синхронно через контроллер повторов и очищается.
 *
 * Потокобезопасность
 *  - Разные рабочие вызывают {@link #submitBatch} параллельно; общий только клиент Kafka и карта пачек.
 *  - Один и тот же {@link WorkerId} не должен использоваться из двух потоков одновременно.
 *
 * Логирование
 *  - WARN: отброшенные события (ошибка кодека/шаблона, исчерпан бюджет), конечный бюджет на старте.
 *  - DEBUG: прерванные сливы, сводка инициализации, трассировки.
 */
public final class KafkaEventOutput implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaEventOutput.class);

    private final E2kConfig config;
    private final OutputResources resources;
    private final OutputLog log;
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private ObjectName jmxName;

    KafkaEventOutput(E2kConfig config, ProducerClient client, EventCodec codec, Sleeper sleeper) {
        this(config, client, codec, sleeper, new JvmSecurityCheck());
    }

    KafkaEventOutput(E2kConfig config,
                     ProducerClient client,
                     EventCodec codec,
                     Sleeper sleeper,
                     JvmSecurityCheck securityCheck) {
        this.config = Objects.requireNonNull(config, "config");
        this.log = new OutputLog(LOG, config.getTopicSettings().getTopicTemplate());
        this.resources = OutputResources.create(config, client, codec, sleeper, this);
        try {
            warnIfFiniteRetries(config.getRetrySettings());
            securityCheck.verify(config.getSecuritySettings());
            if (config.isJmxEnabled()) {
                this.jmxName = E2kMetricsJmx.register(resources.metrics());
            } else if (LOG.isDebugEnabled()) {
                LOG.debug("JMX-метрики e2k отключены ({}=false)", E2kConfig.Keys.JMX_ENABLED);
            }
            logInitSummary();
        } catch (RuntimeException ex) {
            LOG.error("Инициализация выхода e2k не завершена, продьюсер закрывается: {}",
                    OutputLog.safeExceptionMessage(ex));
            E2kMetricsJmx.unregister(jmxName);
            jmxName = null;
            resources.close();
            throw ex;
        }
    }

    /**
     * Выход поверх готового продьюсера (например, {@code MockProducer} в тестах).
     */
    public KafkaEventOutput(E2kConfig config, Producer<String, byte[]> producer) {
        this(config, new KafkaProducerClient(producer),
                EventCodecs.fromSettings(config.getCodecSettings()), Sleeper.SYSTEM);
    }

    /**
     * Читает конфигурацию {@code e2k.*} и создаёт выход с настоящим {@link KafkaProducer}.
     *
     * @throws ConfigurationException при некорректной конфигурации; ничего не отправляется
     * @throws KafkaException если продьюсер не удалось создать
     */
    public static KafkaEventOutput create(Configuration cfg) {
        final E2kConfig config;
        try {
            config = E2kConfig.from(cfg);
        } catch (ConfigurationException ex) {
            LOG.error("Некорректная конфигурация выхода e2k: {}", ex.getMessage());
            throw ex;
        }
        return create(config);
    }

    public static KafkaEventOutput create(E2kConfig config) {
        Properties props = ProducerPropsFactory.build(config);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Kafka-producer: client.id={}, брокеры={}, acks={}, компрессия={}, linger.ms={}, batch.size={}, протокол={}",
                    props.get(ProducerConfig.CLIENT_ID_CONFIG),
                    props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG),
                    props.get(ProducerConfig.ACKS_CONFIG),
                    props.get(ProducerConfig.COMPRESSION_TYPE_CONFIG),
                    props.get(ProducerConfig.LINGER_MS_CONFIG),
                    props.get(ProducerConfig.BATCH_SIZE_CONFIG),
                    config.getSecuritySettings().getProtocol());
        }
        final Producer<String, byte[]> producer;
        try {
            producer = new KafkaProducer<>(props);
        } catch (KafkaException ex) {
            LOG.error("Не удалось создать Kafka-продьюсер (брокеры={}): {}", config.getBootstrap(), ex.getMessage());
            throw ex;
        }
        return new KafkaEventOutput(config, producer);
    }

    /**
     * Кодирует события, накапливает пачку рабочего и синхронно сливает её в Kafka.
     *
     * Ошибка кодека или шаблона для отдельного события логируется (WARN), учитывается
     * в {@code events.failed}, и событие пропускается. Сигнальное {@link Event#SHUTDOWN}
     * прекращает кодирование оставшихся событий вызова; уже накопленное всё равно сливается.
     *
     * @param worker рабочий, от имени которого идёт вызов
     * @param events события пачки
     * @return итог слива ({@link DrainResult#empty()}, если отправлять нечего)
     */
    public DrainResult submitBatch(WorkerId worker, Collection<Event> events) {
        Objects.requireNonNull(worker, "worker");
        Objects.requireNonNull(events, "events");
        DeliveryMetrics metrics = resources.metrics();
        for (Event event : events) {
            if (event == null) {
                continue;
            }
            if (event.isShutdownSignal()) {
                log.debug("остановка", worker, "Получен сигнал остановки, оставшиеся события вызова не кодируются");
                break;
            }
            encodeOne(worker, event, metrics);
        }
        Optional<List<AddressedRecord>> batch = resources.batchStore().drainIfNonEmpty(worker);
        if (!batch.isPresent()) {
            return DrainResult.empty();
        }
        DrainResult result = resources.retryController().drain(worker, batch.get());
        if (log.isDebugEnabled()) {
            log.debug("слив", worker, "Пачка обработана: {}", result);
        }
        return result;
    }

    private void encodeOne(WorkerId worker, Event event, DeliveryMetrics metrics) {
        try {
            resources.codec().encode(event, (encoded, payload) -> {
                AddressedRecord record = resources.recordBuilder().build(encoded, payload);
                resources.batchStore().append(worker, record);
                metrics.eventEncoded();
            });
        } catch (RuntimeException ex) {
            metrics.eventFailed();
            log.warn("кодирование", worker, "Событие пропущено: {} ({})",
                    OutputLog.safeExceptionMessage(ex), event);
            if (LOG.isDebugEnabled()) {
                LOG.debug("Трассировка ошибки кодирования события", ex);
            }
        }
    }

    /**
     * Просит текущие сливы завершиться: флаг проверяется перед каждым раундом отправки.
     */
    public void requestShutdown() {
        if (shutdownRequested.compareAndSet(false, true) && LOG.isDebugEnabled()) {
            LOG.debug("Запрошена остановка выхода e2k");
        }
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    public DeliveryMetrics metrics() {
        return resources.metrics();
    }

    /**
     * Число записей, накопленных рабочим и ещё не слитых.
     * Только для потока, который вызывает {@link #submitBatch} от имени этого рабочего.
     */
    public int pendingCount(WorkerId worker) {
        return resources.batchStore().pendingCount(worker);
    }

    /**
     * Выводит рабочего из оборота: его список пачки удаляется.
     *
     * @return число записей, которые так и не были слиты
     */
    public int retireWorker(WorkerId worker) {
        int lost = resources.batchStore().forget(worker);
        if (lost > 0) {
            log.warn("вывод_рабочего", worker, "Удалён рабочий с неслитыми записями: {}", lost);
        }
        return lost;
    }

    E2kConfig config() {
        return config;
    }

    ObjectName jmxName() {
        return jmxName;
    }

    /**
     * Запрашивает остановку, снимает JMX-регистрацию и закрывает продьюсер. Повторный вызов ничего не делает.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        requestShutdown();
        E2kMetricsJmx.unregister(jmxName);
        jmxName = null;
        resources.close();
        if (LOG.isInfoEnabled()) {
            LOG.info("Выход e2k остановлен: {}", resources.metrics().snapshot());
        }
    }

    private static void warnIfFiniteRetries(RetrySettings retry) {
        if (retry.isUnlimited()) {
            return;
        }
        LOG.warn("Выход Kafka настроен с конечным числом повторов ({}={}): после исчерпания попыток события будут ПОТЕРЯНЫ. "
                        + "Чтобы не терять данные при недоступности Kafka, уберите этот параметр.",
                E2kConfig.Keys.RETRIES, retry.getRetries());
    }

    private void logInitSummary() {
        if (!LOG.isDebugEnabled()) {
            return;
        }
        LOG.debug("Инициализация выхода e2k завершена: топик={}, ключ={}, кодек={}, повторы={}, backoff_мс={}, режим_backoff={}, jmx={}",
                config.getTopicSettings().getTopicTemplate(),
                config.getTopicSettings().getKeyTemplate(),
                resources.codec().name(),
                config.getRetrySettings().isUnlimited() ? "без ограничений" : config.getRetrySettings().getRetries(),
                config.getRetrySettings().getBackoffMs(),
                config.getRetrySettings().getBackoffMode(),
                jmxName);
    }
}
