package kz.qazmarka.e2k.output.metrics;

import java.lang.management.ManagementFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import javax.management.Attribute;
import javax.management.AttributeList;
import javax.management.AttributeNotFoundException;
import javax.management.DynamicMBean;
import javax.management.InstanceAlreadyExistsException;
import javax.management.InstanceNotFoundException;
import javax.management.JMException;
import javax.management.MBeanAttributeInfo;
import javax.management.MBeanException;
import javax.management.MBeanInfo;
import javax.management.MBeanServer;
import javax.management.ObjectName;
import javax.management.ReflectionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.e2k.kafka.producer.DeliveryMetrics;

/**
 * Read-only JMX-обёртка над {@link DeliveryMetrics}.
 *
 * Набор атрибутов фиксируется по первому снимку; имя атрибута получается из ключа метрики в нижнем регистре,
 * где всё, кроме латиницы и цифр, заменено на '_' ({@code records.dropped} → {@code records_dropped}).
 * Значения читаются из свежего снимка при каждом обращении.
 */
public final class E2kMetricsJmx implements DynamicMBean {

    private static final Logger LOG = LoggerFactory.getLogger(E2kMetricsJmx.class);
    private static final String OBJECT_NAME_BASE = "kz.qazmarka.e2k:type=Output,name=DeliveryMetrics";

    private final Supplier<Map<String, Long>> snapshotSupplier;
    /** Имя JMX-атрибута -> ключ метрики. */
    private final Map<String, String> attrToKey;
    private final MBeanInfo mbeanInfo;

    E2kMetricsJmx(Supplier<Map<String, Long>> snapshotSupplier) {
        this.snapshotSupplier = Objects.requireNonNull(snapshotSupplier, "snapshotSupplier");
        Map<String, Long> snapshot = snapshotSupplier.get();
        Map<String, String> mapping = new LinkedHashMap<>(snapshot.size());
        List<MBeanAttributeInfo> infos = new ArrayList<>(snapshot.size());
        for (String key : snapshot.keySet()) {
            String attr = uniqueName(attributeName(key), mapping);
            mapping.put(attr, key);
            infos.add(new MBeanAttributeInfo(attr, Long.class.getName(),
                    "Метрика доставки '" + key + "'", true, false, false));
        }
        this.attrToKey = Collections.unmodifiableMap(mapping);
        this.mbeanInfo = new MBeanInfo(
                E2kMetricsJmx.class.getName(),
                "Метрики доставки событий в Kafka",
                infos.toArray(new MBeanAttributeInfo[0]),
                null,
                null,
                null);
    }

    /**
     * Регистрирует MBean в платформенном {@link MBeanServer}.
     * При занятом имени добавляет суффикс {@code uid}, чтобы несколько выходов жили в одной JVM.
     *
     * @return зарегистрированное имя либо {@code null}, если регистрация не удалась
     */
    public static ObjectName register(DeliveryMetrics metrics) {
        Objects.requireNonNull(metrics, "metrics");
        E2kMetricsJmx mbean = new E2kMetricsJmx(metrics::snapshot);
        MBeanServer server = ManagementFactory.getPlatformMBeanServer();
        try {
            ObjectName name = new ObjectName(OBJECT_NAME_BASE);
            try {
                server.registerMBean(mbean, name);
                return name;
            } catch (InstanceAlreadyExistsException e) {
                ObjectName unique = new ObjectName(OBJECT_NAME_BASE + ",uid="
                        + Integer.toHexString(System.identityHashCode(mbean)));
                server.registerMBean(mbean, unique);
                return unique;
            }
        } catch (JMException e) {
            LOG.warn("Не удалось зарегистрировать JMX-метрики e2k: {}", e.getMessage());
            if (LOG.isDebugEnabled()) {
                LOG.debug("Трассировка ошибки регистрации JMX-метрик", e);
            }
            return null;
        }
    }

    /** Снимает регистрацию; отсутствие MBean не считается ошибкой. */
    public static void unregister(ObjectName name) {
        if (name == null) {
            return;
        }
        try {
            ManagementFactory.getPlatformMBeanServer().unregisterMBean(name);
        } catch (InstanceNotFoundException e) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("JMX-метрики {} уже сняты с регистрации", name);
            }
        } catch (JMException e) {
            LOG.warn("Не удалось снять регистрацию JMX-метрик {}: {}", name, e.getMessage());
        }
    }

    static String attributeName(String key) {
        if (key == null || key.isEmpty()) {
            return "metric";
        }
        String lower = key.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char ch = lower.charAt(i);
            boolean keep = (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9');
            if (keep) {
                sb.append(ch);
            } else if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '_') {
                sb.append('_');
            }
        }
        while (sb.length() > 0 && sb.charAt(sb.length() - 1) == '_') {
            sb.setLength(sb.length() - 1);
        }
        return sb.length() == 0 ? "metric" : sb.toString();
    }

    private static String uniqueName(String base, Map<String, String> taken) {
        String candidate = base;
        int index = 2;
        while (taken.containsKey(candidate)) {
            candidate = base + '_' + index;
            index++;
        }
        return candidate;
    }

    @Override
    public Object getAttribute(String attribute)
            throws AttributeNotFoundException, MBeanException, ReflectionException {
        String key = attrToKey.get(attribute);
        if (key == null) {
            throw new AttributeNotFoundException(attribute);
        }
        return snapshotSupplier.get().get(key);
    }

    @Override
    public void setAttribute(Attribute attribute) throws AttributeNotFoundException {
        throw new AttributeNotFoundException("Атрибуты только для чтения: " + attribute.getName());
    }

    @Override
    public AttributeList getAttributes(String[] attributes) {
        AttributeList list = new AttributeList();
        if (attributes == null || attributes.length == 0) {
            return list;
        }
        Map<String, Long> snap = snapshotSupplier.get();
        for (String attr : attributes) {
            String key = attrToKey.get(attr);
            if (key != null) {
                list.add(new Attribute(attr, snap.get(key)));
            }
        }
        return list;
    }

    @Override
    public AttributeList setAttributes(AttributeList attributes) {
        return new AttributeList();
    }

    @Override
    public Object invoke(String actionName, Object[] params, String[] signature)
            throws MBeanException, ReflectionException {
        throw new ReflectionException(new NoSuchMethodException(actionName), "Операции не поддерживаются");
    }

    @Override
    public MBeanInfo getMBeanInfo() {
        return mbeanInfo;
    }
}
