package kz.qazmarka.e2k.output;

import org.slf4j.Logger;
import org.slf4j.helpers.MessageFormatter;

import kz.qazmarka.e2k.kafka.producer.batch.WorkerId;

/**
 * Лёгкий помощник для единых лог-сообщений выхода:
 * {@code событие=<имя> worker=<id> topic=<шаблон> msg=<текст>}.
 */
final class OutputLog {

    static final String LOG_UNKNOWN = "-";
    private static final String LOG_MESSAGE_FORMAT = "{} msg={}";

    private final Logger log;
    private final String topicTemplate;

    OutputLog(Logger log, String topicTemplate) {
        this.log = log;
        this.topicTemplate = safeValue(topicTemplate);
    }

    String prefix(String event, WorkerId worker) {
        StringBuilder sb = new StringBuilder(96);
        sb.append("событие=").append(safeValue(event));
        sb.append(" worker=").append(worker == null ? LOG_UNKNOWN : worker.name());
        sb.append(" topic=").append(topicTemplate);
        return sb.toString();
    }

    void info(String event, WorkerId worker, String template, Object... args) {
        if (!log.isInfoEnabled()) {
            return;
        }
        log.info(LOG_MESSAGE_FORMAT, prefix(event, worker), formatMessage(template, args));
    }

    void warn(String event, WorkerId worker, String template, Object... args) {
        if (!log.isWarnEnabled()) {
            return;
        }
        log.warn(LOG_MESSAGE_FORMAT, prefix(event, worker), formatMessage(template, args));
    }

    void error(String event, WorkerId worker, String template, Object... args) {
        if (!log.isErrorEnabled()) {
            return;
        }
        log.error(LOG_MESSAGE_FORMAT, prefix(event, worker), formatMessage(template, args));
    }

    void debug(String event, WorkerId worker, String template, Object... args) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug(LOG_MESSAGE_FORMAT, prefix(event, worker), formatMessage(template, args));
    }

    boolean isDebugEnabled() {
        return log.isDebugEnabled();
    }

    static String safeExceptionMessage(Throwable ex) {
        if (ex == null) {
            return LOG_UNKNOWN;
        }
        String message = ex.getMessage();
        return message == null || message.isEmpty() ? ex.getClass().getSimpleName() : message;
    }

    private static String safeValue(String value) {
        if (value == null || value.isEmpty()) {
            return LOG_UNKNOWN;
        }
        return value;
    }

    private static String formatMessage(String template, Object... args) {
        if (args == null || args.length == 0) {
            return template;
        }
        return MessageFormatter.arrayFormat(template, args).getMessage();
    }
}
