package kz.qazmarka.e2k.config;

import kz.qazmarka.e2k.util.Parsers;

/**
 * DTO с настройками повторов доставки: бюджет повторов и пауза между раундами.
 */
public final class RetrySettings {

    /**
     * Способ вычисления паузы между раундами повторов.
     */
    public enum BackoffMode {
        /** Пауза ровно {@code backoffMs} миллисекунд. */
        FIXED,
        /**
         * Совместимость с исходным плагином: пауза {@code 1 / backoffMs} секунд.
         * Для реальных значений это доли миллисекунды, т.е. backoff фактически отключён.
         */
        LEGACY_RECIPROCAL;

        static BackoffMode parse(String raw) {
            String normalized = Parsers.up(raw).replace('-', '_');
            for (BackoffMode mode : values()) {
                if (mode.name().equals(normalized)) {
                    return mode;
                }
            }
            throw new ConfigurationException("Неизвестный режим backoff '" + raw
                    + "' (" + E2kConfig.K_RETRY_BACKOFF_MODE + "): допустимы fixed, legacy_reciprocal");
        }
    }

    private final Integer retries;
    private final long backoffMs;
    private final BackoffMode backoffMode;
    private final int jitterPercent;

    RetrySettings(Integer retries, long backoffMs, BackoffMode backoffMode, int jitterPercent) {
        this.retries = retries;
        this.backoffMs = backoffMs;
        this.backoffMode = backoffMode;
        this.jitterPercent = jitterPercent;
    }

    /** @return {@code true}, если повторы не ограничены (ключ {@code e2k.retries} не задан) */
    public boolean isUnlimited() {
        return retries == null;
    }

    /** @return число дополнительных попыток либо {@code null} для неограниченного бюджета */
    public Integer getRetries() {
        return retries;
    }

    public long getBackoffMs() {
        return backoffMs;
    }

    public BackoffMode getBackoffMode() {
        return backoffMode;
    }

    public int getJitterPercent() {
        return jitterPercent;
    }
}
