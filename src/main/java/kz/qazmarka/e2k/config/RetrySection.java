package kz.qazmarka.e2k.config;

import org.apache.hadoop.conf.Configuration;

import kz.qazmarka.e2k.config.RetrySettings.BackoffMode;
import kz.qazmarka.e2k.util.Parsers;

/**
 * Секция повторов доставки. Некорректное число в {@code e2k.retries} не подменяется дефолтом:
 * «молча» превратить опечатку в бесконечные повторы (или в потерю данных) нельзя.
 */
final class RetrySection {
    final Integer retries;
    final long backoffMs;
    final BackoffMode backoffMode;
    final int jitterPercent;

    private RetrySection(Integer retries, long backoffMs, BackoffMode backoffMode, int jitterPercent) {
        this.retries = retries;
        this.backoffMs = backoffMs;
        this.backoffMode = backoffMode;
        this.jitterPercent = jitterPercent;
    }

    static RetrySection from(Configuration cfg) {
        Integer retries;
        try {
            retries = Parsers.readOptionalInt(cfg, E2kConfig.K_RETRIES);
        } catch (NumberFormatException ex) {
            throw new ConfigurationException("Некорректное число повторов: " + E2kConfig.K_RETRIES + "='"
                    + cfg.getTrimmed(E2kConfig.K_RETRIES) + "'", ex);
        }
        long backoffMs = Parsers.readLong(cfg, E2kConfig.K_RETRY_BACKOFF_MS, E2kConfig.DEFAULT_RETRY_BACKOFF_MS);
        String rawMode = cfg.getTrimmed(E2kConfig.K_RETRY_BACKOFF_MODE);
        BackoffMode mode = (rawMode == null || rawMode.isEmpty()) ? BackoffMode.FIXED : BackoffMode.parse(rawMode);
        int jitter = Parsers.readIntMin(cfg, E2kConfig.K_RETRY_BACKOFF_JITTER, E2kConfig.DEFAULT_JITTER_PERCENT, 0);
        return new RetrySection(retries, backoffMs, mode, jitter);
    }
}
