package kz.qazmarka.e2k.kafka.producer;

import java.security.SecureRandom;
import java.util.concurrent.TimeUnit;

import kz.qazmarka.e2k.config.RetrySettings;
import kz.qazmarka.e2k.config.RetrySettings.BackoffMode;

/**
 * Фиксированная пауза между раундами повторов с необязательным криптографическим джиттером.
 * Пауза не растёт от раунда к раунду.
 */
public final class BackoffPolicy {
    private static final SecureRandom SR = new SecureRandom();
    private final long baseNanos;
    private final int jitterPercent;

    BackoffPolicy(long baseNanos, int jitterPercent) {
        if (baseNanos < 0L) {
            throw new IllegalArgumentException("Пауза не может быть отрицательной: " + baseNanos);
        }
        if (jitterPercent < 0 || jitterPercent > 100) {
            throw new IllegalArgumentException("Джиттер должен быть в диапазоне 0..100: " + jitterPercent);
        }
        this.baseNanos = baseNanos;
        this.jitterPercent = jitterPercent;
    }

    public static BackoffPolicy from(RetrySettings settings) {
        return new BackoffPolicy(baseNanos(settings.getBackoffMode(), settings.getBackoffMs()),
                settings.getJitterPercent());
    }

    /**
     * Базовая пауза в наносекундах.
     * {@link BackoffMode#LEGACY_RECIPROCAL} даёт {@code 1 / backoffMs} секунд.
     */
    static long baseNanos(BackoffMode mode, long backoffMs) {
        if (backoffMs <= 0L) {
            throw new IllegalArgumentException("backoffMs должен быть > 0");
        }
        if (mode == BackoffMode.LEGACY_RECIPROCAL) {
            return TimeUnit.SECONDS.toNanos(1L) / backoffMs;
        }
        return TimeUnit.MILLISECONDS.toNanos(backoffMs);
    }

    public long baseNanos() {
        return baseNanos;
    }

    long nextDelayNanos() {
        if (jitterPercent == 0 || baseNanos == 0L) {
            return baseNanos;
        }
        long jitter = Math.max(1L, (baseNanos * jitterPercent) / 100L);
        long delta = nextLongBetweenSecure(-jitter, jitter + 1);
        long d = baseNanos + delta;
        return (d < 0L) ? 0L : d;
    }

    private static long nextLongBetweenSecure(long originInclusive, long boundExclusive) {
        long n = boundExclusive - originInclusive;
        if (n <= 0) return originInclusive;
        long bits;
        long val;
        do {
            bits = SR.nextLong() >>> 1;
            val = bits % n;
        } while (bits - val + (n - 1) < 0L);
        return originInclusive + val;
    }
}
