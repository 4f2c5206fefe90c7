package kz.qazmarka.e2k.kafka.producer;

import kz.qazmarka.e2k.config.RetrySettings;

/**
 * Бюджет повторов одного слива пачки: число дополнительных раундов после первого
 * либо неограниченный бюджет.
 *
 * Экземпляр изменяемый и живёт ровно один слив; между вызовами не переиспользуется.
 */
public final class RetryBudget {

    private static final int UNLIMITED = -1;

    private final int configured;
    private int remaining;

    private RetryBudget(int configured) {
        this.configured = configured;
        this.remaining = configured;
    }

    public static RetryBudget unlimited() {
        return new RetryBudget(UNLIMITED);
    }

    public static RetryBudget finite(int retries) {
        if (retries < 0) {
            throw new IllegalArgumentException("Бюджет повторов не может быть отрицательным: " + retries);
        }
        return new RetryBudget(retries);
    }

    public static RetryBudget from(RetrySettings settings) {
        return settings.isUnlimited() ? unlimited() : finite(settings.getRetries());
    }

    public boolean isUnlimited() {
        return configured == UNLIMITED;
    }

    /**
     * Списывает один повтор.
     *
     * @return {@code false}, если конечный бюджет исчерпан
     */
    public boolean tryConsume() {
        if (isUnlimited()) {
            return true;
        }
        if (remaining == 0) {
            return false;
        }
        remaining--;
        return true;
    }

    /** @return остаток повторов; для неограниченного бюджета {@code -1} */
    public int remaining() {
        return isUnlimited() ? UNLIMITED : remaining;
    }

    /** @return исходный размер бюджета; для неограниченного {@code -1} */
    public int configured() {
        return configured;
    }

    @Override
    public String toString() {
        return isUnlimited() ? "без ограничений" : remaining + "/" + configured;
    }
}
