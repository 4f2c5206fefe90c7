package kz.qazmarka.e2k.kafka.producer;

/**
 * Итог слива одной пачки через {@link RetryController}.
 */
public final class DrainResult {

    /** Конечное состояние слива. */
    public enum Status {
        /** Все записи подтверждены брокером. */
        DONE,
        /** Конечный бюджет повторов исчерпан, оставшиеся записи отброшены. */
        ABANDONED,
        /** Слив прерван остановкой выхода или прерыванием потока. */
        INTERRUPTED
    }

    private static final DrainResult EMPTY = new DrainResult(Status.DONE, 0, 0, 0, 0, 0);

    private final Status status;
    private final int rounds;
    private final int submitted;
    private final int delivered;
    private final int dropped;
    private final int sleeps;

    DrainResult(Status status, int rounds, int submitted, int delivered, int dropped, int sleeps) {
        this.status = status;
        this.rounds = rounds;
        this.submitted = submitted;
        this.delivered = delivered;
        this.dropped = dropped;
        this.sleeps = sleeps;
    }

    /** Результат для пустой пачки: ни одного раунда. */
    public static DrainResult empty() {
        return EMPTY;
    }

    public Status status() {
        return status;
    }

    /** Число раундов отправки (первый раунд плюс повторы). */
    public int rounds() {
        return rounds;
    }

    /** Суммарное число вызовов submit по всем раундам. */
    public int submitted() {
        return submitted;
    }

    public int delivered() {
        return delivered;
    }

    /** Записи, отброшенные при исчерпании бюджета; для INTERRUPTED недоставленный остаток. */
    public int dropped() {
        return dropped;
    }

    public int sleeps() {
        return sleeps;
    }

    public boolean isDone() {
        return status == Status.DONE;
    }

    @Override
    public String toString() {
        return "DrainResult{status=" + status
                + ", rounds=" + rounds
                + ", submitted=" + submitted
                + ", delivered=" + delivered
                + ", dropped=" + dropped
                + ", sleeps=" + sleeps + '}';
    }
}
