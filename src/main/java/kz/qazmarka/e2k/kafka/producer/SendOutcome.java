package kz.qazmarka.e2k.kafka.producer;

import java.util.Objects;

/**
 * Итог отправки одной записи: успех либо ошибка с причиной.
 */
public final class SendOutcome {

    private static final SendOutcome SUCCESS = new SendOutcome(null);

    private final Throwable error;

    private SendOutcome(Throwable error) {
        this.error = error;
    }

    public static SendOutcome success() {
        return SUCCESS;
    }

    public static SendOutcome failure(Throwable error) {
        return new SendOutcome(Objects.requireNonNull(error, "Причина ошибки не может быть null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** @return причина ошибки либо {@code null} при успехе */
    public Throwable error() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "SendOutcome{success}" : "SendOutcome{failure=" + error + '}';
    }
}
