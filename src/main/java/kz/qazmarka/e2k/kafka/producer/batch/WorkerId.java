package kz.qazmarka.e2k.kafka.producer.batch;

import java.util.Objects;

/**
 * Явный идентификатор рабочего потока (сессии) выхода.
 * Пачка накапливается и отправляется строго в рамках одного {@code WorkerId}.
 */
public final class WorkerId {

    private final String name;

    private WorkerId(String name) {
        this.name = name;
    }

    public static WorkerId of(String name) {
        Objects.requireNonNull(name, "Имя рабочего не может быть null");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("Имя рабочего не может быть пустым");
        }
        return new WorkerId(name);
    }

    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkerId)) {
            return false;
        }
        return name.equals(((WorkerId) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
