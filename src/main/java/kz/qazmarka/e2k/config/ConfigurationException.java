package kz.qazmarka.e2k.config;

/**
 * Фатальная ошибка конфигурации, обнаруженная на старте. Выход не запускается, отправки не выполняются.
 */
public final class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
