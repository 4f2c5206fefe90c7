package kz.qazmarka.e2k.event;

/**
 * Ссылка на поле в шаблоне не разрешилась, а шаблон работает в строгом режиме.
 */
public final class TemplateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String reference;

    public TemplateException(String template, String reference) {
        super("Не удалось подставить поле '" + reference + "' в шаблон '" + template + "'");
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
