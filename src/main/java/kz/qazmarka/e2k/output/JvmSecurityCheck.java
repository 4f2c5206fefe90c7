package kz.qazmarka.e2k.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.e2k.config.SecuritySettings;

/**
 * Сверяет файлы JAAS и krb5 из конфигурации с общими для JVM системными свойствами.
 *
 * Клиент Kafka читает их только из {@code java.security.auth.login.config} и
 * {@code java.security.krb5.conf}. Выход эти свойства не меняет: выставлять их должен владелец процесса,
 * здесь расхождения лишь выводятся в WARN.
 */
final class JvmSecurityCheck {

    private static final Logger LOG = LoggerFactory.getLogger(JvmSecurityCheck.class);

    static final String JAAS_PROPERTY = "java.security.auth.login.config";
    static final String KRB5_PROPERTY = "java.security.krb5.conf";

    private final UnaryOperator<String> systemProperties;

    JvmSecurityCheck() {
        this(System::getProperty);
    }

    JvmSecurityCheck(UnaryOperator<String> systemProperties) {
        this.systemProperties = systemProperties;
    }

    /**
     * Файлы JAAS и krb5 нужны только SASL-протоколам; для PLAINTEXT и SSL проверка не выполняется.
     *
     * @return список расхождений в человекочитаемом виде (пустой, если всё согласовано)
     */
    List<String> verify(SecuritySettings security) {
        if (!security.getProtocol().usesSasl()) {
            return Collections.<String>emptyList();
        }
        SecuritySettings.Sasl sasl = security.getSasl();
        List<String> problems = new ArrayList<>(2);
        check(JAAS_PROPERTY, sasl.getJaasPath(), problems);
        check(KRB5_PROPERTY, sasl.getKerberosConfig(), problems);
        for (String problem : problems) {
            LOG.warn(problem);
        }
        return problems.isEmpty() ? Collections.<String>emptyList() : problems;
    }

    private void check(String property, String expected, List<String> problems) {
        if (expected == null || expected.isEmpty()) {
            return;
        }
        String actual = systemProperties.apply(property);
        if (actual == null || actual.isEmpty()) {
            problems.add("Системное свойство " + property + " не задано, ожидалось '" + expected
                    + "': задайте его при запуске JVM");
        } else if (!actual.equals(expected)) {
            problems.add("Системное свойство " + property + "='" + actual + "' расходится с конфигурацией '"
                    + expected + "': в одной JVM действует только одно значение");
        }
    }
}
