package kz.qazmarka.e2k.config;

import kz.qazmarka.e2k.util.Parsers;

/**
 * Параметры защищённого транспорта (SSL) и аутентификации (SASL) для Kafka Producer.
 *
 * Все значения передаются клиенту через его {@link java.util.Properties}; глобальные свойства JVM
 * ({@code java.security.auth.login.config}, {@code java.security.krb5.conf}) здесь только описываются:
 * их установкой управляет владелец процесса.
 */
public final class SecuritySettings {

    /** Механизм SASL, требующий имя Kerberos-сервиса. */
    public static final String MECHANISM_GSSAPI = "GSSAPI";

    /**
     * Протокол безопасности соединения с брокером.
     */
    public enum Protocol {
        PLAINTEXT, SSL, SASL_PLAINTEXT, SASL_SSL;

        public boolean usesSsl() {
            return this == SSL || this == SASL_SSL;
        }

        public boolean usesSasl() {
            return this == SASL_PLAINTEXT || this == SASL_SSL;
        }

        static Protocol parse(String raw) {
            String v = Parsers.up(raw);
            for (Protocol p : values()) {
                if (p.name().equals(v)) {
                    return p;
                }
            }
            throw new ConfigurationException("Недопустимое значение " + E2kConfig.K_SECURITY_PROTOCOL + "='" + raw
                    + "': допустимы PLAINTEXT, SSL, SASL_PLAINTEXT, SASL_SSL");
        }
    }

    private final Protocol protocol;
    private final Ssl ssl;
    private final Sasl sasl;

    SecuritySettings(Protocol protocol, Ssl ssl, Sasl sasl) {
        this.protocol = protocol;
        this.ssl = ssl;
        this.sasl = sasl;
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public Ssl getSsl() {
        return ssl;
    }

    public Sasl getSasl() {
        return sasl;
    }

    /**
     * Хранилища ключей и сертификатов. Любое поле может быть {@code null}.
     */
    public static final class Ssl {
        private final String truststoreType;
        private final String truststoreLocation;
        private final String truststorePassword;
        private final String keystoreType;
        private final String keystoreLocation;
        private final String keystorePassword;
        private final String keyPassword;

        Ssl(String truststoreType,
            String truststoreLocation,
            String truststorePassword,
            String keystoreType,
            String keystoreLocation,
            String keystorePassword,
            String keyPassword) {
            this.truststoreType = truststoreType;
            this.truststoreLocation = truststoreLocation;
            this.truststorePassword = truststorePassword;
            this.keystoreType = keystoreType;
            this.keystoreLocation = keystoreLocation;
            this.keystorePassword = keystorePassword;
            this.keyPassword = keyPassword;
        }

        public String getTruststoreType() {
            return truststoreType;
        }

        public String getTruststoreLocation() {
            return truststoreLocation;
        }

        public String getTruststorePassword() {
            return truststorePassword;
        }

        public String getKeystoreType() {
            return keystoreType;
        }

        public String getKeystoreLocation() {
            return keystoreLocation;
        }

        public String getKeystorePassword() {
            return keystorePassword;
        }

        public String getKeyPassword() {
            return keyPassword;
        }
    }

    /**
     * Параметры SASL. {@code jaasPath} и {@code kerberosConfig} клиент Kafka читает только из свойств JVM.
     */
    public static final class Sasl {
        private final String mechanism;
        private final String kerberosServiceName;
        private final String jaasConfig;
        private final String jaasPath;
        private final String kerberosConfig;

        Sasl(String mechanism,
             String kerberosServiceName,
             String jaasConfig,
             String jaasPath,
             String kerberosConfig) {
            this.mechanism = mechanism;
            this.kerberosServiceName = kerberosServiceName;
            this.jaasConfig = jaasConfig;
            this.jaasPath = jaasPath;
            this.kerberosConfig = kerberosConfig;
        }

        public String getMechanism() {
            return mechanism;
        }

        public String getKerberosServiceName() {
            return kerberosServiceName;
        }

        /** @return встроенная JAAS-запись для {@code sasl.jaas.config} либо {@code null} */
        public String getJaasConfig() {
            return jaasConfig;
        }

        public String getJaasPath() {
            return jaasPath;
        }

        public String getKerberosConfig() {
            return kerberosConfig;
        }
    }
}
