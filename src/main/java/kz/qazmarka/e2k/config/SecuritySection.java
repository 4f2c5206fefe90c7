package kz.qazmarka.e2k.config;

import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.e2k.config.SecuritySettings.Protocol;
import kz.qazmarka.e2k.util.Parsers;

/**
 * Секция SSL/SASL. Устаревший флаг {@code e2k.ssl.enabled=true} при протоколе PLAINTEXT
 * трактуется как {@code SSL}.
 */
final class SecuritySection {
    private static final Logger LOG = LoggerFactory.getLogger(SecuritySection.class);

    final Protocol protocol;
    final String truststoreType;
    final String truststoreLocation;
    final String truststorePassword;
    final String keystoreType;
    final String keystoreLocation;
    final String keystorePassword;
    final String keyPassword;
    final String saslMechanism;
    final String kerberosServiceName;
    final String jaasConfig;
    final String jaasPath;
    final String kerberosConfig;

    private SecuritySection(Configuration cfg) {
        Protocol configured = Protocol.parse(Parsers.readStringOrDefault(cfg, E2kConfig.K_SECURITY_PROTOCOL,
                Protocol.PLAINTEXT.name()));
        boolean legacySsl = Parsers.readBoolean(cfg, E2kConfig.K_SSL_ENABLED, false);
        if (legacySsl) {
            LOG.warn("Ключ {} устарел, используйте {}=SSL", E2kConfig.K_SSL_ENABLED, E2kConfig.K_SECURITY_PROTOCOL);
        }
        this.protocol = (legacySsl && configured == Protocol.PLAINTEXT) ? Protocol.SSL : configured;
        this.truststoreType = cfg.getTrimmed(E2kConfig.K_SSL_TRUSTSTORE_TYPE);
        this.truststoreLocation = cfg.getTrimmed(E2kConfig.K_SSL_TRUSTSTORE_LOCATION);
        this.truststorePassword = cfg.getTrimmed(E2kConfig.K_SSL_TRUSTSTORE_PASSWORD);
        this.keystoreType = cfg.getTrimmed(E2kConfig.K_SSL_KEYSTORE_TYPE);
        this.keystoreLocation = cfg.getTrimmed(E2kConfig.K_SSL_KEYSTORE_LOCATION);
        this.keystorePassword = cfg.getTrimmed(E2kConfig.K_SSL_KEYSTORE_PASSWORD);
        this.keyPassword = cfg.getTrimmed(E2kConfig.K_SSL_KEY_PASSWORD);
        this.saslMechanism = Parsers.readStringOrDefault(cfg, E2kConfig.K_SASL_MECHANISM,
                E2kConfig.DEFAULT_SASL_MECHANISM);
        this.kerberosServiceName = cfg.getTrimmed(E2kConfig.K_SASL_KERBEROS_SERVICE_NAME);
        this.jaasConfig = cfg.getTrimmed(E2kConfig.K_SASL_JAAS_CONFIG);
        this.jaasPath = cfg.getTrimmed(E2kConfig.K_SASL_JAAS_PATH);
        this.kerberosConfig = cfg.getTrimmed(E2kConfig.K_KERBEROS_CONFIG);
    }

    static SecuritySection from(Configuration cfg) {
        return new SecuritySection(cfg);
    }
}
