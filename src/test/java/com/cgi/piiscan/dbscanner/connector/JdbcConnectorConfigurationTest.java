package com.cgi.piiscan.dbscanner.connector;

import com.cgi.piiscan.dbscanner.config.ScannerProperties;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.TlsSettings;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcConnectorConfigurationTest {

    private final ScannerProperties properties = new ScannerProperties();

    private static ConnectionParameters.ConnectionParametersBuilder params(EngineKind engine) {
        return ConnectionParameters.builder()
                .engine(engine)
                .host("db.internal")
                .database("crm")
                .username("scanner")
                .password("pw");
    }

    @Test
    void postgresTlsDefaultsToRequire() {
        Properties target = new Properties();

        new PostgreSQLConnector(properties).applyTls(TlsSettings.builder().enabled(true).build(), target);

        assertThat(target).containsEntry("ssl", "true").containsEntry("sslmode", "require");
    }

    @Test
    void mysqlTranslatesVerifyFullMode() {
        Properties target = new Properties();
        TlsSettings tls = TlsSettings.builder()
                .enabled(true)
                .mode("verify-full")
                .trustStorePath("/etc/ssl/ca.jks")
                .trustStorePassword("changeit")
                .build();

        new MySQLConnector(properties).applyTls(tls, target);

        assertThat(target)
                .containsEntry("sslMode", "VERIFY_IDENTITY")
                .containsEntry("trustCertificateKeyStoreUrl", "file:/etc/ssl/ca.jks")
                .containsEntry("trustCertificateKeyStorePassword", "changeit");
    }

    @Test
    void mysqlUrlUsesDefaultPort() {
        assertThat(new MySQLConnector(properties).buildJdbcUrl(params(EngineKind.MYSQL).build()))
                .isEqualTo("jdbc:mysql://db.internal:3306/crm");
    }

    @Test
    void sqlServerUrlStatesEncryption() {
        SQLServerConnector connector = new SQLServerConnector(properties);

        assertThat(connector.buildJdbcUrl(params(EngineKind.SQLSERVER).build()))
                .isEqualTo("jdbc:sqlserver://db.internal:1433;databaseName=crm;encrypt=false");
        assertThat(connector.buildJdbcUrl(params(EngineKind.SQLSERVER)
                .tls(TlsSettings.builder().enabled(true).build())
                .build()))
                .endsWith(";encrypt=true");
    }

    @Test
    void sqlServerTrustsServerCertificateOnlyWithoutVerification() {
        Properties require = new Properties();
        Properties verify = new Properties();
        SQLServerConnector connector = new SQLServerConnector(properties);

        connector.applyTls(TlsSettings.builder().enabled(true).mode("require").build(), require);
        connector.applyTls(TlsSettings.builder().enabled(true).mode("verify-ca").build(), verify);

        assertThat(require).containsEntry("trustServerCertificate", "true");
        assertThat(verify).containsEntry("trustServerCertificate", "false");
    }
}
