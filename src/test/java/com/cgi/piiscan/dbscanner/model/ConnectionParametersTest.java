package com.cgi.piiscan.dbscanner.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionParametersTest {

    @Test
    void fallsBackToEngineDefaultPort() {
        ConnectionParameters mysql = ConnectionParameters.builder().engine(EngineKind.MYSQL).host("h").build();
        ConnectionParameters custom = mysql.toBuilder().port(13306).build();

        assertThat(mysql.getEffectivePort()).isEqualTo(3306);
        assertThat(custom.getEffectivePort()).isEqualTo(13306);
    }

    @Test
    void describeAndToStringHidePassword() {
        ConnectionParameters params = ConnectionParameters.builder()
                .engine(EngineKind.SQLSERVER)
                .host("sql01")
                .database("hr")
                .username("sa")
                .password("Hunter2!")
                .build();

        assertThat(params.describe()).isEqualTo("sqlserver://sql01:1433/hr");
        assertThat(params.toString()).doesNotContain("Hunter2!");
    }

    @Test
    void sqliteIsDescribedByFilePath() {
        ConnectionParameters params = ConnectionParameters.builder()
                .engine(EngineKind.SQLITE)
                .database("/var/data/app.db")
                .build();

        assertThat(params.describe()).isEqualTo("sqlite:///var/data/app.db");
    }

    @Test
    void tlsIsOffUnlessEnabled() {
        ConnectionParameters plain = ConnectionParameters.builder().engine(EngineKind.REDIS).build();
        ConnectionParameters disabled = plain.toBuilder().tls(TlsSettings.disabled()).build();
        ConnectionParameters enabled = plain.toBuilder()
                .tls(TlsSettings.builder().enabled(true).mode("require").build())
                .build();

        assertThat(plain.isTlsEnabled()).isFalse();
        assertThat(disabled.isTlsEnabled()).isFalse();
        assertThat(enabled.isTlsEnabled()).isTrue();
    }

    @Test
    void engineIsRequired() {
        assertThatThrownBy(() -> ConnectionParameters.builder().host("h").build())
                .isInstanceOf(NullPointerException.class);
    }
}
