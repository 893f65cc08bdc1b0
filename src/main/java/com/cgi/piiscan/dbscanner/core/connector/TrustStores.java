package com.cgi.piiscan.dbscanner.core.connector;

import com.cgi.piiscan.dbscanner.model.TlsSettings;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;

/**
 * Builds SSL contexts from the trust store named in {@link TlsSettings}, for clients that take
 * an SSLContext instead of driver properties.
 */
public final class TrustStores {

    private TrustStores() {
    }

    /**
     * Creates an SSL context trusting the certificates of the configured trust store.
     *
     * @param tls TLS settings with a trust store path
     * @return SSL context
     * @throws IOException If the trust store cannot be read
     * @throws GeneralSecurityException If the trust store is invalid
     */
    public static SSLContext createSslContext(TlsSettings tls) throws IOException, GeneralSecurityException {
        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        char[] password = tls.getTrustStorePassword() != null ? tls.getTrustStorePassword().toCharArray() : null;
        try (InputStream in = Files.newInputStream(Path.of(tls.getTrustStorePath()))) {
            trustStore.load(in, password);
        }

        TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        factory.init(trustStore);
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, factory.getTrustManagers(), null);
        return context;
    }
}
