package com.cgi.piiscan.dbscanner.connector;

import com.cgi.piiscan.dbscanner.config.ScannerProperties;
import com.cgi.piiscan.dbscanner.core.connector.DatabaseConnector;
import com.cgi.piiscan.dbscanner.core.connector.DatabaseType;
import com.cgi.piiscan.dbscanner.core.connector.TrustStores;
import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.exception.ConnectionException;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.TlsSettings;
import com.cgi.piiscan.dbscanner.scanner.MongoDatabaseScanner;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLContext;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Connector for MongoDB.
 * Credentials are checked against the "authSource" property, "admin" by default.
 */
@Slf4j
@Component
@DatabaseType(EngineKind.MONGODB)
public class MongoConnector implements DatabaseConnector {
    private final ScannerProperties properties;

    public MongoConnector(ScannerProperties properties) {
        this.properties = properties;
    }

    @Override
    public DatabaseScanner open(ConnectionParameters params, int maxConnections) {
        if (params.getDatabase() == null || params.getDatabase().isBlank()) {
            throw new ConnectionException(EngineKind.MONGODB, "MongoDB database name is required");
        }

        MongoClient client = null;
        try {
            client = MongoClients.create(buildSettings(params, maxConnections));
            client.getDatabase("admin").runCommand(new Document("ping", 1));
            log.debug("Validated connection to {}", params.describe());
            return new MongoDatabaseScanner(client, params.getDatabase(), properties.getIntrospectionSampleDocuments());
        } catch (Exception e) {
            if (client != null) {
                client.close();
            }
            log.error("Failed to connect to {}: {}", params.describe(), e.getMessage());
            throw new ConnectionException(EngineKind.MONGODB, "Failed to connect to " + params.describe(), e);
        }
    }

    MongoClientSettings buildSettings(ConnectionParameters params, int maxConnections) throws Exception {
        int connectMillis = (int) properties.getConnectTimeout().toMillis();
        int readMillis = (int) properties.getTableTimeout().toMillis();

        MongoClientSettings.Builder builder = MongoClientSettings.builder()
                .applyToClusterSettings(cluster -> cluster
                        .hosts(List.of(new ServerAddress(params.getHost(), params.getEffectivePort())))
                        .serverSelectionTimeout(connectMillis, TimeUnit.MILLISECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(connectMillis, TimeUnit.MILLISECONDS)
                        .readTimeout(readMillis, TimeUnit.MILLISECONDS))
                .applyToConnectionPoolSettings(pool -> pool.maxSize(maxConnections));

        if (params.getUsername() != null) {
            String authSource = params.getProperties().getOrDefault("authSource", "admin");
            char[] password = params.getPassword() != null ? params.getPassword().toCharArray() : new char[0];
            builder.credential(MongoCredential.createCredential(params.getUsername(), authSource, password));
        }

        if (params.isTlsEnabled()) {
            TlsSettings tls = params.getTls();
            SSLContext context = tls.getTrustStorePath() != null ? TrustStores.createSslContext(tls) : null;
            boolean verifyHost = tls.getMode() == null || "verify-full".equals(tls.getMode());
            builder.applyToSslSettings(ssl -> {
                ssl.enabled(true).invalidHostNameAllowed(!verifyHost);
                if (context != null) {
                    ssl.context(context);
                }
            });
        }
        return builder.build();
    }
}
