package com.cgi.piiscan.dbscanner.connector;

import com.cgi.piiscan.dbscanner.config.ScannerProperties;
import com.cgi.piiscan.dbscanner.core.connector.DatabaseConnector;
import com.cgi.piiscan.dbscanner.core.connector.DatabaseType;
import com.cgi.piiscan.dbscanner.core.connector.TrustStores;
import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.exception.ConnectionException;
import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.scanner.RedisDatabaseScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

/**
 * Connector for Redis.
 * The database field selects the logical database index, 0 when absent.
 */
@Slf4j
@Component
@DatabaseType(EngineKind.REDIS)
public class RedisConnector implements DatabaseConnector {
    private final ScannerProperties properties;

    public RedisConnector(ScannerProperties properties) {
        this.properties = properties;
    }

    @Override
    public DatabaseScanner open(ConnectionParameters params, int maxConnections) {
        int databaseIndex = parseDatabaseIndex(params.getDatabase());

        JedisPool pool = null;
        try {
            DefaultJedisClientConfig.Builder clientConfig = DefaultJedisClientConfig.builder()
                    .connectionTimeoutMillis((int) properties.getConnectTimeout().toMillis())
                    .socketTimeoutMillis((int) properties.getTableTimeout().toMillis())
                    .database(databaseIndex)
                    .clientName("piiscan");
            if (params.getUsername() != null) {
                clientConfig.user(params.getUsername());
            }
            if (params.getPassword() != null) {
                clientConfig.password(params.getPassword());
            }
            if (params.isTlsEnabled()) {
                clientConfig.ssl(true);
                if (params.getTls().getTrustStorePath() != null) {
                    clientConfig.sslSocketFactory(TrustStores.createSslContext(params.getTls()).getSocketFactory());
                }
            }

            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(maxConnections);
            poolConfig.setMaxIdle(maxConnections);
            poolConfig.setJmxEnabled(false);

            pool = new JedisPool(poolConfig, new HostAndPort(params.getHost(), params.getEffectivePort()),
                    clientConfig.build());
            try (Jedis jedis = pool.getResource()) {
                jedis.ping();
            }
            log.debug("Validated connection to {}", params.describe());
            return new RedisDatabaseScanner(pool, properties.getKeyScanLimit());
        } catch (Exception e) {
            if (pool != null) {
                pool.close();
            }
            log.error("Failed to connect to {}: {}", params.describe(), e.getMessage());
            throw new ConnectionException(EngineKind.REDIS, "Failed to connect to " + params.describe(), e);
        }
    }

    private static int parseDatabaseIndex(String database) {
        if (database == null || database.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(database.trim());
        } catch (NumberFormatException e) {
            throw new ConnectionException(EngineKind.REDIS, "Redis database must be a numeric index: " + database, e);
        }
    }
}
