package com.cgi.piiscan.dbscanner.scanner;

import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.exception.IntrospectionException;
import com.cgi.piiscan.dbscanner.exception.SamplingException;
import com.cgi.piiscan.dbscanner.model.ColumnDescriptor;
import com.cgi.piiscan.dbscanner.model.DataSample;
import com.cgi.piiscan.dbscanner.model.EngineKind;
import com.cgi.piiscan.dbscanner.model.IntrospectionFailure;
import com.cgi.piiscan.dbscanner.model.IntrospectionResult;
import com.cgi.piiscan.dbscanner.model.TableDescriptor;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.exceptions.JedisException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scanner implementation for Redis.
 * Keys are grouped into key spaces by the prefix before their first colon; each key space
 * is treated as a table whose rows are the keys.
 */
@Slf4j
public class RedisDatabaseScanner implements DatabaseScanner {
    static final String KEY_COLUMN = "key";
    static final String VALUE_COLUMN = "value";
    static final String HASH_FIELD_PREFIX = "hash.";

    private static final int SCAN_PAGE_SIZE = 500;
    private static final int HASH_KEYS_INSPECTED = 3;
    private static final int COLLECTION_VALUES_READ = 50;

    private final JedisPool pool;
    private final int keyScanLimit;

    public RedisDatabaseScanner(JedisPool pool, int keyScanLimit) {
        this.pool = pool;
        this.keyScanLimit = keyScanLimit;
    }

    @Override
    public EngineKind getEngineKind() {
        return EngineKind.REDIS;
    }

    @Override
    public IntrospectionResult scanTables() {
        Map<String, List<String>> keySpaces;
        try (Jedis jedis = pool.getResource()) {
            keySpaces = groupByKeySpace(scanKeys(jedis, "*", keyScanLimit));
        } catch (JedisException e) {
            throw new IntrospectionException("Cannot scan Redis key space", e);
        }

        List<TableDescriptor> tables = new ArrayList<>();
        List<IntrospectionFailure> failures = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : keySpaces.entrySet()) {
            try (Jedis jedis = pool.getResource()) {
                Set<String> fields = new LinkedHashSet<>();
                int inspected = 0;
                for (String key : entry.getValue()) {
                    if (inspected >= HASH_KEYS_INSPECTED) {
                        break;
                    }
                    if ("hash".equals(jedis.type(key))) {
                        fields.addAll(jedis.hkeys(key));
                        inspected++;
                    }
                }

                TableDescriptor.TableDescriptorBuilder builder = TableDescriptor.builder()
                        .name(entry.getKey())
                        .estimatedRowCount(entry.getValue().size())
                        .column(ColumnDescriptor.of(KEY_COLUMN, "string"))
                        .column(ColumnDescriptor.of(VALUE_COLUMN, "string"));
                fields.forEach(field -> builder.column(ColumnDescriptor.of(hashFieldColumn(field), "hash-field")));
                tables.add(builder.build());
            } catch (JedisException e) {
                log.warn("Skipping key space {} during introspection: {}", entry.getKey(), e.getMessage());
                failures.add(new IntrospectionFailure(entry.getKey(), e.getMessage()));
            }
        }
        return new IntrospectionResult(tables, failures);
    }

    @Override
    public DataSample sampleTableData(TableDescriptor table, int limit) {
        validateTableName(table.getName());
        String keySpace = table.getName();
        try (Jedis jedis = pool.getResource()) {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (String key : scanKeys(jedis, escapeGlob(keySpace) + "*", keyScanLimit)) {
                if (rows.size() >= limit) {
                    break;
                }
                if (keySpace.equals(keySpaceOf(key))) {
                    rows.add(readKey(jedis, key));
                }
            }
            return DataSample.builder()
                    .tableName(keySpace)
                    .columnNames(table.getColumnNames())
                    .rows(rows)
                    .build();
        } catch (JedisException e) {
            throw new SamplingException("Error sampling key space " + keySpace, e);
        }
    }

    private List<String> scanKeys(Jedis jedis, String pattern, int limit) {
        List<String> keys = new ArrayList<>();
        ScanParams params = new ScanParams().match(pattern).count(SCAN_PAGE_SIZE);
        String cursor = ScanParams.SCAN_POINTER_START;
        do {
            redis.clients.jedis.resps.ScanResult<String> page = jedis.scan(cursor, params);
            for (String key : page.getResult()) {
                if (keys.size() >= limit) {
                    return keys;
                }
                keys.add(key);
            }
            cursor = page.getCursor();
        } while (!ScanParams.SCAN_POINTER_START.equals(cursor) && !Thread.currentThread().isInterrupted());
        return keys;
    }

    private Map<String, Object> readKey(Jedis jedis, String key) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(KEY_COLUMN, key);
        switch (jedis.type(key)) {
            case "string" -> row.put(VALUE_COLUMN, jedis.get(key));
            case "hash" -> putHashFields(row, jedis.hgetAll(key));
            case "list" -> row.put(VALUE_COLUMN, String.join(" ", jedis.lrange(key, 0, COLLECTION_VALUES_READ - 1)));
            case "set" -> row.put(VALUE_COLUMN, String.join(" ", jedis.srandmember(key, COLLECTION_VALUES_READ)));
            case "zset" -> row.put(VALUE_COLUMN, String.join(" ", jedis.zrange(key, 0, COLLECTION_VALUES_READ - 1)));
            default -> log.debug("Not reading value of key {} with unsupported type", key);
        }
        return row;
    }

    /**
     * Adds hash fields to a row without overwriting its key or value column.
     *
     * @param row Row already holding the key column
     * @param fields Hash fields
     */
    static void putHashFields(Map<String, Object> row, Map<String, String> fields) {
        fields.forEach((field, value) -> row.put(hashFieldColumn(field), value));
    }

    /**
     * Column name of a hash field; fields named like a reserved column are prefixed.
     */
    static String hashFieldColumn(String field) {
        if (KEY_COLUMN.equals(field) || VALUE_COLUMN.equals(field)) {
            return HASH_FIELD_PREFIX + field;
        }
        return field;
    }

    /**
     * Groups keys by key space, keeping first-seen order.
     *
     * @param keys Keys
     * @return Key space to keys
     */
    static Map<String, List<String>> groupByKeySpace(List<String> keys) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (String key : keys) {
            groups.computeIfAbsent(keySpaceOf(key), k -> new ArrayList<>()).add(key);
        }
        return groups;
    }

    /**
     * Gets the key space of a key: the part before the first colon, or the whole key.
     *
     * @param key Key
     * @return Key space
     */
    static String keySpaceOf(String key) {
        int colon = key.indexOf(':');
        return colon > 0 ? key.substring(0, colon) : key;
    }

    private static String escapeGlob(String value) {
        return value.replaceAll("([*?\\[\\]\\\\])", "\\\\$1");
    }

    @Override
    public void close() {
        log.debug("Closing Redis pool");
        pool.close();
    }
}
