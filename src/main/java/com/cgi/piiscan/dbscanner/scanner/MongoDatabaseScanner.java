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
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scanner implementation for MongoDB.
 * Collections play the role of tables; their fields are approximated from a few sampled
 * documents, nested documents being flattened with dot notation.
 */
@Slf4j
public class MongoDatabaseScanner implements DatabaseScanner {
    private final MongoClient client;
    private final MongoDatabase database;
    private final int sampleDocuments;

    public MongoDatabaseScanner(MongoClient client, String databaseName, int sampleDocuments) {
        this.client = client;
        this.database = client.getDatabase(databaseName);
        this.sampleDocuments = sampleDocuments;
    }

    @Override
    public EngineKind getEngineKind() {
        return EngineKind.MONGODB;
    }

    @Override
    public IntrospectionResult scanTables() {
        List<String> names;
        try {
            names = database.listCollectionNames().into(new ArrayList<>());
        } catch (MongoException e) {
            throw new IntrospectionException("Cannot list collections of " + database.getName(), e);
        }

        List<TableDescriptor> tables = new ArrayList<>();
        List<IntrospectionFailure> failures = new ArrayList<>();
        for (String name : names) {
            if (name.startsWith("system.")) {
                continue;
            }
            try {
                MongoCollection<Document> collection = database.getCollection(name);
                long count = collection.estimatedDocumentCount();
                Map<String, String> fields = new LinkedHashMap<>();
                for (Document doc : collection.find().limit(sampleDocuments)) {
                    Map<String, Object> flat = new LinkedHashMap<>();
                    flatten("", doc, flat);
                    flat.forEach((field, value) -> fields.putIfAbsent(field, typeOf(value)));
                }

                TableDescriptor.TableDescriptorBuilder builder = TableDescriptor.builder()
                        .name(name)
                        .estimatedRowCount(count);
                fields.forEach((field, type) -> builder.column(ColumnDescriptor.of(field, type)));
                tables.add(builder.build());
            } catch (MongoException e) {
                log.warn("Skipping collection {} during introspection: {}", name, e.getMessage());
                failures.add(new IntrospectionFailure(name, e.getMessage()));
            }
        }
        return new IntrospectionResult(tables, failures);
    }

    @Override
    public DataSample sampleTableData(TableDescriptor table, int limit) {
        validateTableName(table.getName());
        try {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (Document doc : database.getCollection(table.getName()).find().limit(limit)) {
                Map<String, Object> row = new LinkedHashMap<>();
                flatten("", doc, row);
                rows.add(row);
            }
            return DataSample.builder()
                    .tableName(table.getName())
                    .columnNames(table.getColumnNames())
                    .rows(rows)
                    .build();
        } catch (MongoException e) {
            throw new SamplingException("Error sampling collection " + table.getName(), e);
        }
    }

    /**
     * Flattens a document into dot-notation paths.
     *
     * @param prefix Path of the enclosing document, empty at the root
     * @param document Document to flatten
     * @param target Receives path to leaf value entries
     */
    static void flatten(String prefix, Document document, Map<String, Object> target) {
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            if (entry.getValue() instanceof Document) {
                flatten(path, (Document) entry.getValue(), target);
            } else {
                target.put(path, entry.getValue());
            }
        }
    }

    private static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    @Override
    public void close() {
        log.debug("Closing MongoDB client");
        client.close();
    }
}
