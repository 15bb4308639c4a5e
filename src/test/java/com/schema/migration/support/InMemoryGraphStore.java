package com.schema.migration.support;

import com.schema.migration.graph.GraphConnection;
import com.schema.migration.graph.GraphStoreException;
import com.schema.migration.graph.GraphTransaction;
import com.schema.migration.graph.QueryRow;
import com.schema.migration.graph.TransactionType;
import com.schema.migration.schema.EntitySpec;
import com.schema.migration.schema.OwnsSpec;
import com.schema.migration.schema.SchemaModel;
import com.schema.migration.schema.SchemaRenderer;
import com.schema.migration.schema.TypeQlSchemaParser;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * In-memory store understanding the subset of TypeQL the library emits: {@code define}
 * and label {@code undefine} statements, single-variable {@code insert}s and
 * {@code match} queries ending in {@code fetch}, {@code reduce ... count} or {@code delete}.
 *
 * <p>Transactions work on a copy of the database that replaces the committed state on
 * commit. {@code @key} uniqueness is enforced on insert. Statements containing
 * {@code INVALID}, or matching a predicate set with {@link #failWhen}, are rejected.</p>
 */
public class InMemoryGraphStore {

    private static final String VALUE = "(\"(?:[^\"\\\\]|\\\\.)*\"|[^,;\\s]+)";
    private static final String HAS_CLAUSES = "((?:\\s*,\\s*has\\s+[\\w-]+\\s+" + VALUE + ")*)";
    private static final Pattern HAS = Pattern.compile("has\\s+([\\w-]+)\\s+" + VALUE);
    private static final Pattern INSERT = Pattern.compile(
            "(?s)insert\\s+\\$(\\w+)\\s+isa\\s+([\\w-]+)" + HAS_CLAUSES + "\\s*;\\s*");
    private static final Pattern MATCH = Pattern.compile(
            "(?s)match\\s+\\$(\\w+)\\s+isa\\s+([\\w-]+)" + HAS_CLAUSES + "\\s*;\\s*(.*)");
    private static final Pattern REDUCE_COUNT = Pattern.compile(
            "(?s)reduce\\s+\\$(\\w+)\\s*=\\s*count\\(\\s*\\$\\w+\\s*\\)\\s*;\\s*");
    private static final Pattern FETCH = Pattern.compile("(?s)fetch\\s*\\{(.*)}\\s*;\\s*");
    private static final Pattern FETCH_ENTRY = Pattern.compile("\"([^\"]+)\"\\s*:\\s*\\$\\w+\\.([\\w-]+)");
    private static final Pattern DELETE = Pattern.compile("(?s)delete\\s+\\$\\w+\\s*;\\s*");
    private static final Pattern DATETIME = Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?");

    private final TypeQlSchemaParser parser = new TypeQlSchemaParser();
    private final Map<String, DatabaseState> databases = new LinkedHashMap<>();
    private final List<String> executed = new CopyOnWriteArrayList<>();
    private final AtomicInteger openConnections = new AtomicInteger();
    private final AtomicInteger createdConnections = new AtomicInteger();
    private volatile Predicate<String> failWhen = statement -> false;

    /**
     * Creates a store holding one empty database.
     */
    public static InMemoryGraphStore withDatabase(String name) {
        InMemoryGraphStore store = new InMemoryGraphStore();
        store.createDatabase(name);
        return store;
    }

    public InMemoryConnection connect() {
        createdConnections.incrementAndGet();
        openConnections.incrementAndGet();
        return new InMemoryConnection();
    }

    public synchronized void createDatabase(String name) {
        databases.putIfAbsent(name, new DatabaseState(SchemaModel.empty(), new ArrayList<>()));
    }

    /**
     * Rejects every statement matching the predicate.
     */
    public void failWhen(Predicate<String> predicate) {
        this.failWhen = predicate;
    }

    public synchronized SchemaModel schemaModel(String database) {
        return state(database).schema();
    }

    /**
     * Committed and uncommitted statements in execution order.
     */
    public List<String> executedStatements() {
        return List.copyOf(executed);
    }

    public void clearExecuted() {
        executed.clear();
    }

    /**
     * Stored instances of a type, as attribute maps.
     */
    public synchronized List<Map<String, List<Object>>> instances(String database, String type) {
        return state(database).instances().stream()
                .filter(i -> i.type().equals(type))
                .map(Instance::attributes)
                .collect(Collectors.toList());
    }

    public int openConnections() {
        return openConnections.get();
    }

    public int createdConnections() {
        return createdConnections.get();
    }

    private DatabaseState state(String database) {
        DatabaseState state = databases.get(database);
        if (state == null) {
            throw new GraphStoreException("Database '" + database + "' does not exist");
        }
        return state;
    }

    private synchronized DatabaseState snapshot(String database) {
        return state(database).copy();
    }

    private synchronized void commit(String database, DatabaseState state) {
        state(database);
        databases.put(database, state);
    }

    // --- statement execution ---

    private List<QueryRow> execute(DatabaseState state, TransactionType type, String statement) {
        executed.add(statement);
        if (statement.contains("INVALID") || failWhen.test(statement)) {
            throw new GraphStoreException("Statement rejected: " + statement);
        }
        String trimmed = statement.strip();
        TransactionType required = TransactionType.infer(trimmed);
        if (required == TransactionType.SCHEMA) {
            if (type != TransactionType.SCHEMA) {
                throw new GraphStoreException("Schema statement requires a schema transaction");
            }
            if (trimmed.startsWith("define")) {
                state.schema = parser.apply(state.schema, trimmed);
            } else if (trimmed.startsWith("undefine")) {
                state.schema = undefine(state.schema, trimmed);
            } else {
                throw new GraphStoreException("Unsupported schema statement: " + trimmed);
            }
            return List.of();
        }
        if (trimmed.startsWith("insert")) {
            requireWritable(type);
            insert(state, trimmed);
            return List.of();
        }
        if (trimmed.startsWith("match")) {
            return match(state, type, trimmed);
        }
        throw new GraphStoreException("Unsupported statement: " + trimmed);
    }

    private static SchemaModel undefine(SchemaModel schema, String statement) {
        List<String> labels = Arrays.stream(statement.substring("undefine".length()).split(";"))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        for (String label : labels) {
            if (!label.matches("[\\w-]+")) {
                throw new GraphStoreException("Unsupported undefine clause: " + label);
            }
            if (schema.attribute(label).isEmpty() && !schema.typeNames().contains(label)) {
                throw new GraphStoreException("Cannot undefine unknown type '" + label + "'");
            }
        }
        return schema.without(labels);
    }

    private static void requireWritable(TransactionType type) {
        if (type == TransactionType.READ) {
            throw new GraphStoreException("Write statement in a read transaction");
        }
    }

    private static void insert(DatabaseState state, String statement) {
        Matcher m = INSERT.matcher(statement);
        if (!m.matches()) {
            throw new GraphStoreException("Unsupported insert: " + statement);
        }
        String type = m.group(2);
        EntitySpec entity = state.schema.entity(type)
                .orElseThrow(() -> new GraphStoreException("Unknown entity type '" + type + "'"));
        Map<String, List<Object>> attributes = hasClauses(m.group(3));
        for (String attribute : attributes.keySet()) {
            if (entity.ownsClause(attribute).isEmpty()) {
                throw new GraphStoreException("Type '" + type + "' does not own '" + attribute + "'");
            }
        }
        for (OwnsSpec clause : entity.owns()) {
            if (!clause.key()) {
                continue;
            }
            List<Object> value = attributes.get(clause.attribute());
            boolean taken = state.instances.stream().anyMatch(i -> i.type().equals(type)
                    && value != null && value.equals(i.attributes().get(clause.attribute())));
            if (taken) {
                throw new GraphStoreException("Key constraint violated: " + type + "." + clause.attribute()
                        + " = " + value);
            }
        }
        state.instances.add(new Instance(type, attributes));
    }

    private static List<QueryRow> match(DatabaseState state, TransactionType type, String statement) {
        Matcher m = MATCH.matcher(statement);
        if (!m.matches()) {
            throw new GraphStoreException("Unsupported match: " + statement);
        }
        String typeName = m.group(2);
        if (state.schema.entity(typeName).isEmpty() && state.schema.relation(typeName).isEmpty()) {
            throw new GraphStoreException("Unknown type '" + typeName + "'");
        }
        Map<String, List<Object>> filters = hasClauses(m.group(3));
        List<Instance> matched = state.instances.stream()
                .filter(i -> i.type().equals(typeName))
                .filter(i -> filters.entrySet().stream()
                        .allMatch(f -> i.attributes().getOrDefault(f.getKey(), List.of()).containsAll(f.getValue())))
                .collect(Collectors.toList());
        String tail = m.group(5);

        Matcher reduce = REDUCE_COUNT.matcher(tail);
        if (reduce.matches()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(reduce.group(1), (long) matched.size());
            return List.of(QueryRow.of(row));
        }
        Matcher fetch = FETCH.matcher(tail);
        if (fetch.matches()) {
            Matcher entry = FETCH_ENTRY.matcher(fetch.group(1));
            Map<String, String> columns = new LinkedHashMap<>();
            while (entry.find()) {
                columns.put(entry.group(1), entry.group(2));
            }
            List<QueryRow> rows = new ArrayList<>();
            for (Instance instance : matched) {
                Map<String, Object> row = new LinkedHashMap<>();
                columns.forEach((column, attribute) -> {
                    List<Object> values = instance.attributes().get(attribute);
                    if (values != null && !values.isEmpty()) {
                        row.put(column, values.get(0));
                    }
                });
                rows.add(QueryRow.of(row));
            }
            return rows;
        }
        if (DELETE.matcher(tail).matches()) {
            requireWritable(type);
            state.instances.removeAll(matched);
            return List.of();
        }
        throw new GraphStoreException("Unsupported match tail: " + tail);
    }

    private static Map<String, List<Object>> hasClauses(String text) {
        Map<String, List<Object>> attributes = new LinkedHashMap<>();
        Matcher has = HAS.matcher(text);
        while (has.find()) {
            attributes.computeIfAbsent(has.group(1), k -> new ArrayList<>()).add(literal(has.group(2)));
        }
        return attributes;
    }

    private static Object literal(String text) {
        if (text.startsWith("\"")) {
            return text.substring(1, text.length() - 1).replace("\\\"", "\"").replace("\\\\", "\\");
        }
        if (DATETIME.matcher(text).matches()) {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        }
        if (text.equals("true") || text.equals("false")) {
            return Boolean.parseBoolean(text);
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException inner) {
                throw new GraphStoreException("Unsupported literal: " + text);
            }
        }
    }

    // --- state ---

    private record Instance(String type, Map<String, List<Object>> attributes) {
        Instance {
            Map<String, List<Object>> copy = new LinkedHashMap<>();
            attributes.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            attributes = Collections.unmodifiableMap(copy);
        }
    }

    private static final class DatabaseState {
        private SchemaModel schema;
        private final List<Instance> instances;

        private DatabaseState(SchemaModel schema, List<Instance> instances) {
            this.schema = schema;
            this.instances = instances;
        }

        private DatabaseState copy() {
            return new DatabaseState(schema, new ArrayList<>(instances));
        }

        private SchemaModel schema() {
            return schema;
        }

        private List<Instance> instances() {
            return instances;
        }
    }

    /**
     * A connection to the store. Transactions opened on it see committed state only.
     */
    public final class InMemoryConnection implements GraphConnection {
        private volatile boolean open = true;

        @Override
        public GraphTransaction transaction(String database, TransactionType type) {
            requireOpen();
            return new InMemoryTransaction(database, type, snapshot(database));
        }

        @Override
        public String schema(String database) {
            requireOpen();
            synchronized (InMemoryGraphStore.this) {
                return SchemaRenderer.render(state(database).schema());
            }
        }

        @Override
        public void createDatabase(String name) {
            requireOpen();
            InMemoryGraphStore.this.createDatabase(name);
        }

        @Override
        public void deleteDatabase(String name) {
            requireOpen();
            synchronized (InMemoryGraphStore.this) {
                databases.remove(name);
            }
        }

        @Override
        public boolean containsDatabase(String name) {
            requireOpen();
            synchronized (InMemoryGraphStore.this) {
                return databases.containsKey(name);
            }
        }

        @Override
        public List<String> databases() {
            requireOpen();
            synchronized (InMemoryGraphStore.this) {
                return List.copyOf(databases.keySet());
            }
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        /**
         * Marks the connection broken without closing it.
         */
        public void breakConnection() {
            open = false;
        }

        @Override
        public void close() {
            if (open) {
                open = false;
            }
            openConnections.decrementAndGet();
        }

        private void requireOpen() {
            if (!open) {
                throw new GraphStoreException("Connection is closed");
            }
        }
    }

    private final class InMemoryTransaction implements GraphTransaction {
        private final String database;
        private final TransactionType type;
        private final DatabaseState state;
        private boolean open = true;

        private InMemoryTransaction(String database, TransactionType type, DatabaseState state) {
            this.database = database;
            this.type = type;
            this.state = state;
        }

        @Override
        public List<QueryRow> query(String statement) {
            if (!open) {
                throw new GraphStoreException("Transaction is closed");
            }
            return execute(state, type, statement);
        }

        @Override
        public void commit() {
            if (!open) {
                throw new GraphStoreException("Transaction is closed");
            }
            open = false;
            if (type != TransactionType.READ) {
                InMemoryGraphStore.this.commit(database, state);
            }
        }

        @Override
        public void rollback() {
            open = false;
        }

        @Override
        public void close() {
            open = false;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public TransactionType type() {
            return type;
        }
    }

    /**
     * Looks up the stored value of one attribute of the first instance matching a key.
     */
    public synchronized Optional<Object> value(String database, String type, String keyAttribute, Object key,
                                               String attribute) {
        return state(database).instances().stream()
                .filter(i -> i.type().equals(type))
                .filter(i -> i.attributes().getOrDefault(keyAttribute, List.of()).contains(key))
                .map(i -> i.attributes().getOrDefault(attribute, List.of()))
                .filter(values -> !values.isEmpty())
                .map(values -> values.get(0))
                .findFirst();
    }
}
