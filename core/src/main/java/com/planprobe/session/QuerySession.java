package com.planprobe.session;

import com.planprobe.config.ExecutionOptions;
import com.planprobe.exception.RegistrationException;
import com.planprobe.runtime.DuckDBRuntime;
import com.planprobe.runtime.SqlQuoting;
import com.planprobe.source.RelationSource;
import com.planprobe.source.SourceDescriptor;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * An explicitly constructed engine session with named relation bindings.
 *
 * <p>Each session owns its own {@link DuckDBRuntime} (an isolated in-memory
 * database configured from the session's {@link ExecutionOptions}). Relations
 * are bound once through {@link #register}; bindings are never replaced or
 * dropped while the session is open, so stages may read a session from
 * several threads without synchronization.
 *
 * <p>Example usage:
 * <pre>
 *   try (QuerySession session = QuerySession.create(options)) {
 *       session.register("runs", new ParquetSource("data/runs.parquet"));
 *       LogicalPlan plan = compiler.compile(session, "SELECT * FROM runs");
 *   }
 * </pre>
 */
public class QuerySession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QuerySession.class);

    private static final Pattern RELATION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final DuckDBRuntime runtime;
    private final ExecutionOptions options;
    private final Map<String, RelationBinding> bindings = new ConcurrentHashMap<>();
    private final List<String> registrationOrder = Collections.synchronizedList(new ArrayList<>());

    QuerySession(DuckDBRuntime runtime) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        this.options = runtime.getOptions();
    }

    /**
     * Create a session over a fresh in-memory database.
     *
     * @param options validated execution options
     * @return the new session
     */
    public static QuerySession create(ExecutionOptions options) {
        return new QuerySession(DuckDBRuntime.create(options));
    }

    /**
     * Bind a name to an external source.
     *
     * <p>Names are case-insensitive, matching the engine's identifier rules.
     * Registration reads the source's schema and statistics and defines a
     * view over it; it does not depend on option values.
     *
     * @param name relation name, a plain SQL identifier
     * @param source the external source
     * @return the new binding
     * @throws RegistrationException with {@code DUPLICATE_NAME} if the name is taken
     *         (the existing binding is untouched), {@code INVALID_NAME} if the name is
     *         not a plain identifier, or {@code SOURCE_UNAVAILABLE} if the source cannot be read
     */
    public synchronized RelationBinding register(String name, RelationSource source) {
        Objects.requireNonNull(source, "source must not be null");
        if (name == null || !RELATION_NAME.matcher(name).matches()) {
            throw new RegistrationException(RegistrationException.Kind.INVALID_NAME, name,
                "Relation name must be a plain identifier: " + name);
        }
        String key = name.toLowerCase(Locale.ROOT);
        if (bindings.containsKey(key)) {
            throw new RegistrationException(RegistrationException.Kind.DUPLICATE_NAME, name,
                "Relation '" + name + "' is already registered to " + bindings.get(key).source().location());
        }

        DuckDBConnection conn = runtime.getConnection();
        SourceDescriptor descriptor;
        try {
            descriptor = source.open(conn);
        } catch (SQLException e) {
            throw new RegistrationException(RegistrationException.Kind.SOURCE_UNAVAILABLE, name,
                "Cannot open " + source.location() + ": " + e.getMessage(), e);
        }

        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE VIEW " + SqlQuoting.quoteIdentifier(name) + " AS SELECT * FROM "
                + source.scanExpression());
        } catch (SQLException e) {
            throw new RegistrationException(RegistrationException.Kind.SOURCE_UNAVAILABLE, name,
                "Cannot bind " + source.location() + ": " + e.getMessage(), e);
        }

        RelationBinding binding = new RelationBinding(name, source, descriptor.schema(), descriptor.statistics());
        bindings.put(key, binding);
        registrationOrder.add(key);

        logger.info("Registered relation '{}' -> {} ({} columns, {} rows in {} row groups)",
            name, source.location(), descriptor.schema().size(),
            descriptor.statistics().rowCount(), descriptor.statistics().rowGroupCount());
        return binding;
    }

    /**
     * Look up a binding by name (case-insensitive).
     *
     * @param name relation name
     * @return the binding, or empty if not registered
     */
    public Optional<RelationBinding> binding(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bindings.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * All bindings in registration order.
     *
     * @return unmodifiable list of bindings
     */
    public List<RelationBinding> bindings() {
        synchronized (registrationOrder) {
            return registrationOrder.stream().map(bindings::get).toList();
        }
    }

    public ExecutionOptions options() {
        return options;
    }

    /**
     * Open a configured connection for one pipeline stage.
     *
     * <p>The caller owns the connection and must close it.
     *
     * @return a connection sharing this session's relations
     * @throws SQLException if the connection cannot be opened
     */
    public DuckDBConnection openConnection() throws SQLException {
        return runtime.openConnection();
    }

    public boolean isClosed() {
        return runtime.isClosed();
    }

    /**
     * Tear the session down, dropping the database and all bindings. Idempotent.
     */
    @Override
    public void close() {
        runtime.close();
    }
}
