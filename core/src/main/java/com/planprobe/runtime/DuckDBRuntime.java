package com.planprobe.runtime;

import com.planprobe.config.ExecutionOptions;
import com.planprobe.exception.ConfigException;
import org.duckdb.DuckDBConnection;
import org.duckdb.DuckDBDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * DuckDB runtime - owns one isolated in-memory DuckDB database.
 *
 * <p>The root connection holds the catalog (registered views). Every pipeline
 * stage works on its own connection obtained from {@link #openConnection()},
 * a duplicate of the root connection with the same settings applied, so stages
 * share relations but never statement or result state.
 *
 * <p>Test usage:
 * <pre>{@code
 * @BeforeEach
 * void setup() {
 *     runtime = DuckDBRuntime.create(ExecutionOptions.defaults());
 * }
 *
 * @AfterEach
 * void teardown() {
 *     runtime.close();
 * }
 * }</pre>
 */
public class DuckDBRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBRuntime.class);

    /** Anonymous in-memory database; every runtime gets its own instance. */
    public static final String IN_MEMORY_JDBC_URL = "jdbc:duckdb:";

    private final String jdbcUrl;
    private final ExecutionOptions options;
    private final List<String> settings;
    private final DuckDBConnection connection;
    private volatile boolean closed = false;

    private DuckDBRuntime(String jdbcUrl, ExecutionOptions options) throws SQLException {
        this.jdbcUrl = jdbcUrl;
        this.options = options;
        this.settings = options.engineSettings();

        logger.info("Creating DuckDB runtime with URL: {}", jdbcUrl);

        // Streaming results let the Arrow export read batches as the engine produces them
        Properties props = new Properties();
        props.setProperty(DuckDBDriver.JDBC_STREAM_RESULTS, "true");

        Connection rawConn = DriverManager.getConnection(jdbcUrl, props);
        this.connection = rawConn.unwrap(DuckDBConnection.class);
        try {
            configureConnection(connection);
        } catch (SQLException | ConfigException e) {
            connection.close();
            throw e;
        }

        logger.info("DuckDB runtime initialized with settings {}", settings);
    }

    /**
     * Create a runtime over a fresh in-memory database.
     *
     * @param options validated execution options
     * @return new DuckDBRuntime instance
     * @throws ConfigException if the engine rejects an option setting
     * @throws IllegalStateException if the engine rejects the connection
     */
    public static DuckDBRuntime create(ExecutionOptions options) {
        return create(IN_MEMORY_JDBC_URL, options);
    }

    /**
     * Create a runtime with a custom JDBC URL.
     *
     * @param jdbcUrl JDBC URL (e.g., "jdbc:duckdb:/tmp/probe.duckdb")
     * @param options validated execution options
     * @return new DuckDBRuntime instance
     * @throws ConfigException if the engine rejects an option setting
     * @throws IllegalStateException if the engine rejects the connection
     */
    public static DuckDBRuntime create(String jdbcUrl, ExecutionOptions options) {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null");
        Objects.requireNonNull(options, "options must not be null");
        try {
            return new DuckDBRuntime(jdbcUrl, options);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create DuckDB runtime: " + e.getMessage(), e);
        }
    }

    /**
     * Apply probe defaults and the option settings to a connection.
     *
     * <p>{@code explain_output='all'} makes EXPLAIN return the unoptimized logical,
     * optimized logical and physical plans together.
     */
    private void configureConnection(DuckDBConnection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("SET enable_progress_bar=false");
            stmt.execute("SET preserve_insertion_order=true");
            stmt.execute("SET explain_output='all'");
        }
        applySettings(conn, settings);
    }

    /**
     * Apply option statements to a connection.
     *
     * @throws ConfigException with {@code ENGINE_REJECTED} naming the option the engine refused
     */
    static void applySettings(DuckDBConnection conn, List<String> settings) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String setting : settings) {
                try {
                    stmt.execute(setting);
                } catch (SQLException e) {
                    throw ConfigException.engineRejected(ExecutionOptions.optionForSetting(setting), setting, e);
                }
            }
        }
    }

    /**
     * Get the root connection that owns the catalog.
     *
     * <p>The connection is managed by the runtime - callers should NOT close it.
     *
     * @return the DuckDB connection
     * @throws IllegalStateException if runtime is closed
     */
    public DuckDBConnection getConnection() {
        if (closed) {
            throw new IllegalStateException("DuckDB runtime is closed");
        }
        return connection;
    }

    /**
     * Open a configured connection to the same database for one stage.
     *
     * <p>The caller owns the returned connection and must close it.
     *
     * @return a new connection sharing this runtime's catalog
     * @throws SQLException if the connection cannot be opened or configured
     */
    public DuckDBConnection openConnection() throws SQLException {
        Connection duplicate = getConnection().duplicate();
        DuckDBConnection conn = duplicate.unwrap(DuckDBConnection.class);
        try {
            configureConnection(conn);
        } catch (SQLException | ConfigException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    public ExecutionOptions getOptions() {
        return options;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Close the runtime and release the database.
     *
     * <p>After closing, the runtime cannot be used. Closing twice has no effect.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        logger.info("Closing DuckDB runtime: {}", jdbcUrl);
        try {
            connection.close();
        } catch (SQLException e) {
            logger.error("Error closing DuckDB connection", e);
        }
    }
}
