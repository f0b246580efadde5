package io.eventstats.jdbc.store;

import io.eventstats.jdbc.DataSourceConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC aggregate stores with auto-detection support.
 *
 * <p>Aggregate stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.eventstats.jdbc.store.AbstractJdbcAggregateStore}.
 * Stores returned by {@link #all()}, {@link #get(String)} and {@link #detect(String)} are
 * unbound templates; the {@link DataSource} variants return stores ready for use.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect and bind to a DataSource
 * AggregateStore store = JdbcAggregateStores.detect(dataSource);
 *
 * // Same, with a non-default table
 * AggregateStore store = JdbcAggregateStores.detect(dataSource, "checkout_stats");
 *
 * // Get by name, then bind
 * AggregateStore store = JdbcAggregateStores.get("postgresql")
 *     .withConnectionProvider(connectionProvider);
 * }</pre>
 */
public final class JdbcAggregateStores {

    private static final List<AbstractJdbcAggregateStore> STORES;
    private static final Map<String, AbstractJdbcAggregateStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcAggregateStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcAggregateStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(), store);
        }
    }

    private JdbcAggregateStores() {
    }

    /**
     * Returns all registered aggregate stores.
     */
    public static List<AbstractJdbcAggregateStore> all() {
        return STORES;
    }

    /**
     * Gets an aggregate store by name.
     *
     * @param name aggregate store name (case-insensitive)
     * @return the unbound aggregate store
     * @throws IllegalArgumentException if no aggregate store found
     */
    public static AbstractJdbcAggregateStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcAggregateStore store = BY_NAME.get(name.toLowerCase());
        if (store == null) {
            throw new IllegalArgumentException("Unknown aggregate store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the aggregate store for a DataSource and binds it to that DataSource.
     *
     * @param dataSource the data source
     * @return detected aggregate store using the default table
     * @throws IllegalStateException if detection fails or no matching aggregate store
     */
    public static AbstractJdbcAggregateStore detect(DataSource dataSource) {
        return detect(dataSource, AbstractJdbcAggregateStore.DEFAULT_TABLE);
    }

    /**
     * Auto-detects the aggregate store for a DataSource and binds it to that DataSource and table.
     *
     * @param dataSource the data source
     * @param tableName  the aggregate table
     * @return detected aggregate store
     * @throws IllegalStateException if detection fails or no matching aggregate store
     */
    public static AbstractJdbcAggregateStore detect(DataSource dataSource, String tableName) {
        Objects.requireNonNull(dataSource, "dataSource");
        Objects.requireNonNull(tableName, "tableName");
        String url;
        try (Connection conn = dataSource.getConnection()) {
            url = conn.getMetaData().getURL();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect aggregate store from DataSource", e);
        }
        return detect(url)
                .withConnectionProvider(new DataSourceConnectionProvider(dataSource))
                .withTableName(tableName);
    }

    /**
     * Auto-detects aggregate store from a JDBC URL.
     *
     * @param jdbcUrl the JDBC URL
     * @return detected, unbound aggregate store
     * @throws IllegalArgumentException if no matching aggregate store found
     */
    public static AbstractJdbcAggregateStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        for (AbstractJdbcAggregateStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (jdbcUrl.toLowerCase().startsWith(prefix.toLowerCase())) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No aggregate store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
