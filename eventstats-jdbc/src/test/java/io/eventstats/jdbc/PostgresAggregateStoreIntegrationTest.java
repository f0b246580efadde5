package io.eventstats.jdbc;

import io.eventstats.jdbc.store.AbstractJdbcAggregateStore;
import io.eventstats.jdbc.store.PostgresAggregateStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class PostgresAggregateStoreIntegrationTest extends AbstractAggregateStoreIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("eventstats_test");

    private static final PostgresAggregateStore STORE = new PostgresAggregateStore();
    private static SimpleDataSource dataSource;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        applySchema(dataSource, "postgresql");
    }

    @BeforeEach
    void truncate() throws Exception {
        clear(dataSource);
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcAggregateStore template() {
        return STORE;
    }
}
