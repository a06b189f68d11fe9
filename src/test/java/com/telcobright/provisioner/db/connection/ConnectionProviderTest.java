package com.telcobright.provisioner.db.connection;

import com.telcobright.provisioner.core.config.DataSourceConfig;
import com.telcobright.provisioner.core.config.ProvisioningConfig;
import com.telcobright.provisioner.core.header.HeaderDescriptor;
import com.telcobright.provisioner.core.schema.SchemaPlan;
import com.telcobright.provisioner.core.schema.SchemaPlanner;
import com.telcobright.provisioner.db.executor.DdlExecutor;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.pool.HikariPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ConnectionProvider Tests")
class ConnectionProviderTest {

    @ParameterizedTest
    @CsvSource({
        "jdbc:postgresql://localhost:5432/benchmark, jdbc:postgresql://localhost:5432/",
        "jdbc:postgresql://localhost:5432, jdbc:postgresql://localhost:5432/",
        "jdbc:postgresql://localhost:5432/, jdbc:postgresql://localhost:5432/",
        "jdbc:postgresql://db/benchmark?sslmode=disable, jdbc:postgresql://db/?sslmode=disable",
        "jdbc:postgresql://db/?dbname=benchmark&sslmode=disable, jdbc:postgresql://db/?sslmode=disable",
        "jdbc:postgresql://db/?sslmode=disable&dbname=benchmark, jdbc:postgresql://db/?sslmode=disable",
        "jdbc:postgresql://db/x?DATABASE=benchmark, jdbc:postgresql://db/",
        "'jdbc:postgresql://h1:5432,h2:5433/benchmark?targetServerType=primary', 'jdbc:postgresql://h1:5432,h2:5433/?targetServerType=primary'"
    })
    @DisplayName("Should strip the database from the JDBC URL")
    void testStripDatabase(String url, String expected) {
        assertThat(ConnectionProvider.stripDatabase(url)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should insert the target database before the query string")
    void testWithDatabase() {
        assertThat(ConnectionProvider.withDatabase("jdbc:postgresql://db/", "benchmark"))
            .isEqualTo("jdbc:postgresql://db/benchmark");
        assertThat(ConnectionProvider.withDatabase("jdbc:postgresql://db/?sslmode=disable", "benchmark"))
            .isEqualTo("jdbc:postgresql://db/benchmark?sslmode=disable");
    }

    @Test
    @DisplayName("Should derive admin and benchmark URLs from the configuration")
    void testUrls() {
        // Given
        DataSourceConfig config = DataSourceConfig.create(
            "jdbc:postgresql://localhost:5432/postgres?sslmode=disable", "benchmark", "bench", "secret");

        // When
        try (ConnectionProvider provider = new ConnectionProvider(config)) {
            // Then
            assertThat(provider.getAdminUrl()).isEqualTo("jdbc:postgresql://localhost:5432/?sslmode=disable");
            assertThat(provider.getBenchmarkUrl()).isEqualTo("jdbc:postgresql://localhost:5432/benchmark?sslmode=disable");
            assertThat(provider.getDatabase()).isEqualTo("benchmark");

            HikariConfig hikari = provider.createBenchmarkConfig();
            assertThat(hikari.getJdbcUrl()).isEqualTo(provider.getBenchmarkUrl());
            assertThat(hikari.getUsername()).isEqualTo("bench");
            assertThat(hikari.getMaximumPoolSize()).isEqualTo(1);
            assertThat(hikari.getPoolName()).isEqualTo("provisioner-benchmark");
        }
    }

    @Test
    @DisplayName("Should close without ever opening the pool")
    void testCloseUnused() {
        ConnectionProvider provider = new ConnectionProvider(
            DataSourceConfig.create("jdbc:postgresql://localhost:5432/", "benchmark"));

        assertThatCode(provider::close).doesNotThrowAnyException();
        assertThatCode(provider::close).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should report an unreachable benchmark server as SQLException")
    void testBenchmarkConnectionRefused() {
        // Given - nothing listens on port 1
        ConnectionProvider provider = new ConnectionProvider(
            DataSourceConfig.create("jdbc:postgresql://127.0.0.1:1/", "benchmark"));

        // When/Then
        assertThatThrownBy(provider::getBenchmarkConnection)
            .isInstanceOf(SQLException.class)
            .hasMessageContaining("benchmark")
            .hasCauseInstanceOf(HikariPool.PoolInitializationException.class);
        assertThatCode(provider::close).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should surface a refused benchmark connection from DdlExecutor as SQLException")
    void testExecuteAgainstUnreachableServer() {
        ConnectionProvider provider = new ConnectionProvider(
            DataSourceConfig.create("jdbc:postgresql://127.0.0.1:1/", "benchmark"));
        SchemaPlan plan = new SchemaPlanner().plan(
            HeaderDescriptor.fromLines("tags,hostname", "cpu,usage_user"), ProvisioningConfig.defaults());

        assertThatThrownBy(() -> new DdlExecutor(provider).execute(plan))
            .isInstanceOf(SQLException.class);
    }
}
