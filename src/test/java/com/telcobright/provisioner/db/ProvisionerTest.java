package com.telcobright.provisioner.db;

import com.telcobright.provisioner.core.config.ProvisioningConfig;
import com.telcobright.provisioner.core.exception.HeaderFormatException;
import com.telcobright.provisioner.core.schema.SchemaPlan;
import com.telcobright.provisioner.db.executor.DdlExecutor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Provisioner Tests")
class ProvisionerTest {

    private static final String INPUT =
        "tags,hostname,region\ncpu,usage_user,usage_system\n\ntags,hostname=host_0,region=us-east-1\n";

    @Mock
    private DdlExecutor executor;

    private static BufferedReader input(String content) {
        return new BufferedReader(new StringReader(content));
    }

    @Test
    @DisplayName("Should drop an existing database, recreate it and execute the plan")
    void testProvisionExistingDatabase() throws SQLException {
        // Given
        when(executor.databaseExists("benchmark")).thenReturn(true);
        Provisioner provisioner = new Provisioner(ProvisioningConfig.defaults(), "benchmark", executor);

        // When
        SchemaPlan plan = provisioner.provision(input(INPUT));

        // Then
        InOrder inOrder = inOrder(executor);
        inOrder.verify(executor).databaseExists("benchmark");
        inOrder.verify(executor).dropDatabaseIfExists("benchmark");
        inOrder.verify(executor).createDatabase("benchmark");
        inOrder.verify(executor).execute(plan);
        assertThat(plan.getRegistry().getTables()).containsExactly("tags", "cpu");
    }

    @Test
    @DisplayName("Should not drop a database that does not exist")
    void testProvisionFreshDatabase() throws SQLException {
        when(executor.databaseExists("benchmark")).thenReturn(false);
        Provisioner provisioner = new Provisioner(ProvisioningConfig.defaults(), "benchmark", executor);

        provisioner.provision(input(INPUT));

        verify(executor, never()).dropDatabaseIfExists(any());
        verify(executor).createDatabase("benchmark");
        verify(executor).execute(any(SchemaPlan.class));
    }

    @Test
    @DisplayName("Should reuse the database when creation is disabled")
    void testProvisionWithoutCreate() throws SQLException {
        ProvisioningConfig config = ProvisioningConfig.builder().createDatabase(false).build();
        Provisioner provisioner = new Provisioner(config, "benchmark", executor);

        provisioner.provision(input(INPUT));

        verify(executor).execute(any(SchemaPlan.class));
        verifyNoMoreInteractions(executor);
    }

    @Test
    @DisplayName("Should leave the input at the first data row")
    void testInputPosition() throws SQLException, IOException {
        BufferedReader reader = input(INPUT);
        Provisioner provisioner = new Provisioner(
            ProvisioningConfig.builder().createDatabase(false).build(), "benchmark", executor);

        provisioner.provision(reader);

        assertThat(reader.readLine()).isEqualTo("tags,hostname=host_0,region=us-east-1");
    }

    @Test
    @DisplayName("Should not touch the database for a malformed header")
    void testMalformedHeader() {
        Provisioner provisioner = new Provisioner(ProvisioningConfig.defaults(), "benchmark", executor);

        assertThatThrownBy(() -> provisioner.provision(input("tag,hostname\ncpu,usage_user\n\n")))
            .isInstanceOf(HeaderFormatException.class);
        verifyNoInteractions(executor);
    }

    @Test
    @DisplayName("Should surface DDL failures to the caller")
    void testExecutionFailure() throws SQLException {
        when(executor.databaseExists("benchmark")).thenReturn(false);
        when(executor.execute(any(SchemaPlan.class))).thenThrow(new SQLException("permission denied", "42501"));
        Provisioner provisioner = new Provisioner(ProvisioningConfig.defaults(), "benchmark", executor);

        assertThatThrownBy(() -> provisioner.provision(input(INPUT)))
            .isInstanceOf(SQLException.class)
            .hasMessageContaining("permission denied");
    }

    @Test
    @DisplayName("Should plan without a database")
    void testPlanOnly() {
        Provisioner provisioner = new Provisioner(ProvisioningConfig.defaults(), "benchmark", executor);

        SchemaPlan plan = provisioner.plan(input(INPUT));

        assertThat(plan.getHypertable()).isEqualTo("cpu");
        verifyNoInteractions(executor);
    }
}
