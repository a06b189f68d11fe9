package com.telcobright.provisioner.db.example;

import com.telcobright.provisioner.core.config.DataSourceConfig;
import com.telcobright.provisioner.core.config.ProvisioningConfig;
import com.telcobright.provisioner.core.exception.SchemaProvisioningException;
import com.telcobright.provisioner.core.header.HeaderParser;
import com.telcobright.provisioner.core.schema.SchemaPlan;
import com.telcobright.provisioner.core.schema.SchemaPlanner;
import com.telcobright.provisioner.db.Provisioner;
import com.telcobright.provisioner.db.connection.ConnectionProvider;
import com.telcobright.provisioner.db.executor.DdlExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Provisions a benchmark schema from a header piped on stdin.
 *
 * <pre>
 * printf 'tags,hostname,region\ncpu,usage_user,usage_system\n\n' | \
 *   java -Dprovisioner.url=jdbc:postgresql://localhost:5432/ -Dprovisioner.db=benchmark \
 *        -Dprovisioner.field-index=time-major -Dprovisioner.field-index-count=-1 \
 *        com.telcobright.provisioner.db.example.ProvisioningExample
 * </pre>
 *
 * Pass {@code -Dprovisioner.dry-run=true} to print the statements without connecting.
 */
public class ProvisioningExample {

    private static final Logger logger = LoggerFactory.getLogger(ProvisioningExample.class);

    private static final String PREFIX = "provisioner.";

    public static void main(String[] args) {
        System.exit(run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))));
    }

    static int run(BufferedReader input) {
        try {
            DataSourceConfig dataSource = DataSourceConfig.create(
                property("url", "jdbc:postgresql://localhost:5432/"),
                property("db", "benchmark"),
                property("user", "postgres"),
                property("pass", ""));
            ProvisioningConfig config = readConfig();
            logger.info("Using {}", config);

            if (Boolean.parseBoolean(property("dry-run", "false"))) {
                SchemaPlan plan = new SchemaPlanner().plan(new HeaderParser().parse(input), config);
                plan.statements().forEach(System.out::println);
                return 0;
            }

            try (ConnectionProvider connections = new ConnectionProvider(dataSource)) {
                Provisioner provisioner = new Provisioner(config, dataSource.getDatabase(),
                    new DdlExecutor(connections));
                SchemaPlan plan = provisioner.provision(input);
                logger.info("Column registry: {}", plan.getRegistry());
            }
            return 0;
        } catch (SchemaProvisioningException | IllegalArgumentException | DateTimeParseException e) {
            logger.error("Invalid input: {}", e.getMessage());
            return 2;
        } catch (SQLException e) {
            logger.error("Provisioning failed", e);
            return 1;
        }
    }

    static ProvisioningConfig readConfig() {
        return ProvisioningConfig.builder()
            .inTableTag(Boolean.parseBoolean(property("in-table-tag", "false")))
            .fieldIndex(property("field-index", "value-major"))
            .fieldIndexCount(Integer.parseInt(property("field-index-count", "0")))
            .partitionIndex(Boolean.parseBoolean(property("partition-index", "true")))
            .timeIndex(Boolean.parseBoolean(property("time-index", "false")))
            .timePartitionIndex(Boolean.parseBoolean(property("time-partition-index", "false")))
            .useHypertable(Boolean.parseBoolean(property("use-hypertable", "true")))
            .numberPartitions(Integer.parseInt(property("number-partitions", "1")))
            .chunkTime(Duration.parse(property("chunk-time", "PT12H")))
            .createDatabase(Boolean.parseBoolean(property("do-create-db", "true")))
            .build();
    }

    private static String property(String name, String defaultValue) {
        return System.getProperty(PREFIX + name, defaultValue);
    }
}
