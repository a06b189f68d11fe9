package com.telcobright.provisioner.db;

import com.telcobright.provisioner.core.config.ProvisioningConfig;
import com.telcobright.provisioner.core.header.HeaderDescriptor;
import com.telcobright.provisioner.core.header.HeaderParser;
import com.telcobright.provisioner.core.schema.SchemaPlan;
import com.telcobright.provisioner.core.schema.SchemaPlanner;
import com.telcobright.provisioner.db.executor.DdlExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.sql.SQLException;

/**
 * One provisioning run: read the header, plan the schema, recreate the database
 * and execute the plan.
 *
 * <p>The reader is left at the first data row and the returned plan carries the
 * column registry the row loader needs.
 */
public class Provisioner {

    private static final Logger logger = LoggerFactory.getLogger(Provisioner.class);

    private final ProvisioningConfig config;
    private final String database;
    private final DdlExecutor executor;
    private final HeaderParser headerParser;
    private final SchemaPlanner schemaPlanner;

    public Provisioner(ProvisioningConfig config, String database, DdlExecutor executor) {
        this(config, database, executor, new HeaderParser(), new SchemaPlanner());
    }

    public Provisioner(ProvisioningConfig config, String database, DdlExecutor executor,
                       HeaderParser headerParser, SchemaPlanner schemaPlanner) {
        this.config = config;
        this.database = database;
        this.executor = executor;
        this.headerParser = headerParser;
        this.schemaPlanner = schemaPlanner;
    }

    /**
     * Parse and plan without touching the database.
     */
    public SchemaPlan plan(BufferedReader reader) {
        HeaderDescriptor header = headerParser.parse(reader);
        logger.info("Read header: {}", header);
        return schemaPlanner.plan(header, config);
    }

    /**
     * @throws com.telcobright.provisioner.core.exception.SchemaProvisioningException
     *         for a malformed header or bad index configuration, before any DDL runs
     * @throws SQLException if any database operation fails; remaining steps are skipped
     */
    public SchemaPlan provision(BufferedReader reader) throws SQLException {
        SchemaPlan plan = plan(reader);

        if (config.isCreateDatabase()) {
            if (executor.databaseExists(database)) {
                logger.info("Database {} already exists, dropping it", database);
                executor.dropDatabaseIfExists(database);
            }
            executor.createDatabase(database);
        }

        executor.execute(plan);
        logger.info("Provisioned {} in {}: tables={}", plan.getHypertable(), database,
            plan.getRegistry().getTables());
        return plan;
    }
}
