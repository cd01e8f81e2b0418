package edustats.oecd.pipeline.service;

import edustats.oecd.pipeline.exception.StoreException;
import edustats.oecd.pipeline.model.DatasetKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Declares the four pipeline tables and creates the missing ones.
 *
 * Existing tables are never altered. There is no migration support: if a
 * table exists with an older layout, it has to be fixed outside the pipeline.
 */
@Service
public class SchemaManager {

    private static final Logger logger = LoggerFactory.getLogger(SchemaManager.class);

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TableNamingService tableNamingService;

    public SchemaManager(DataSource dataSource, JdbcTemplate jdbcTemplate, TableNamingService tableNamingService) {
        this.dataSource = dataSource;
        this.jdbcTemplate = jdbcTemplate;
        this.tableNamingService = tableNamingService;
    }

    /**
     * Create every pipeline table that does not exist yet. Safe to call
     * repeatedly.
     *
     * @throws StoreException if a table cannot be created
     */
    public void ensureSchema() {
        logger.info("========================================");
        logger.info("SCHEMA CHECK - Starting");
        logger.info("========================================");

        String enrollment = tableNamingService.factTable(DatasetKind.ENROLLMENT);
        String graduation = tableNamingService.factTable(DatasetKind.GRADUATION);
        String spending = tableNamingService.factTable(DatasetKind.SPENDING);
        String countries = tableNamingService.countryTable();

        ensureTable(enrollment, enrollmentDdl(enrollment));
        ensureTable(graduation, graduationDdl(graduation));
        ensureTable(spending, spendingDdl(spending));
        ensureTable(countries, countryDdl(countries));

        logger.info("SCHEMA CHECK - COMPLETED");
    }

    /**
     * Check if a table exists in the connection's current schema, regardless
     * of how the database folds identifier case. Tables of the same name in
     * other schemas do not count: unqualified DDL and DML resolve against the
     * current schema only.
     */
    public boolean tableExists(String tableName) {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String schema = connection.getSchema();
            return hasTable(metaData, schema, tableName.toLowerCase(Locale.ROOT))
                    || hasTable(metaData, schema, tableName.toUpperCase(Locale.ROOT));
        } catch (SQLException e) {
            throw new StoreException(tableName, "Error checking existence of table " + tableName, e);
        }
    }

    private boolean hasTable(DatabaseMetaData metaData, String schema, String tableName) throws SQLException {
        try (ResultSet tables = metaData.getTables(null, schema, tableName, new String[] { "TABLE" })) {
            return tables.next();
        }
    }

    private void ensureTable(String tableName, String ddl) {
        if (tableExists(tableName)) {
            logger.info("[OK] Table '{}' exists", tableName);
            return;
        }

        logger.info("Table '{}' does not exist, creating it", tableName);
        try {
            jdbcTemplate.execute(ddl);
        } catch (DataAccessException e) {
            logger.error("[FAILED] Could not create table '{}': {}", tableName, e.getMessage());
            throw new StoreException(tableName, "Failed to create table " + tableName, e);
        }
        logger.info("[CREATED] Table '{}'", tableName);
    }

    String enrollmentDdl(String tableName) {
        return """
                CREATE TABLE IF NOT EXISTS %s (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    country_code VARCHAR(3) NOT NULL,
                    country_name VARCHAR(100),
                    year INTEGER NOT NULL,
                    enrollment_rate DOUBLE PRECISION,
                    education_level VARCHAR(50),
                    gender VARCHAR(20),
                    data_source VARCHAR(50),
                    extraction_date DATE,
                    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                )
                """.formatted(tableName);
    }

    String graduationDdl(String tableName) {
        return """
                CREATE TABLE IF NOT EXISTS %s (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    country_code VARCHAR(3) NOT NULL,
                    country_name VARCHAR(100),
                    year INTEGER NOT NULL,
                    graduation_rate DOUBLE PRECISION,
                    completion_rate DOUBLE PRECISION,
                    education_level VARCHAR(50),
                    data_source VARCHAR(50),
                    extraction_date DATE,
                    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                )
                """.formatted(tableName);
    }

    String spendingDdl(String tableName) {
        return """
                CREATE TABLE IF NOT EXISTS %s (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    country_code VARCHAR(3) NOT NULL,
                    country_name VARCHAR(100),
                    year INTEGER NOT NULL,
                    spending_usd DOUBLE PRECISION,
                    spending_per_capita DOUBLE PRECISION,
                    spending_percent_gdp DOUBLE PRECISION,
                    currency VARCHAR(3),
                    education_level VARCHAR(50),
                    data_source VARCHAR(50),
                    extraction_date DATE,
                    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                )
                """.formatted(tableName);
    }

    String countryDdl(String tableName) {
        return """
                CREATE TABLE IF NOT EXISTS %s (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    country_code VARCHAR(3) NOT NULL UNIQUE,
                    country_name VARCHAR(100) UNIQUE,
                    region VARCHAR(50),
                    income_group VARCHAR(50),
                    population BIGINT,
                    gdp_per_capita DOUBLE PRECISION,
                    data_available BOOLEAN,
                    last_updated DATE,
                    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                )
                """.formatted(tableName);
    }
}
