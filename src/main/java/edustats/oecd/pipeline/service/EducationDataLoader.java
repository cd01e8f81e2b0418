package edustats.oecd.pipeline.service;

import edustats.oecd.pipeline.config.PipelineConfig;
import edustats.oecd.pipeline.exception.StoreException;
import edustats.oecd.pipeline.model.CountryMetadata;
import edustats.oecd.pipeline.model.DatasetKind;
import edustats.oecd.pipeline.model.EnrollmentRecord;
import edustats.oecd.pipeline.model.GraduationRecord;
import edustats.oecd.pipeline.model.SpendingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ParameterizedPreparedStatementSetter;
import org.springframework.stereotype.Service;

import java.sql.Date;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Writes cleaned records into the store.
 *
 * Fact tables are append-only: every call inserts every record, without
 * looking for existing rows, so loading the same batch twice doubles it.
 * Batches are not wrapped in a transaction; rows written before a failure
 * stay written.
 *
 * The country table is the only one with update semantics: rows are
 * matched on country_code and overwritten, or inserted when absent.
 */
@Service
public class EducationDataLoader {

    private static final Logger logger = LoggerFactory.getLogger(EducationDataLoader.class);

    private final JdbcTemplate jdbcTemplate;
    private final TableNamingService tableNamingService;
    private final PipelineConfig config;
    private final Clock clock;

    public EducationDataLoader(JdbcTemplate jdbcTemplate, TableNamingService tableNamingService,
                               PipelineConfig config, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.tableNamingService = tableNamingService;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Append enrollment rows.
     *
     * @return number of rows written
     * @throws StoreException if the insert fails
     */
    public int appendEnrollment(List<EnrollmentRecord> records) {
        String table = tableNamingService.factTable(DatasetKind.ENROLLMENT);
        String sql = "INSERT INTO " + table + " (country_code, country_name, year, enrollment_rate, "
                + "education_level, gender, data_source, extraction_date, created_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        Timestamp createdAt = now();

        return append(DatasetKind.ENROLLMENT, table, sql, records, (ps, record) -> {
            ps.setString(1, record.getCountryCode());
            ps.setString(2, record.getCountryName());
            ps.setInt(3, record.getYear());
            ps.setDouble(4, record.getEnrollmentRate());
            ps.setString(5, record.getEducationLevel());
            ps.setString(6, record.getGender());
            ps.setString(7, record.getDataSource());
            ps.setDate(8, toSqlDate(record.getExtractionDate()));
            ps.setTimestamp(9, createdAt);
        });
    }

    /**
     * Append graduation rows.
     *
     * @return number of rows written
     * @throws StoreException if the insert fails
     */
    public int appendGraduation(List<GraduationRecord> records) {
        String table = tableNamingService.factTable(DatasetKind.GRADUATION);
        String sql = "INSERT INTO " + table + " (country_code, country_name, year, graduation_rate, "
                + "completion_rate, education_level, data_source, extraction_date, created_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        Timestamp createdAt = now();

        return append(DatasetKind.GRADUATION, table, sql, records, (ps, record) -> {
            ps.setString(1, record.getCountryCode());
            ps.setString(2, record.getCountryName());
            ps.setInt(3, record.getYear());
            ps.setDouble(4, record.getGraduationRate());
            ps.setDouble(5, record.getCompletionRate());
            ps.setString(6, record.getEducationLevel());
            ps.setString(7, record.getDataSource());
            ps.setDate(8, toSqlDate(record.getExtractionDate()));
            ps.setTimestamp(9, createdAt);
        });
    }

    /**
     * Append spending rows.
     *
     * @return number of rows written
     * @throws StoreException if the insert fails
     */
    public int appendSpending(List<SpendingRecord> records) {
        String table = tableNamingService.factTable(DatasetKind.SPENDING);
        String sql = "INSERT INTO " + table + " (country_code, country_name, year, spending_usd, "
                + "spending_per_capita, spending_percent_gdp, currency, education_level, data_source, "
                + "extraction_date, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        Timestamp createdAt = now();

        return append(DatasetKind.SPENDING, table, sql, records, (ps, record) -> {
            ps.setString(1, record.getCountryCode());
            ps.setString(2, record.getCountryName());
            ps.setInt(3, record.getYear());
            ps.setDouble(4, record.getSpendingUsd());
            ps.setDouble(5, record.getSpendingPerCapita());
            if (record.getSpendingPercentGdp() == null) {
                ps.setNull(6, Types.DOUBLE);
            } else {
                ps.setDouble(6, record.getSpendingPercentGdp());
            }
            ps.setString(7, record.getCurrency());
            ps.setString(8, record.getEducationLevel());
            ps.setString(9, record.getDataSource());
            ps.setDate(10, toSqlDate(record.getExtractionDate()));
            ps.setTimestamp(11, createdAt);
        });
    }

    /**
     * Insert or update country rows keyed by country_code. Every mutable
     * column of an existing row is overwritten by the incoming values.
     *
     * @return number of rows inserted or updated
     * @throws StoreException if a statement fails
     */
    public int upsertCountries(List<CountryMetadata> records) {
        String table = tableNamingService.countryTable();
        logger.info("Loading country metadata: {} records", records.size());

        String updateSql = "UPDATE " + table + " SET country_name = ?, region = ?, income_group = ?, "
                + "population = ?, gdp_per_capita = ?, data_available = ?, last_updated = ? "
                + "WHERE country_code = ?";
        String insertSql = "INSERT INTO " + table + " (country_name, region, income_group, population, "
                + "gdp_per_capita, data_available, last_updated, country_code, created_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

        int inserted = 0;
        int updated = 0;
        try {
            for (CountryMetadata record : records) {
                Object[] values = {
                        record.getCountryName(),
                        record.getRegion(),
                        record.getIncomeGroup(),
                        record.getPopulation(),
                        record.getGdpPerCapita(),
                        record.isDataAvailable(),
                        toSqlDate(record.getLastUpdated()),
                        record.getCountryCode()
                };
                int[] types = {
                        Types.VARCHAR, Types.VARCHAR, Types.VARCHAR, Types.BIGINT,
                        Types.DOUBLE, Types.BOOLEAN, Types.DATE, Types.VARCHAR
                };

                if (jdbcTemplate.update(updateSql, values, types) > 0) {
                    updated++;
                    continue;
                }

                Object[] insertValues = new Object[values.length + 1];
                System.arraycopy(values, 0, insertValues, 0, values.length);
                insertValues[values.length] = now();
                int[] insertTypes = new int[types.length + 1];
                System.arraycopy(types, 0, insertTypes, 0, types.length);
                insertTypes[types.length] = Types.TIMESTAMP;

                jdbcTemplate.update(insertSql, insertValues, insertTypes);
                inserted++;
            }
        } catch (DataAccessException e) {
            logger.error("Error loading country metadata after {} inserts and {} updates: {}",
                    inserted, updated, e.getMessage());
            throw new StoreException(table, "Failed to upsert country metadata into " + table, e);
        }

        logger.info("Successfully loaded/updated {} country records ({} inserted, {} updated)",
                inserted + updated, inserted, updated);
        return inserted + updated;
    }

    private <T> int append(DatasetKind kind, String table, String sql, List<T> records,
                           ParameterizedPreparedStatementSetter<T> setter) {
        logger.info("Loading {} data: {} records into {}", kind.getKey(), records.size(), table);
        if (records.isEmpty()) {
            return 0;
        }

        try {
            jdbcTemplate.batchUpdate(sql, records, config.getLoader().getBatchSize(), setter);
        } catch (DataAccessException e) {
            logger.error("Error loading {} data into {}: {}", kind.getKey(), table, e.getMessage());
            throw new StoreException(table, "Failed to append " + kind.getKey() + " records into " + table, e);
        }

        logger.info("Successfully loaded {} {} records", records.size(), kind.getKey());
        return records.size();
    }

    private Timestamp now() {
        return Timestamp.valueOf(LocalDateTime.now(clock));
    }

    private static Date toSqlDate(LocalDate date) {
        return date == null ? null : Date.valueOf(date);
    }
}
