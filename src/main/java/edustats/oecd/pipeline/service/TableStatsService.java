package edustats.oecd.pipeline.service;

import edustats.oecd.pipeline.model.DatasetKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports row counts of the pipeline tables.
 * A table that cannot be counted (missing, connection failure) reports 0.
 */
@Service
public class TableStatsService {

    private static final Logger logger = LoggerFactory.getLogger(TableStatsService.class);

    private final JdbcTemplate jdbcTemplate;
    private final TableNamingService tableNamingService;

    public TableStatsService(JdbcTemplate jdbcTemplate, TableNamingService tableNamingService) {
        this.jdbcTemplate = jdbcTemplate;
        this.tableNamingService = tableNamingService;
    }

    /**
     * Row count per configured table, fact tables first, country table last.
     *
     * @return table name to row count
     */
    public Map<String, Long> getTableStats() {
        logger.info("Retrieving table statistics");

        Map<String, Long> stats = new LinkedHashMap<>();
        for (DatasetKind kind : DatasetKind.values()) {
            String table = tableNamingService.factTable(kind);
            stats.put(table, countRows(table));
        }
        String countries = tableNamingService.countryTable();
        stats.put(countries, countRows(countries));

        logger.info("Table statistics: {}", stats);
        return stats;
    }

    /**
     * Count rows of one table.
     *
     * @param tableName validated table name
     * @return row count, 0 if the query fails
     */
    public long countRows(String tableName) {
        try {
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
            return count != null ? count : 0L;
        } catch (Exception e) {
            logger.warn("Could not get row count for table '{}': {}", tableName, e.getMessage());
            return 0L;
        }
    }
}
