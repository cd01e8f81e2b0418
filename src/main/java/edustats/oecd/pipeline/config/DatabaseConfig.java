package edustats.oecd.pipeline.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Connection pool and JdbcTemplate for the education store.
 *
 * The pipeline is the only writer and runs one stage at a time, so the pool
 * stays small. Any JDBC URL works; PostgreSQL gets batch insert rewriting.
 */
@Configuration
public class DatabaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConfig.class);

    private static final String POSTGRESQL_URL_PREFIX = "jdbc:postgresql:";
    private static final String POOL_NAME = "Education-Pipeline-Pool";

    @Value("${spring.datasource.url}")
    private String jdbcUrl;

    @Value("${spring.datasource.username}")
    private String username;

    @Value("${spring.datasource.password}")
    private String password;

    @Value("${spring.datasource.driver-class-name:org.postgresql.Driver}")
    private String driverClassName;

    /** Optional target schema for the four pipeline tables */
    @Value("${spring.datasource.schema:}")
    private String schema;

    @Value("${spring.datasource.hikari.maximum-pool-size:5}")
    private int maximumPoolSize;

    @Value("${spring.datasource.hikari.minimum-idle:1}")
    private int minimumIdle;

    @Value("${spring.datasource.hikari.connection-timeout:30000}")
    private long connectionTimeout;

    @Bean
    @Primary
    public DataSource dataSource() {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName(POOL_NAME);
        hikari.setJdbcUrl(jdbcUrl);
        hikari.setDriverClassName(driverClassName);
        hikari.setUsername(username);
        hikari.setPassword(password);
        if (schema != null && !schema.isBlank()) {
            hikari.setSchema(schema.trim());
        }

        hikari.setMaximumPoolSize(maximumPoolSize);
        hikari.setMinimumIdle(minimumIdle);
        hikari.setConnectionTimeout(connectionTimeout);
        hikari.setValidationTimeout(5000);
        hikari.setMaxLifetime(1800000); // 30 minutes

        applyDriverProperties(hikari);

        logger.info("Configuring {} for {} (max pool size {})", POOL_NAME, jdbcUrl, maximumPoolSize);
        return new HikariDataSource(hikari);
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource, PipelineConfig pipelineConfig) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout(pipelineConfig.getLoader().getQueryTimeoutSeconds());
        return jdbcTemplate;
    }

    private void applyDriverProperties(HikariConfig hikari) {
        if (jdbcUrl.startsWith(POSTGRESQL_URL_PREFIX)) {
            // Fact appends go out as multi-row INSERTs
            hikari.addDataSourceProperty("reWriteBatchedInserts", "true");
            hikari.addDataSourceProperty("ApplicationName", "education-data-pipeline");
        }
    }
}
