package edustats.oecd.pipeline.service;

import edustats.oecd.pipeline.config.PipelineConfig;
import edustats.oecd.pipeline.exception.StoreException;
import edustats.oecd.pipeline.model.CountryMetadata;
import edustats.oecd.pipeline.model.EnrollmentRecord;
import edustats.oecd.pipeline.model.GraduationRecord;
import edustats.oecd.pipeline.model.SpendingRecord;
import edustats.oecd.pipeline.util.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for EducationDataLoader against an in-memory H2 database in PostgreSQL mode
 */
class EducationDataLoaderTest {

    private JdbcTemplate jdbcTemplate;
    private EducationDataLoader loader;
    private SchemaManager schemaManager;

    @BeforeEach
    void setUp() {
        DataSource dataSource = TestDataFactory.h2DataSource();
        PipelineConfig config = TestDataFactory.testConfig();
        config.getLoader().setBatchSize(2);
        jdbcTemplate = new JdbcTemplate(dataSource);

        TableNamingService naming = new TableNamingService(config);
        schemaManager = new SchemaManager(dataSource, jdbcTemplate, naming);
        schemaManager.ensureSchema();
        loader = new EducationDataLoader(jdbcTemplate, naming, config, TestDataFactory.fixedClock());
    }

    private static EnrollmentRecord enrollment(String code, int year, double rate) {
        return new EnrollmentRecord(code, code, year, rate, "Not Specified", "Female", "OECD",
                TestDataFactory.FIXED_DATE);
    }

    private static CountryMetadata country(String code, String name, String region) {
        return CountryMetadata.builder()
                .countryCode(code)
                .countryName(name)
                .region(region)
                .incomeGroup("High Income")
                .dataAvailable(true)
                .lastUpdated(TestDataFactory.FIXED_DATE)
                .build();
    }

    private int count(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    // ========== fact appends ==========

    @Test
    void testAppendEnrollment_WritesAllColumns() {
        // When
        int loaded = loader.appendEnrollment(Collections.singletonList(enrollment("USA", 2022, 95.5)));

        // Then
        assertThat(loaded).isEqualTo(1);
        Map<String, Object> row = jdbcTemplate.queryForMap("SELECT * FROM enrollment_data");
        assertThat(row.get("COUNTRY_CODE")).isEqualTo("USA");
        assertThat(((Number) row.get("YEAR")).intValue()).isEqualTo(2022);
        assertThat(((Number) row.get("ENROLLMENT_RATE")).doubleValue()).isEqualTo(95.5);
        assertThat(row.get("GENDER")).isEqualTo("Female");
        assertThat(row.get("DATA_SOURCE")).isEqualTo("OECD");
        assertThat(row.get("EXTRACTION_DATE").toString()).isEqualTo("2024-03-15");
        assertThat(row.get("CREATED_AT")).isNotNull();
    }

    @Test
    void testAppendEnrollment_TwiceDoublesRows() {
        // Given: a batch larger than the JDBC batch size
        List<EnrollmentRecord> batch = Arrays.asList(
                enrollment("USA", 2020, 90.0),
                enrollment("USA", 2021, 91.0),
                enrollment("DEU", 2021, 92.0));

        // When: loaded twice
        loader.appendEnrollment(batch);
        loader.appendEnrollment(batch);

        // Then: append-only, no duplicate detection
        assertThat(count("enrollment_data")).isEqualTo(6);
    }

    @Test
    void testAppendGraduation() {
        GraduationRecord record = new GraduationRecord("FRA", "France", 2019, 42.0, "All Levels", "OECD",
                TestDataFactory.FIXED_DATE);

        loader.appendGraduation(Collections.singletonList(record));

        Double completion = jdbcTemplate.queryForObject("SELECT completion_rate FROM graduation_data", Double.class);
        assertThat(completion).isEqualTo(0.42);
    }

    @Test
    void testAppendSpending_NullPercentGdp() {
        SpendingRecord record = new SpendingRecord("JPN", "Japan", 2018, 12000.0, "Not Specified", "OECD",
                TestDataFactory.FIXED_DATE);

        loader.appendSpending(Collections.singletonList(record));

        Map<String, Object> row = jdbcTemplate.queryForMap("SELECT * FROM spending_data");
        assertThat(row.get("SPENDING_PERCENT_GDP")).isNull();
        assertThat(row.get("CURRENCY")).isEqualTo("USD");
        assertThat(((Number) row.get("SPENDING_PER_CAPITA")).doubleValue()).isEqualTo(12000.0);
    }

    @Test
    void testAppend_EmptyList_NoStatement() {
        assertThat(loader.appendSpending(Collections.emptyList())).isZero();
        assertThat(count("spending_data")).isZero();
    }

    @Test
    void testAppend_MissingTable_ThrowsStoreException() {
        // Given: table dropped after schema creation
        jdbcTemplate.execute("DROP TABLE graduation_data");
        GraduationRecord record = new GraduationRecord("FRA", "France", 2019, 42.0, "All Levels", "OECD",
                LocalDate.of(2024, 1, 1));

        // When / Then
        assertThatThrownBy(() -> loader.appendGraduation(Collections.singletonList(record)))
                .isInstanceOf(StoreException.class)
                .satisfies(e -> assertThat(((StoreException) e).getTableName()).isEqualTo("graduation_data"));
    }

    // ========== country upsert ==========

    @Test
    void testUpsertCountries_SecondValuesWin() {
        // Given
        loader.upsertCountries(Collections.singletonList(country("USA", "USA", "North America")));

        // When: same code with different attributes
        loader.upsertCountries(Collections.singletonList(country("USA", "USA", "Americas")));

        // Then
        assertThat(count("country_metadata")).isEqualTo(1);
        String region = jdbcTemplate.queryForObject(
                "SELECT region FROM country_metadata WHERE country_code = 'USA'", String.class);
        assertThat(region).isEqualTo("Americas");
    }

    @Test
    void testUpsertCountries_InsertsNewCodes() {
        // When
        int upserted = loader.upsertCountries(Arrays.asList(
                country("USA", "USA", "North America"),
                country("DEU", "DEU", "Europe")));

        // Then
        assertThat(upserted).isEqualTo(2);
        assertThat(count("country_metadata")).isEqualTo(2);
        Boolean available = jdbcTemplate.queryForObject(
                "SELECT data_available FROM country_metadata WHERE country_code = 'DEU'", Boolean.class);
        assertThat(available).isTrue();
    }

    @Test
    void testUpsertCountries_NameOnlyRowsCollapseOnEmptyCode() {
        // Given: two name-only rows share the empty code
        List<CountryMetadata> metadata = new ArrayList<>();
        metadata.add(country("", "Germany", "Other"));
        metadata.add(country("", "United States", "Other"));

        // When
        loader.upsertCountries(metadata);

        // Then: the later row overwrites the earlier one
        assertThat(count("country_metadata")).isEqualTo(1);
        String name = jdbcTemplate.queryForObject(
                "SELECT country_name FROM country_metadata WHERE country_code = ''", String.class);
        assertThat(name).isEqualTo("United States");
    }

    @Test
    void testUpsertCountries_MissingTable_ThrowsStoreException() {
        jdbcTemplate.execute("DROP TABLE country_metadata");

        assertThatThrownBy(() -> loader.upsertCountries(
                Collections.singletonList(country("USA", "USA", "North America"))))
                .isInstanceOf(StoreException.class);
    }
}
