package edustats.oecd.pipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import edustats.oecd.pipeline.config.PipelineConfig;
import edustats.oecd.pipeline.dto.PipelineRunResultDto;
import edustats.oecd.pipeline.dto.PipelineRunResultDto.DatasetSummary;
import edustats.oecd.pipeline.exception.FetchException;
import edustats.oecd.pipeline.exception.RunInProgressException;
import edustats.oecd.pipeline.exception.StoreException;
import edustats.oecd.pipeline.model.DatasetKind;
import edustats.oecd.pipeline.model.FlatRecord;
import edustats.oecd.pipeline.util.RunIdUtil;
import edustats.oecd.pipeline.util.TestDataFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static edustats.oecd.pipeline.util.TestDataFactory.indicatorObservation;
import static edustats.oecd.pipeline.util.TestDataFactory.observation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * End-to-end tests for PipelineService.
 * Real cleaners, schema manager and loader on H2; only the extraction is mocked.
 */
class PipelineServiceTest {

    @TempDir
    Path tempDir;

    private PipelineConfig config;
    private JdbcTemplate jdbcTemplate;
    private OecdExtractionService extractionService;
    private SchemaManager schemaManager;
    private PipelineService pipelineService;

    @BeforeEach
    void setUp() {
        MDC.clear();
        config = TestDataFactory.testConfig();
        Clock clock = TestDataFactory.fixedClock();
        DataSource dataSource = TestDataFactory.h2DataSource();
        jdbcTemplate = new JdbcTemplate(dataSource);

        TableNamingService naming = new TableNamingService(config);
        CountryResolver resolver = new CountryResolver();
        schemaManager = new SchemaManager(dataSource, jdbcTemplate, naming);
        extractionService = mock(OecdExtractionService.class);

        pipelineService = new PipelineService(
                extractionService,
                new RecordCleanerFactory(config, resolver, clock),
                new MetadataSynthesizer(resolver, clock),
                new ArtifactWriterService(config, new ObjectMapper(), clock),
                schemaManager,
                new EducationDataLoader(jdbcTemplate, naming, config, clock),
                config,
                clock);
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    private static Map<DatasetKind, List<FlatRecord>> sampleDatasets() {
        Map<DatasetKind, List<FlatRecord>> datasets = new EnumMap<>(DatasetKind.class);
        datasets.put(DatasetKind.ENROLLMENT, Arrays.asList(
                observation("USA", "2022", 95.5),
                observation("DEU", "2022", 250.0),
                observation("DEU", "1990", 80.0)));
        datasets.put(DatasetKind.GRADUATION, Arrays.asList(
                indicatorObservation("DEU", "2021", "GRAD_RATE", 40.0),
                indicatorObservation("DEU", "2021", "ENRL_RATE", 90.0)));
        datasets.put(DatasetKind.SPENDING, Collections.singletonList(
                observation("JPN", "2020", 11000.0)));
        return datasets;
    }

    private long count(String table) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0 : count;
    }

    @Test
    void testRun_LoadsCleanRecordsAndCountries() {
        // Given
        when(extractionService.fetchAll()).thenReturn(sampleDatasets());

        // When
        PipelineRunResultDto result = pipelineService.run();

        // Then: summary
        assertThat(result.getStatus()).isEqualTo("COMPLETED");
        assertThat(result.getRunId()).isNotBlank();
        assertThat(result.getStartedAt()).isNotNull();
        assertThat(result.getFinishedAt()).isNotNull();

        DatasetSummary enrollment = result.getDatasets().get("enrollment");
        assertThat(enrollment.getDatasetCode()).isEqualTo("EDU_ENRL");
        assertThat(enrollment.getFetchedRecords()).isEqualTo(3);
        assertThat(enrollment.getCleanRecords()).isEqualTo(1);
        assertThat(enrollment.getLoadedRecords()).isEqualTo(1);
        assertThat(enrollment.getDroppedRecords())
                .containsEntry("out_of_range", 1)
                .containsEntry("year_out_of_window", 1);
        assertThat(result.getDatasets().get("graduation").getDroppedRecords()).containsEntry("kind_mismatch", 1);

        // Then: store
        assertThat(count("enrollment_data")).isEqualTo(1);
        assertThat(count("graduation_data")).isEqualTo(1);
        assertThat(count("spending_data")).isEqualTo(1);
        String name = jdbcTemplate.queryForObject(
                "SELECT country_name FROM enrollment_data WHERE country_code = 'USA'", String.class);
        assertThat(name).isEqualTo("United States");

        // Codes USA, DEU, JPN plus names collapsing on the empty code
        assertThat(count("country_metadata")).isEqualTo(4);
        assertThat(result.getCountriesUpserted()).isEqualTo(6);
    }

    @Test
    void testRun_TwiceDuplicatesFactsButNotCountries() {
        when(extractionService.fetchAll()).thenReturn(sampleDatasets());

        pipelineService.run();
        pipelineService.run();

        assertThat(count("enrollment_data")).isEqualTo(2);
        assertThat(count("country_metadata")).isEqualTo(4);
    }

    @Test
    void testRun_RunIdInMdcDuringRunOnly() {
        // Given: capture MDC while extracting
        AtomicReference<String> seen = new AtomicReference<>();
        when(extractionService.fetchAll()).thenAnswer(invocation -> {
            seen.set(MDC.get(RunIdUtil.RUN_ID_KEY));
            return sampleDatasets();
        });

        // When
        PipelineRunResultDto result = pipelineService.run();

        // Then
        assertThat(seen.get()).isEqualTo(result.getRunId());
        assertThat(RunIdUtil.hasRunId()).isFalse();
    }

    @Test
    void testRun_ConcurrentRunRejected() {
        // Given: a second run requested while the first is extracting
        AtomicReference<Throwable> rejected = new AtomicReference<>();
        when(extractionService.fetchAll()).thenAnswer(invocation -> {
            try {
                pipelineService.run();
            } catch (RunInProgressException e) {
                rejected.set(e);
            }
            return sampleDatasets();
        });

        // When
        PipelineRunResultDto result = pipelineService.run();

        // Then: first run completes, nested one is refused
        assertThat(result.getStatus()).isEqualTo("COMPLETED");
        assertThat(rejected.get()).isInstanceOf(RunInProgressException.class);
        assertThat(((RunInProgressException) rejected.get()).getActiveRunId()).isEqualTo(result.getRunId());
        assertThat(pipelineService.getActiveRunId()).isNull();
    }

    @Test
    void testRun_FetchFailure_StopsBeforeLoading() {
        // Given
        when(extractionService.fetchAll()).thenThrow(new FetchException("EDU_ENRL", 500));

        // When / Then
        assertThatThrownBy(() -> pipelineService.run())
                .isInstanceOf(FetchException.class)
                .satisfies(e -> assertThat(((FetchException) e).getRunId()).isNotBlank());
        assertThat(schemaManager.tableExists("enrollment_data")).isFalse();
        assertThat(pipelineService.getActiveRunId()).isNull();
    }

    @Test
    void testRun_ExistingTableWithOtherLayout_FailsWithStoreException() {
        // Given: an incompatible table is never altered
        jdbcTemplate.execute("CREATE TABLE enrollment_data (id INTEGER)");
        when(extractionService.fetchAll()).thenReturn(sampleDatasets());

        // When / Then
        assertThatThrownBy(() -> pipelineService.run()).isInstanceOf(StoreException.class);

        // Country metadata was upserted before the failing append
        assertThat(count("country_metadata")).isEqualTo(4);
    }

    @Test
    void testRun_WritesArtifactsWhenEnabled() {
        // Given
        config.getOutput().setEnabled(true);
        config.getOutput().setRawDir(tempDir.resolve("raw").toString());
        config.getOutput().setProcessedDir(tempDir.resolve("processed").toString());
        when(extractionService.fetchAll()).thenReturn(sampleDatasets());

        // When
        PipelineRunResultDto result = pipelineService.run();

        // Then
        assertThat(result.getRawArtifactDir()).isEqualTo(tempDir.resolve("raw").toString());
        assertThat(tempDir.resolve("raw").resolve("metadata_20240315_101530.json")).exists();
        assertThat(tempDir.resolve("processed").resolve("spending_clean_20240315_101530.csv")).exists();
    }
}
