package edustats.oecd.pipeline.service;

import edustats.oecd.pipeline.config.PipelineConfig;
import edustats.oecd.pipeline.dto.PipelineRunResultDto;
import edustats.oecd.pipeline.dto.PipelineRunResultDto.DatasetSummary;
import edustats.oecd.pipeline.exception.PipelineException;
import edustats.oecd.pipeline.exception.RunInProgressException;
import edustats.oecd.pipeline.model.CleanRecord;
import edustats.oecd.pipeline.model.CleaningResult;
import edustats.oecd.pipeline.model.CountryMetadata;
import edustats.oecd.pipeline.model.DatasetKind;
import edustats.oecd.pipeline.model.DropReason;
import edustats.oecd.pipeline.model.EnrollmentRecord;
import edustats.oecd.pipeline.model.FlatRecord;
import edustats.oecd.pipeline.model.GraduationRecord;
import edustats.oecd.pipeline.model.SpendingRecord;
import edustats.oecd.pipeline.util.RunIdUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the pipeline end to end:
 * extract → save raw → clean → synthesize countries → save clean →
 * ensure schema → upsert countries → append facts.
 *
 * Stages run sequentially on the calling thread. The first failing stage
 * stops the run and its exception is rethrown to the caller. Only one run
 * may be active per process.
 */
@Service
public class PipelineService {

    private static final Logger logger = LoggerFactory.getLogger(PipelineService.class);

    public static final String STATUS_COMPLETED = "COMPLETED";

    private final OecdExtractionService extractionService;
    private final RecordCleanerFactory cleanerFactory;
    private final MetadataSynthesizer metadataSynthesizer;
    private final ArtifactWriterService artifactWriter;
    private final SchemaManager schemaManager;
    private final EducationDataLoader loader;
    private final PipelineConfig config;
    private final Clock clock;

    private final AtomicReference<String> activeRunId = new AtomicReference<>();

    public PipelineService(OecdExtractionService extractionService,
                           RecordCleanerFactory cleanerFactory,
                           MetadataSynthesizer metadataSynthesizer,
                           ArtifactWriterService artifactWriter,
                           SchemaManager schemaManager,
                           EducationDataLoader loader,
                           PipelineConfig config,
                           Clock clock) {
        this.extractionService = extractionService;
        this.cleanerFactory = cleanerFactory;
        this.metadataSynthesizer = metadataSynthesizer;
        this.artifactWriter = artifactWriter;
        this.schemaManager = schemaManager;
        this.loader = loader;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Execute one complete run.
     *
     * @return run summary with per dataset counts
     * @throws RunInProgressException if another run is active
     * @throws PipelineException      if a stage fails
     */
    public PipelineRunResultDto run() {
        String runId = RunIdUtil.newRunId();
        if (!activeRunId.compareAndSet(null, runId)) {
            String active = activeRunId.get();
            logger.warn("Rejected pipeline run request, run {} is still active", active);
            throw new RunInProgressException(active);
        }

        RunIdUtil.setRunId(runId);
        LocalDateTime startTime = LocalDateTime.now(clock);
        try {
            logger.info("========================================");
            logger.info("PIPELINE RUN {} - Starting", runId);
            logger.info("========================================");

            PipelineRunResultDto result = execute(runId, startTime);

            long durationMs = Duration.between(startTime, result.getFinishedAt()).toMillis();
            logger.info("PIPELINE RUN {} - COMPLETED in {}ms, {} countries upserted",
                    runId, durationMs, result.getCountriesUpserted());
            return result;

        } catch (PipelineException e) {
            e.setRunId(runId);
            logger.error("PIPELINE RUN {} - FAILED: {}", runId, e.getMessage(), e);
            throw e;
        } finally {
            RunIdUtil.clearRunId();
            activeRunId.set(null);
        }
    }

    /**
     * @return id of the active run, or null when idle
     */
    public String getActiveRunId() {
        return activeRunId.get();
    }

    private PipelineRunResultDto execute(String runId, LocalDateTime startTime) {
        PipelineRunResultDto result = new PipelineRunResultDto();
        result.setRunId(runId);
        result.setStartedAt(startTime);
        String timestamp = artifactWriter.newTimestamp();

        // Extract
        logger.info("Step 1: Extracting data");
        Map<DatasetKind, List<FlatRecord>> raw = extractionService.fetchAll();
        Path rawDir = artifactWriter.writeRaw(raw, timestamp);

        // Transform
        logger.info("Step 2: Transforming data");
        CleaningResult<EnrollmentRecord> enrollment =
                cleanerFactory.enrollment().cleanWithReport(rawOf(raw, DatasetKind.ENROLLMENT));
        CleaningResult<GraduationRecord> graduation =
                cleanerFactory.graduation().cleanWithReport(rawOf(raw, DatasetKind.GRADUATION));
        CleaningResult<SpendingRecord> spending =
                cleanerFactory.spending().cleanWithReport(rawOf(raw, DatasetKind.SPENDING));

        List<CountryMetadata> countries = metadataSynthesizer.synthesize(Arrays.asList(
                enrollment.getRecords(), graduation.getRecords(), spending.getRecords()));

        Map<DatasetKind, List<? extends CleanRecord>> cleaned = new EnumMap<>(DatasetKind.class);
        cleaned.put(DatasetKind.ENROLLMENT, enrollment.getRecords());
        cleaned.put(DatasetKind.GRADUATION, graduation.getRecords());
        cleaned.put(DatasetKind.SPENDING, spending.getRecords());
        Path processedDir = artifactWriter.writeClean(cleaned, timestamp);

        // Load
        logger.info("Step 3: Loading data");
        schemaManager.ensureSchema();
        int countriesUpserted = loader.upsertCountries(countries);
        int enrollmentLoaded = loader.appendEnrollment(enrollment.getRecords());
        int graduationLoaded = loader.appendGraduation(graduation.getRecords());
        int spendingLoaded = loader.appendSpending(spending.getRecords());

        result.getDatasets().put(DatasetKind.ENROLLMENT.getKey(),
                summarize(DatasetKind.ENROLLMENT, enrollment, enrollmentLoaded));
        result.getDatasets().put(DatasetKind.GRADUATION.getKey(),
                summarize(DatasetKind.GRADUATION, graduation, graduationLoaded));
        result.getDatasets().put(DatasetKind.SPENDING.getKey(),
                summarize(DatasetKind.SPENDING, spending, spendingLoaded));
        result.setCountriesUpserted(countriesUpserted);
        result.setRawArtifactDir(rawDir != null ? rawDir.toString() : null);
        result.setProcessedArtifactDir(processedDir != null ? processedDir.toString() : null);
        result.setStatus(STATUS_COMPLETED);
        result.setFinishedAt(LocalDateTime.now(clock));
        return result;
    }

    private static List<FlatRecord> rawOf(Map<DatasetKind, List<FlatRecord>> raw, DatasetKind kind) {
        List<FlatRecord> records = raw.get(kind);
        return records != null ? records : Collections.emptyList();
    }

    private DatasetSummary summarize(DatasetKind kind, CleaningResult<?> cleaning, int loaded) {
        DatasetSummary summary = new DatasetSummary();
        summary.setDatasetCode(config.getDatasetCode(kind));
        summary.setFetchedRecords(cleaning.getInputCount());
        summary.setCleanRecords(cleaning.getRecords().size());
        for (Map.Entry<DropReason, Integer> drop : cleaning.getDrops().entrySet()) {
            if (drop.getValue() > 0) {
                summary.getDroppedRecords().put(drop.getKey().name().toLowerCase(Locale.ROOT), drop.getValue());
            }
        }
        summary.setLoadedRecords(loaded);
        return summary;
    }
}
