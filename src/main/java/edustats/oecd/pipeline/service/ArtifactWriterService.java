package edustats.oecd.pipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import edustats.oecd.pipeline.config.PipelineConfig;
import edustats.oecd.pipeline.exception.ArtifactException;
import edustats.oecd.pipeline.model.CleanRecord;
import edustats.oecd.pipeline.model.DatasetKind;
import edustats.oecd.pipeline.model.EnrollmentRecord;
import edustats.oecd.pipeline.model.FlatRecord;
import edustats.oecd.pipeline.model.GraduationRecord;
import edustats.oecd.pipeline.model.SpendingRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes the intermediate files of a run:
 * - {rawDir}/{kind}_{timestamp}.csv, one per fetched dataset
 * - {rawDir}/metadata_{timestamp}.json, extraction summary
 * - {processedDir}/{kind}_clean_{timestamp}.csv, one per cleaned dataset
 *
 * Nothing is written when pipeline.output.enabled is false.
 */
@Service
public class ArtifactWriterService {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactWriterService.class);

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final List<String> COMMON_COLUMNS = Arrays.asList(
            "country_code", "country_name", "year");
    private static final List<String> PROVENANCE_COLUMNS = Arrays.asList(
            "data_source", "extraction_date");

    private final PipelineConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ArtifactWriterService(PipelineConfig config, ObjectMapper objectMapper, Clock clock) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return config.getOutput().isEnabled();
    }

    /**
     * Timestamp shared by every file of one run.
     */
    public String newTimestamp() {
        return LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
    }

    /**
     * Write the raw CSV of each dataset and the extraction summary.
     *
     * @param datasets  fetched records per kind
     * @param timestamp run timestamp
     * @return raw directory, or null when output is disabled
     * @throws ArtifactException if a file cannot be written
     */
    public Path writeRaw(Map<DatasetKind, List<FlatRecord>> datasets, String timestamp) {
        if (!isEnabled()) {
            logger.debug("Artifact output disabled, skipping raw files");
            return null;
        }

        Path rawDir = Paths.get(config.getOutput().getRawDir());
        createDirectories(rawDir);

        int totalRecords = 0;
        List<String> extracted = new ArrayList<>();
        for (Map.Entry<DatasetKind, List<FlatRecord>> entry : datasets.entrySet()) {
            List<FlatRecord> records = entry.getValue();
            Path file = rawDir.resolve(entry.getKey().getKey() + "_" + timestamp + ".csv");
            writeRawCsv(file, records);
            logger.info("Saved {} raw records to {}", records.size(), file);

            extracted.add(entry.getKey().getKey());
            totalRecords += records.size();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("extraction_time", LocalDateTime.now(clock).toString());
        metadata.put("datasets_extracted", extracted);
        metadata.put("total_records", totalRecords);

        Path metadataFile = rawDir.resolve("metadata_" + timestamp + ".json");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(metadataFile.toFile(), metadata);
        } catch (IOException e) {
            throw new ArtifactException("Failed to write extraction metadata to " + metadataFile, e);
        }
        logger.info("Saved extraction metadata to {}", metadataFile);
        return rawDir;
    }

    /**
     * Write the cleaned CSV of each dataset.
     *
     * @param cleaned   cleaned records per kind
     * @param timestamp run timestamp
     * @return processed directory, or null when output is disabled
     * @throws ArtifactException if a file cannot be written
     */
    public Path writeClean(Map<DatasetKind, ? extends List<? extends CleanRecord>> cleaned, String timestamp) {
        if (!isEnabled()) {
            logger.debug("Artifact output disabled, skipping cleaned files");
            return null;
        }

        Path processedDir = Paths.get(config.getOutput().getProcessedDir());
        createDirectories(processedDir);

        for (Map.Entry<DatasetKind, ? extends List<? extends CleanRecord>> entry : cleaned.entrySet()) {
            DatasetKind kind = entry.getKey();
            Path file = processedDir.resolve(kind.getKey() + "_clean_" + timestamp + ".csv");

            List<List<Object>> rows = new ArrayList<>(entry.getValue().size());
            for (CleanRecord record : entry.getValue()) {
                rows.add(cleanValues(record));
            }
            writeCsv(file, cleanColumns(kind), rows);
            logger.info("Saved {} clean records to {}", rows.size(), file);
        }
        return processedDir;
    }

    private void writeRawCsv(Path file, List<FlatRecord> records) {
        // Header is the union of keys in first-seen order
        Set<String> header = new LinkedHashSet<>();
        for (FlatRecord record : records) {
            header.addAll(record.getFields().keySet());
        }

        List<List<Object>> rows = new ArrayList<>(records.size());
        for (FlatRecord record : records) {
            List<Object> row = new ArrayList<>(header.size());
            for (String column : header) {
                row.add(record.get(column));
            }
            rows.add(row);
        }
        writeCsv(file, new ArrayList<>(header), rows);
    }

    private void writeCsv(Path file, List<String> header, List<List<Object>> rows) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(header.toArray(new String[0]))
                .build();

        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (List<Object> row : rows) {
                printer.printRecord(row);
            }
        } catch (IOException e) {
            throw new ArtifactException("Failed to write " + file, e);
        }
    }

    private void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ArtifactException("Failed to create artifact directory " + dir, e);
        }
    }

    List<String> cleanColumns(DatasetKind kind) {
        List<String> columns = new ArrayList<>(COMMON_COLUMNS);
        switch (kind) {
            case ENROLLMENT:
                columns.addAll(Arrays.asList("enrollment_rate", "education_level", "gender"));
                break;
            case GRADUATION:
                columns.addAll(Arrays.asList("graduation_rate", "completion_rate", "education_level"));
                break;
            case SPENDING:
                columns.addAll(Arrays.asList("spending_usd", "spending_per_capita", "spending_percent_gdp",
                        "currency", "education_level"));
                break;
            default:
                throw new IllegalArgumentException("Unknown dataset kind: " + kind);
        }
        columns.addAll(PROVENANCE_COLUMNS);
        return columns;
    }

    List<Object> cleanValues(CleanRecord record) {
        List<Object> values = new ArrayList<>();
        values.add(record.getCountryCode());
        values.add(record.getCountryName());
        values.add(record.getYear());

        if (record instanceof EnrollmentRecord) {
            EnrollmentRecord enrollment = (EnrollmentRecord) record;
            values.add(enrollment.getEnrollmentRate());
            values.add(enrollment.getEducationLevel());
            values.add(enrollment.getGender());
        } else if (record instanceof GraduationRecord) {
            GraduationRecord graduation = (GraduationRecord) record;
            values.add(graduation.getGraduationRate());
            values.add(graduation.getCompletionRate());
            values.add(graduation.getEducationLevel());
        } else if (record instanceof SpendingRecord) {
            SpendingRecord spending = (SpendingRecord) record;
            values.add(spending.getSpendingUsd());
            values.add(spending.getSpendingPerCapita());
            values.add(spending.getSpendingPercentGdp());
            values.add(spending.getCurrency());
            values.add(spending.getEducationLevel());
        } else {
            throw new IllegalArgumentException("Unsupported record type: " + record.getClass().getName());
        }

        values.add(record.getDataSource());
        values.add(record.getExtractionDate());
        return values;
    }
}
