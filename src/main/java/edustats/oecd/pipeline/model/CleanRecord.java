package edustats.oecd.pipeline.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Base type for a cleaned fact row. One subclass per {@link DatasetKind}.
 *
 * Instances are immutable; the country code and year are always present,
 * the measure fields live on the subclasses.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class CleanRecord {

    public static final String DEFAULT_DATA_SOURCE = "OECD";

    private final String countryCode;
    private final String countryName;
    private final int year;
    private final String educationLevel;
    private final String dataSource;
    private final LocalDate extractionDate;

    protected CleanRecord(String countryCode, String countryName, int year, String educationLevel,
                          String dataSource, LocalDate extractionDate) {
        this.countryCode = Objects.requireNonNull(countryCode, "countryCode");
        this.countryName = countryName;
        this.year = year;
        this.educationLevel = educationLevel;
        this.dataSource = dataSource;
        this.extractionDate = extractionDate;
    }

    public abstract DatasetKind getKind();
}
