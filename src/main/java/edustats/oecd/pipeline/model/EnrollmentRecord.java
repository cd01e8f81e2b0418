package edustats.oecd.pipeline.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Cleaned enrollment row. {@code enrollmentRate} is within [0, 200].
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class EnrollmentRecord extends CleanRecord {

    private final double enrollmentRate;
    private final String gender;

    public EnrollmentRecord(String countryCode, String countryName, int year, double enrollmentRate,
                            String educationLevel, String gender, String dataSource, LocalDate extractionDate) {
        super(countryCode, countryName, year, educationLevel, dataSource, extractionDate);
        this.enrollmentRate = enrollmentRate;
        this.gender = gender;
    }

    @Override
    public DatasetKind getKind() {
        return DatasetKind.ENROLLMENT;
    }
}
