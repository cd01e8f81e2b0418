package edustats.oecd.pipeline.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Cleaned graduation row. {@code completionRate} is always
 * {@code graduationRate / 100}.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class GraduationRecord extends CleanRecord {

    private final double graduationRate;
    private final double completionRate;

    public GraduationRecord(String countryCode, String countryName, int year, double graduationRate,
                            String educationLevel, String dataSource, LocalDate extractionDate) {
        super(countryCode, countryName, year, educationLevel, dataSource, extractionDate);
        this.graduationRate = graduationRate;
        this.completionRate = graduationRate / 100;
    }

    @Override
    public DatasetKind getKind() {
        return DatasetKind.GRADUATION;
    }
}
