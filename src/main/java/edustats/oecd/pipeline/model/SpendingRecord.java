package edustats.oecd.pipeline.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Cleaned spending row.
 *
 * {@code spendingPerCapita} equals {@code spendingUsd} until population data
 * is ingested, and {@code spendingPercentGdp} stays null until GDP data is.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class SpendingRecord extends CleanRecord {

    public static final String DEFAULT_CURRENCY = "USD";

    private final double spendingUsd;
    private final double spendingPerCapita;
    private final Double spendingPercentGdp;
    private final String currency;

    public SpendingRecord(String countryCode, String countryName, int year, double spendingUsd,
                          String educationLevel, String dataSource, LocalDate extractionDate) {
        super(countryCode, countryName, year, educationLevel, dataSource, extractionDate);
        this.spendingUsd = spendingUsd;
        this.spendingPerCapita = spendingUsd;
        this.spendingPercentGdp = null;
        this.currency = DEFAULT_CURRENCY;
    }

    @Override
    public DatasetKind getKind() {
        return DatasetKind.SPENDING;
    }
}
