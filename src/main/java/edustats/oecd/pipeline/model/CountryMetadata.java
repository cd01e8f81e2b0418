package edustats.oecd.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Row of the country reference table, keyed by {@code countryCode}.
 *
 * Synthesized from cleaned fact data on every run and upserted; population
 * and GDP are not ingested yet and stay null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CountryMetadata {
    private String countryCode;
    private String countryName;
    private String region;
    private String incomeGroup;
    private Long population;
    private Double gdpPerCapita;
    private boolean dataAvailable;
    private LocalDate lastUpdated;
}
