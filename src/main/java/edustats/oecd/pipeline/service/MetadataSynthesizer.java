package edustats.oecd.pipeline.service;

import edustats.oecd.pipeline.model.CleanRecord;
import edustats.oecd.pipeline.model.CountryMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Derives the country reference rows from cleaned fact data.
 *
 * Codes and names from every dataset go into one sorted set. Elements of
 * three characters or fewer become codes; longer elements become a row with
 * an empty code and the element as name. A resolved name such as "Germany"
 * therefore produces its own row next to "DEU", and all name-only rows share
 * the empty code when upserted.
 */
@Service
@Slf4j
public class MetadataSynthesizer {

    private static final int MAX_CODE_LENGTH = 3;

    private final CountryResolver countryResolver;
    private final Clock clock;

    public MetadataSynthesizer(CountryResolver countryResolver, Clock clock) {
        this.countryResolver = countryResolver;
        this.clock = clock;
    }

    /**
     * Build one metadata row per distinct code or name.
     *
     * @param cleanDatasets cleaned records of every dataset in the run
     * @return rows in sorted element order
     */
    public List<CountryMetadata> synthesize(List<? extends List<? extends CleanRecord>> cleanDatasets) {
        log.info("Creating country metadata from {} datasets", cleanDatasets.size());

        SortedSet<String> countries = new TreeSet<>();
        for (List<? extends CleanRecord> dataset : cleanDatasets) {
            for (CleanRecord record : dataset) {
                addIfPresent(countries, record.getCountryCode());
                addIfPresent(countries, record.getCountryName());
            }
        }

        LocalDate today = LocalDate.now(clock);
        List<CountryMetadata> metadata = new ArrayList<>(countries.size());
        for (String country : countries) {
            metadata.add(CountryMetadata.builder()
                    .countryCode(country.length() <= MAX_CODE_LENGTH ? country : "")
                    .countryName(country)
                    .region(countryResolver.regionOf(country))
                    .incomeGroup(countryResolver.incomeGroupOf(country))
                    .population(null)
                    .gdpPerCapita(null)
                    .dataAvailable(true)
                    .lastUpdated(today)
                    .build());
        }

        log.info("Created metadata for {} countries", metadata.size());
        return metadata;
    }

    private static void addIfPresent(SortedSet<String> countries, String value) {
        if (value != null && !value.isBlank()) {
            countries.add(value);
        }
    }
}
