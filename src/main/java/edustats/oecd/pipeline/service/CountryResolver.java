package edustats.oecd.pipeline.service;

import edustats.oecd.pipeline.model.CountryInfo;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static lookup from raw location tokens to country attributes.
 *
 * Coverage is limited to the fixed tables below. Anything else resolves to
 * itself as name, region "Other" and income group "Not Specified".
 */
@Service
public class CountryResolver {

    public static final String UNKNOWN_REGION = "Other";
    public static final String UNKNOWN_INCOME_GROUP = "Not Specified";
    public static final String HIGH_INCOME = "High Income";

    private static final int CODE_LENGTH = 3;

    private static final Map<String, String> COUNTRY_NAMES = Map.of(
            "USA", "United States",
            "GBR", "United Kingdom",
            "DEU", "Germany",
            "FRA", "France",
            "JPN", "Japan",
            "CAN", "Canada",
            "AUS", "Australia",
            "OECD", "OECD Average",
            "EU", "European Union");

    private static final Map<String, String> REGIONS = Map.of(
            "USA", "North America",
            "CAN", "North America",
            "GBR", "Europe",
            "DEU", "Europe",
            "FRA", "Europe",
            "ITA", "Europe",
            "ESP", "Europe",
            "JPN", "Asia",
            "AUS", "Oceania");

    private static final Set<String> HIGH_INCOME_CODES = Set.of(
            "USA", "GBR", "DEU", "FRA", "JPN", "CAN", "AUS", "OECD");

    /**
     * Resolve a raw location token.
     *
     * @param rawLocation location code or name as it came from the source
     * @return code (first three characters, upper case), display name, region and income group
     */
    public CountryInfo resolve(String rawLocation) {
        Objects.requireNonNull(rawLocation, "rawLocation");
        String token = rawLocation.trim();
        String code = toCode(token);
        return new CountryInfo(code, nameOf(token), regionOf(code), incomeGroupOf(code));
    }

    /**
     * First three characters, upper-cased. Shorter tokens are kept whole.
     */
    public String toCode(String token) {
        String code = token.length() > CODE_LENGTH ? token.substring(0, CODE_LENGTH) : token;
        return code.toUpperCase(Locale.ROOT);
    }

    public String nameOf(String token) {
        String name = COUNTRY_NAMES.get(token);
        if (name == null) {
            return token;
        }
        return name;
    }

    public String regionOf(String key) {
        String region = REGIONS.get(key);
        if (region == null) {
            return UNKNOWN_REGION;
        }
        return region;
    }

    public String incomeGroupOf(String key) {
        if (HIGH_INCOME_CODES.contains(key)) {
            return HIGH_INCOME;
        }
        return UNKNOWN_INCOME_GROUP;
    }
}
