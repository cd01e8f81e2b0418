package edustats.oecd.pipeline.model;

import lombok.Value;

/**
 * Result of resolving a raw location token.
 */
@Value
public class CountryInfo {
    String code;
    String name;
    String region;
    String incomeGroup;
}
