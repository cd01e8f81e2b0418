package edustats.oecd.pipeline.service;

import edustats.oecd.pipeline.model.CountryInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CountryResolver
 */
class CountryResolverTest {

    private final CountryResolver resolver = new CountryResolver();

    @ParameterizedTest
    @CsvSource({
            "USA, United States, North America",
            "CAN, Canada, North America",
            "GBR, United Kingdom, Europe",
            "DEU, Germany, Europe",
            "FRA, France, Europe",
            "JPN, Japan, Asia",
            "AUS, Australia, Oceania"
    })
    void testResolve_KnownCodes(String code, String name, String region) {
        CountryInfo info = resolver.resolve(code);

        assertThat(info.getCode()).isEqualTo(code);
        assertThat(info.getName()).isEqualTo(name);
        assertThat(info.getRegion()).isEqualTo(region);
        assertThat(info.getIncomeGroup()).isEqualTo("High Income");
    }

    @Test
    void testResolve_UnknownCode_Fallbacks() {
        // When
        CountryInfo info = resolver.resolve("ZZZ");

        // Then
        assertThat(info.getCode()).isEqualTo("ZZZ");
        assertThat(info.getName()).isEqualTo("ZZZ");
        assertThat(info.getRegion()).isEqualTo("Other");
        assertThat(info.getIncomeGroup()).isEqualTo("Not Specified");
    }

    @Test
    void testResolve_RegionOnlyCodes() {
        // ITA and ESP have a region but no name or income entry
        CountryInfo italy = resolver.resolve("ITA");

        assertThat(italy.getName()).isEqualTo("ITA");
        assertThat(italy.getRegion()).isEqualTo("Europe");
        assertThat(italy.getIncomeGroup()).isEqualTo("Not Specified");
    }

    @Test
    void testResolve_LongTokenTruncatedAndUpperCased() {
        // When
        CountryInfo info = resolver.resolve("oecd");

        // Then: code is the first three characters, name lookup uses the raw token
        assertThat(info.getCode()).isEqualTo("OEC");
        assertThat(info.getName()).isEqualTo("oecd");
        assertThat(info.getRegion()).isEqualTo("Other");
    }

    @Test
    void testResolve_AggregateNames() {
        assertThat(resolver.resolve("OECD").getName()).isEqualTo("OECD Average");
        assertThat(resolver.resolve("EU").getName()).isEqualTo("European Union");
        assertThat(resolver.resolve("EU").getCode()).isEqualTo("EU");
    }

    @Test
    void testResolve_TrimsWhitespace() {
        assertThat(resolver.resolve("  usa ").getCode()).isEqualTo("USA");
    }

    @Test
    void testResolve_Null_Throws() {
        assertThatThrownBy(() -> resolver.resolve(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testIncomeGroupOf_OecdAggregate() {
        assertThat(resolver.incomeGroupOf("OECD")).isEqualTo("High Income");
        assertThat(resolver.incomeGroupOf("EU")).isEqualTo("Not Specified");
    }
}
