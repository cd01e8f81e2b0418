package edustats.oecd.pipeline.service;

import edustats.oecd.pipeline.config.PipelineConfig;
import edustats.oecd.pipeline.model.DatasetKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TableNamingService
 * Tests configured table name validation and sanitization
 */
class TableNamingServiceTest {

    private PipelineConfig config;
    private TableNamingService tableNamingService;

    @BeforeEach
    void setUp() {
        config = new PipelineConfig();
        tableNamingService = new TableNamingService(config);
    }

    // ========== configured names ==========

    @Test
    void testFactTable_Defaults() {
        assertEquals("enrollment_data", tableNamingService.factTable(DatasetKind.ENROLLMENT));
        assertEquals("graduation_data", tableNamingService.factTable(DatasetKind.GRADUATION));
        assertEquals("spending_data", tableNamingService.factTable(DatasetKind.SPENDING));
        assertEquals("country_metadata", tableNamingService.countryTable());
    }

    @Test
    void testFactTable_ConfiguredName() {
        // Given: custom table name
        config.getTables().setEnrollment("edu_enrollment_v2");

        // When / Then
        assertEquals("edu_enrollment_v2", tableNamingService.factTable(DatasetKind.ENROLLMENT));
    }

    @Test
    void testCountryTable_UnsafeName_Rejected() {
        // Given: injection attempt
        config.getTables().setCountries("countries; DROP TABLE x");

        // When / Then
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> tableNamingService.countryTable());
        assertTrue(e.getMessage().contains("countries_drop_table_x"));
    }

    // ========== requireSafeIdentifier Tests ==========

    @Test
    void testRequireSafeIdentifier_UpperCase_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> tableNamingService.requireSafeIdentifier("Spending"));
    }

    @Test
    void testRequireSafeIdentifier_LeadingDigit_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> tableNamingService.requireSafeIdentifier("2023_data"));
    }

    @Test
    void testRequireSafeIdentifier_Blank_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> tableNamingService.requireSafeIdentifier(" "));
        assertThrows(IllegalArgumentException.class, () -> tableNamingService.requireSafeIdentifier(null));
    }

    @Test
    void testRequireSafeIdentifier_TooLong_Rejected() {
        String longName = "a".repeat(64);
        assertThrows(IllegalArgumentException.class, () -> tableNamingService.requireSafeIdentifier(longName));
        assertEquals("a".repeat(63), tableNamingService.requireSafeIdentifier("a".repeat(63)));
    }

    // ========== sanitizeTableName Tests ==========

    @Test
    void testSanitizeTableName() {
        assertEquals("enrollment_data", tableNamingService.sanitizeTableName("Enrollment-Data"));
        assertEquals("country_metadata", tableNamingService.sanitizeTableName("COUNTRY__METADATA"));
        assertEquals("spending", tableNamingService.sanitizeTableName("_spending_"));
        assertEquals("", tableNamingService.sanitizeTableName(null));
    }
}
