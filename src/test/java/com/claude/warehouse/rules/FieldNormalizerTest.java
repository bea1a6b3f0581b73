package com.claude.warehouse.rules;

import com.claude.warehouse.domain.Gender;
import com.claude.warehouse.domain.MaintenanceFlag;
import com.claude.warehouse.domain.MaritalStatus;
import com.claude.warehouse.domain.ProductLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class FieldNormalizerTest {

    private final FieldNormalizer normalizer = new FieldNormalizer();

    // ========== Marital Status Tests ==========

    @ParameterizedTest
    @CsvSource({
            "S, SINGLE",
            "M, MARRIED",
            "' s ', SINGLE",
            "m, MARRIED",
            "X, UNKNOWN",
            "Married, UNKNOWN"
    })
    @DisplayName("Should map marital status codes to the canonical vocabulary")
    void testMaritalStatus(String raw, MaritalStatus expected) {
        assertEquals(expected, normalizer.maritalStatus(raw));
    }

    @Test
    @DisplayName("Should strip line breaks before comparing marital status")
    void testMaritalStatusWithLineBreak() {
        assertEquals(MaritalStatus.MARRIED, normalizer.maritalStatus("M\r\n"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "\n"})
    @DisplayName("Should map missing marital status to Unknown")
    void testMissingMaritalStatus(String raw) {
        assertEquals(MaritalStatus.UNKNOWN, normalizer.maritalStatus(raw));
    }

    // ========== Gender Tests ==========

    @ParameterizedTest
    @CsvSource({
            "F, FEMALE",
            "female, FEMALE",
            "' Female ', FEMALE",
            "M, MALE",
            "MALE, MALE",
            "male, MALE",
            "?, UNKNOWN",
            "X, UNKNOWN"
    })
    @DisplayName("Should map gender codes and words to the canonical vocabulary")
    void testGender(String raw, Gender expected) {
        assertEquals(expected, normalizer.gender(raw));
    }

    @Test
    @DisplayName("Should map gender with embedded control characters")
    void testGenderWithControlCharacters() {
        assertEquals(Gender.FEMALE, normalizer.gender("F\r"));
        assertEquals(Gender.MALE, normalizer.gender("\nMale\r\n"));
        assertEquals(Gender.UNKNOWN, normalizer.gender(null));
    }

    @Test
    @DisplayName("Should strip every control character before comparing codes")
    void testCodesWithNonLineControlCharacters() {
        assertEquals(Gender.FEMALE, normalizer.gender("F\u0000"));
        assertEquals(Gender.MALE, normalizer.gender("M\u0007ALE"));
        assertEquals(Gender.FEMALE, normalizer.gender("\tfe\u001Bmale "));
        assertEquals(MaritalStatus.SINGLE, normalizer.maritalStatus("\u0000S\u007F"));
    }

    // ========== Product Line Tests ==========

    @ParameterizedTest
    @CsvSource({
            "M, MOUNTAIN",
            "r, ROAD",
            "' T ', TOURING",
            "S, OTHER",
            "Road, OTHER"
    })
    @DisplayName("Should map product line codes, anything else is Other")
    void testProductLine(String raw, ProductLine expected) {
        assertEquals(expected, normalizer.productLine(raw));
    }

    @Test
    @DisplayName("Should map missing product line to Other")
    void testMissingProductLine() {
        assertEquals(ProductLine.OTHER, normalizer.productLine(null));
        assertEquals("Other", normalizer.productLine("").getLabel());
    }

    // ========== Maintenance Flag Tests ==========

    @ParameterizedTest
    @CsvSource({
            "Yes, YES",
            "y, YES",
            "1, YES",
            "TRUE, YES",
            "no, NO",
            "N, NO",
            "0, NO",
            "false, NO",
            "maybe, UNKNOWN"
    })
    @DisplayName("Should map maintenance flag variants to Yes/No/Unknown")
    void testMaintenanceFlag(String raw, MaintenanceFlag expected) {
        assertEquals(expected, normalizer.maintenanceFlag(raw));
    }

    // ========== Country Tests ==========

    @ParameterizedTest
    @CsvSource({
            "DE, Germany",
            "'de ', Germany",
            "US, United States",
            "USA, United States",
            "Australia, Australia",
            "' Canada ', Canada",
            "'  ', n/a"
    })
    @DisplayName("Should standardize country codes and clean other values")
    void testCountry(String raw, String expected) {
        assertEquals(expected, normalizer.country(raw));
    }

    @Test
    @DisplayName("Should keep null country as null")
    void testNullCountry() {
        assertNull(normalizer.country(null));
        assertEquals("United States", normalizer.country("USA\r"));
    }

    // ========== Demographic Key Tests ==========

    @Test
    @DisplayName("Should drop the leading tag from keys ending with NAS")
    void testDemographicKeyWithTag() {
        assertEquals("123-NAS", normalizer.demographicCustomerKey("AB-123-NAS"));
    }

    @ParameterizedTest
    @CsvSource({
            "AW00011000, AW00011000",
            "' AW00011001 ', AW00011001",
            "NASAW00011000, NASAW00011000",
            "XYZNAS, NAS"
    })
    @DisplayName("Should only rewrite keys whose cleaned value ends with NAS")
    void testDemographicKey(String raw, String expected) {
        assertEquals(expected, normalizer.demographicCustomerKey(raw));
    }

    @Test
    @DisplayName("Should treat blank demographic keys as missing")
    void testBlankDemographicKey() {
        assertNull(normalizer.demographicCustomerKey(null));
        assertNull(normalizer.demographicCustomerKey("  "));
        assertNull(normalizer.demographicCustomerKey("NAS"));
    }
}
