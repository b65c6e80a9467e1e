package com.listing.reconciliation.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VariantSpecExtractor Tests")
class VariantSpecExtractorTest {

    private final VariantSpecExtractor extractor = new VariantSpecExtractor();

    @Nested
    @DisplayName("extract")
    class Extract {

        @Test
        @DisplayName("Should split horsepower, transmission, drive and engine code from the core variant")
        void fullAudiVariant() {
            VariantSpecs specs = extractor.extract("2.0 TDI 150 HK DSG quattro");

            assertEquals("2.0", specs.coreVariant());
            assertEquals(150, specs.horsepower());
            assertEquals("automatic", specs.transmission());
            assertTrue(specs.awd());
        }

        @Test
        @DisplayName("Should strip fuel markers")
        void stripsFuelMarkers() {
            assertEquals("1.5", extractor.extract("1.5 Hybrid").coreVariant());
            assertEquals("50", extractor.extract("50 e-tron").coreVariant());
            assertEquals("1.4 style", extractor.extract("1.4 eTSI Style mild hybrid").coreVariant());
        }

        @Test
        @DisplayName("Should leave a plain trim name untouched apart from normalization")
        void plainTrim() {
            VariantSpecs specs = extractor.extract("  Active   Plus ");

            assertEquals("active plus", specs.coreVariant());
            assertNull(specs.horsepower());
            assertNull(specs.transmission());
            assertFalse(specs.awd());
        }

        @Test
        @DisplayName("Blank variant yields an empty core")
        void blankVariant() {
            assertEquals("", extractor.extract(null).coreVariant());
            assertEquals("", extractor.extract("   ").coreVariant());
        }

        @ParameterizedTest
        @CsvSource({
                "1.0 TSI 110 hp manual, manual",
                "1.0 TSI 110 hp Manuel, manual",
                "35 TFSI S tronic, automatic",
                "35 TFSI S-tronic, automatic",
                "1.5 automatgear, automatic",
                "xDrive30d Automatik, automatic"
        })
        @DisplayName("Should recognise transmission spellings")
        void transmissions(String variant, String expected) {
            assertEquals(expected, extractor.extract(variant).transmission());
        }

        @ParameterizedTest
        @CsvSource({"quattro", "4MOTION", "AWD", "4wd", "xDrive", "Allrad"})
        @DisplayName("Should recognise all-wheel-drive markers")
        void awdMarkers(String marker) {
            assertTrue(extractor.extract("2.0 " + marker).awd());
        }
    }

    @Nested
    @DisplayName("compositeKey")
    class CompositeKey {

        @Test
        @DisplayName("Spellings of the same trim share a composite key")
        void sameTrimSameKey() {
            String a = extractor.compositeKey("Audi", "A4", "2.0 TDI 150 HK DSG quattro", null, null);
            String b = extractor.compositeKey("AUDI", "a4", "2.0 150hp S tronic Quattro", null, null);

            assertEquals("audi|a4|2.0|150hp|automatic|awd", a);
            assertEquals(a, b);
        }

        @Test
        @DisplayName("Explicit attributes take precedence over parsed specs")
        void explicitAttributesWin() {
            String key = extractor.compositeKey("VW", "Golf", "1.5 TSI 130 HK", 150, "Automatic");

            assertEquals("vw|golf|1.5|150hp|automatic", key);
        }

        @Test
        @DisplayName("Different horsepower gives a different key")
        void horsepowerSeparates() {
            assertNotEquals(
                    extractor.compositeKey("VW", "Golf", "1.5 TSI 130 HK", null, null),
                    extractor.compositeKey("VW", "Golf", "1.5 TSI 150 HK", null, null));
        }
    }

    @ParameterizedTest
    @CsvSource({
            "Automatic, automatic",
            "automatgear, automatic",
            "DSG, automatic",
            "Manual, manual",
            "CVT, cvt"
    })
    @DisplayName("canonicalTransmission maps attribute values")
    void canonicalTransmission(String value, String expected) {
        assertEquals(expected, VariantSpecExtractor.canonicalTransmission(value));
    }

    @Test
    @DisplayName("canonicalTransmission returns null for blank values")
    void canonicalTransmissionBlank() {
        assertNull(VariantSpecExtractor.canonicalTransmission(null));
        assertNull(VariantSpecExtractor.canonicalTransmission(" "));
    }
}
