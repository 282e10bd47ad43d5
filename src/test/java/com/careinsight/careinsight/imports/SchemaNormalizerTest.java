package com.careinsight.careinsight.imports;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaNormalizerTest {

    @Test
    void shouldMapSpellingVariantsToOneKey() {
        assertEquals("startdate", SchemaNormalizer.normalize("Start date"));
        assertEquals("startdate", SchemaNormalizer.normalize("start_date"));
        assertEquals("startdate", SchemaNormalizer.normalize("StartDate"));
        assertEquals("startdate", SchemaNormalizer.normalize(" START-DATE "));
        assertEquals("mriskfactors", SchemaNormalizer.normalize("M-Risk Factors"));
        assertEquals("mriskfactors", SchemaNormalizer.normalize("m_risk_factors"));
        assertEquals("", SchemaNormalizer.normalize(null));
    }

    @Test
    void shouldMatchSourceHeaderAndDestinationColumnOnCanonicalKey() {
        Map<String, String> source = SchemaNormalizer.buildMapping(List.of("Start date"), List.of("Start Date"));
        Map<String, String> destination = SchemaNormalizer.buildMapping(List.of("Start date"), List.of("start_date"));

        assertEquals("Start Date", source.get("Start date"));
        assertEquals("start_date", destination.get("Start date"));
    }

    @Test
    void shouldPreferFirstMatchingCandidate() {
        Map<String, String> mapping = SchemaNormalizer.buildMapping(
                List.of("PersonID"), List.of("person_id", "PersonID", "PERSON-ID"));

        assertEquals("person_id", mapping.get("PersonID"));
    }

    @Test
    void shouldReportUnmatchedFieldsInExpectedOrder() {
        Map<String, String> mapping = SchemaNormalizer.buildMapping(
                ImportConstants.EXPECTED_COLUMNS, List.of("personid", "gender", "weight"));

        assertEquals(ImportConstants.EXPECTED_COLUMNS, List.copyOf(mapping.keySet()));
        assertNull(mapping.get(ImportConstants.FIELD_AGE));
        assertEquals(
                List.of("Start date", "End date", "M-Risk Factors", "Age", "MNA", "BMI"),
                SchemaNormalizer.missingFields(mapping)
        );
    }

    @Test
    void shouldTolerateNullCandidates() {
        Map<String, String> mapping = SchemaNormalizer.buildMapping(List.of("Age"), Arrays.asList(null, "AGE"));
        assertEquals("AGE", mapping.get("Age"));

        assertTrue(SchemaNormalizer.missingFields(SchemaNormalizer.buildMapping(List.of("Age"), null)).contains("Age"));
    }
}
