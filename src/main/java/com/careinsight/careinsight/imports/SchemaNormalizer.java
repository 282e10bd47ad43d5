package com.careinsight.careinsight.imports;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Canonicalizes column-name spellings so source headers, the expected schema and live
 * destination columns can be compared despite case, punctuation and whitespace differences.
 */
public final class SchemaNormalizer {

    private SchemaNormalizer() {
    }

    /**
     * Lowercases the name and drops every character that is not a letter or digit.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String lower = name.toLowerCase(Locale.ROOT);
        StringBuilder key = new StringBuilder(lower.length());
        lower.codePoints()
                .filter(Character::isLetterOrDigit)
                .forEach(key::appendCodePoint);
        return key.toString();
    }

    /**
     * Maps each expected field to the first candidate sharing its canonical key, or {@code null}.
     */
    public static Map<String, String> buildMapping(List<String> expectedFields, List<String> candidateNames) {
        Map<String, String> byKey = new LinkedHashMap<>();
        if (candidateNames != null) {
            for (String candidate : candidateNames) {
                byKey.putIfAbsent(normalize(candidate), candidate);
            }
        }

        Map<String, String> mapping = new LinkedHashMap<>();
        for (String expected : expectedFields) {
            mapping.put(expected, byKey.get(normalize(expected)));
        }
        return mapping;
    }

    public static List<String> missingFields(Map<String, String> mapping) {
        List<String> missing = new ArrayList<>();
        mapping.forEach((expected, actual) -> {
            if (actual == null) {
                missing.add(expected);
            }
        });
        return missing;
    }
}
