package com.careinsight.careinsight.imports;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed content of one staged file: unique header names plus rows aligned to them.
 * Missing cells are {@code null}.
 */
public record StagedDataset(List<String> headers, List<List<String>> rows) {

    public StagedDataset {
        headers = List.copyOf(headers);
        rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public int size() {
        return rows.size();
    }

    /**
     * Returns up to {@code limit} leading rows keyed by header, in header order.
     */
    public List<Map<String, String>> head(int limit) {
        int count = Math.min(Math.max(limit, 0), rows.size());
        List<Map<String, String>> preview = new ArrayList<>(count);
        for (int r = 0; r < count; r++) {
            List<String> row = rows.get(r);
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                values.put(headers.get(c), row.get(c));
            }
            preview.add(values);
        }
        return preview;
    }

    /**
     * Re-keys every row by expected field using an expected-to-header mapping.
     * Fields mapped to no header get a {@code null} value.
     */
    public List<Map<String, String>> project(Map<String, String> expectedToHeader) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        expectedToHeader.forEach((expected, header) ->
                positions.put(expected, header == null ? -1 : headers.indexOf(header)));

        List<Map<String, String>> projected = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            Map<String, String> values = new HashMap<>();
            positions.forEach((expected, index) -> values.put(expected, index < 0 ? null : row.get(index)));
            projected.add(values);
        }
        return projected;
    }
}
