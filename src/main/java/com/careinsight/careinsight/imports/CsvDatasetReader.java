package com.careinsight.careinsight.imports;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses a staged file into a {@link StagedDataset}, trying comma delimiting first and
 * falling back to tab delimiting.
 */
@Component
public class CsvDatasetReader {

    private static final Logger log = LoggerFactory.getLogger(CsvDatasetReader.class);

    private static final char COMMA = ',';
    private static final char TAB = '\t';
    private static final char BOM = '\uFEFF';

    /**
     * Reads and parses the file.
     *
     * @throws MalformedImportFileException when the content is empty, not UTF-8, or unparseable
     *                                      under both delimiters
     */
    public StagedDataset read(Path file) {
        String content = readContent(file);
        if (content.isBlank()) {
            throw new MalformedImportFileException(ImportConstants.MSG_PARSE_FAILED.formatted(ImportConstants.MSG_FILE_EMPTY));
        }

        try {
            StagedDataset commaSeparated = parse(content, COMMA);
            if (commaSeparated.headers().size() > 1 || firstLine(content).indexOf(TAB) < 0) {
                return commaSeparated;
            }
            log.debug("Single column under comma delimiting for {}, retrying with tab", file.getFileName());
        } catch (MalformedImportFileException ex) {
            log.debug("Comma parse failed for {}: {}", file.getFileName(), ex.getMessage());
        }

        try {
            return parse(content, TAB);
        } catch (MalformedImportFileException ex) {
            throw new MalformedImportFileException(ImportConstants.MSG_PARSE_FAILED.formatted(ex.getMessage()), ex);
        }
    }

    private String readContent(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return !content.isEmpty() && content.charAt(0) == BOM ? content.substring(1) : content;
        } catch (CharacterCodingException ex) {
            throw new MalformedImportFileException(ImportConstants.MSG_PARSE_FAILED.formatted(ImportConstants.MSG_NOT_UTF8), ex);
        } catch (NoSuchFileException ex) {
            throw new InvalidTokenException();
        } catch (IOException ex) {
            throw new IllegalStateException(ImportConstants.MSG_READ_FAILED.formatted(file.getFileName()), ex);
        }
    }

    private StagedDataset parse(String content, char delimiter) {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .build();

        try (CSVParser parser = csvFormat.parse(new StringReader(content))) {
            List<String> headers = null;
            List<List<String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                if (headers == null) {
                    headers = uniqueHeaders(record);
                    continue;
                }
                if (record.size() > headers.size()) {
                    throw new MalformedImportFileException(ImportConstants.MSG_TOO_MANY_FIELDS.formatted(
                            headers.size(), record.getRecordNumber(), record.size()));
                }
                List<String> row = new ArrayList<>(headers.size());
                for (int i = 0; i < headers.size(); i++) {
                    row.add(i < record.size() ? cellValue(record.get(i)) : null);
                }
                rows.add(row);
            }
            if (headers == null) {
                throw new MalformedImportFileException(ImportConstants.MSG_FILE_EMPTY);
            }
            return new StagedDataset(headers, rows);
        } catch (IOException | UncheckedIOException | IllegalStateException ex) {
            throw new MalformedImportFileException(ex.getMessage(), ex);
        }
    }

    /**
     * Blank headers become {@code Unnamed: i}; repeats get a {@code .n} suffix.
     */
    private List<String> uniqueHeaders(CSVRecord headerRecord) {
        List<String> headers = new ArrayList<>(headerRecord.size());
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < headerRecord.size(); i++) {
            String header = headerRecord.get(i);
            if (header == null || header.isBlank()) {
                header = ImportConstants.UNNAMED_COLUMN_PREFIX + i;
            }
            String candidate = header;
            int count = seen.getOrDefault(header, 0);
            while (headers.contains(candidate)) {
                count++;
                candidate = header + "." + count;
            }
            seen.put(header, count);
            headers.add(candidate);
        }
        return headers;
    }

    private String cellValue(String raw) {
        if (raw == null || ImportConstants.MISSING_VALUE_MARKERS.contains(raw)) {
            return null;
        }
        return raw;
    }

    private String firstLine(String content) {
        for (String line : content.split("\\R")) {
            if (!line.isBlank()) {
                return line;
            }
        }
        return "";
    }
}
