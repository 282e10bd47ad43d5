package com.careinsight.careinsight.imports;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts one staged record, keyed by expected field, into a {@link PatientRow}.
 * A cell that cannot be coerced becomes {@code null}; the row itself is never rejected.
 */
@Component
public class PatientRowTransformer {

    private static final Set<String> NULL_TOKENS = Set.of("none", "nan", "null");
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("uuuu-M-d"),
            strict("d/M/uuuu"),
            strict("M/d/uuuu"),
            strict("d-M-uuuu"),
            strict("M-d-uuuu"),
            strict("uuuu/M/d")
    );

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            strict("uuuu-MM-dd HH:mm:ss"),
            strict("uuuu-MM-dd HH:mm")
    );

    public PatientRow transform(Map<String, String> record) {
        return new PatientRow(
                text(record.get(ImportConstants.FIELD_PERSON_ID)),
                date(record.get(ImportConstants.FIELD_START_DATE)),
                date(record.get(ImportConstants.FIELD_END_DATE)),
                text(record.get(ImportConstants.FIELD_RISK_FACTORS)),
                text(record.get(ImportConstants.FIELD_GENDER)),
                number(record.get(ImportConstants.FIELD_AGE)),
                number(record.get(ImportConstants.FIELD_MNA)),
                number(record.get(ImportConstants.FIELD_BMI)),
                number(record.get(ImportConstants.FIELD_WEIGHT))
        );
    }

    String text(String value) {
        String trimmed = trimToNull(value);
        if (trimmed == null || NULL_TOKENS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return trimmed;
    }

    /**
     * First matching format wins; unparseable values yield {@code null}.
     */
    LocalDate date(String value) {
        String trimmed = text(value);
        if (trimmed == null) {
            return null;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(trimmed, format);
            } catch (DateTimeParseException ignored) {
                // try next format
            }
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(trimmed, format).toLocalDate();
            } catch (DateTimeParseException ignored) {
                // try next format
            }
        }
        return null;
    }

    Double number(String value) {
        String trimmed = trimToNull(value);
        if (trimmed == null || !DECIMAL_PATTERN.matcher(trimmed).matches()) {
            return null;
        }
        double parsed = Double.parseDouble(trimmed);
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            return null;
        }
        return parsed;
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }
}
