package com.careinsight.careinsight.imports;

import java.time.LocalDate;

/**
 * Typed, coerced patient record ready for insertion. Every field may be {@code null}.
 */
public record PatientRow(
        String personId,
        LocalDate startDate,
        LocalDate endDate,
        String riskFactors,
        String gender,
        Double age,
        Double mna,
        Double bmi,
        Double weight
) {

    /**
     * Values in {@link ImportConstants#EXPECTED_COLUMNS} order.
     */
    public Object[] toParameters() {
        return new Object[]{personId, startDate, endDate, riskFactors, gender, age, mna, bmi, weight};
    }
}
