package com.example.invoiceverify.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Domain DTO for a single extracted header datum.
 * A value is present exactly when it is non-null, and an absent value always carries zero confidence.
 */
@JsonPropertyOrder({"value", "confidence", "present"})
public record FieldValue(
        String value,
        double confidence,
        boolean present
) {

    private static final FieldValue ABSENT = new FieldValue(null, 0.0, false);

    public FieldValue {
        if (present != (value != null)) {
            throw new IllegalArgumentException("present must be true exactly when a value is set");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        if (!present && confidence != 0.0) {
            throw new IllegalArgumentException("an absent field cannot carry confidence");
        }
    }

    /**
     * Creates a present field value.
     *
     * @param value      extracted text, never {@code null}
     * @param confidence extraction confidence in [0, 1]
     * @return present field value
     */
    public static FieldValue of(String value, double confidence) {
        if (value == null) {
            throw new IllegalArgumentException("value is required for a present field");
        }
        return new FieldValue(value, confidence, true);
    }

    /**
     * @return the shared absent value with zero confidence
     */
    public static FieldValue absent() {
        return ABSENT;
    }
}
