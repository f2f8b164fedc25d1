package com.example.invoiceverify.application.service;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Parses numbers written in plain decimal notation, the only form accepted for OCR amounts.
 */
final class NumericText {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private NumericText() {
    }

    /**
     * @param raw text to parse, surrounding whitespace ignored
     * @return parsed value, or empty when the text is not a finite decimal number
     */
    static OptionalDouble parse(String raw) {
        if (raw == null) {
            return OptionalDouble.empty();
        }
        String trimmed = raw.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            return OptionalDouble.empty();
        }
        double value = Double.parseDouble(trimmed);
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /**
     * Same as {@link #parse(String)} after removing thousands separators.
     */
    static OptionalDouble parseAmount(String raw) {
        return raw == null ? OptionalDouble.empty() : parse(raw.replace(",", ""));
    }
}
