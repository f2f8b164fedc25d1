package com.example.invoiceverify.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Domain DTO for one OCR-recognized token together with its pixel bounding box.
 * Produced by the external OCR engine, one JSON array per page.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WordRecord(
        String text,
        int left,
        int top,
        int width,
        int height,
        @JsonProperty("conf") double confidence
) {

    public WordRecord {
        text = text == null ? "" : text;
    }

    /**
     * @return {@code true} when the token is non-empty and made of digits only
     */
    public boolean isAllDigits() {
        return !text.isEmpty() && text.chars().allMatch(Character::isDigit);
    }

    /**
     * @return {@code true} when the token contains at least one digit
     */
    public boolean containsDigit() {
        return text.chars().anyMatch(Character::isDigit);
    }
}
