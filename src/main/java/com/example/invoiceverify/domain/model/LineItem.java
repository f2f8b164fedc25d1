package com.example.invoiceverify.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Domain DTO describing one invoice table row reconstructed from word records.
 * {@code valid} records whether quantity times unit price lands close to the row total.
 */
@JsonPropertyOrder({"description", "qty", "unit_price", "row_total", "valid"})
public record LineItem(
        String description,
        double qty,
        @JsonProperty("unit_price") double unitPrice,
        @JsonProperty("row_total") double rowTotal,
        boolean valid
) {

    /**
     * Builds a line item and derives its validity flag.
     *
     * @param description text found next to the row start
     * @param qty         parsed quantity
     * @param unitPrice   parsed unit price
     * @param rowTotal    parsed row total
     * @param tolerance   absolute tolerance for {@code qty * unitPrice} against {@code rowTotal}
     * @return line item with {@code valid} computed
     */
    public static LineItem of(String description, double qty, double unitPrice, double rowTotal, double tolerance) {
        boolean valid = Math.abs(qty * unitPrice - rowTotal) < tolerance;
        return new LineItem(description, qty, unitPrice, rowTotal, valid);
    }
}
