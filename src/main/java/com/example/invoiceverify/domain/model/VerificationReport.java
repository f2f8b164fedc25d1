package com.example.invoiceverify.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Domain DTO holding the arithmetic cross-check result for one document.
 * A report is either a success record carrying every intermediate figure, or a failure record
 * carrying only the error message with zero confidence and no margin.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"verified", "error", "confidence", "error_margin", "extracted_subtotal",
        "computed_subtotal", "extracted_total", "computed_total", "gst", "discount"})
public record VerificationReport(
        boolean verified,
        String error,
        double confidence,
        @JsonInclude(JsonInclude.Include.ALWAYS) @JsonProperty("error_margin") Double errorMargin,
        @JsonProperty("extracted_subtotal") Double extractedSubtotal,
        @JsonProperty("computed_subtotal") Double computedSubtotal,
        @JsonProperty("extracted_total") Double extractedTotal,
        @JsonProperty("computed_total") Double computedTotal,
        Double gst,
        Double discount
) {

    /**
     * Creates a success record.
     *
     * @return report without an error message
     */
    public static VerificationReport success(boolean verified,
                                             double confidence,
                                             double errorMargin,
                                             double extractedSubtotal,
                                             double computedSubtotal,
                                             double extractedTotal,
                                             double computedTotal,
                                             double gst,
                                             double discount) {
        return new VerificationReport(verified, null, confidence, errorMargin, extractedSubtotal,
                computedSubtotal, extractedTotal, computedTotal, gst, discount);
    }

    /**
     * Creates a failure record.
     *
     * @param error human readable reason why the figures could not be compared
     * @return unverified report with zero confidence and no margin
     */
    public static VerificationReport failure(String error) {
        return new VerificationReport(false, error, 0.0, null, null, null, null, null, null, null);
    }
}
