package com.example.invoiceverify.interfaces.api;

import com.example.invoiceverify.domain.model.FieldSet;
import com.example.invoiceverify.domain.model.LineItem;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * API-layer body for verifying figures that were not produced by the stored pipeline.
 */
public record VerificationRequest(
        FieldSet fields,
        @JsonProperty("line_items") List<LineItem> lineItems
) {
}
