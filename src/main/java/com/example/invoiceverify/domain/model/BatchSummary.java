package com.example.invoiceverify.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome counters of one batch run over every discovered document.
 */
public record BatchSummary(
        int documents,
        @JsonProperty("fields_extracted") int fieldsExtracted,
        @JsonProperty("line_items_extracted") int lineItemsExtracted,
        int verified,
        int skipped,
        List<String> failed
) {

    public BatchSummary {
        failed = failed == null ? List.of() : List.copyOf(failed);
    }
}
