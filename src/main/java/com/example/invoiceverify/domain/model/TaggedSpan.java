package com.example.invoiceverify.domain.model;

/**
 * A span of document text recognized as a named entity.
 */
public record TaggedSpan(
        String text,
        EntityCategory category
) {
}
