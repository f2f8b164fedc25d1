package com.example.invoiceverify.domain.model;

/**
 * Categories reported by an {@link com.example.invoiceverify.domain.port.EntityTagger}.
 * {@link #ORGANIZATION} covers both companies and people.
 */
public enum EntityCategory {
    ORGANIZATION,
    LOCATION
}
