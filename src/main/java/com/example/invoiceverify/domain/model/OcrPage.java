package com.example.invoiceverify.domain.model;

import java.util.List;

/**
 * Word records of one page, keyed by the page number parsed from {@code <prefix>_page_<n>_raw.json}.
 */
public record OcrPage(
        int pageNumber,
        List<WordRecord> words
) {

    public OcrPage {
        words = words == null ? List.of() : List.copyOf(words);
    }

    /**
     * @return the page text: word texts joined with single spaces, in the order the OCR engine returned them
     */
    public String text() {
        return String.join(" ", words.stream().map(WordRecord::text).toList());
    }
}
