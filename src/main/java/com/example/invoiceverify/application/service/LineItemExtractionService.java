package com.example.invoiceverify.application.service;

import com.example.invoiceverify.config.InvoiceProperties;
import com.example.invoiceverify.domain.model.LineItem;
import com.example.invoiceverify.domain.model.WordRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Application-layer service that reconstructs invoice table rows from a flat word sequence.
 * <p>
 * Every all-digit word (serial number, HSN/SAC code) opens a candidate row. The candidate looks at a
 * bounded window starting at that word; the digit-bearing tokens of the window supply quantity,
 * unit price and row total in that order. A rejected candidate never advances the scan past its own
 * window, so candidates may overlap.
 */
@Service
public class LineItemExtractionService {

    private static final Logger log = LoggerFactory.getLogger(LineItemExtractionService.class);
    private static final int DESCRIPTION_START = 1;
    private static final int DESCRIPTION_END = 3;

    private final int windowSize;
    private final int minNumericTokens;
    private final double rowTolerance;

    /**
     * @param properties externalized extraction settings (window size, numeric threshold, row tolerance)
     */
    public LineItemExtractionService(InvoiceProperties properties) {
        InvoiceProperties.Extraction extraction = properties.extraction();
        this.windowSize = extraction.windowSize();
        this.minNumericTokens = extraction.minNumericTokens();
        this.rowTolerance = extraction.rowTolerance();
    }

    /**
     * Scans the words once, left to right.
     *
     * @param words document words, all pages concatenated in page order
     * @return accepted line items in detection order, possibly empty
     */
    public List<LineItem> extract(List<WordRecord> words) {
        if (words == null || words.isEmpty()) {
            return List.of();
        }
        List<LineItem> items = new ArrayList<>();
        for (int index = 0; index < words.size(); index++) {
            if (!words.get(index).isAllDigits()) {
                continue;
            }
            int end = Math.min(index + windowSize, words.size());
            parseCandidate(words.subList(index, end), index).ifPresent(items::add);
        }
        return List.copyOf(items);
    }

    /**
     * Tries to turn one window into a line item.
     *
     * @param window words starting at the row-start token
     * @param index  position of the row-start token, for logging
     * @return parsed item, or empty when the window does not look like a row
     */
    Optional<LineItem> parseCandidate(List<WordRecord> window, int index) {
        List<String> numericTokens = window.stream()
                .filter(WordRecord::containsDigit)
                .map(WordRecord::text)
                .toList();
        if (numericTokens.size() < minNumericTokens) {
            return Optional.empty();
        }
        if (numericTokens.size() < 4) {
            log.debug("Row candidate at word {} has no row total token", index);
            return Optional.empty();
        }

        OptionalDouble qty = NumericText.parseAmount(numericTokens.get(1));
        OptionalDouble unitPrice = NumericText.parseAmount(numericTokens.get(2));
        OptionalDouble rowTotal = NumericText.parseAmount(numericTokens.get(3));
        if (qty.isEmpty() || unitPrice.isEmpty() || rowTotal.isEmpty()) {
            log.debug("Discarding row candidate at word {}: unparsable numbers {}", index, numericTokens.subList(1, 4));
            return Optional.empty();
        }

        return Optional.of(LineItem.of(description(window), qty.getAsDouble(), unitPrice.getAsDouble(),
                rowTotal.getAsDouble(), rowTolerance));
    }

    private String description(List<WordRecord> window) {
        int end = Math.min(DESCRIPTION_END, window.size());
        if (end <= DESCRIPTION_START) {
            return "";
        }
        return String.join(" ", window.subList(DESCRIPTION_START, end).stream().map(WordRecord::text).toList());
    }
}
