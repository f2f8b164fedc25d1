package com.example.invoiceverify.application.service;

import com.example.invoiceverify.config.InvoiceProperties;
import com.example.invoiceverify.domain.model.LineItem;
import com.example.invoiceverify.domain.model.WordRecord;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests covering the row reconstruction scan.
 */
class LineItemExtractionServiceTest {

    private final LineItemExtractionService service = new LineItemExtractionService(InvoiceProperties.defaults());

    @Test
    void rowWithMatchingArithmeticIsValid() {
        List<LineItem> items = service.extract(words("1", "Steel", "Rod", "2", "100", "200"));

        assertThat(items).hasSize(1);
        LineItem item = items.get(0);
        assertThat(item.description()).isEqualTo("Steel Rod");
        assertThat(item.qty()).isEqualTo(2.0);
        assertThat(item.unitPrice()).isEqualTo(100.0);
        assertThat(item.rowTotal()).isEqualTo(200.0);
        assertThat(item.valid()).isTrue();
    }

    @Test
    void rowOffByFiveIsInvalid() {
        List<LineItem> items = service.extract(words("1", "Steel", "Rod", "2", "100", "205"));

        assertThat(items).singleElement().satisfies(item -> assertThat(item.valid()).isFalse());
    }

    @Test
    void thousandsSeparatorsAreIgnored() {
        List<LineItem> items = service.extract(words("1", "Laptop", "Pro", "2", "1,250.50", "2,501.00"));

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.unitPrice()).isEqualTo(1250.50);
            assertThat(item.rowTotal()).isEqualTo(2501.0);
            assertThat(item.valid()).isTrue();
        });
    }

    @Test
    void candidateWithTooFewNumericTokensIsDropped() {
        assertThat(service.extract(words("1", "Freight", "charges", "extra", "50"))).isEmpty();
    }

    @Test
    void candidateWithoutRowTotalIsDropped() {
        assertThat(service.extract(words("1", "Freight", "charges", "2", "50"))).isEmpty();
    }

    @Test
    void unparsableNumbersDropOnlyThatCandidate() {
        List<LineItem> items = service.extract(words(
                "1", "Bolt", "M8", "2x", "10", "20",
                "2", "Nut", "Hex", "4", "5", "20"));

        assertThat(items).extracting(LineItem::description).contains("Nut Hex");
        assertThat(items).extracting(LineItem::description).doesNotContain("Bolt M8");
    }

    /**
     * A rejected or accepted candidate does not skip the words inside its window.
     */
    @Test
    void overlappingCandidatesAreAllConsidered() {
        List<LineItem> items = service.extract(words("1", "Steel", "Rod", "2", "100", "200", "5", "7"));

        assertThat(items).extracting(LineItem::description)
                .containsExactly("Steel Rod", "100 200", "200 5");
    }

    @Test
    void windowIsBoundedToEightWords() {
        List<LineItem> items = service.extract(words("1", "a", "b", "c", "d", "e", "f", "g", "3", "4", "12"));

        assertThat(items).isEmpty();
    }

    @Test
    void windowIsClippedAtTheEndOfTheDocument() {
        List<LineItem> items = service.extract(words("Total", "7", "3", "4", "12"));

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.description()).isEqualTo("3 4");
            assertThat(item.qty()).isEqualTo(3.0);
            assertThat(item.unitPrice()).isEqualTo(4.0);
            assertThat(item.rowTotal()).isEqualTo(12.0);
            assertThat(item.valid()).isTrue();
        });
    }

    @Test
    void rowToleranceIsConfigurable() {
        LineItemExtractionService strict = new LineItemExtractionService(new InvoiceProperties(null,
                new InvoiceProperties.Extraction(null, null, null, null, null, 0.5, null), null, null, null));

        List<LineItem> items = strict.extract(words("1", "Steel", "Rod", "2", "100", "201"));

        assertThat(items).singleElement().satisfies(item -> assertThat(item.valid()).isFalse());
    }

    @Test
    void emptyInputYieldsNoItems() {
        assertThat(service.extract(List.of())).isEmpty();
        assertThat(service.extract(null)).isEmpty();
    }

    private static List<WordRecord> words(String... texts) {
        return Arrays.stream(texts)
                .map(text -> new WordRecord(text, 0, 0, 10, 10, 95.0))
                .toList();
    }
}
