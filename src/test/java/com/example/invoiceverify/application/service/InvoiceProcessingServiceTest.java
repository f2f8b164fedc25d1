package com.example.invoiceverify.application.service;

import com.example.invoiceverify.application.exception.UseCaseValidationException;
import com.example.invoiceverify.config.InvoiceProperties;
import com.example.invoiceverify.domain.exception.DocumentInputMissingException;
import com.example.invoiceverify.domain.model.BatchSummary;
import com.example.invoiceverify.domain.model.FieldNames;
import com.example.invoiceverify.domain.model.FieldSet;
import com.example.invoiceverify.domain.model.FieldValue;
import com.example.invoiceverify.domain.model.LineItem;
import com.example.invoiceverify.domain.model.VerificationReport;
import com.example.invoiceverify.infrastructure.nlp.GazetteerEntityTagger;
import com.example.invoiceverify.infrastructure.storage.DocumentArtifactStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests the stage drivers and the batch run against files in a temporary directory.
 */
class InvoiceProcessingServiceTest {

    @TempDir
    Path workDir;

    private Path ocrDir;
    private Path outputDir;
    private InvoiceProcessingService service;

    @BeforeEach
    void setUp() throws IOException {
        ocrDir = Files.createDirectories(workDir.resolve("ocr"));
        outputDir = workDir.resolve("out");
        InvoiceProperties properties = new InvoiceProperties(
                new InvoiceProperties.Storage(ocrDir, outputDir),
                null,
                null,
                new InvoiceProperties.Entities(List.of("Acme Traders", "Globex Retail"), List.of("Mumbai", "Pune")),
                null);
        DocumentArtifactStore store = new DocumentArtifactStore(new ObjectMapper(), properties);
        service = new InvoiceProcessingService(
                store,
                new FieldExtractionService(new GazetteerEntityTagger(properties), properties),
                new LineItemExtractionService(properties),
                new VerificationService(properties));
    }

    @Test
    void extractFieldsReadsPagesInNumericOrder() throws IOException {
        writePage("inv_a", 10, "\"Mumbai\"");
        writePage("inv_a", 2, "\"Date:\", \"01/02/2024\", \"Globex\", \"Retail\", \"Pune\"");
        writePage("inv_a", 1, "\"Invoice\", \"No:\", \"INV-9\", \"Acme\", \"Traders\"");

        FieldSet fields = service.extractFields("inv_a");

        assertThat(fields.get(FieldNames.INVOICE_NUMBER).map(FieldValue::value)).contains("INV-9");
        assertThat(fields.get(FieldNames.DATE).map(FieldValue::value)).contains("01/02/2024");
        assertThat(fields.get(FieldNames.BILL_TO).map(FieldValue::value)).contains("Acme Traders");
        assertThat(fields.get(FieldNames.SHIP_TO).map(FieldValue::value)).contains("Globex Retail");
        assertThat(fields.get(FieldNames.BILL_TO_ADDRESS).map(FieldValue::value)).contains("Pune");
        assertThat(fields.get(FieldNames.SHIP_TO_ADDRESS).map(FieldValue::value)).contains("Mumbai");
        assertThat(outputDir.resolve("inv_a_fields.json")).exists();
    }

    @Test
    void extractLineItemsConcatenatesPages() throws IOException {
        writePage("inv_b", 1, "\"1\", \"Steel\", \"Rod\"");
        writePage("inv_b", 2, "\"2\", \"100\", \"200\"");

        List<LineItem> items = service.extractLineItems("inv_b");

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.description()).isEqualTo("Steel Rod");
            assertThat(item.rowTotal()).isEqualTo(200.0);
        });
        assertThat(outputDir.resolve("inv_b_lineitems.json")).exists();
    }

    @Test
    void stagesWithoutPagesReportMissingInput() {
        assertThrows(DocumentInputMissingException.class, () -> service.extractFields("ghost"));
        assertThrows(DocumentInputMissingException.class, () -> service.extractLineItems("ghost"));
    }

    @Test
    void verificationWithoutLineItemsWritesNothing() throws IOException {
        writePage("inv_c", 1, "\"Invoice\", \"No:\", \"INV-3\"");
        service.extractFields("inv_c");

        assertThrows(DocumentInputMissingException.class, () -> service.verifyDocument("inv_c"));
        assertThat(outputDir.resolve("inv_c_verifiability_report.json")).doesNotExist();
    }

    @Test
    void suppliedAmountsFlowIntoVerification() throws IOException {
        writePage("inv_d", 1, "\"Invoice\", \"No:\", \"INV-4\", \"1\", \"Steel\", \"Rod\", \"3\", \"100\", \"300\", "
                + "\"Thank\", \"you\"");
        service.extractFields("inv_d");
        service.extractLineItems("inv_d");
        Map<String, String> amounts = new LinkedHashMap<>();
        amounts.put("subtotal", "300");
        amounts.put("gst_amount", "54");
        amounts.put("discount", "0");
        amounts.put("total", "354");

        FieldSet merged = service.supplyAmounts("inv_d", amounts);
        VerificationReport report = service.verifyDocument("inv_d");

        assertThat(merged.get(FieldNames.INVOICE_NUMBER).map(FieldValue::value)).contains("INV-4");
        assertThat(merged.get(FieldNames.TOTAL)).contains(FieldValue.of("354", 1.0));
        assertThat(report.computedSubtotal()).isEqualTo(300.0);
        assertThat(report.verified()).isTrue();
        assertThat(outputDir.resolve("inv_d_verifiability_report.json")).exists();
    }

    @Test
    void unknownAmountNamesAreRejected() {
        assertThrows(UseCaseValidationException.class,
                () -> service.supplyAmounts("inv_e", Map.of("grand_total", "10")));
        assertThrows(UseCaseValidationException.class, () -> service.supplyAmounts("inv_e", Map.of()));
    }

    @Test
    void amountsNeedExtractedFields() {
        assertThrows(DocumentInputMissingException.class,
                () -> service.supplyAmounts("inv_f", Map.of("total", "10")));
    }

    /**
     * One broken page file must not stop the remaining documents.
     *
     * @throws IOException when fixtures cannot be written
     */
    @Test
    void batchIsolatesFailingDocuments() throws IOException {
        writePage("alpha", 1, "\"Invoice\", \"No:\", \"A-1\"");
        Files.writeString(ocrDir.resolve("broken_page_1_raw.json"), "{not json", StandardCharsets.UTF_8);
        writePage("zeta", 1, "\"Invoice\", \"No:\", \"Z-1\"");

        BatchSummary summary = service.runBatch();

        assertThat(summary.documents()).isEqualTo(3);
        assertThat(summary.failed()).containsExactly("broken");
        assertThat(summary.fieldsExtracted()).isEqualTo(2);
        assertThat(summary.lineItemsExtracted()).isEqualTo(2);
        assertThat(summary.verified()).isZero();
        assertThat(outputDir.resolve("alpha_verifiability_report.json")).exists();
        assertThat(outputDir.resolve("zeta_verifiability_report.json")).exists();
        assertThat(outputDir.resolve("broken_fields.json")).doesNotExist();
    }

    @Test
    void discoverPrefixesListsEachDocumentOnce() throws IOException {
        writePage("inv_2024_07", 1, "");
        writePage("inv_2024_07", 2, "");
        writePage("other", 1, "");
        Files.writeString(ocrDir.resolve("notes.txt"), "ignore me", StandardCharsets.UTF_8);

        assertThat(service.discoverPrefixes()).containsExactly("inv_2024_07", "other");
    }

    private void writePage(String prefix, int page, String quotedWords) throws IOException {
        StringBuilder json = new StringBuilder("[");
        if (!quotedWords.isEmpty()) {
            String[] words = quotedWords.split(",\\s*");
            for (int i = 0; i < words.length; i++) {
                if (i > 0) {
                    json.append(',');
                }
                json.append("{\"text\": ").append(words[i])
                        .append(", \"left\": ").append(i * 40)
                        .append(", \"top\": 10, \"width\": 35, \"height\": 12, \"conf\": 91.5}");
            }
        }
        json.append(']');
        Files.writeString(ocrDir.resolve(prefix + "_page_" + page + "_raw.json"), json, StandardCharsets.UTF_8);
    }
}
