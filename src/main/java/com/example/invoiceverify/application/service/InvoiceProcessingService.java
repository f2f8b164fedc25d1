package com.example.invoiceverify.application.service;

import com.example.invoiceverify.application.exception.UseCaseValidationException;
import com.example.invoiceverify.domain.exception.DocumentInputMissingException;
import com.example.invoiceverify.domain.model.BatchSummary;
import com.example.invoiceverify.domain.model.FieldNames;
import com.example.invoiceverify.domain.model.FieldSet;
import com.example.invoiceverify.domain.model.FieldValue;
import com.example.invoiceverify.domain.model.LineItem;
import com.example.invoiceverify.domain.model.OcrPage;
import com.example.invoiceverify.domain.model.VerificationReport;
import com.example.invoiceverify.domain.model.WordRecord;
import com.example.invoiceverify.infrastructure.storage.DocumentArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application-layer service that drives the extraction stages for stored documents.
 * Each stage reads its inputs from the {@link DocumentArtifactStore}, delegates to the matching
 * extraction or verification service, and replaces the stage's output artifact.
 */
@Service
public class InvoiceProcessingService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceProcessingService.class);
    private static final double SUPPLIED_AMOUNT_CONFIDENCE = 1.0;

    private final DocumentArtifactStore artifactStore;
    private final FieldExtractionService fieldExtractionService;
    private final LineItemExtractionService lineItemExtractionService;
    private final VerificationService verificationService;

    public InvoiceProcessingService(DocumentArtifactStore artifactStore,
                                    FieldExtractionService fieldExtractionService,
                                    LineItemExtractionService lineItemExtractionService,
                                    VerificationService verificationService) {
        this.artifactStore = artifactStore;
        this.fieldExtractionService = fieldExtractionService;
        this.lineItemExtractionService = lineItemExtractionService;
        this.verificationService = verificationService;
    }

    /**
     * @return prefixes of every document with OCR output, sorted
     */
    public List<String> discoverPrefixes() {
        return artifactStore.listPrefixes();
    }

    /**
     * Extracts header fields for one document and stores {@code <prefix>_fields.json}.
     *
     * @param prefix document identifier
     * @return extracted fields
     * @throws DocumentInputMissingException when the document has no OCR pages
     */
    public FieldSet extractFields(String prefix) {
        List<OcrPage> pages = requirePages(prefix);
        FieldSet fields = fieldExtractionService.extract(FieldExtractionService.documentText(pages));
        Path written = artifactStore.writeFields(prefix, fields);
        log.info("Extracted fields saved to {}", written.toAbsolutePath());
        return fields;
    }

    /**
     * Reconstructs line items for one document and stores {@code <prefix>_lineitems.json}.
     *
     * @param prefix document identifier
     * @return line items in detection order
     * @throws DocumentInputMissingException when the document has no OCR pages
     */
    public List<LineItem> extractLineItems(String prefix) {
        List<OcrPage> pages = requirePages(prefix);
        List<WordRecord> words = new ArrayList<>();
        pages.forEach(page -> words.addAll(page.words()));
        List<LineItem> lineItems = lineItemExtractionService.extract(words);
        Path written = artifactStore.writeLineItems(prefix, lineItems);
        log.info("Extracted {} line items saved to {}", lineItems.size(), written.toAbsolutePath());
        return lineItems;
    }

    /**
     * Merges externally supplied amounts into the stored fields of a document.
     * Blank values are stored as absent fields.
     *
     * @param prefix  document identifier
     * @param amounts amount field name to raw value; names must be amount fields
     * @return the merged field set, as persisted
     * @throws UseCaseValidationException    when no amounts or an unknown field name is supplied
     * @throws DocumentInputMissingException when the document has no stored fields yet
     */
    public FieldSet supplyAmounts(String prefix, Map<String, String> amounts) {
        if (amounts == null || amounts.isEmpty()) {
            throw new UseCaseValidationException("Please supply at least one amount field.");
        }
        Map<String, FieldValue> supplied = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : amounts.entrySet()) {
            if (!FieldNames.AMOUNT_FIELDS.contains(entry.getKey())) {
                throw new UseCaseValidationException("Unknown amount field '" + entry.getKey()
                        + "'. Expected one of " + FieldNames.AMOUNT_FIELDS + ".");
            }
            String value = entry.getValue() == null ? "" : entry.getValue().trim();
            supplied.put(entry.getKey(), value.isEmpty()
                    ? FieldValue.absent()
                    : FieldValue.of(value, SUPPLIED_AMOUNT_CONFIDENCE));
        }

        FieldSet stored = artifactStore.readFields(prefix)
                .orElseThrow(() -> new DocumentInputMissingException(prefix, "extracted fields"));
        FieldSet merged = stored.withFields(supplied);
        artifactStore.writeFields(prefix, merged);
        log.info("Stored supplied amounts {} for '{}'", supplied.keySet(), prefix);
        return merged;
    }

    /**
     * Cross-checks the stored fields and line items of a document and stores
     * {@code <prefix>_verifiability_report.json}. Nothing is written when an input is missing.
     *
     * @param prefix document identifier
     * @return verification report, possibly a failure record
     * @throws DocumentInputMissingException when fields or line items have not been extracted
     */
    public VerificationReport verifyDocument(String prefix) {
        FieldSet fields = artifactStore.readFields(prefix)
                .orElseThrow(() -> new DocumentInputMissingException(prefix, "extracted fields"));
        List<LineItem> lineItems = artifactStore.readLineItems(prefix)
                .orElseThrow(() -> new DocumentInputMissingException(prefix, "extracted line items"));

        VerificationReport report = verificationService.verify(fields, lineItems);
        Path written = artifactStore.writeReport(prefix, report);
        log.info("Verification report saved to {} (verified={})", written.toAbsolutePath(), report.verified());
        return report;
    }

    /**
     * Runs every stage for every discovered document, one document at a time.
     * A document that lacks inputs is skipped and a document that fails is logged; neither stops the run.
     *
     * @return counters for the run
     */
    public BatchSummary runBatch() {
        List<String> prefixes = discoverPrefixes();
        if (prefixes.isEmpty()) {
            log.info("No OCR outputs found; nothing to process");
        }

        int fieldsExtracted = 0;
        int lineItemsExtracted = 0;
        int verified = 0;
        int skipped = 0;
        List<String> failed = new ArrayList<>();

        for (String prefix : prefixes) {
            try {
                extractFields(prefix);
                fieldsExtracted++;
                extractLineItems(prefix);
                lineItemsExtracted++;
                if (verifyDocument(prefix).verified()) {
                    verified++;
                }
            } catch (DocumentInputMissingException ex) {
                log.warn("Skipping '{}': {}", prefix, ex.getMessage());
                skipped++;
            } catch (RuntimeException ex) {
                log.error("Processing failed for '{}'; continuing with the next document", prefix, ex);
                failed.add(prefix);
            }
        }

        BatchSummary summary = new BatchSummary(prefixes.size(), fieldsExtracted, lineItemsExtracted,
                verified, skipped, failed);
        log.info("Batch finished: {}", summary);
        return summary;
    }

    private List<OcrPage> requirePages(String prefix) {
        List<OcrPage> pages = artifactStore.readPages(prefix);
        if (pages.isEmpty()) {
            throw new DocumentInputMissingException(prefix, "OCR page files");
        }
        return pages;
    }
}
