package com.example.invoiceverify.interfaces.api;

import com.example.invoiceverify.application.service.InvoiceProcessingService;
import com.example.invoiceverify.application.service.VerificationService;
import com.example.invoiceverify.domain.model.BatchSummary;
import com.example.invoiceverify.domain.model.FieldSet;
import com.example.invoiceverify.domain.model.LineItem;
import com.example.invoiceverify.domain.model.VerificationReport;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Interfaces-layer REST controller exposing the per-document stages, the batch run and stateless verification.
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class InvoiceDocumentController {

    private final InvoiceProcessingService processingService;
    private final VerificationService verificationService;

    /**
     * @param processingService drives the stored per-document stages
     * @param verificationService shared arithmetic cross-check
     */
    public InvoiceDocumentController(InvoiceProcessingService processingService,
                                     VerificationService verificationService) {
        this.processingService = processingService;
        this.verificationService = verificationService;
    }

    /**
     * @return prefixes of every document that has OCR output
     */
    @GetMapping("/documents")
    public ResponseEntity<List<String>> listDocuments() {
        return ResponseEntity.ok(processingService.discoverPrefixes());
    }

    @PostMapping("/documents/{prefix}/fields")
    public ResponseEntity<FieldSet> extractFields(@PathVariable("prefix") String prefix) {
        return ResponseEntity.ok(processingService.extractFields(prefix));
    }

    /**
     * Merges amounts read by a person or another system into the stored fields.
     *
     * @param prefix  document identifier
     * @param amounts e.g. {@code {"subtotal": "300", "gst_amount": "54", "discount": "0", "total": "354"}}
     * @return merged fields
     */
    @PutMapping(value = "/documents/{prefix}/fields/amounts", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FieldSet> supplyAmounts(@PathVariable("prefix") String prefix,
                                                  @RequestBody Map<String, String> amounts) {
        return ResponseEntity.ok(processingService.supplyAmounts(prefix, amounts));
    }

    @PostMapping("/documents/{prefix}/line-items")
    public ResponseEntity<List<LineItem>> extractLineItems(@PathVariable("prefix") String prefix) {
        return ResponseEntity.ok(processingService.extractLineItems(prefix));
    }

    @PostMapping("/documents/{prefix}/verification")
    public ResponseEntity<VerificationReport> verifyDocument(@PathVariable("prefix") String prefix) {
        return ResponseEntity.ok(processingService.verifyDocument(prefix));
    }

    /**
     * Verifies posted figures without touching stored artifacts.
     *
     * @param request fields and line items to cross-check
     * @return verification report, possibly a failure record
     */
    @PostMapping(value = "/verify", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<VerificationReport> verify(@RequestBody VerificationRequest request) {
        return ResponseEntity.ok(verificationService.verify(request.fields(), request.lineItems()));
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchSummary> runBatch() {
        return ResponseEntity.ok(processingService.runBatch());
    }
}
