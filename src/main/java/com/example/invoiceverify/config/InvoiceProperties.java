package com.example.invoiceverify.config;

import com.example.invoiceverify.domain.model.FieldNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized settings bound from the {@code invoice.*} namespace.
 * Every value falls back to the built-in default when it is not configured, so
 * {@link #defaults()} yields the same settings as an empty property source.
 */
@ConfigurationProperties(prefix = "invoice")
public record InvoiceProperties(
        Storage storage,
        Extraction extraction,
        Verification verification,
        Entities entities,
        Batch batch
) {

    public InvoiceProperties {
        storage = storage == null ? new Storage(null, null) : storage;
        extraction = extraction == null ? new Extraction(null, null, null, null, null, null, null) : extraction;
        verification = verification == null ? new Verification(null, null) : verification;
        entities = entities == null ? new Entities(null, null) : entities;
        batch = batch == null ? new Batch(null) : batch;
    }

    public static InvoiceProperties defaults() {
        return new InvoiceProperties(null, null, null, null, null);
    }

    /**
     * Directories for OCR input pages and per-document output artifacts.
     */
    public record Storage(Path ocrDir, Path outputDir) {

        public Storage {
            ocrDir = ocrDir == null ? Path.of("output", "ocr") : ocrDir;
            outputDir = outputDir == null ? Path.of("output") : outputDir;
        }
    }

    /**
     * Confidences, row heuristics and ordered header patterns used by the extractors.
     */
    public record Extraction(
            Double regexConfidence,
            Double organizationConfidence,
            Double locationConfidence,
            Integer windowSize,
            Integer minNumericTokens,
            Double rowTolerance,
            Map<String, List<String>> patterns
    ) {

        public Extraction {
            regexConfidence = regexConfidence == null ? 0.95 : regexConfidence;
            organizationConfidence = organizationConfidence == null ? 0.8 : organizationConfidence;
            locationConfidence = locationConfidence == null ? 0.7 : locationConfidence;
            windowSize = windowSize == null ? 8 : windowSize;
            minNumericTokens = minNumericTokens == null ? 3 : minNumericTokens;
            rowTolerance = rowTolerance == null ? 2.0 : rowTolerance;
            patterns = mergePatterns(patterns);
        }

        private static Map<String, List<String>> mergePatterns(Map<String, List<String>> configured) {
            Map<String, List<String>> merged = new LinkedHashMap<>(defaultPatterns());
            if (configured != null) {
                configured.forEach((field, list) -> {
                    if (list != null && !list.isEmpty()) {
                        merged.put(field, List.copyOf(list));
                    }
                });
            }
            return Collections.unmodifiableMap(merged);
        }

        static Map<String, List<String>> defaultPatterns() {
            Map<String, List<String>> defaults = new LinkedHashMap<>();
            defaults.put(FieldNames.INVOICE_NUMBER, List.of("Invoice\\s*No\\.?\\s*[:\\-]?\\s*([A-Za-z0-9\\-]+)"));
            defaults.put(FieldNames.DATE, List.of("Date\\s*[:\\-]?\\s*([0-9]{2,4}[-/][0-9]{1,2}[-/][0-9]{1,4})"));
            defaults.put(FieldNames.GST_NUMBER, List.of("GSTIN\\s*[:\\-]?\\s*([0-9A-Z]{15})"));
            defaults.put(FieldNames.PO_NUMBER, List.of("PO\\s*No\\.?\\s*[:\\-]?\\s*([A-Za-z0-9\\-]+)"));
            return defaults;
        }
    }

    /**
     * Tolerance and division guard of the arithmetic cross-check. Neither is scaled to invoice magnitude.
     */
    public record Verification(Double marginTolerance, Double epsilon) {

        public Verification {
            marginTolerance = marginTolerance == null ? 1.0 : marginTolerance;
            epsilon = epsilon == null ? 1e-5 : epsilon;
        }
    }

    /**
     * Name lists for the gazetteer entity tagger.
     */
    public record Entities(List<String> organizations, List<String> locations) {

        public Entities {
            organizations = organizations == null ? List.of() : List.copyOf(organizations);
            locations = locations == null ? List.of() : List.copyOf(locations);
        }
    }

    public record Batch(Boolean runOnStartup) {

        public Batch {
            runOnStartup = runOnStartup != null && runOnStartup;
        }
    }
}
