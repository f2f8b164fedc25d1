package com.example.invoiceverify.application.service;

import com.example.invoiceverify.config.InvoiceProperties;
import com.example.invoiceverify.domain.model.EntityCategory;
import com.example.invoiceverify.domain.model.FieldNames;
import com.example.invoiceverify.domain.model.FieldSet;
import com.example.invoiceverify.domain.model.FieldValue;
import com.example.invoiceverify.domain.model.OcrPage;
import com.example.invoiceverify.domain.model.TaggedSpan;
import com.example.invoiceverify.domain.port.EntityTagger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Application-layer service that turns the concatenated text of a document into header fields.
 * Regex fields try their patterns in configured order and stop at the first match; the bill/ship
 * parties and addresses are picked by position from the entity tagger output.
 */
@Service
public class FieldExtractionService {

    private static final Logger log = LoggerFactory.getLogger(FieldExtractionService.class);

    private final EntityTagger entityTagger;
    private final Map<String, List<Pattern>> fieldPatterns;
    private final double regexConfidence;
    private final double organizationConfidence;
    private final double locationConfidence;

    /**
     * Creates the service and compiles the configured header patterns.
     *
     * @param entityTagger tagger used for bill/ship parties and addresses
     * @param properties   externalized extraction settings
     */
    public FieldExtractionService(EntityTagger entityTagger, InvoiceProperties properties) {
        InvoiceProperties.Extraction extraction = properties.extraction();
        this.entityTagger = entityTagger;
        this.fieldPatterns = compile(extraction.patterns());
        this.regexConfidence = extraction.regexConfidence();
        this.organizationConfidence = extraction.organizationConfidence();
        this.locationConfidence = extraction.locationConfidence();
    }

    /**
     * Joins page texts the way the extractor expects: one line per page, in ascending page order.
     *
     * @param pages pages already sorted by page number
     * @return document text, each page followed by a newline
     */
    public static String documentText(List<OcrPage> pages) {
        StringBuilder builder = new StringBuilder();
        for (OcrPage page : pages) {
            builder.append(page.text()).append('\n');
        }
        return builder.toString();
    }

    /**
     * Extracts every header field from the given document text.
     *
     * @param text concatenated document text
     * @return regex fields followed by entity fields
     */
    public FieldSet extract(String text) {
        String source = text == null ? "" : text;
        Map<String, FieldValue> fields = new LinkedHashMap<>(extractRegexFields(source));
        fields.putAll(extractPartyFields(source));
        return new FieldSet(fields);
    }

    /**
     * Runs the ordered pattern list of each regex field.
     *
     * @param text document text
     * @return one entry per configured regex field
     */
    Map<String, FieldValue> extractRegexFields(String text) {
        Map<String, FieldValue> results = new LinkedHashMap<>();
        fieldPatterns.forEach((field, patterns) -> results.put(field, firstMatch(field, patterns, text)));
        return results;
    }

    private FieldValue firstMatch(String field, List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                continue;
            }
            String value = matcher.groupCount() > 0 && matcher.group(1) != null ? matcher.group(1).trim() : "";
            if (value.isEmpty()) {
                log.debug("Pattern for field '{}' matched with an empty capture", field);
                return FieldValue.absent();
            }
            return FieldValue.of(value, regexConfidence);
        }
        log.debug("No pattern matched field '{}'", field);
        return FieldValue.absent();
    }

    /**
     * Tags the text once and selects parties and addresses by position.
     * The first organization is the billed party and the second the shipped-to party; no attempt is
     * made to tell buyer from seller.
     *
     * @param text document text
     * @return bill/ship party and address fields
     */
    Map<String, FieldValue> extractPartyFields(String text) {
        List<String> organizations = new ArrayList<>();
        List<String> locations = new ArrayList<>();
        for (TaggedSpan span : entityTagger.tag(text)) {
            if (span.category() == EntityCategory.ORGANIZATION) {
                organizations.add(span.text());
            } else if (span.category() == EntityCategory.LOCATION) {
                locations.add(span.text());
            }
        }

        Map<String, FieldValue> results = new LinkedHashMap<>();
        results.put(FieldNames.BILL_TO, pick(organizations, 0, organizationConfidence));
        results.put(FieldNames.SHIP_TO, pick(organizations, 1, organizationConfidence));
        results.put(FieldNames.BILL_TO_ADDRESS, pick(locations, 0, locationConfidence));
        results.put(FieldNames.SHIP_TO_ADDRESS, pick(locations, 1, locationConfidence));
        return results;
    }

    private FieldValue pick(List<String> candidates, int index, double confidence) {
        if (candidates.size() <= index) {
            return FieldValue.absent();
        }
        String value = candidates.get(index);
        return value == null || value.isEmpty() ? FieldValue.absent() : FieldValue.of(value, confidence);
    }

    private static Map<String, List<Pattern>> compile(Map<String, List<String>> patterns) {
        Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
        for (String field : FieldNames.REGEX_FIELDS) {
            compiled.put(field, compileAll(patterns.getOrDefault(field, List.of())));
        }
        patterns.forEach((field, list) -> compiled.putIfAbsent(field, compileAll(list)));
        return compiled;
    }

    private static List<Pattern> compileAll(List<String> regexes) {
        return regexes.stream()
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
