package com.example.invoiceverify.infrastructure.storage;

import com.example.invoiceverify.config.InvoiceProperties;
import com.example.invoiceverify.domain.exception.InvalidPrefixException;
import com.example.invoiceverify.domain.model.FieldSet;
import com.example.invoiceverify.domain.model.LineItem;
import com.example.invoiceverify.domain.model.OcrPage;
import com.example.invoiceverify.domain.model.VerificationReport;
import com.example.invoiceverify.domain.model.WordRecord;
import com.example.invoiceverify.infrastructure.exception.ArtifactStorageException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Infrastructure component that maps per-document JSON artifacts to and from the domain model.
 * OCR pages are read from the OCR directory; fields, line items and verification reports live in the
 * output directory, one pretty-printed UTF-8 file each, named after the document prefix.
 */
@Component
public class DocumentArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(DocumentArtifactStore.class);
    private static final Pattern PAGE_FILE = Pattern.compile("^(.+)_page_(\\d{1,9})_raw\\.json$");
    private static final Pattern SAFE_PREFIX = Pattern.compile("[^/\\\\:*?\"<>|\\p{Cntrl}]+");
    private static final TypeReference<List<WordRecord>> WORDS = new TypeReference<>() {
    };
    private static final TypeReference<List<LineItem>> LINE_ITEMS = new TypeReference<>() {
    };

    static final String FIELDS_SUFFIX = "_fields.json";
    static final String LINE_ITEMS_SUFFIX = "_lineitems.json";
    static final String REPORT_SUFFIX = "_verifiability_report.json";

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final Path ocrDir;
    private final Path outputDir;

    /**
     * @param objectMapper Jackson mapper shared with the web layer
     * @param properties   storage directories
     */
    public DocumentArtifactStore(ObjectMapper objectMapper, InvoiceProperties properties) {
        this.objectMapper = objectMapper;
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
        this.ocrDir = properties.storage().ocrDir();
        this.outputDir = properties.storage().outputDir();
    }

    /**
     * Derives the document prefix from an OCR page file name by dropping the trailing
     * {@code _page_<n>_raw.json} part.
     *
     * @param fileName page file name
     * @return prefix, or empty when the name is not a page file
     */
    public static Optional<String> prefixOf(String fileName) {
        Matcher matcher = PAGE_FILE.matcher(fileName);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * @return sorted distinct prefixes that have at least one OCR page file
     */
    public List<String> listPrefixes() {
        if (!Files.isDirectory(ocrDir)) {
            log.warn("OCR directory {} does not exist", ocrDir.toAbsolutePath());
            return List.of();
        }
        try (Stream<Path> files = Files.list(ocrDir)) {
            TreeSet<String> prefixes = new TreeSet<>();
            files.filter(Files::isRegularFile)
                    .map(path -> prefixOf(path.getFileName().toString()))
                    .flatMap(Optional::stream)
                    .forEach(prefixes::add);
            return List.copyOf(prefixes);
        } catch (IOException e) {
            throw new ArtifactStorageException("Unable to list OCR directory " + ocrDir, e);
        }
    }

    /**
     * Loads every OCR page of a document in ascending numeric page order.
     *
     * @param prefix document identifier
     * @return pages, empty when the document has no page files
     */
    public List<OcrPage> readPages(String prefix) {
        requireSafePrefix(prefix);
        if (!Files.isDirectory(ocrDir)) {
            return List.of();
        }
        List<Path> pageFiles = new ArrayList<>();
        try (Stream<Path> files = Files.list(ocrDir)) {
            files.filter(Files::isRegularFile)
                    .filter(path -> prefixOf(path.getFileName().toString()).filter(prefix::equals).isPresent())
                    .forEach(pageFiles::add);
        } catch (IOException e) {
            throw new ArtifactStorageException("Unable to list OCR directory " + ocrDir, e);
        }

        List<OcrPage> pages = new ArrayList<>();
        for (Path pageFile : pageFiles) {
            pages.add(new OcrPage(pageNumber(pageFile), read(pageFile, WORDS)));
        }
        pages.sort(Comparator.comparingInt(OcrPage::pageNumber));
        return pages;
    }

    public Optional<FieldSet> readFields(String prefix) {
        Path path = outputFile(prefix, FIELDS_SUFFIX);
        return Files.exists(path) ? Optional.ofNullable(read(path, FieldSet.class)) : Optional.empty();
    }

    public Optional<List<LineItem>> readLineItems(String prefix) {
        Path path = outputFile(prefix, LINE_ITEMS_SUFFIX);
        return Files.exists(path) ? Optional.ofNullable(read(path, LINE_ITEMS)) : Optional.empty();
    }

    public Optional<VerificationReport> readReport(String prefix) {
        Path path = outputFile(prefix, REPORT_SUFFIX);
        return Files.exists(path) ? Optional.ofNullable(read(path, VerificationReport.class)) : Optional.empty();
    }

    public Path writeFields(String prefix, FieldSet fields) {
        return write(outputFile(prefix, FIELDS_SUFFIX), fields);
    }

    public Path writeLineItems(String prefix, List<LineItem> lineItems) {
        return write(outputFile(prefix, LINE_ITEMS_SUFFIX), lineItems);
    }

    public Path writeReport(String prefix, VerificationReport report) {
        return write(outputFile(prefix, REPORT_SUFFIX), report);
    }

    /**
     * Rejects prefixes that could escape the configured directories.
     *
     * @param prefix caller supplied prefix
     * @throws InvalidPrefixException when the prefix is empty, a dot segment or contains path characters
     */
    public static void requireSafePrefix(String prefix) {
        if (prefix == null || !SAFE_PREFIX.matcher(prefix).matches() || ".".equals(prefix) || "..".equals(prefix)) {
            throw new InvalidPrefixException(prefix);
        }
    }

    private Path outputFile(String prefix, String suffix) {
        requireSafePrefix(prefix);
        return outputDir.resolve(prefix + suffix);
    }

    private int pageNumber(Path pageFile) {
        Matcher matcher = PAGE_FILE.matcher(pageFile.getFileName().toString());
        if (!matcher.matches()) {
            throw new IllegalStateException("Not an OCR page file: " + pageFile);
        }
        return Integer.parseInt(matcher.group(2));
    }

    private <T> T read(Path path, Class<T> type) {
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new ArtifactStorageException("Unable to read " + path, e);
        }
    }

    private <T> T read(Path path, TypeReference<T> type) {
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new ArtifactStorageException("Unable to read " + path, e);
        }
    }

    private Path write(Path path, Object value) {
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            writer.writeValue(path.toFile(), value);
            return path;
        } catch (IOException e) {
            throw new ArtifactStorageException("Unable to write " + path, e);
        }
    }
}
