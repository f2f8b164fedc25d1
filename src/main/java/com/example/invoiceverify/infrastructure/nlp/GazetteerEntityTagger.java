package com.example.invoiceverify.infrastructure.nlp;

import com.example.invoiceverify.config.InvoiceProperties;
import com.example.invoiceverify.domain.model.EntityCategory;
import com.example.invoiceverify.domain.model.TaggedSpan;
import com.example.invoiceverify.domain.port.EntityTagger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infrastructure {@link EntityTagger} backed by configured name lists.
 * Each configured organization or location name is matched case-insensitively on word boundaries;
 * overlapping hits resolve to the earliest start, then to the longest match.
 */
@Component
public class GazetteerEntityTagger implements EntityTagger {

    private static final Logger log = LoggerFactory.getLogger(GazetteerEntityTagger.class);

    private final List<Entry> entries;

    /**
     * @param properties gazetteer name lists under {@code invoice.entities}
     */
    public GazetteerEntityTagger(InvoiceProperties properties) {
        List<Entry> compiled = new ArrayList<>();
        addAll(compiled, properties.entities().organizations(), EntityCategory.ORGANIZATION);
        addAll(compiled, properties.entities().locations(), EntityCategory.LOCATION);
        this.entries = List.copyOf(compiled);
        if (entries.isEmpty()) {
            log.info("No gazetteer names configured; bill/ship parties and addresses will be absent");
        }
    }

    @Override
    public List<TaggedSpan> tag(String text) {
        if (text == null || text.isEmpty() || entries.isEmpty()) {
            return List.of();
        }

        List<Hit> hits = new ArrayList<>();
        for (Entry entry : entries) {
            Matcher matcher = entry.pattern().matcher(text);
            while (matcher.find()) {
                hits.add(new Hit(matcher.start(), matcher.end(), entry.category()));
            }
        }
        hits.sort(Comparator.comparingInt(Hit::start)
                .thenComparing(Comparator.comparingInt((Hit hit) -> hit.length()).reversed()));

        List<TaggedSpan> spans = new ArrayList<>();
        int consumedUpTo = 0;
        for (Hit hit : hits) {
            if (hit.start() < consumedUpTo) {
                continue;
            }
            spans.add(new TaggedSpan(text.substring(hit.start(), hit.end()), hit.category()));
            consumedUpTo = hit.end();
        }
        return spans;
    }

    private static void addAll(List<Entry> target, List<String> names, EntityCategory category) {
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            String quoted = Pattern.quote(name.trim());
            Pattern pattern = Pattern.compile("(?<![\\p{L}\\p{N}])" + quoted + "(?![\\p{L}\\p{N}])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            target.add(new Entry(pattern, category));
        }
    }

    private record Entry(Pattern pattern, EntityCategory category) {
    }

    private record Hit(int start, int end, EntityCategory category) {

        int length() {
            return end - start;
        }
    }
}
