package com.example.invoiceverify.domain.port;

import com.example.invoiceverify.domain.model.TaggedSpan;

import java.util.List;

/**
 * Capability that recognizes organizations, people and locations in free text.
 * Implementations may be expensive; callers invoke it once per document.
 */
public interface EntityTagger {

    /**
     * Tags the given text.
     *
     * @param text full document text
     * @return tagged spans in order of appearance, never {@code null}
     */
    List<TaggedSpan> tag(String text);
}
