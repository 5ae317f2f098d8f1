package com.infragraph.core.detect;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts resource references from attribute values with a regular expression.
 *
 * <p>The first capture group is the reference; a pattern without groups yields the whole match.
 * List values are matched item by item. An item that does not match on its own is retried in
 * quoted form, so a pattern such as {@code "([^"]+)"} works on both {@code "[\"1\", \"2\"]"}
 * and the already parsed list {@code [1, 2]}.
 */
public final class ReferenceExtractor {

    private final Pattern pattern;

    /**
     * Creates an extractor.
     *
     * @param regex reference pattern
     * @throws java.util.regex.PatternSyntaxException if the pattern is invalid
     */
    public ReferenceExtractor(String regex) {
        Objects.requireNonNull(regex, "regex must not be null");
        this.pattern = Pattern.compile(regex);
    }

    /**
     * Returns the distinct references found in a value, in order of appearance.
     *
     * @param value attribute value: a string, a collection or null
     * @return distinct references
     */
    public List<String> extract(Object value) {
        Set<String> references = new LinkedHashSet<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item == null) {
                    continue;
                }
                String text = String.valueOf(item);
                if (!collect(text, references)) {
                    collect("\"" + text + "\"", references);
                }
            }
        } else if (value != null) {
            collect(String.valueOf(value), references);
        }
        return new ArrayList<>(references);
    }

    private boolean collect(String text, Set<String> references) {
        Matcher matcher = pattern.matcher(text);
        boolean found = false;
        while (matcher.find()) {
            String reference = matcher.groupCount() >= 1 ? matcher.group(1) : matcher.group();
            if (reference != null && !reference.isBlank()) {
                references.add(reference);
                found = true;
            }
        }
        return found;
    }
}
