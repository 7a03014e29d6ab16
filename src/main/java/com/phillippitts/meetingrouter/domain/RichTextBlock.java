package com.phillippitts.meetingrouter.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One segment of a rich-text comment: a text run and its formatting attributes
 * ({@code bold}, {@code link}).
 *
 * @param text       segment text, may be empty
 * @param attributes formatting attributes in insertion order, never null
 */
public record RichTextBlock(String text, Map<String, Object> attributes) {

    public static final String BOLD = "bold";
    public static final String LINK = "link";

    private static final RichTextBlock NEWLINE = new RichTextBlock("\n", Map.of());

    public RichTextBlock {
        Objects.requireNonNull(text, "text must not be null");
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static RichTextBlock plain(String text) {
        return new RichTextBlock(text, Map.of());
    }

    public static RichTextBlock newline() {
        return NEWLINE;
    }

    public boolean isBold() {
        return Boolean.TRUE.equals(attributes.get(BOLD));
    }

    public String link() {
        Object link = attributes.get(LINK);
        return link == null ? null : link.toString();
    }
}
