package org.lituus.mtgl.tagger;

import org.lituus.mtgl.catalog.CatalogMatch;
import org.lituus.mtgl.catalog.Category;

import java.util.List;
import java.util.Map;

/**
 * A run of source characters [start, end) with its category.
 *
 * @param text       the original characters, unmodified
 * @param value      normalized value (catalog value, folded word or canonical punctuation)
 * @param candidates every meaning of an {@link Category#AMBIGUOUS} span, empty otherwise
 */
public record TaggedSpan(
    int start,
    int end,
    String text,
    Category category,
    String value,
    Map<String, String> attributes,
    List<CatalogMatch.Known> candidates
) {
    public TaggedSpan {
        attributes = Map.copyOf(attributes);
        candidates = List.copyOf(candidates);
    }

    public static TaggedSpan of(int start, String text, Category category, String value) {
        return new TaggedSpan(start, start + text.length(), text, category, value, Map.of(), List.of());
    }

    public static TaggedSpan of(int start, String text, CatalogMatch.Known known) {
        return new TaggedSpan(start, start + text.length(), text, known.category(), known.value(),
                              known.attributes(), List.of());
    }

    public static TaggedSpan ambiguous(int start, String text, CatalogMatch.Ambiguous ambiguous) {
        return new TaggedSpan(start, start + text.length(), text, Category.AMBIGUOUS, ambiguous.phrase(),
                              Map.of(), ambiguous.candidates());
    }

    /**
     * Compact rendering such as {@code xa<add>}; trivia renders as its text.
     */
    public String render() {
        if (category.isTrivia() || category == Category.PUNCTUATION || category == Category.WORD) {
            return text;
        }
        return category.code() + "<" + value + ">";
    }
}
