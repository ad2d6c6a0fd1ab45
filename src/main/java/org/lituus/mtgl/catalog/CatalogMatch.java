package org.lituus.mtgl.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a successful catalog lookup.
 */
public sealed interface CatalogMatch {

    /**
     * Exactly one registered meaning.
     */
    record Known(Category category, String value, Map<String, String> attributes) implements CatalogMatch {
        public Known {
            attributes = Map.copyOf(attributes);
        }

        public static Known of(Category category, String value) {
            return new Known(category, value, Map.of());
        }

        public Known withAttribute(String key, String val) {
            var merged = new LinkedHashMap<>(attributes);
            merged.put(key, val);
            return new Known(category, value, merged);
        }
    }

    /**
     * Phrase registered under more than one category; the caller decides from context.
     */
    record Ambiguous(String phrase, List<Known> candidates) implements CatalogMatch {
        public Ambiguous {
            candidates = List.copyOf(candidates);
        }

        public Optional<Known> candidate(Category category) {
            return candidates.stream().filter(k -> k.category() == category).findFirst();
        }
    }
}
