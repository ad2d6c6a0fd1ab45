package org.lituus.mtgl.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable, versioned registry of the rules vocabulary.
 *
 * <p>Lookups are tolerant to case and punctuation variants through the catalog's {@link Normalizer}.
 * A phrase registered under several categories is reported as {@link CatalogMatch.Ambiguous};
 * registration order never decides between meanings.
 *
 * <p>Derived forms (plurals, conjugations) never shadow an explicitly registered phrase:
 * {@code tapped} stays a status although it also looks like a form of {@code tap}.
 */
public final class SymbolCatalog {
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+|x)");
    private static final Pattern LEVEL_RANGE = Pattern.compile("\\d+(-\\d+|\\+)");
    private static final Pattern POWER_TOUGHNESS = Pattern.compile("[+-]?(\\d+|x)/[+-]?(\\d+|x)");

    private final String version;
    private final Normalizer normalizer;
    private final Map<String, List<CatalogMatch.Known>> entries;
    private final int maxPhraseWords;

    private SymbolCatalog(String version, Normalizer normalizer, Map<String, List<CatalogMatch.Known>> entries) {
        this.version = version;
        this.normalizer = normalizer;
        var frozen = new LinkedHashMap<String, List<CatalogMatch.Known>>();
        entries.forEach((key, known) -> frozen.put(key, List.copyOf(known)));
        this.entries = Map.copyOf(frozen);
        this.maxPhraseWords = entries.keySet()
                                     .stream()
                                     .mapToInt(key -> key.split(" ").length)
                                     .max()
                                     .orElse(1);
    }

    /**
     * The bundled vocabulary.
     */
    public static SymbolCatalog standard() {
        return StandardHolder.INSTANCE;
    }

    public static Builder builder(String version) {
        return new Builder(version);
    }

    public String version() {
        return version;
    }

    public Normalizer normalizer() {
        return normalizer;
    }

    public int maxPhraseWords() {
        return maxPhraseWords;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Classify a candidate phrase.
     *
     * <p>Brace strings classify as {@link Category#MANA} (or {@link Category#SYMBOL} when they only hold
     * {T}, {Q} or {E}) with attributes {@code symbols} and {@code counts}. Numbers and power/toughness
     * pairs classify by shape. Possessives ({@code opponent's}) and {@code non-} prefixes fall back to
     * their base phrase with a {@code possessive} or {@code negated} attribute.
     */
    public Optional<CatalogMatch> lookup(String phrase) {
        var trimmed = phrase.strip();
        if (ManaSymbols.isBraceString(trimmed)) {
            return classifyMana(trimmed).map(SymbolCatalog::manaMatch);
        }
        var key = normalizer.normalize(trimmed);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        var direct = find(key);
        if (direct.isPresent()) {
            return direct;
        }
        if (NUMBER.matcher(key).matches()) {
            return Optional.of(CatalogMatch.Known.of(Category.NUMBER, key));
        }
        if (LEVEL_RANGE.matcher(key).matches()) {
            return Optional.of(new CatalogMatch.Known(Category.NUMBER, key, Map.of("kind", "range")));
        }
        if (POWER_TOUGHNESS.matcher(key).matches()) {
            return Optional.of(new CatalogMatch.Known(Category.QUALITY, key, Map.of("kind", "pt")));
        }
        if (key.endsWith("'s") && key.length() > 2) {
            return find(key.substring(0, key.length() - 2)).map(m -> mark(m, "possessive"));
        }
        if (key.endsWith("s'")) {
            return find(key.substring(0, key.length() - 1)).map(m -> mark(m, "possessive"));
        }
        if (key.startsWith("non-") && key.length() > 4) {
            return negated(key.substring(4));
        }
        if (key.startsWith("non") && key.length() > 3) {
            return negated(key.substring(3));
        }
        return Optional.empty();
    }

    public Optional<ManaSymbols.ManaString> classifyMana(String text) {
        return ManaSymbols.classify(text);
    }

    private Optional<CatalogMatch> find(String key) {
        var found = entries.get(key);
        if (found == null) {
            return Optional.empty();
        }
        if (found.size() == 1) {
            return Optional.of(found.get(0));
        }
        return Optional.of(new CatalogMatch.Ambiguous(key, found));
    }

    private Optional<CatalogMatch> negated(String base) {
        return find(base).filter(m -> m instanceof CatalogMatch.Known known && known.category() == Category.QUALITY)
                         .map(m -> mark(m, "negated"));
    }

    private static CatalogMatch mark(CatalogMatch match, String flag) {
        if (match instanceof CatalogMatch.Known known) {
            return known.withAttribute(flag, "true");
        }
        var ambiguous = (CatalogMatch.Ambiguous) match;
        return new CatalogMatch.Ambiguous(ambiguous.phrase(),
                                          ambiguous.candidates()
                                                   .stream()
                                                   .map(k -> k.withAttribute(flag, "true"))
                                                   .toList());
    }

    private static CatalogMatch manaMatch(ManaSymbols.ManaString mana) {
        return new CatalogMatch.Known(mana.mana() ? Category.MANA : Category.SYMBOL,
                                      mana.canonicalText(),
                                      Map.of("symbols", String.join(" ", mana.symbols()),
                                             "counts", mana.describeCounts()));
    }

    /**
     * Collects phrases, then freezes them into a catalog.
     */
    public static final class Builder {
        private final String version;
        private Normalizer normalizer = Normalizer.STANDARD;
        private final List<Registration> registered = new ArrayList<>();
        private final List<Registration> derived = new ArrayList<>();

        private Builder(String version) {
            this.version = version;
        }

        public Builder normalizer(Normalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder add(Category category, String phrase) {
            return add(category, phrase, phrase, Map.of());
        }

        public Builder add(Category category, String phrase, String value) {
            return add(category, phrase, value, Map.of());
        }

        public Builder add(Category category, String phrase, String value, Map<String, String> attributes) {
            registered.add(new Registration(phrase, new CatalogMatch.Known(category, value, attributes)));
            return this;
        }

        public Builder addAll(Category category, Collection<String> phrases, Map<String, String> attributes) {
            phrases.forEach(p -> add(category, p, p, attributes));
            return this;
        }

        /**
         * Register a noun phrase and its plural (last word inflected).
         */
        public Builder addNoun(Category category, String phrase, String value, Map<String, String> attributes) {
            add(category, phrase, value, attributes);
            var known = new CatalogMatch.Known(category, value, attributes);
            derived.add(new Registration(Inflections.inflectLast(phrase, Inflections::plural), known));
            return this;
        }

        public Builder addNouns(Category category, Collection<String> phrases, Map<String, String> attributes) {
            phrases.forEach(p -> addNoun(category, p, p, attributes));
            return this;
        }

        /**
         * Register a verb phrase and its conjugations (first word inflected).
         */
        public Builder addVerb(Category category, String phrase, String value, Map<String, String> attributes) {
            add(category, phrase, value, attributes);
            var known = new CatalogMatch.Known(category, value, attributes);
            for (var form : Inflections.conjugations(phrase)) {
                derived.add(new Registration(form, known));
            }
            return this;
        }

        public Builder addVerbs(Category category, Collection<String> phrases, Map<String, String> attributes) {
            phrases.forEach(p -> addVerb(category, p, p, attributes));
            return this;
        }

        public SymbolCatalog build() {
            var entries = new LinkedHashMap<String, List<CatalogMatch.Known>>();
            collect(entries, registered);
            var derivedEntries = new LinkedHashMap<String, List<CatalogMatch.Known>>();
            collect(derivedEntries, derived);
            derivedEntries.forEach(entries::putIfAbsent);
            return new SymbolCatalog(version, normalizer, entries);
        }

        private void collect(Map<String, List<CatalogMatch.Known>> target, List<Registration> source) {
            for (var registration : source) {
                var key = normalizer.normalize(registration.phrase());
                var list = target.computeIfAbsent(key, k -> new ArrayList<>());
                var duplicate = list.stream()
                                    .anyMatch(k -> k.category() == registration.match().category()
                                                   && k.value().equals(registration.match().value()));
                if (!duplicate) {
                    list.add(registration.match());
                }
            }
        }
    }

    private record Registration(String phrase, CatalogMatch.Known match) {}

    private static final class StandardHolder {
        private static final SymbolCatalog INSTANCE = createStandard();

        private static SymbolCatalog createStandard() {
            var builder = builder(Vocabulary.VERSION)
                .addVerbs(Category.ACTION, Vocabulary.KEYWORD_ACTIONS, Map.of("kind", "keyword-action"))
                .addVerbs(Category.ACTION, Vocabulary.ACTIONS, Map.of("kind", "action"))
                .addAll(Category.KEYWORD, Vocabulary.KEYWORDS, Map.of())
                .addAll(Category.ABILITY_WORD, Vocabulary.ABILITY_WORDS, Map.of())
                .addNouns(Category.REFERENCE, Vocabulary.OBJECTS, Map.of("kind", "object"))
                .addNouns(Category.REFERENCE, Vocabulary.PLAYERS, Map.of("kind", "player"))
                .addNouns(Category.REFERENCE, Vocabulary.EFFECTS, Map.of("kind", "effect"))
                .addNouns(Category.QUALITY, Vocabulary.META_CHARACTERISTICS, Map.of("kind", "meta"))
                .addAll(Category.QUALITY, Vocabulary.COLORS, Map.of("kind", "color"))
                .addAll(Category.QUALITY, Vocabulary.SUPERTYPES, Map.of("kind", "supertype"))
                .addNouns(Category.QUALITY, Vocabulary.CARD_TYPES, Map.of("kind", "type"))
                .addNouns(Category.QUALITY, Vocabulary.SUBTYPES, Map.of("kind", "subtype"))
                .addAll(Category.QUALITY, Vocabulary.STATUSES, Map.of("kind", "status"))
                .addNouns(Category.QUALITY, Vocabulary.PLAYER_CHARACTERISTICS, Map.of("kind", "player"))
                .addAll(Category.QUANTIFIER, Vocabulary.QUANTIFIERS, Map.of())
                .addAll(Category.PREPOSITION, Vocabulary.PREPOSITIONS, Map.of())
                .addAll(Category.CONDITIONAL, Vocabulary.CONDITIONALS, Map.of())
                .addAll(Category.SEQUENCE, Vocabulary.SEQUENCES, Map.of())
                .addAll(Category.TRIGGER, Vocabulary.TRIGGERS, Map.of());
            for (var zone : Vocabulary.ZONES) {
                if (zone.equals("exile") || zone.equals("anywhere") || zone.equals("command")) {
                    builder.add(Category.ZONE, zone);
                } else {
                    builder.addNoun(Category.ZONE, zone, zone, Map.of());
                }
            }
            for (var self : Vocabulary.SELF_REFERENCES) {
                builder.add(Category.REFERENCE, self, "self", Map.of("kind", "self"));
            }
            Vocabulary.PHASES.forEach((phrase, value) -> builder.addNoun(Category.PHASE, phrase, value, Map.of()));
            Vocabulary.OPERATORS.forEach((phrase, value) -> builder.add(Category.OPERATOR, phrase, value));
            for (var counter : Vocabulary.NAMED_COUNTERS) {
                builder.addNoun(Category.REFERENCE, counter + " counter", "counter",
                                Map.of("kind", "object", "counter", counter));
            }
            Vocabulary.ROMAN_NUMERALS.forEach((roman, value) ->
                builder.add(Category.NUMBER, roman, value, Map.of("roman", roman)));
            return builder.build();
        }
    }
}
