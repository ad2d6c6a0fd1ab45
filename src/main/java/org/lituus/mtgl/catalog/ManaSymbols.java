package org.lituus.mtgl.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classification of brace strings such as {@code {2}{W/U}{W/U}} or {@code {T}}.
 */
public final class ManaSymbols {
    private static final Pattern BRACE_STRING = Pattern.compile("(\\{[^{}\\s]+})+");
    private static final Pattern SYMBOL = Pattern.compile("\\{([^{}\\s]+)}");
    private static final Pattern GENERIC = Pattern.compile("\\d+|[XYZ]");
    private static final Set<String> COLORED = Set.of("W", "U", "B", "R", "G", "C", "S");
    private static final Set<String> HYBRID_COLORS = Set.of("W", "U", "B", "R", "G");
    private static final Set<String> NON_MANA = Set.of("T", "Q", "E", "CHAOS");
    // allied then enemy pairs, in the order they are printed
    private static final Set<String> HYBRID_PAIRS = Set.of(
        "W/U", "U/B", "B/R", "R/G", "G/W", "W/B", "U/R", "B/G", "R/W", "G/U");

    private ManaSymbols() {}

    /**
     * A classified brace string.
     *
     * @param symbols canonical symbol bodies in source order, without braces
     * @param counts  occurrences per canonical symbol, in order of first appearance
     * @param mana    false when every symbol is a non-mana symbol ({T}, {Q}, {E})
     */
    public record ManaString(List<String> symbols, Map<String, Integer> counts, boolean mana) {
        public ManaString {
            symbols = List.copyOf(symbols);
            counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
        }

        public String canonicalText() {
            return symbols.stream().map(s -> "{" + s + "}").collect(Collectors.joining());
        }

        public String describeCounts() {
            return counts.entrySet()
                         .stream()
                         .map(e -> e.getKey() + "=" + e.getValue())
                         .collect(Collectors.joining(" "));
        }
    }

    public static boolean isBraceString(String text) {
        return BRACE_STRING.matcher(text).matches();
    }

    /**
     * Classify a brace string. Empty when the text is not a brace string or holds an unknown symbol.
     */
    public static Optional<ManaString> classify(String text) {
        if (!isBraceString(text)) {
            return Optional.empty();
        }
        var symbols = new ArrayList<String>();
        var counts = new LinkedHashMap<String, Integer>();
        var mana = false;
        var matcher = SYMBOL.matcher(text);
        while (matcher.find()) {
            var canonical = canonical(matcher.group(1));
            if (canonical.isEmpty()) {
                return Optional.empty();
            }
            var symbol = canonical.get();
            symbols.add(symbol);
            counts.merge(symbol, 1, Integer::sum);
            mana |= isMana(symbol);
        }
        return Optional.of(new ManaString(symbols, counts, mana));
    }

    /**
     * Canonical form of one symbol body: upper case, hybrid halves in printed order.
     */
    public static Optional<String> canonical(String body) {
        var upper = body.toUpperCase(Locale.ROOT);
        if (GENERIC.matcher(upper).matches() || COLORED.contains(upper) || NON_MANA.contains(upper)) {
            return Optional.of(upper);
        }
        var parts = upper.split("/");
        if (parts.length == 2) {
            return canonicalPair(parts[0], parts[1]);
        }
        if (parts.length == 3 && parts[2].equals("P")) {
            return canonicalPair(parts[0], parts[1]).map(pair -> pair + "/P");
        }
        return Optional.empty();
    }

    public static boolean isMana(String canonicalSymbol) {
        return !NON_MANA.contains(canonicalSymbol);
    }

    private static Optional<String> canonicalPair(String first, String second) {
        if (second.equals("P") && COLORED.contains(first)) {
            return Optional.of(first + "/P");
        }
        if (HYBRID_COLORS.contains(second) && GENERIC.matcher(first).matches()) {
            return Optional.of(first + "/" + second);
        }
        if (HYBRID_PAIRS.contains(first + "/" + second)) {
            return Optional.of(first + "/" + second);
        }
        if (HYBRID_PAIRS.contains(second + "/" + first)) {
            return Optional.of(second + "/" + first);
        }
        return Optional.empty();
    }
}
