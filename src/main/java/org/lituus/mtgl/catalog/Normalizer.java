package org.lituus.mtgl.catalog;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Case and punctuation folding applied to both catalog phrases and looked-up text.
 *
 * <p>Rules, in order: lower case; curly quotes to straight; U+2212 minus to hyphen; collapse whitespace;
 * per-word rewrites (contractions, irregular forms, English numbers). Rules are versioned with the catalog.
 */
public final class Normalizer {
    private static final Map<String, String> WORD_REWRITES = Map.ofEntries(
        Map.entry("can't", "cannot"),
        Map.entry("don't", "dont"),
        Map.entry("didn't", "didnt"),
        Map.entry("isn't", "isnt"),
        Map.entry("haven't", "havent"),
        Map.entry("hasn't", "hasnt"),
        Map.entry("aren't", "arent"),
        Map.entry("couldn't", "couldnt"),
        Map.entry("doesn't", "doesnt"),
        Map.entry("wasn't", "wasnt"),
        Map.entry("weren't", "werent"),
        Map.entry("its", "it"),
        Map.entry("an", "a"),
        Map.entry("your", "you"),
        Map.entry("werewolves", "werewolf"),
        Map.entry("wolves", "wolf"),
        Map.entry("elves", "elf"),
        Map.entry("dwarves", "dwarf"),
        Map.entry("dealt", "deal"),
        Map.entry("lost", "lose"),
        Map.entry("left", "leave"),
        Map.entry("spent", "spend"),
        Map.entry("dying", "die"),
        Map.entry("chosen", "choose"),
        Map.entry("chose", "choose"),
        Map.entry("paid", "pay"),
        Map.entry("drawn", "draw"),
        Map.entry("drew", "draw"),
        Map.entry("taken", "take"),
        Map.entry("took", "take"),
        Map.entry("became", "become"),
        Map.entry("won", "win"),
        Map.entry("got", "get"));

    private static final Map<String, String> NUMBER_WORDS = Map.ofEntries(
        Map.entry("one", "1"), Map.entry("two", "2"), Map.entry("three", "3"),
        Map.entry("four", "4"), Map.entry("five", "5"), Map.entry("six", "6"),
        Map.entry("seven", "7"), Map.entry("eight", "8"), Map.entry("nine", "9"),
        Map.entry("ten", "10"), Map.entry("eleven", "11"), Map.entry("twelve", "12"),
        Map.entry("thirteen", "13"), Map.entry("fourteen", "14"), Map.entry("fifteen", "15"));

    public static final Normalizer STANDARD = new Normalizer("1", merge(WORD_REWRITES, NUMBER_WORDS));

    private final String version;
    private final Map<String, String> rewrites;

    private Normalizer(String version, Map<String, String> rewrites) {
        this.version = version;
        this.rewrites = Map.copyOf(rewrites);
    }

    public static Normalizer of(String version, Map<String, String> rewrites) {
        return new Normalizer(version, rewrites);
    }

    public String version() {
        return version;
    }

    /**
     * Character-level folding only, length preserving.
     */
    public String fold(String text) {
        var chars = new char[text.length()];
        for (int i = 0; i < chars.length; i++) {
            chars[i] = foldChar(text.charAt(i));
        }
        return new String(chars);
    }

    public String normalizeWord(String word) {
        var folded = fold(word);
        return rewrites.getOrDefault(folded, folded);
    }

    public String normalize(String phrase) {
        var trimmed = phrase.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        return Arrays.stream(trimmed.split("\\s+"))
                     .map(this::normalizeWord)
                     .collect(Collectors.joining(" "));
    }

    private static char foldChar(char c) {
        return switch (c) {
            case '’', '‘' -> '\'';
            case '“', '”' -> '"';
            case '−' -> '-';
            default -> Character.toLowerCase(c);
        };
    }

    private static Map<String, String> merge(Map<String, String> first, Map<String, String> second) {
        var merged = new LinkedHashMap<>(first);
        merged.putAll(second);
        return merged;
    }
}
