package org.lituus.mtgl.catalog;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Regular English plural and verb forms used to derive catalog phrases.
 */
final class Inflections {
    private Inflections() {}

    static String plural(String word) {
        if (endsWithConsonantY(word)) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (word.endsWith("s") || word.endsWith("h") || word.endsWith("x")) {
            return word + "es";
        }
        return word + "s";
    }

    static String past(String word) {
        if (word.endsWith("e")) {
            return word + "d";
        }
        if (endsWithConsonantY(word)) {
            return word.substring(0, word.length() - 1) + "ied";
        }
        return word + "ed";
    }

    static String gerund(String word) {
        if (word.endsWith("ie")) {
            return word.substring(0, word.length() - 2) + "ying";
        }
        if (word.endsWith("e") && !word.endsWith("ee")) {
            return word.substring(0, word.length() - 1) + "ing";
        }
        return word + "ing";
    }

    /**
     * Third person, past and gerund forms of a verb phrase, inflecting its first word.
     */
    static List<String> conjugations(String phrase) {
        var space = phrase.indexOf(' ');
        var verb = space < 0 ? phrase : phrase.substring(0, space);
        var rest = space < 0 ? "" : phrase.substring(space);
        return List.of(plural(verb) + rest, past(verb) + rest, gerund(verb) + rest);
    }

    static String inflectLast(String phrase, UnaryOperator<String> inflection) {
        var space = phrase.lastIndexOf(' ');
        if (space < 0) {
            return inflection.apply(phrase);
        }
        return phrase.substring(0, space + 1) + inflection.apply(phrase.substring(space + 1));
    }

    private static boolean endsWithConsonantY(String word) {
        if (word.length() < 2 || !word.endsWith("y")) {
            return false;
        }
        return "aeiou".indexOf(word.charAt(word.length() - 2)) < 0;
    }
}
