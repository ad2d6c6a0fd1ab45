package org.lituus.mtgl.tagger;

import org.lituus.mtgl.catalog.CatalogMatch;
import org.lituus.mtgl.catalog.Category;
import org.lituus.mtgl.catalog.SymbolCatalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Annotates one ability line with catalog categories.
 *
 * <p>Longest match first: at each word the longest run of words (separated by whitespace only)
 * known to the catalog wins; otherwise the single word falls back to {@link Category#WORD}.
 * Every character ends up in exactly one span, so tagging never fails.
 */
public final class Tagger {
    private static final String MANA_REMINDER_PREFIX = "{t}: add";

    private final SymbolCatalog catalog;

    private Tagger(SymbolCatalog catalog) {
        this.catalog = catalog;
    }

    public static Tagger create(SymbolCatalog catalog) {
        return new Tagger(catalog);
    }

    public SymbolCatalog catalog() {
        return catalog;
    }

    public TaggedText tag(String line) {
        return tag(line, null);
    }

    /**
     * Tag a line, recognizing {@code cardName} (and the part before its first comma) as a self reference.
     */
    public TaggedText tag(String line, String cardName) {
        var scan = new Scan(line, selfNames(cardName));
        scan.tagRange(0, line.length());
        return new TaggedText(line, scan.spans);
    }

    private List<String> selfNames(String cardName) {
        if (cardName == null || cardName.isBlank()) {
            return List.of();
        }
        var full = catalog.normalizer().fold(cardName.strip());
        var comma = full.indexOf(',');
        if (comma > 0) {
            return List.of(full, full.substring(0, comma));
        }
        return List.of(full);
    }

    private final class Scan {
        private final String line;
        private final String folded;
        private final List<String> selfNames;
        private final List<TaggedSpan> spans = new ArrayList<>();
        private int pos;

        private Scan(String line, List<String> selfNames) {
            this.line = line;
            this.folded = catalog.normalizer().fold(line);
            this.selfNames = selfNames;
        }

        private void tagRange(int from, int to) {
            pos = from;
            while (pos < to) {
                char c = line.charAt(pos);
                if (Character.isWhitespace(c)) {
                    scanWhitespace(to);
                } else if (c == '(') {
                    scanParenthesis(to);
                } else if (c == '{') {
                    scanBraces(to);
                } else if (matchesSelfName(to)) {
                    continue;
                } else if (isWordStart(pos, to)) {
                    scanPhrase(to);
                } else {
                    var text = String.valueOf(c);
                    spans.add(TaggedSpan.of(pos, text, Category.PUNCTUATION, canonicalPunctuation(c)));
                    pos++;
                }
            }
        }

        private void scanWhitespace(int to) {
            int start = pos;
            while (pos < to && Character.isWhitespace(line.charAt(pos))) {
                pos++;
            }
            spans.add(TaggedSpan.of(start, line.substring(start, pos), Category.WHITESPACE, " "));
        }

        /**
         * Reminder text is dropped as one span, except mana reminders whose content is tagged.
         */
        private void scanParenthesis(int to) {
            int start = pos;
            int close = line.indexOf(')', start);
            if (close < 0 || close >= to) {
                spans.add(TaggedSpan.of(start, "(", Category.PUNCTUATION, "("));
                pos++;
                return;
            }
            if (folded.startsWith(MANA_REMINDER_PREFIX, start + 1)) {
                spans.add(TaggedSpan.of(start, "(", Category.REMINDER, "("));
                tagRange(start + 1, close);
                spans.add(TaggedSpan.of(close, ")", Category.REMINDER, ")"));
                pos = close + 1;
                return;
            }
            var text = line.substring(start, close + 1);
            spans.add(TaggedSpan.of(start, text, Category.REMINDER, text));
            pos = close + 1;
        }

        private void scanBraces(int to) {
            int start = pos;
            int end = start;
            while (end < to && line.charAt(end) == '{') {
                int close = line.indexOf('}', end);
                if (close < 0 || close >= to || close == end + 1 || containsWhitespace(end, close)) {
                    break;
                }
                end = close + 1;
            }
            if (end == start) {
                spans.add(TaggedSpan.of(start, "{", Category.WORD, "{"));
                pos = start + 1;
                return;
            }
            var text = line.substring(start, end);
            var match = catalog.lookup(text);
            if (match.isPresent() && match.get() instanceof CatalogMatch.Known known) {
                spans.add(TaggedSpan.of(start, text, known));
            } else {
                spans.add(TaggedSpan.of(start, text, Category.WORD, folded.substring(start, end)));
            }
            pos = end;
        }

        private boolean matchesSelfName(int to) {
            if (pos > 0 && Character.isLetterOrDigit(line.charAt(pos - 1))) {
                return false;
            }
            for (var name : selfNames) {
                int end = pos + name.length();
                if (end > to || !folded.startsWith(name, pos)) {
                    continue;
                }
                var possessive = end + 2 <= to && folded.startsWith("'s", end)
                                 && (end + 2 == to || !isWordChar(line.charAt(end + 2)));
                if (possessive || end == to || !isWordChar(line.charAt(end))) {
                    var attributes = Map.of("kind", "self");
                    if (possessive) {
                        end += 2;
                        attributes = Map.of("kind", "self", "possessive", "true");
                    }
                    var known = new CatalogMatch.Known(Category.REFERENCE, "self", attributes);
                    spans.add(TaggedSpan.of(pos, line.substring(pos, end), known));
                    pos = end;
                    return true;
                }
            }
            return false;
        }

        private void scanPhrase(int to) {
            var starts = new ArrayList<Integer>();
            var ends = new ArrayList<Integer>();
            int cursor = pos;
            while (starts.size() < catalog.maxPhraseWords() && cursor < to && isWordStart(cursor, to)) {
                int end = cursor;
                while (end < to && isWordChar(line.charAt(end))) {
                    end++;
                }
                starts.add(cursor);
                ends.add(end);
                int next = end;
                while (next < to && line.charAt(next) == ' ') {
                    next++;
                }
                if (next == end) {
                    break;
                }
                cursor = next;
            }
            for (int words = starts.size(); words >= 1; words--) {
                int end = ends.get(words - 1);
                var text = line.substring(pos, end);
                var match = catalog.lookup(text);
                if (match.isPresent()) {
                    addMatch(text, match.get());
                    pos = end;
                    return;
                }
            }
            int end = ends.get(0);
            var word = line.substring(pos, end);
            spans.add(TaggedSpan.of(pos, word, Category.WORD, catalog.normalizer().normalizeWord(word)));
            pos = end;
        }

        private void addMatch(String text, CatalogMatch match) {
            if (match instanceof CatalogMatch.Known known) {
                spans.add(TaggedSpan.of(pos, text, known));
            } else {
                spans.add(TaggedSpan.ambiguous(pos, text, (CatalogMatch.Ambiguous) match));
            }
        }

        private boolean containsWhitespace(int from, int to) {
            for (int i = from; i < to; i++) {
                if (Character.isWhitespace(line.charAt(i))) {
                    return true;
                }
            }
            return false;
        }

        private boolean isWordStart(int at, int to) {
            char c = line.charAt(at);
            if (Character.isLetterOrDigit(c) || c == '~') {
                return true;
            }
            if ((c == '+' || c == '-' || c == '−') && at + 1 < to) {
                char next = line.charAt(at + 1);
                return Character.isDigit(next) || next == 'X' || next == 'x';
            }
            return false;
        }
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '\'' || c == '’' || c == '-' || c == '/'
               || c == '+' || c == '−' || c == '~';
    }

    private static String canonicalPunctuation(char c) {
        return switch (c) {
            case '–', '―' -> "—";
            case '“', '”' -> "\"";
            case '‘', '’' -> "'";
            case '−' -> "-";
            default -> String.valueOf(c);
        };
    }
}
