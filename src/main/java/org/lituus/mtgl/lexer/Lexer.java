package org.lituus.mtgl.lexer;

import org.lituus.mtgl.catalog.CatalogMatch;
import org.lituus.mtgl.catalog.Category;
import org.lituus.mtgl.catalog.ManaSymbols;
import org.lituus.mtgl.tagger.TaggedSpan;
import org.lituus.mtgl.tagger.TaggedText;
import org.lituus.mtgl.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns tagged text into typed tokens in source order.
 *
 * <p>Whitespace and reminder spans are dropped, mana strings are split into one token per symbol,
 * and ambiguous phrases are resolved by {@link ContextRule}s. An ambiguity no rule decides becomes an
 * {@link TokenType#UNPARSED} token listing its candidates.
 */
public final class Lexer {
    private static final Logger log = LoggerFactory.getLogger(Lexer.class);
    private static final Pattern SYMBOL = Pattern.compile("\\{([^{}]+)}");

    private final List<ContextRule> rules;

    private Lexer(List<ContextRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static Lexer create() {
        return new Lexer(ContextRule.STANDARD);
    }

    public static Lexer create(List<ContextRule> rules) {
        return new Lexer(rules);
    }

    public List<Token> tokenize(TaggedText text) {
        return tokenize(text, 1);
    }

    /**
     * @param lineNumber 1-based ability line number recorded in every token span
     */
    public List<Token> tokenize(TaggedText text, int lineNumber) {
        var spans = text.spans();
        var tokens = new ArrayList<Token>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            var span = spans.get(i);
            var category = span.category();
            if (category.isTrivia()) {
                continue;
            }
            if (category == Category.MANA || category == Category.SYMBOL) {
                splitSymbols(span, i, lineNumber, tokens);
            } else if (category == Category.AMBIGUOUS) {
                var previous = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
                tokens.add(resolve(span, i, lineNumber, previous, following(spans, i)));
            } else {
                tokens.add(new Token(TokenType.of(category), span.value(), span.text(),
                                     SourceSpan.onLine(lineNumber, span.start(), span.end()), i, span.attributes()));
            }
        }
        return tokens;
    }

    private void splitSymbols(TaggedSpan span, int group, int lineNumber, List<Token> tokens) {
        var matcher = SYMBOL.matcher(span.text());
        while (matcher.find()) {
            var body = matcher.group(1);
            var canonical = ManaSymbols.canonical(body).orElse(body.toUpperCase(Locale.ROOT));
            var type = ManaSymbols.isMana(canonical) ? TokenType.MANA_SYMBOL : TokenType.SYMBOL;
            int start = span.start() + matcher.start();
            int end = span.start() + matcher.end();
            tokens.add(new Token(type, canonical, matcher.group(), SourceSpan.onLine(lineNumber, start, end), group,
                                 Map.of()));
        }
    }

    private Token resolve(TaggedSpan span, int group, int lineNumber, Token previous, TaggedSpan next) {
        var location = SourceSpan.onLine(lineNumber, span.start(), span.end());
        for (var rule : rules) {
            var candidate = span.candidates()
                                .stream()
                                .filter(k -> k.value().equals(rule.value()) && k.category() == rule.resolvesTo())
                                .findFirst();
            if (candidate.isPresent() && rule.applies(previous, next)) {
                var known = candidate.get();
                return new Token(TokenType.of(known.category()), known.value(), span.text(), location, group,
                                 known.attributes());
            }
        }
        var candidates = span.candidates()
                             .stream()
                             .map(Lexer::describe)
                             .collect(Collectors.joining(" "));
        log.debug("Unresolved ambiguity '{}' at {} ({})", span.text(), location, candidates);
        return new Token(TokenType.UNPARSED, span.value(), span.text(), location, group,
                         Map.of("candidates", candidates));
    }

    private static TaggedSpan following(List<TaggedSpan> spans, int index) {
        for (int i = index + 1; i < spans.size(); i++) {
            if (!spans.get(i).category().isTrivia()) {
                return spans.get(i);
            }
        }
        return null;
    }

    private static String describe(CatalogMatch.Known known) {
        return known.category().name().toLowerCase(Locale.ROOT) + ":" + known.value();
    }
}
