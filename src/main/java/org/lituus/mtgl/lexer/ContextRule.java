package org.lituus.mtgl.lexer;

import org.lituus.mtgl.catalog.Category;
import org.lituus.mtgl.tagger.TaggedSpan;

import java.util.List;
import java.util.Set;

/**
 * Decides one meaning of an ambiguous phrase from its neighbours.
 *
 * @param value      catalog value the rule applies to ({@code exile}, {@code counter})
 * @param resolvesTo category chosen when the rule applies
 * @param previous   types the preceding token must have, empty for any
 * @param next       categories the following span must have, empty for any
 */
public record ContextRule(String value, Category resolvesTo, Set<TokenType> previous, Set<Category> next) {

    /**
     * Rules tried in order; the first applicable one wins.
     */
    public static final List<ContextRule> STANDARD = List.of(
        // "from exile", "in exile" vs "exile target creature"
        new ContextRule("exile", Category.ZONE, Set.of(TokenType.PREPOSITION), Set.of()),
        new ContextRule("exile", Category.ACTION, Set.of(), Set.of()),
        // "a +1/+1 counter", "all counters" vs "counter target spell"
        new ContextRule("counter", Category.REFERENCE,
                        Set.of(TokenType.QUALITY, TokenType.NUMBER, TokenType.QUANTIFIER, TokenType.PREPOSITION),
                        Set.of()),
        new ContextRule("counter", Category.ACTION, Set.of(),
                        Set.of(Category.QUANTIFIER, Category.REFERENCE, Category.NUMBER)),
        // "a copy of" vs "copy target instant"
        new ContextRule("copy", Category.REFERENCE,
                        Set.of(TokenType.QUALITY, TokenType.NUMBER, TokenType.QUANTIFIER, TokenType.PREPOSITION),
                        Set.of()),
        new ContextRule("copy", Category.ACTION, Set.of(), Set.of(Category.QUANTIFIER, Category.REFERENCE)));

    public static ContextRule after(String value, Category resolvesTo, TokenType... previous) {
        return new ContextRule(value, resolvesTo, Set.of(previous), Set.of());
    }

    public static ContextRule before(String value, Category resolvesTo, Category... next) {
        return new ContextRule(value, resolvesTo, Set.of(), Set.of(next));
    }

    boolean applies(Token preceding, TaggedSpan following) {
        if (!previous.isEmpty() && (preceding == null || !previous.contains(preceding.type()))) {
            return false;
        }
        return next.isEmpty() || (following != null && next.contains(following.category()));
    }
}
