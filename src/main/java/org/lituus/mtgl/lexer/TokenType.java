package org.lituus.mtgl.lexer;

import org.lituus.mtgl.catalog.Category;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of token types. The lower-case {@link #grammarName()} is how clause rules refer to a type.
 */
public enum TokenType {
    ACTION,
    KEYWORD,
    ABILITY_WORD,
    MANA_SYMBOL,
    SYMBOL,
    NUMBER,
    REFERENCE,
    ZONE,
    QUALITY,
    PHASE,
    TRIGGER,
    CONDITIONAL,
    PREPOSITION,
    SEQUENCE,
    QUANTIFIER,
    OPERATOR,
    PUNCTUATION,
    WORD,
    UNPARSED;

    public String grammarName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TokenType> fromGrammarName(String name) {
        for (var type : values()) {
            if (type.grammarName().equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Token type of a resolved, non-trivia category. Mana strings map per symbol, see {@link Lexer}.
     */
    static TokenType of(Category category) {
        return switch (category) {
            case ACTION -> ACTION;
            case KEYWORD -> KEYWORD;
            case ABILITY_WORD -> ABILITY_WORD;
            case MANA -> MANA_SYMBOL;
            case SYMBOL -> SYMBOL;
            case NUMBER -> NUMBER;
            case REFERENCE -> REFERENCE;
            case ZONE -> ZONE;
            case QUALITY -> QUALITY;
            case PHASE -> PHASE;
            case TRIGGER -> TRIGGER;
            case CONDITIONAL -> CONDITIONAL;
            case PREPOSITION -> PREPOSITION;
            case SEQUENCE -> SEQUENCE;
            case QUANTIFIER -> QUANTIFIER;
            case OPERATOR -> OPERATOR;
            case PUNCTUATION -> PUNCTUATION;
            case WORD -> WORD;
            case AMBIGUOUS, WHITESPACE, REMINDER -> UNPARSED;
        };
    }
}
