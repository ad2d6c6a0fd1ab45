package org.lituus.mtgl.lexer;

import org.lituus.mtgl.tree.SourceSpan;

import java.util.Map;

/**
 * Atomic unit of an ability line.
 *
 * @param value normalized value; mana symbols carry their canonical body ({@code B}, {@code W/U})
 * @param text  original characters
 * @param group index of the tagged span the token came from; symbols of one mana string share it
 */
public record Token(
    TokenType type,
    String value,
    String text,
    SourceSpan span,
    int group,
    Map<String, String> attributes
) {
    public Token {
        attributes = Map.copyOf(attributes);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isSymbol() {
        return type == TokenType.MANA_SYMBOL || type == TokenType.SYMBOL;
    }

    /**
     * Value as written into clause attributes: symbols in braces, everything else as is.
     */
    public String surface() {
        return isSymbol() ? "{" + value + "}" : value;
    }

    @Override
    public String toString() {
        return type.grammarName() + ":" + value;
    }
}
