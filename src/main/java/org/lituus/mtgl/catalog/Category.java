package org.lituus.mtgl.catalog;

/**
 * Closed set of semantic categories a span of oracle text can be tagged with.
 *
 * <p>Each category carries the two-letter tag code used in compact renderings ({@code xa<draw>}).
 */
public enum Category {
    ACTION("xa"),
    KEYWORD("kw"),
    ABILITY_WORD("aw"),
    MANA("ms"),
    SYMBOL("sy"),
    NUMBER("nu"),
    REFERENCE("ob"),
    ZONE("zn"),
    QUALITY("ch"),
    PHASE("ph"),
    TRIGGER("mt"),
    CONDITIONAL("cn"),
    PREPOSITION("pr"),
    SEQUENCE("sq"),
    QUANTIFIER("xq"),
    OPERATOR("op"),
    PUNCTUATION("pu"),
    WORD("wd"),
    WHITESPACE("ws"),
    REMINDER("rt"),
    AMBIGUOUS("am");

    private final String code;

    Category(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Categories that carry no meaning for the clause grammar.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == REMINDER;
    }
}
