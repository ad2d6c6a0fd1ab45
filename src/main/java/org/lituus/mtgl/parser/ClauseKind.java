package org.lituus.mtgl.parser;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of clause kinds. Grammar rules name them by {@link #label()}.
 */
public enum ClauseKind {
    MANA,
    COST,
    TRIGGER,
    CONDITION,
    EFFECT,
    ACTION,
    TARGET,
    MODIFIER,
    CONDITIONAL,
    REPLACEMENT,
    KEYWORD,
    KEYWORD_LINE,
    ACTIVATED,
    ABILITY_WORD,
    MODAL,
    MODE,
    CHAPTER,
    LEVEL,
    GRANTED,
    /**
     * Ability line of no other shape on a permanent card. Assigned when the tree is built.
     */
    STATIC,
    /**
     * Ability line of no other shape on an instant or sorcery. Assigned when the tree is built.
     */
    SPELL,
    UNPARSED;

    private static final Set<ClauseKind> LINE_SHAPES =
        EnumSet.of(ABILITY_WORD, KEYWORD_LINE, MODAL, MODE, CHAPTER, LEVEL, ACTIVATED, TRIGGER);

    private final String label = name().toLowerCase(Locale.ROOT)
                                       .replace('_', '-');

    /**
     * Kebab-case label, also used as tree node label.
     */
    public String label() {
        return label;
    }

    /**
     * Whether grammar rules may produce clauses of this kind.
     */
    public boolean isRuleKind() {
        return this != UNPARSED && this != STATIC && this != SPELL;
    }

    /**
     * Whether a line starting with a clause of this kind is classified by that clause alone.
     */
    public boolean isLineShape() {
        return LINE_SHAPES.contains(this);
    }

    public static Optional<ClauseKind> fromLabel(String label) {
        for (var kind : values()) {
            if (kind.label.equals(label)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
