package org.lituus.mtgl.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Captures and child clauses collected while matching one expression.
 *
 * <p>Every attempt that may fail works on a fresh scope and is merged into its parent only on success,
 * so abandoned alternatives leave nothing behind.
 */
final class ClauseScope {
    private final Map<String, String> captures = new LinkedHashMap<>();
    private final List<Clause> children = new ArrayList<>();

    private ClauseScope() {}

    static ClauseScope create() {
        return new ClauseScope();
    }

    /**
     * Record a capture; a name captured again gets the new value appended after a space.
     */
    void capture(String name, String value) {
        captures.merge(name, value, (first, second) -> first + " " + second);
    }

    void addChild(Clause clause) {
        children.add(clause);
    }

    void addChildren(List<Clause> clauses) {
        children.addAll(clauses);
    }

    void mergeFrom(ClauseScope other) {
        other.captures.forEach(this::capture);
        children.addAll(other.children);
    }

    Map<String, String> captures() {
        return captures;
    }

    List<Clause> children() {
        return children;
    }
}
