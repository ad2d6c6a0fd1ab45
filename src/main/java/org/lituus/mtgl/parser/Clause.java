package org.lituus.mtgl.parser;

import org.lituus.mtgl.tree.SourceSpan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A recognized structural unit of an ability line.
 *
 * @param rule  name of the grammar rule that produced the clause; {@code null} for unparsed clauses
 * @param start index of the first token covered (inclusive)
 * @param end   index after the last token covered (exclusive)
 */
public record Clause(
    ClauseKind kind,
    String rule,
    int start,
    int end,
    SourceSpan span,
    Map<String, String> attributes,
    List<Clause> children
) {
    public Clause {
        // insertion order is capture order
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = List.copyOf(children);
    }

    public boolean isUnparsed() {
        return kind == ClauseKind.UNPARSED;
    }

    public int tokenCount() {
        return end - start;
    }

    @Override
    public String toString() {
        return kind.label() + attributes + "@" + start + ".." + end + children;
    }
}
