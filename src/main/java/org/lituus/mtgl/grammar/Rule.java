package org.lituus.mtgl.grammar;

import org.lituus.mtgl.tree.SourceSpan;

import java.util.Optional;

/**
 * A grammar rule: Name <- Expression { kind }
 *
 * <p>A rule with a kind produces a clause of that kind; a rule without one is a fragment whose matches
 * and captures belong to the calling rule.
 */
public record Rule(
 SourceSpan span,
 String name,
 Expression expression,
 Optional<String> kind) {
    public boolean isClause() {
        return kind.isPresent();
    }
}
