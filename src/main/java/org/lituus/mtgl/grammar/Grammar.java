package org.lituus.mtgl.grammar;

import org.lituus.mtgl.error.MtglError;
import org.lituus.mtgl.error.MtglException;
import org.lituus.mtgl.tree.SourceLocation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A complete clause grammar - collection of rules with directives.
 *
 * @param version     value of the {@code %version} directive
 * @param clauseOrder rules named by the {@code %clauses} directive, in priority order; empty when absent
 */
public record Grammar(
 List<Rule> rules,
 String version,
 List<Expression.Reference> clauseOrder) {
    public static final String STANDARD_RESOURCE = "mtgl/clauses.peg";
    public static final String UNVERSIONED = "0";

    public Grammar {
        rules = List.copyOf(rules);
        clauseOrder = List.copyOf(clauseOrder);
    }

    /**
     * The bundled clause grammar, parsed and validated.
     */
    public static Grammar standard() {
        return StandardHolder.INSTANCE;
    }

    /**
     * Parse and validate a grammar from a classpath resource.
     */
    public static Grammar fromResource(String path) {
        var loader = Grammar.class.getClassLoader();
        try (var in = loader.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Grammar resource not found: " + path);
            }
            return GrammarParser.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8))
                                .validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read grammar resource " + path, e);
        }
    }

    /**
     * Get rule by name.
     */
    public Optional<Rule> rule(String name) {
        return rules.stream()
                    .filter(r -> r.name()
                                  .equals(name))
                    .findFirst();
    }

    /**
     * Build a lookup map for efficient rule access.
     */
    public Map<String, Rule> ruleMap() {
        return rules.stream()
                    .collect(Collectors.toMap(Rule::name, r -> r, (first, second) -> first));
    }

    /**
     * Top-level clause rules in priority order: the {@code %clauses} list, or declaration order of clause rules.
     */
    public List<Rule> clauseRules() {
        if (clauseOrder.isEmpty()) {
            return rules.stream()
                        .filter(Rule::isClause)
                        .toList();
        }
        var map = ruleMap();
        return clauseOrder.stream()
                          .map(ref -> map.get(ref.ruleName()))
                          .toList();
    }

    /**
     * Validate the grammar for duplicate rules, undefined references and unusable clause lists.
     *
     * @throws MtglException carrying a {@link MtglError.GrammarError}
     */
    public Grammar validate() {
        var ruleNames = new HashSet<String>();
        for (var rule : rules) {
            if (!ruleNames.add(rule.name())) {
                throw grammarError(rule.span()
                                       .start(), "Duplicate rule: '" + rule.name() + "'");
            }
        }
        for (var rule : rules) {
            var undefinedRef = findUndefinedReference(rule.expression(), ruleNames);
            if (undefinedRef.isPresent()) {
                var ref = undefinedRef.get();
                throw grammarError(ref.span()
                                      .start(), "Undefined rule reference: '" + ref.ruleName() + "'");
            }
        }
        var map = ruleMap();
        for (var ref : clauseOrder) {
            var rule = map.get(ref.ruleName());
            if (rule == null) {
                throw grammarError(ref.span()
                                      .start(), "Unknown rule in %clauses: '" + ref.ruleName() + "'");
            }
            if (!rule.isClause()) {
                throw grammarError(ref.span()
                                      .start(), "Rule in %clauses has no clause kind: '" + ref.ruleName() + "'");
            }
        }
        if (clauseRules().isEmpty()) {
            throw grammarError(SourceLocation.START, "Grammar defines no clause rules");
        }
        return this;
    }

    private static MtglException grammarError(SourceLocation location, String reason) {
        return new MtglException(new MtglError.GrammarError(location, reason));
    }

    /**
     * Recursively find the first undefined rule reference in an expression.
     */
    private Optional<Expression.Reference> findUndefinedReference(Expression expr, Set<String> ruleNames) {
        if (expr instanceof Expression.Reference ref) {
            return ruleNames.contains(ref.ruleName())
                   ? Optional.empty()
                   : Optional.of(ref);
        }
        return nested(expr).stream()
                           .map(e -> findUndefinedReference(e, ruleNames))
                           .flatMap(Optional::stream)
                           .findFirst();
    }

    /**
     * Direct sub-expressions; terminals have none.
     */
    static List<Expression> nested(Expression expr) {
        if (expr instanceof Expression.Sequence seq) {
            return seq.elements();
        }
        if (expr instanceof Expression.Choice choice) {
            return choice.alternatives();
        }
        if (expr instanceof Expression.ZeroOrMore zom) {
            return List.of(zom.expression());
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return List.of(oom.expression());
        }
        if (expr instanceof Expression.Optional opt) {
            return List.of(opt.expression());
        }
        if (expr instanceof Expression.And and) {
            return List.of(and.expression());
        }
        if (expr instanceof Expression.Not not) {
            return List.of(not.expression());
        }
        if (expr instanceof Expression.Capture cap) {
            return List.of(cap.expression());
        }
        if (expr instanceof Expression.Nested nested) {
            return List.of(nested.expression());
        }
        if (expr instanceof Expression.Group grp) {
            return List.of(grp.expression());
        }
        return List.of();
    }

    private static final class StandardHolder {
        private static final Grammar INSTANCE = fromResource(STANDARD_RESOURCE);
    }
}
