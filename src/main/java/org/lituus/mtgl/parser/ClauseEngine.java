package org.lituus.mtgl.parser;

import org.lituus.mtgl.error.MtglError;
import org.lituus.mtgl.error.MtglException;
import org.lituus.mtgl.grammar.Expression;
import org.lituus.mtgl.grammar.Grammar;
import org.lituus.mtgl.grammar.Rule;
import org.lituus.mtgl.lexer.Token;
import org.lituus.mtgl.lexer.TokenType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Clause parsing engine - interprets a clause {@link Grammar} over the tokens of one ability line.
 *
 * <p>At every position the top-level clause rules are tried in priority order and the first one that consumes
 * tokens produces a clause. Tokens no rule matches are skipped one at a time and reported as unparsed clauses.
 * Nested spans {@code [ e ]} are parsed again the same way, which is how clauses get child clauses.
 */
public final class ClauseEngine implements ClauseParser {

    private final Grammar grammar;
    private final ParserConfig config;
    private final Map<String, Rule> rules;
    private final Map<String, ClauseKind> kinds;
    private final List<Rule> clauseRules;

    private ClauseEngine(Grammar grammar, ParserConfig config, Map<String, ClauseKind> kinds) {
        this.grammar = grammar;
        this.config = config;
        this.rules = grammar.ruleMap();
        this.kinds = Map.copyOf(kinds);
        this.clauseRules = grammar.clauseRules();
    }

    /**
     * @throws MtglException when the grammar does not validate or names an unknown clause kind
     */
    public static ClauseEngine create(Grammar grammar, ParserConfig config) {
        grammar.validate();
        var kinds = new HashMap<String, ClauseKind>();
        for (var rule : grammar.rules()) {
            if (!rule.isClause()) {
                continue;
            }
            var label = rule.kind()
                            .get();
            var kind = ClauseKind.fromLabel(label)
                                 .filter(ClauseKind::isRuleKind)
                                 .orElseThrow(() -> new MtglException(new MtglError.GrammarError(
                                     rule.span().start(),
                                     "Unknown clause kind '" + label + "' in rule '" + rule.name() + "'")));
            kinds.put(rule.name(), kind);
        }
        return new ClauseEngine(grammar, config, kinds);
    }

    public static ClauseEngine create(Grammar grammar) {
        return create(grammar, ParserConfig.DEFAULT);
    }

    public Grammar grammar() {
        return grammar;
    }

    public ParserConfig config() {
        return config;
    }

    @Override
    public List<Clause> parse(List<Token> tokens) {
        var ctx = ParsingContext.create(tokens, config);
        var saved = ctx.enterSpan(0, ctx.size(), false);
        try {
            return parseSpan(ctx);
        } finally {
            ctx.exitSpan(saved);
        }
    }

    // === Span Parsing ===

    /**
     * Parse the current span into clauses covering all of its tokens.
     */
    private List<Clause> parseSpan(ParsingContext ctx) {
        var clauses = new ArrayList<Clause>();
        int unmatchedFrom = -1;

        while (!ctx.isAtEnd()) {
            var startPos = ctx.pos();
            var clause = matchClause(ctx);
            if (clause.isPresent()) {
                if (unmatchedFrom >= 0) {
                    clauses.add(unparsed(ctx, unmatchedFrom, startPos));
                    unmatchedFrom = -1;
                }
                clauses.add(clause.get());
                continue;
            }
            // Skip one token and keep looking for a recognizable clause
            if (unmatchedFrom < 0) {
                unmatchedFrom = startPos;
            }
            ctx.advance();
            if (!config.mergeUnparsed()) {
                clauses.add(unparsed(ctx, unmatchedFrom, ctx.pos()));
                unmatchedFrom = -1;
            }
        }

        if (unmatchedFrom >= 0) {
            clauses.add(unparsed(ctx, unmatchedFrom, ctx.pos()));
        }
        return clauses;
    }

    private Optional<Clause> matchClause(ParsingContext ctx) {
        var startPos = ctx.pos();
        for (var rule : clauseRules) {
            var scope = ClauseScope.create();
            var result = parseRule(ctx, rule, scope);
            if (result.isSuccess() && ctx.pos() > startPos) {
                return Optional.of(scope.children()
                                        .get(0));
            }
            ctx.restorePos(startPos);
        }
        return Optional.empty();
    }

    private Clause unparsed(ParsingContext ctx, int from, int to) {
        var covered = ctx.tokens(from, to);
        var span = ctx.spanOf(from, to);
        var attributes = new LinkedHashMap<String, String>();
        attributes.put("text", covered.stream()
                                      .map(Token::text)
                                      .collect(Collectors.joining(" ")));
        attributes.put("span", span.toString());
        var candidates = covered.stream()
                                .filter(t -> t.is(TokenType.UNPARSED))
                                .map(t -> t.attributes().get("candidates"))
                                .filter(c -> c != null && !c.isEmpty())
                                .collect(Collectors.joining(" "));
        if (!candidates.isEmpty()) {
            attributes.put("candidates", candidates);
        }
        return new Clause(ClauseKind.UNPARSED, null, from, to, span, attributes, List.of());
    }

    // === Rule Parsing ===

    private MatchResult parseRule(ParsingContext ctx, Rule rule, ClauseScope scope) {
        var startPos = ctx.pos();
        var cached = ctx.cachedRule(rule.name());
        if (cached.isPresent()) {
            return replay(ctx, cached.get(), scope);
        }
        // A rule re-entered at the same position of the same span can never make progress
        if (!ctx.enterRule(rule.name())) {
            return MatchResult.Failure.at(startPos, "rule '" + rule.name() + "'");
        }
        var guardHits = ctx.guardHits();
        try {
            var local = ClauseScope.create();
            var result = parseExpression(ctx, rule.expression(), local);
            if (result.isFailure()) {
                ctx.restorePos(startPos);
                if (ctx.guardHits() == guardHits) {
                    ctx.cacheRule(rule.name(), startPos, ParsingContext.RuleOutcome.failure(result));
                }
                return result;
            }
            var contribution = ClauseScope.create();
            if (rule.isClause()) {
                contribution.addChild(new Clause(kinds.get(rule.name()),
                                                 rule.name(),
                                                 startPos,
                                                 ctx.pos(),
                                                 ctx.spanOf(startPos, ctx.pos()),
                                                 local.captures(),
                                                 local.children()));
            } else {
                contribution.mergeFrom(local);
            }
            scope.mergeFrom(contribution);
            var success = MatchResult.Success.at(ctx.pos());
            if (ctx.guardHits() == guardHits) {
                ctx.cacheRule(rule.name(), startPos, new ParsingContext.RuleOutcome(success,
                                                                                   ctx.pos(),
                                                                                   contribution.captures(),
                                                                                   contribution.children()));
            }
            return success;
        } finally {
            ctx.exitRule(rule.name(), startPos);
        }
    }

    private static MatchResult replay(ParsingContext ctx, ParsingContext.RuleOutcome outcome, ClauseScope scope) {
        if (outcome.result().isFailure()) {
            return outcome.result();
        }
        ctx.restorePos(outcome.end());
        outcome.captures().forEach(scope::capture);
        outcome.children().forEach(child -> scope.addChild(copy(child)));
        return outcome.result();
    }

    /**
     * Fresh instances for a memoized subtree, so no clause object is ever reachable twice.
     */
    private static Clause copy(Clause clause) {
        return new Clause(clause.kind(),
                          clause.rule(),
                          clause.start(),
                          clause.end(),
                          clause.span(),
                          clause.attributes(),
                          clause.children()
                                .stream()
                                .map(ClauseEngine::copy)
                                .toList());
    }

    // === Expression Parsing ===

    private MatchResult parseExpression(ParsingContext ctx, Expression expr, ClauseScope scope) {
        if (expr instanceof Expression.TypeMatch type) {
            return parseToken(ctx, t -> t.type() == type.type(), type.type().grammarName());
        }
        if (expr instanceof Expression.Literal lit) {
            return parseToken(ctx, t -> t.value().equals(lit.value()), "'" + lit.value() + "'");
        }
        if (expr instanceof Expression.TypedLiteral typed) {
            return parseToken(ctx,
                              t -> t.type() == typed.type() && t.value().equals(typed.value()),
                              typed.type().grammarName() + ":'" + typed.value() + "'");
        }
        if (expr instanceof Expression.Dictionary dict) {
            return parseToken(ctx, t -> dict.values().contains(t.value()), String.join(" | ", dict.values()));
        }
        if (expr instanceof Expression.Any) {
            return parseToken(ctx, t -> true, "any token");
        }
        if (expr instanceof Expression.Anchor) {
            return ctx.pos() == ctx.spanStart()
                   ? new MatchResult.PredicateSuccess(ctx.pos())
                   : MatchResult.Failure.at(ctx.pos(), "start of span");
        }
        if (expr instanceof Expression.Reference ref) {
            return parseRule(ctx, rules.get(ref.ruleName()), scope);
        }
        if (expr instanceof Expression.Sequence seq) {
            return parseSequence(ctx, seq, scope);
        }
        if (expr instanceof Expression.Choice choice) {
            return parseChoice(ctx, choice, scope);
        }
        if (expr instanceof Expression.ZeroOrMore zom) {
            return parseRepeated(ctx, zom.expression(), scope, 0);
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return parseRepeated(ctx, oom.expression(), scope, 1);
        }
        if (expr instanceof Expression.Optional opt) {
            return parseOptional(ctx, opt, scope);
        }
        if (expr instanceof Expression.And and) {
            return parseAnd(ctx, and);
        }
        if (expr instanceof Expression.Not not) {
            return parseNot(ctx, not);
        }
        if (expr instanceof Expression.Capture cap) {
            return parseCapture(ctx, cap, scope);
        }
        if (expr instanceof Expression.Nested nested) {
            return parseNested(ctx, nested, scope);
        }
        if (expr instanceof Expression.Group grp) {
            return parseExpression(ctx, grp.expression(), scope);
        }
        throw new IllegalStateException("Unsupported expression: " + expr);
    }

    // === Terminal Parsers ===

    private MatchResult parseToken(ParsingContext ctx, Predicate<Token> matches, String expected) {
        if (ctx.isAtEnd() || !matches.test(ctx.peek())) {
            return MatchResult.Failure.at(ctx.pos(), expected);
        }
        ctx.advance();
        return MatchResult.Success.at(ctx.pos());
    }

    // === Combinator Parsers ===

    private MatchResult parseSequence(ParsingContext ctx, Expression.Sequence seq, ClauseScope scope) {
        var startPos = ctx.pos();
        var local = ClauseScope.create();

        for (var element : seq.elements()) {
            var result = parseExpression(ctx, element, local);
            if (result.isFailure()) {
                ctx.restorePos(startPos);
                return result;
            }
        }

        scope.mergeFrom(local);
        return MatchResult.Success.at(ctx.pos());
    }

    private MatchResult parseChoice(ParsingContext ctx, Expression.Choice choice, ClauseScope scope) {
        var startPos = ctx.pos();
        MatchResult lastFailure = null;

        for (var alt : choice.alternatives()) {
            // Local collector - only merged on success
            var local = ClauseScope.create();
            var result = parseExpression(ctx, alt, local);
            if (result.isSuccess()) {
                scope.mergeFrom(local);
                return result;
            }
            lastFailure = result;
            ctx.restorePos(startPos);
        }

        return lastFailure != null
               ? lastFailure
               : MatchResult.Failure.at(startPos, "one of alternatives");
    }

    private MatchResult parseRepeated(ParsingContext ctx, Expression expr, ClauseScope scope, int min) {
        var startPos = ctx.pos();
        var local = ClauseScope.create();
        int count = 0;

        while (true) {
            var beforePos = ctx.pos();
            var iteration = ClauseScope.create();
            var result = parseExpression(ctx, expr, iteration);
            if (result.isFailure()) {
                ctx.restorePos(beforePos);
                break;
            }
            local.mergeFrom(iteration);
            count++;
            // An iteration that consumed nothing would repeat forever
            if (ctx.pos() == beforePos) {
                break;
            }
        }

        if (count < min) {
            ctx.restorePos(startPos);
            return MatchResult.Failure.at(startPos, "at least " + min + " repetition");
        }
        scope.mergeFrom(local);
        return MatchResult.Success.at(ctx.pos());
    }

    private MatchResult parseOptional(ParsingContext ctx, Expression.Optional opt, ClauseScope scope) {
        var startPos = ctx.pos();
        var local = ClauseScope.create();
        var result = parseExpression(ctx, opt.expression(), local);
        if (result.isSuccess()) {
            scope.mergeFrom(local);
        } else {
            ctx.restorePos(startPos);
        }
        return MatchResult.Success.at(ctx.pos());
    }

    // === Predicate Parsers ===

    private MatchResult parseAnd(ParsingContext ctx, Expression.And and) {
        var startPos = ctx.pos();
        var result = parseExpression(ctx, and.expression(), ClauseScope.create());
        ctx.restorePos(startPos); // Always restore - predicates don't consume

        if (result.isSuccess()) {
            return new MatchResult.PredicateSuccess(startPos);
        }
        return result;
    }

    private MatchResult parseNot(ParsingContext ctx, Expression.Not not) {
        var startPos = ctx.pos();
        var result = parseExpression(ctx, not.expression(), ClauseScope.create());
        ctx.restorePos(startPos); // Always restore - predicates don't consume

        if (result.isSuccess()) {
            return MatchResult.Failure.at(startPos, "not " + not.expression());
        }
        return new MatchResult.PredicateSuccess(startPos);
    }

    // === Special Parsers ===

    private MatchResult parseCapture(ParsingContext ctx, Expression.Capture cap, ClauseScope scope) {
        var startPos = ctx.pos();
        var local = ClauseScope.create();
        var result = parseExpression(ctx, cap.expression(), local);
        if (result.isFailure()) {
            return result;
        }

        scope.mergeFrom(local);
        if (ctx.pos() > startPos) {
            scope.capture(cap.name(), render(ctx.tokens(startPos, ctx.pos())));
        }
        return result;
    }

    /**
     * Match the extent of a nested span, then parse its tokens again with the top-level clause rules.
     */
    private MatchResult parseNested(ParsingContext ctx, Expression.Nested nested, ClauseScope scope) {
        var startPos = ctx.pos();
        var result = parseExpression(ctx, nested.expression(), ClauseScope.create());
        if (result.isFailure()) {
            return result;
        }

        var endPos = ctx.pos();
        if (endPos == startPos) {
            return result;
        }
        if (!ctx.canNest(startPos, endPos)) {
            scope.addChild(unparsed(ctx, startPos, endPos));
            return MatchResult.Success.at(endPos);
        }

        var cached = ctx.cachedSpan(startPos, endPos);
        if (cached.isPresent()) {
            cached.get().forEach(child -> scope.addChild(copy(child)));
            return MatchResult.Success.at(endPos);
        }

        // No rule is active inside a span that is just being entered, so its clauses never depend on the caller
        var saved = ctx.enterSpan(startPos, endPos, true);
        List<Clause> children;
        try {
            children = parseSpan(ctx);
        } finally {
            ctx.exitSpan(saved);
        }
        ctx.cacheSpan(startPos, endPos, children);
        scope.addChildren(children);
        return MatchResult.Success.at(ctx.pos());
    }

    /**
     * Attribute value of captured tokens: symbols concatenate ({B}{B}{B}), anything else joins values with spaces.
     */
    private static String render(List<Token> tokens) {
        if (tokens.stream()
                  .allMatch(Token::isSymbol)) {
            return tokens.stream()
                         .map(Token::surface)
                         .collect(Collectors.joining());
        }
        return tokens.stream()
                     .map(Token::value)
                     .collect(Collectors.joining(" "));
    }
}
