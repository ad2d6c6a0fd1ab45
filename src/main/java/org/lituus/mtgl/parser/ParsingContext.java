package org.lituus.mtgl.parser;

import org.lituus.mtgl.lexer.Token;
import org.lituus.mtgl.tree.SourceLocation;
import org.lituus.mtgl.tree.SourceSpan;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable parsing context that tracks state while matching clause rules over the tokens of one line.
 *
 * <p>Matching happens inside a span {@code [spanStart, limit)}: the whole line at the top level, the tokens
 * of a nested span while they are parsed again.
 *
 * <p>With {@link ParserConfig#packratEnabled()} rule outcomes and nested span parses are memoized per span and
 * nesting depth. An outcome computed while the rule recursion guard refused entry depends on the path that led
 * to it and is never stored.
 */
public final class ParsingContext {

    private final List<Token> tokens;
    private final ParserConfig config;
    private final Set<ActiveRule> activeRules;
    private final Set<ActiveSpan> activeSpans;
    private final Map<RuleKey, RuleOutcome> ruleCache;
    private final Map<SpanKey, List<Clause>> spanCache;

    private int pos;
    private int spanStart;
    private int limit;
    private int depth;
    private int guardHits;

    private ParsingContext(List<Token> tokens, ParserConfig config) {
        this.tokens = List.copyOf(tokens);
        this.config = config;
        this.activeRules = new HashSet<>();
        this.activeSpans = new HashSet<>();
        this.ruleCache = config.packratEnabled() ? new HashMap<>() : null;
        this.spanCache = config.packratEnabled() ? new HashMap<>() : null;
        this.pos = 0;
        this.spanStart = 0;
        this.limit = this.tokens.size();
        this.depth = 0;
    }

    public static ParsingContext create(List<Token> tokens, ParserConfig config) {
        return new ParsingContext(tokens, config);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public void restorePos(int pos) {
        this.pos = pos;
    }

    public boolean isAtEnd() {
        return pos >= limit;
    }

    public int spanStart() {
        return spanStart;
    }

    public int limit() {
        return limit;
    }

    public int depth() {
        return depth;
    }

    // === Token Access ===

    public Token peek() {
        return tokens.get(pos);
    }

    public Token advance() {
        return tokens.get(pos++);
    }

    public List<Token> tokens(int from, int to) {
        return tokens.subList(from, to);
    }

    public int size() {
        return tokens.size();
    }

    // === Spans ===

    /**
     * Enter the span {@code [from, to)}; nested spans count towards the nesting depth.
     *
     * @return state to hand back to {@link #exitSpan(Bounds)}
     */
    public Bounds enterSpan(int from, int to, boolean nested) {
        var saved = new Bounds(spanStart, limit, pos, depth);
        spanStart = from;
        limit = to;
        pos = from;
        if (nested) {
            depth++;
        }
        activeSpans.add(new ActiveSpan(from, to));
        return saved;
    }

    public void exitSpan(Bounds saved) {
        activeSpans.remove(new ActiveSpan(spanStart, limit));
        spanStart = saved.spanStart();
        limit = saved.limit();
        pos = saved.pos();
        depth = saved.depth();
    }

    /**
     * Whether a nested span may be entered: it is not already being parsed and the depth limit is not reached.
     *
     * <p>A nested span lies inside the current one, so the only active span it can repeat is the current span.
     * The answer therefore depends on span bounds and depth alone and does not count as a guard hit.
     */
    public boolean canNest(int from, int to) {
        return !activeSpans.contains(new ActiveSpan(from, to)) && depth < config.maxNestingDepth();
    }

    // === Recursion Guard ===

    /**
     * Mark a rule as active at the current position of the current span.
     *
     * @return false when the rule is already active there
     */
    public boolean enterRule(String ruleName) {
        if (activeRules.add(new ActiveRule(ruleName, pos, spanStart, limit))) {
            return true;
        }
        guardHits++;
        return false;
    }

    public void exitRule(String ruleName, int at) {
        activeRules.remove(new ActiveRule(ruleName, at, spanStart, limit));
    }

    /**
     * Number of times the rule recursion guard refused entry so far.
     */
    public int guardHits() {
        return guardHits;
    }

    // === Packrat Cache ===

    public Optional<RuleOutcome> cachedRule(String ruleName) {
        if (ruleCache == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ruleCache.get(new RuleKey(ruleName, pos, spanStart, limit, depth)));
    }

    public void cacheRule(String ruleName, int at, RuleOutcome outcome) {
        if (ruleCache != null) {
            ruleCache.put(new RuleKey(ruleName, at, spanStart, limit, depth), outcome);
        }
    }

    /**
     * Clauses of the nested span {@code [from, to)} entered from the current depth.
     */
    public Optional<List<Clause>> cachedSpan(int from, int to) {
        if (spanCache == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(spanCache.get(new SpanKey(from, to, depth)));
    }

    public void cacheSpan(int from, int to, List<Clause> clauses) {
        if (spanCache != null) {
            spanCache.put(new SpanKey(from, to, depth), List.copyOf(clauses));
        }
    }

    // === Span Creation ===

    /**
     * Source span from the start of token {@code from} to the end of token {@code to - 1}.
     */
    public SourceSpan spanOf(int from, int to) {
        if (from >= to) {
            var at = from < tokens.size()
                     ? tokens.get(from).span().start()
                     : SourceLocation.START;
            return SourceSpan.at(at);
        }
        return tokens.get(from)
                     .span()
                     .merge(tokens.get(to - 1).span());
    }

    /**
     * Saved span state.
     */
    public record Bounds(int spanStart, int limit, int pos, int depth) {}

    private record ActiveSpan(int from, int to) {}

    /**
     * Memoized outcome of a rule: on success the end position and what the rule contributed to its caller.
     */
    public record RuleOutcome(MatchResult result, int end, Map<String, String> captures, List<Clause> children) {
        public RuleOutcome {
            captures = Collections.unmodifiableMap(new LinkedHashMap<>(captures));
            children = List.copyOf(children);
        }

        public static RuleOutcome failure(MatchResult result) {
            return new RuleOutcome(result, -1, Map.of(), List.of());
        }
    }

    private record ActiveRule(String ruleName, int pos, int spanStart, int limit) {}

    private record RuleKey(String ruleName, int pos, int spanStart, int limit, int depth) {}

    private record SpanKey(int from, int to, int depth) {}
}
