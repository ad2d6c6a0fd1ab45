package org.lituus.mtgl.parser;

import org.lituus.mtgl.lexer.Token;

import java.util.List;

/**
 * Clause parser interface - groups the tokens of one ability line into clauses.
 */
public interface ClauseParser {

    /**
     * Parse tokens into top-level clauses.
     *
     * <p>Never fails on unrecognized input: the returned clauses cover every token exactly once, in order,
     * with tokens no rule matches grouped into {@link ClauseKind#UNPARSED} clauses.
     */
    List<Clause> parse(List<Token> tokens);
}
