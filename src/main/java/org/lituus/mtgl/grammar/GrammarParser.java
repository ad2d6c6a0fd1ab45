package org.lituus.mtgl.grammar;

import org.lituus.mtgl.error.MtglError;
import org.lituus.mtgl.error.MtglException;
import org.lituus.mtgl.lexer.TokenType;
import org.lituus.mtgl.tree.SourceLocation;
import org.lituus.mtgl.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parser for clause grammar syntax.
 * Converts grammar text into Grammar object.
 *
 * <p>Lower-case identifiers name token types, capitalized identifiers reference rules.
 */
public final class GrammarParser {
    private static final String SEQUENCE_STARTS = ".^([&!$";

    private final List<GrammarToken> tokens;
    private int pos;

    private GrammarParser(List<GrammarToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse grammar text into Grammar object. The result is not validated, see {@link Grammar#validate()}.
     *
     * @throws MtglException carrying a {@link MtglError.UnexpectedGrammarInput}
     */
    public static Grammar parse(String grammarText) {
        var tokens = GrammarLexer.tokenize(grammarText);

        // Check for lexer errors
        for (var token : tokens) {
            if (token instanceof GrammarToken.Error error) {
                throw unexpected(error.span().start(), error.message(), "valid grammar text");
            }
        }

        return new GrammarParser(tokens).parseGrammar();
    }

    private Grammar parseGrammar() {
        var rules = new ArrayList<Rule>();
        String version = Grammar.UNVERSIONED;
        List<Expression.Reference> clauseOrder = List.of();

        while (!isAtEnd()) {
            var token = peek();

            if (token instanceof GrammarToken.Directive directive) {
                advance();
                expectArrow();
                switch (directive.name()) {
                    case "version" -> version = parseVersion();
                    case "clauses" -> clauseOrder = parseClauseOrder();
                    default -> throw unexpected(directive.span().start(),
                                                "directive '%" + directive.name() + "'",
                                                "%version or %clauses");
                }
            } else if (token instanceof GrammarToken.Identifier) {
                rules.add(parseRule());
            } else {
                throw unexpected(token.span().start(), tokenDescription(token), "rule definition or directive");
            }
        }

        return new Grammar(rules, version, clauseOrder);
    }

    private String parseVersion() {
        if (peek() instanceof GrammarToken.StringLiteral literal) {
            advance();
            return literal.value();
        }
        throw unexpected(peek().span().start(), tokenDescription(peek()), "version string");
    }

    private List<Expression.Reference> parseClauseOrder() {
        var start = peek().span().start();
        var expr = parseExpression();
        var alternatives = expr instanceof Expression.Choice choice
                           ? choice.alternatives()
                           : List.of(expr);
        var references = new ArrayList<Expression.Reference>();
        for (var alternative : alternatives) {
            if (!(alternative instanceof Expression.Reference ref)) {
                throw unexpected(start, "expression", "rule names separated by '/'");
            }
            references.add(ref);
        }
        return references;
    }

    private Rule parseRule() {
        var start = peek().span().start();
        var id = (GrammarToken.Identifier) peek();
        if (!Character.isUpperCase(id.name().charAt(0))) {
            throw unexpected(start, "identifier '" + id.name() + "'", "capitalized rule name");
        }
        advance();
        expectArrow();

        var expression = parseExpression();

        // Check for clause kind
        Optional<String> kind = Optional.empty();
        if (peek() instanceof GrammarToken.KindBlock kindBlock) {
            advance();
            kind = Optional.of(kindBlock.kind());
        }

        var span = SourceSpan.of(start, currentLocation());
        return new Rule(span, id.name(), expression, kind);
    }

    private void expectArrow() {
        if (!expect(GrammarToken.Operator.ARROW)) {
            throw unexpected(peek().span().start(), tokenDescription(peek()), "'<-'");
        }
    }

    private Expression parseExpression() {
        return parseChoice();
    }

    private Expression parseChoice() {
        var start = peek().span().start();
        var alternatives = new ArrayList<Expression>();

        alternatives.add(parseSequence());

        while (at('/')) {
            advance();
            alternatives.add(parseSequence());
        }

        if (alternatives.size() == 1) {
            return alternatives.get(0);
        }
        var span = SourceSpan.of(start, currentLocation());
        return new Expression.Choice(span, alternatives);
    }

    private Expression parseSequence() {
        var start = peek().span().start();
        var elements = new ArrayList<Expression>();

        while (isSequenceElement()) {
            elements.add(parsePrefix());
        }

        if (elements.isEmpty()) {
            throw unexpected(peek().span().start(), tokenDescription(peek()), "expression");
        }

        if (elements.size() == 1) {
            return elements.get(0);
        }
        var span = SourceSpan.of(start, currentLocation());
        return new Expression.Sequence(span, elements);
    }

    private boolean isSequenceElement() {
        var token = peek();
        // Identifier followed by <- is a new rule definition, not a reference
        if (token instanceof GrammarToken.Identifier) {
            return !isRuleDefinitionStart();
        }
        if (token instanceof GrammarToken.Operator operator) {
            return SEQUENCE_STARTS.indexOf(operator.symbol()) >= 0;
        }
        return token instanceof GrammarToken.StringLiteral;
    }

    private boolean isRuleDefinitionStart() {
        // Check if current Identifier is followed by <-
        if (pos + 1 < tokens.size()) {
            return GrammarToken.isOperator(tokens.get(pos + 1), GrammarToken.Operator.ARROW);
        }
        return false;
    }

    private Expression parsePrefix() {
        var start = peek().span().start();

        if (at('&')) {
            advance();
            var inner = parseSuffix();
            return new Expression.And(SourceSpan.of(start, currentLocation()), inner);
        }

        if (at('!')) {
            advance();
            var inner = parseSuffix();
            return new Expression.Not(SourceSpan.of(start, currentLocation()), inner);
        }

        return parseSuffix();
    }

    private Expression parseSuffix() {
        var start = peek().span().start();
        var expr = parsePrimary();

        while (true) {
            if (at('*')) {
                advance();
                expr = new Expression.ZeroOrMore(SourceSpan.of(start, currentLocation()), expr);
            } else if (at('+')) {
                advance();
                expr = new Expression.OneOrMore(SourceSpan.of(start, currentLocation()), expr);
            } else if (at('?')) {
                advance();
                expr = new Expression.Optional(SourceSpan.of(start, currentLocation()), expr);
            } else {
                break;
            }
        }

        return expr;
    }

    private Expression parsePrimary() {
        var token = peek();
        var start = token.span().start();

        // Identifier: token type, typed literal or rule reference
        if (token instanceof GrammarToken.Identifier id) {
            advance();
            if (Character.isUpperCase(id.name().charAt(0))) {
                return new Expression.Reference(token.span(), id.name());
            }
            var type = TokenType.fromGrammarName(id.name())
                                .orElseThrow(() -> unexpected(start, "identifier '" + id.name() + "'", "token type"));
            if (at(':')) {
                advance();
                if (!(peek() instanceof GrammarToken.StringLiteral literal)) {
                    throw unexpected(peek().span().start(), tokenDescription(peek()), "value literal");
                }
                advance();
                return new Expression.TypedLiteral(SourceSpan.of(start, currentLocation()), type, normalize(literal.value()));
            }
            return new Expression.TypeMatch(token.span(), type);
        }

        // Value literal or dictionary
        if (token instanceof GrammarToken.StringLiteral str) {
            advance();
            if (!at('|')) {
                return new Expression.Literal(token.span(), normalize(str.value()));
            }
            var values = new ArrayList<String>();
            values.add(normalize(str.value()));
            while (at('|')) {
                advance();
                if (!(peek() instanceof GrammarToken.StringLiteral next)) {
                    throw unexpected(peek().span().start(), tokenDescription(peek()), "value literal");
                }
                advance();
                values.add(normalize(next.value()));
            }
            return new Expression.Dictionary(SourceSpan.of(start, currentLocation()), values);
        }

        // Any token
        if (at('.')) {
            advance();
            return new Expression.Any(token.span());
        }

        // Span start
        if (at('^')) {
            advance();
            return new Expression.Anchor(token.span());
        }

        // Grouping
        if (at('(')) {
            advance();
            var inner = parseExpression();
            expectClosing(')');
            return new Expression.Group(SourceSpan.of(start, currentLocation()), inner);
        }

        // Nested span [ ]
        if (at('[')) {
            advance();
            var inner = parseExpression();
            expectClosing(']');
            return new Expression.Nested(SourceSpan.of(start, currentLocation()), inner);
        }

        // Named capture $name< >
        if (at('$')) {
            advance();
            if (!(peek() instanceof GrammarToken.Identifier nameId)) {
                throw unexpected(peek().span().start(), tokenDescription(peek()), "capture name");
            }
            advance();
            expectClosing('<');
            var inner = parseExpression();
            expectClosing('>');
            return new Expression.Capture(SourceSpan.of(start, currentLocation()), nameId.name(), inner);
        }

        throw unexpected(start, tokenDescription(token), "expression");
    }

    private void expectClosing(char symbol) {
        if (!expect(symbol)) {
            throw unexpected(peek().span().start(), tokenDescription(peek()), "'" + symbol + "'");
        }
    }

    private static String normalize(String value) {
        return value.strip()
                    .toLowerCase(Locale.ROOT);
    }

    private boolean isAtEnd() {
        return peek() instanceof GrammarToken.Eof;
    }

    private GrammarToken peek() {
        return tokens.get(pos);
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    private boolean at(char symbol) {
        return GrammarToken.isOperator(peek(), symbol);
    }

    private boolean expect(char symbol) {
        if (at(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    private SourceLocation currentLocation() {
        return peek().span().start();
    }

    private static MtglException unexpected(SourceLocation location, String found, String expected) {
        return new MtglException(new MtglError.UnexpectedGrammarInput(location, found, expected));
    }

    private static String tokenDescription(GrammarToken token) {
        if (token instanceof GrammarToken.Identifier id) {
            return "identifier '" + id.name() + "'";
        }
        if (token instanceof GrammarToken.StringLiteral) {
            return "string literal";
        }
        if (token instanceof GrammarToken.KindBlock kind) {
            return "clause kind '" + kind.kind() + "'";
        }
        if (token instanceof GrammarToken.Directive directive) {
            return "directive '%" + directive.name() + "'";
        }
        if (token instanceof GrammarToken.Eof) {
            return "end of input";
        }
        if (token instanceof GrammarToken.Operator operator) {
            return operator.display();
        }
        return ((GrammarToken.Error) token).message();
    }
}
