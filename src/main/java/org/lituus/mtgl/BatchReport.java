package org.lituus.mtgl;

import org.lituus.mtgl.error.Diagnostic;
import org.lituus.mtgl.error.MtglError;
import org.lituus.mtgl.lexer.TokenType;
import org.lituus.mtgl.parser.Clause;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Summary of a batch run: outcomes in input order, grammar coverage figures, unparsed-span warnings and,
 * kept apart from them, structural and input failures.
 */
public record BatchReport(
    String version,
    List<CardOutcome> outcomes,
    int lines,
    int clauses,
    int unparsedClauses,
    int linesWithUnparsed,
    List<Warning> warnings,
    List<MtglError> structuralFailures,
    List<MtglError.InputError> inputFailures
) {
    public static final String UNPARSED_CODE = "W001";

    public BatchReport {
        outcomes = List.copyOf(outcomes);
        warnings = List.copyOf(warnings);
        structuralFailures = List.copyOf(structuralFailures);
        inputFailures = List.copyOf(inputFailures);
    }

    /**
     * An unparsed span of one card, renderable against the card's lines.
     */
    public record Warning(String card, List<String> lines, Diagnostic diagnostic) {
        public Warning {
            lines = List.copyOf(lines);
        }

        public String render() {
            return diagnostic.format(lines, card);
        }
    }

    static BatchReport of(String version, List<CardOutcome> outcomes) {
        int lines = 0;
        int clauses = 0;
        int unparsed = 0;
        int linesWithUnparsed = 0;
        var warnings = new ArrayList<Warning>();
        var structural = new ArrayList<MtglError>();
        var input = new ArrayList<MtglError.InputError>();

        for (var outcome : outcomes) {
            if (outcome instanceof CardOutcome.Parsed parsed) {
                var card = parsed.card();
                for (var line : parsed.lines()) {
                    lines++;
                    clauses += line.clauseCount();
                    var unparsedClauses = line.unparsed();
                    unparsed += unparsedClauses.size();
                    if (!unparsedClauses.isEmpty()) {
                        linesWithUnparsed++;
                    }
                    for (var clause : unparsedClauses) {
                        warnings.add(new Warning(card.name(), card.lines(), unparsedDiagnostic(line, clause)));
                    }
                }
            } else if (outcome instanceof CardOutcome.Rejected rejected) {
                input.add(rejected.error());
            } else if (outcome instanceof CardOutcome.Failed failed) {
                structural.add(failed.error());
            }
        }
        return new BatchReport(version, outcomes, lines, clauses, unparsed, linesWithUnparsed,
                               warnings, structural, input);
    }

    private static Diagnostic unparsedDiagnostic(ParsedLine line, Clause clause) {
        var diagnostic = Diagnostic.warning(UNPARSED_CODE, "unparsed span", clause.span())
                                   .withLabel("no clause rule matched");
        for (int i = clause.start(); i < clause.end(); i++) {
            var token = line.tokens().get(i);
            if (token.is(TokenType.UNPARSED)) {
                diagnostic = diagnostic.withSecondaryLabel(token.span(), "ambiguous");
            }
        }
        var types = line.tokens()
                        .subList(clause.start(), clause.end())
                        .stream()
                        .map(t -> t.type().grammarName())
                        .toList();
        return diagnostic.withNote("tokens: " + String.join(" ", types));
    }

    public int cards() {
        return outcomes.size();
    }

    public int parsedCards() {
        return (int) outcomes.stream()
                             .filter(o -> o instanceof CardOutcome.Parsed)
                             .count();
    }

    /**
     * Share of ability lines parsed without any unparsed clause; 1.0 for a batch without lines.
     */
    public double coverage() {
        return lines == 0 ? 1.0 : (double) (lines - linesWithUnparsed) / lines;
    }

    public boolean hasFailures() {
        return !structuralFailures.isEmpty() || !inputFailures.isEmpty();
    }

    public String summary() {
        return String.format(Locale.ROOT, "%d cards (%d parsed, %d rejected, %d failed), %d lines, %d clauses, "
                             + "%d unparsed clauses on %d lines, coverage %.1f%%",
                             cards(), parsedCards(), inputFailures.size(), structuralFailures.size(),
                             lines, clauses, unparsedClauses, linesWithUnparsed, coverage() * 100);
    }
}
