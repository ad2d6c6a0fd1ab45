package org.lituus.mtgl;

import org.lituus.mtgl.lexer.Token;
import org.lituus.mtgl.parser.Clause;
import org.lituus.mtgl.tagger.TaggedText;

import java.util.ArrayList;
import java.util.List;

/**
 * Every intermediate stage of one ability line.
 *
 * @param index 1-based ability line number
 */
public record ParsedLine(
    int index,
    String text,
    TaggedText tagged,
    List<Token> tokens,
    List<Clause> clauses
) {
    public ParsedLine {
        tokens = List.copyOf(tokens);
        clauses = List.copyOf(clauses);
    }

    /**
     * Unparsed clauses at any depth, in source order.
     */
    public List<Clause> unparsed() {
        var result = new ArrayList<Clause>();
        collectUnparsed(clauses, result);
        return result;
    }

    /**
     * Number of clauses at any depth.
     */
    public int clauseCount() {
        return count(clauses);
    }

    private static void collectUnparsed(List<Clause> clauses, List<Clause> result) {
        for (var clause : clauses) {
            if (clause.isUnparsed()) {
                result.add(clause);
            }
            collectUnparsed(clause.children(), result);
        }
    }

    private static int count(List<Clause> clauses) {
        int total = clauses.size();
        for (var clause : clauses) {
            total += count(clause.children());
        }
        return total;
    }
}
