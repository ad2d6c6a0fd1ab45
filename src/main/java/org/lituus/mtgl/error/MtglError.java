package org.lituus.mtgl.error;

import org.lituus.mtgl.tree.SourceLocation;
import org.lituus.mtgl.tree.SourceSpan;

/**
 * Hard failures of the pipeline with location and context information.
 *
 * <p>Unrecognized text is never an error: it degrades to literal words and unparsed clauses.
 * The variants here are grammar-authoring defects, tree invariant violations and malformed card records.
 */
public sealed interface MtglError {

    String message();

    /**
     * Clause grammar text could not be parsed.
     */
    record UnexpectedGrammarInput(
        SourceLocation location,
        String found,
        String expected
    ) implements MtglError {
        @Override
        public String message() {
            return "Unexpected " + found + " at " + location + ", expected " + expected;
        }
    }

    /**
     * Clause grammar is well formed but not usable (undefined reference, unknown clause rule, ...).
     */
    record GrammarError(
        SourceLocation location,
        String reason
    ) implements MtglError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }

    /**
     * A clause reached twice while building a card tree (shared or cyclic ownership).
     */
    record StructuralError(
        String card,
        int lineIndex,
        String clauseKind,
        SourceSpan span,
        String reason
    ) implements MtglError {
        @Override
        public String message() {
            return reason + ": card '" + card + "', line " + lineIndex + ", " + clauseKind + " clause at " + span;
        }
    }

    /**
     * Tree node ownership violated (second parent, cycle or mutation after freezing).
     */
    record OwnershipError(
        String label,
        String reason
    ) implements MtglError {
        @Override
        public String message() {
            return reason + " (node '" + label + "')";
        }
    }

    /**
     * Card record rejected before entering the pipeline.
     */
    record InputError(
        int position,
        String card,
        String reason
    ) implements MtglError {
        @Override
        public String message() {
            return "Card #" + position + (card == null ? "" : " '" + card + "'") + " rejected: " + reason;
        }
    }

    /**
     * Unexpected runtime failure while one card was processed.
     */
    record ProcessingError(
        String card,
        String cause
    ) implements MtglError {
        @Override
        public String message() {
            return "Card '" + card + "' failed: " + cause;
        }
    }
}
