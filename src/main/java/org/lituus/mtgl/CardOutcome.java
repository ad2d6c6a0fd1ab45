package org.lituus.mtgl;

import org.lituus.mtgl.error.MtglError;
import org.lituus.mtgl.tree.Tree;

import java.util.List;

/**
 * What happened to one card of a batch.
 */
public sealed interface CardOutcome {

    /**
     * Position of the card in the batch input (0-based).
     */
    int position();

    record Parsed(int position, Card card, Tree tree, List<ParsedLine> lines) implements CardOutcome {
        public Parsed {
            lines = List.copyOf(lines);
        }
    }

    /**
     * Card record missing required fields; it never entered the pipeline.
     */
    record Rejected(int position, MtglError.InputError error) implements CardOutcome {}

    /**
     * Tree construction hit a structural defect.
     */
    record Failed(int position, Card card, MtglError error) implements CardOutcome {}
}
