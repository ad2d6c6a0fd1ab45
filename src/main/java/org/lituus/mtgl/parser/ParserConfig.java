package org.lituus.mtgl.parser;

/**
 * Parser configuration options.
 *
 * @param maxNestingDepth deepest nested span that is parsed again; deeper spans become unparsed clauses
 * @param mergeUnparsed   merge consecutive unmatched tokens into one unparsed clause
 * @param packratEnabled  memoize rule outcomes and nested span parses; keeps parse time polynomial
 */
public record ParserConfig(
    int maxNestingDepth,
    boolean mergeUnparsed,
    boolean packratEnabled
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        16,
        true,
        true
    );

    public ParserConfig {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
    }
}
