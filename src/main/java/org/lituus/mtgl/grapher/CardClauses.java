package org.lituus.mtgl.grapher;

import org.lituus.mtgl.parser.Clause;

import java.util.List;

/**
 * Parser output for one card: its ability lines with their top-level clauses.
 *
 * @param spell whether the card is an instant or sorcery
 */
public record CardClauses(
    String name,
    String catalogVersion,
    String grammarVersion,
    List<Line> lines,
    boolean spell
) {
    public CardClauses {
        lines = List.copyOf(lines);
    }

    public CardClauses(String name, String catalogVersion, String grammarVersion, List<Line> lines) {
        this(name, catalogVersion, grammarVersion, lines, false);
    }

    /**
     * Version tag of trees built from this input.
     */
    public String versionTag() {
        return versionTag(catalogVersion, grammarVersion);
    }

    public static String versionTag(String catalogVersion, String grammarVersion) {
        return "catalog-" + catalogVersion + "+grammar-" + grammarVersion;
    }

    /**
     * @param index 1-based ability line number
     */
    public record Line(int index, String text, List<Clause> clauses) {
        public Line {
            clauses = List.copyOf(clauses);
        }
    }
}
