package org.lituus.mtgl.tree;

/**
 * A position in oracle text: ability line (1-based), column (1-based) and character offset within the line.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Location of a character offset on the given ability line.
     */
    public static SourceLocation onLine(int line, int offset) {
        return new SourceLocation(line, offset + 1, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
