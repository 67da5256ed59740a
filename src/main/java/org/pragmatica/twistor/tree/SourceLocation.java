package org.pragmatica.twistor.tree;

/**
 * A position in expression text: 1-based line and column plus 0-based character offset.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Location of the n-th element of a flat, single-line sequence (used for prefix token lists).
     */
    public static SourceLocation ofIndex(int index) {
        return new SourceLocation(1, index + 1, index);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
