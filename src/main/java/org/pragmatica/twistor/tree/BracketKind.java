package org.pragmatica.twistor.tree;

import java.util.Optional;

/**
 * Flavour of a 4-index momentum-twistor invariant.
 */
public enum BracketKind {
    /**
     * Angle bracket: {@code <i, j, k, l>}
     */
    ANGLE("angle", '<', '>'),

    /**
     * Square bracket: {@code [i, j, k, l]}
     */
    SQUARE("square", '[', ']');

    private final String tag;
    private final char open;
    private final char close;

    BracketKind(String tag, char open, char close) {
        this.tag = tag;
        this.open = open;
        this.close = close;
    }

    public String tag() {
        return tag;
    }

    public char open() {
        return open;
    }

    public char close() {
        return close;
    }

    public static Optional<BracketKind> fromOpen(char c) {
        for (var kind : values()) {
            if (kind.open == c) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
