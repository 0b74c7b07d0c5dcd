package io.github.cyfko.drllens.core.model;

/**
 * A matched opening/closing bracket couple.
 *
 * @param kind  bracket family
 * @param open  position of the opening character
 * @param close position of the closing character
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record BracketPair(BracketKind kind, Position open, Position close) {

    public BracketPair shiftLines(int delta) {
        return delta == 0 ? this : new BracketPair(kind, open.shiftLines(delta), close.shiftLines(delta));
    }

    public boolean spansLines() {
        return close.line() > open.line();
    }
}
