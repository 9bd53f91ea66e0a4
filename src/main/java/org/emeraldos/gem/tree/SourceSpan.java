package org.emeraldos.gem.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourcePosition start, SourcePosition end) {

    public static SourceSpan of(SourcePosition start, SourcePosition end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourcePosition position) {
        return new SourceSpan(position, position);
    }

    @Override
    public String toString() {
        return start + "-" + end.line() + ":" + end.column();
    }
}
