package org.emeraldos.gem.markup;

import org.emeraldos.gem.tree.SourceSpan;

import java.util.Objects;
import java.util.Optional;

/**
 * GemXML token.
 *
 * <p>Tokens spliced in from shorthand content carry the shorthand's outer span as {@code region};
 * {@link #span()} reports the region when present. Equality compares kind and value only.
 *
 * @param kind       token kind
 * @param value      literal value (tag name, text, attribute name or data)
 * @param localSpan  span in the text that was lexed to produce this token
 * @param region     span of the enclosing shorthand in the outer text, if spliced
 */
public record MarkupToken(TokenKind kind, String value, SourceSpan localSpan, Optional<SourceSpan> region) {

    public static MarkupToken of(TokenKind kind, String value, SourceSpan span) {
        return new MarkupToken(kind, value, span, Optional.empty());
    }

    public static MarkupToken eof(SourceSpan span) {
        return new MarkupToken(TokenKind.EOF, "", span, Optional.empty());
    }

    public SourceSpan span() {
        return region.orElse(localSpan);
    }

    /**
     * Same token placed inside the given outer region; replaces any region it already had.
     */
    public MarkupToken withRegion(SourceSpan outer) {
        return new MarkupToken(kind, value, localSpan, Optional.of(outer));
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MarkupToken other && kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return value.isEmpty()
               ? kind.name()
               : kind + ":'" + value + "'";
    }
}
