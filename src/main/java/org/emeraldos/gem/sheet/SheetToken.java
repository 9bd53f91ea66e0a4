package org.emeraldos.gem.sheet;

import org.emeraldos.gem.tree.SourceSpan;

/**
 * Token types for the GemSheet lexer.
 */
public sealed interface SheetToken {
    SourceSpan span();

    // Selector parts
    record Tag(SourceSpan span, String name) implements SheetToken {}

    // #
    record IdMarker(SourceSpan span) implements SheetToken {}

    // .
    record ClassMarker(SourceSpan span) implements SheetToken {}

    // Declarations
    record Property(SourceSpan span, String name) implements SheetToken {}

    record Value(SourceSpan span, String text) implements SheetToken {}

    // {
    record LBrace(SourceSpan span) implements SheetToken {}

    // }
    record RBrace(SourceSpan span) implements SheetToken {}

    record Eof(SourceSpan span) implements SheetToken {}
}
