package org.emeraldos.gem.compiler;

import org.emeraldos.gem.tree.SourceSpan;

/**
 * An {@code <include>} kept for a later phase: style includes feed the cascade, markdown
 * includes are left to an external expander.
 *
 * @param kind what the file is included as
 * @param path path as written in the document
 * @param span the include element
 */
public record Include(IncludeKind kind, String path, SourceSpan span) {}
