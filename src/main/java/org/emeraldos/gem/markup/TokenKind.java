package org.emeraldos.gem.markup;

/**
 * Kinds of GemXML tokens.
 */
public enum TokenKind {
    TAG,
    CLOSE,
    TEXT,
    DATA,
    ATTRIBUTE,
    EOF
}
