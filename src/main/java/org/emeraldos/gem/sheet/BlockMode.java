package org.emeraldos.gem.sheet;

/**
 * How the GemSheet parser treats a token inside a rule block that is neither a declaration nor {@code '}'}.
 */
public enum BlockMode {
    /**
     * Reject the token with {@code InvalidSyntax}.
     */
    STRICT,
    /**
     * Skip the token and keep reading declarations.
     */
    TOLERANT
}
