package org.emeraldos.gem;

import org.emeraldos.gem.sheet.BlockMode;

/**
 * Toolchain configuration options.
 *
 * @param blockMode          treatment of stray tokens inside stylesheet blocks
 * @param checkIncludesExist whether included files must exist at compile time
 */
public record GemConfig(
    BlockMode blockMode,
    boolean checkIncludesExist
) {
    public static final GemConfig DEFAULT = new GemConfig(
        BlockMode.STRICT,
        true
    );
}
