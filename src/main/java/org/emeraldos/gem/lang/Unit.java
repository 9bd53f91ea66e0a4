package org.emeraldos.gem.lang;

/**
 * Value of a successful operation which produces nothing.
 */
public enum Unit {
    UNIT;

    public static Result<Unit> unitResult() {
        return Result.success(UNIT);
    }
}
