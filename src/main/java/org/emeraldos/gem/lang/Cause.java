package org.emeraldos.gem.lang;

/**
 * Reason of a failed {@link Result}.
 */
public interface Cause {
    String message();
}
