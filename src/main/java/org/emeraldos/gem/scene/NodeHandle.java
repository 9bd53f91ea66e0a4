package org.emeraldos.gem.scene;

/**
 * Position of a content node in the arena of the compile that created it.
 */
public record NodeHandle(int index) {
    public NodeHandle {
        if (index < 0) {
            throw new IllegalArgumentException("Negative node index: " + index);
        }
    }

    @Override
    public String toString() {
        return "#" + index;
    }
}
