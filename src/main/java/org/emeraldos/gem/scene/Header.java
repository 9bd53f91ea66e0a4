package org.emeraldos.gem.scene;

import java.util.List;

/**
 * Heading of level 1 to 3.
 */
public final class Header extends Content {
    private final int level;
    private final List<Content> contents;

    public Header(NodeHandle handle, int level, List<Content> contents) {
        super(handle);
        if (level < 1 || level > 3) {
            throw new IllegalArgumentException("Header level must be between 1 and 3, got " + level);
        }
        this.level = level;
        this.contents = List.copyOf(contents);
    }

    public int level() {
        return level;
    }

    public List<Content> contents() {
        return contents;
    }

    @Override
    public List<Content> children() {
        return contents;
    }

    @Override
    public ContentKind kind() {
        return ContentKind.HEADER;
    }

    @Override
    public String toString() {
        return "H" + level + " " + contents;
    }
}
