package org.emeraldos.gem.scene;

import java.util.List;

/**
 * Bold, italic, bold-italic or underlined run of content.
 */
public final class StyledContent extends Content {
    private final Emphasis emphasis;
    private final List<Content> contents;

    public StyledContent(NodeHandle handle, Emphasis emphasis, List<Content> contents) {
        super(handle);
        this.emphasis = emphasis;
        this.contents = List.copyOf(contents);
    }

    public Emphasis emphasis() {
        return emphasis;
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
        return ContentKind.STYLED_CONTENT;
    }

    @Override
    public String toString() {
        return emphasis.name() + " " + contents;
    }
}
