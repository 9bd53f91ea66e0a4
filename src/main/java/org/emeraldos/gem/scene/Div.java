package org.emeraldos.gem.scene;

import java.util.List;

public final class Div extends Content {
    private final List<Content> contents;

    public Div(NodeHandle handle, List<Content> contents) {
        super(handle);
        this.contents = List.copyOf(contents);
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
        return ContentKind.DIV;
    }

    @Override
    public String toString() {
        return "DIV " + contents;
    }
}
