package org.emeraldos.gem.scene;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Window content. Structure is fixed at construction; only {@link #styles()} changes afterwards.
 */
public abstract sealed class Content implements StyledNode
    permits Text, Rect, Circle, Line, Div, Header, StyledContent {

    private final NodeHandle handle;
    private final Map<String, String> styles = new LinkedHashMap<>();

    protected Content(NodeHandle handle) {
        this.handle = handle;
    }

    public NodeHandle handle() {
        return handle;
    }

    public abstract ContentKind kind();

    @Override
    public String kindName() {
        return kind().kindName();
    }

    @Override
    public Map<String, String> styles() {
        return styles;
    }

    @Override
    public List<Content> children() {
        return List.of();
    }
}
