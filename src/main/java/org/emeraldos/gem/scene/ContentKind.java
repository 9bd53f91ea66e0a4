package org.emeraldos.gem.scene;

/**
 * Kinds of window content.
 */
public enum ContentKind {
    TEXT("text"),
    RECT("rect"),
    CIRCLE("circle"),
    LINE("line"),
    DIV("div"),
    HEADER("header"),
    STYLED_CONTENT("styledcontent");

    private final String kindName;

    ContentKind(String kindName) {
        this.kindName = kindName;
    }

    public String kindName() {
        return kindName;
    }
}
