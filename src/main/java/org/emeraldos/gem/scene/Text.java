package org.emeraldos.gem.scene;

public final class Text extends Content {
    private final String text;

    public Text(NodeHandle handle, String text) {
        super(handle);
        this.text = text;
    }

    public String text() {
        return text;
    }

    @Override
    public ContentKind kind() {
        return ContentKind.TEXT;
    }

    @Override
    public String toString() {
        return "Text ('" + text + "')";
    }
}
