package org.emeraldos.gem.scene;

public final class Rect extends Content {
    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public Rect(NodeHandle handle, int x, int y, int width, int height) {
        super(handle);
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public int x() {
        return x;
    }

    public int y() {
        return y;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    @Override
    public ContentKind kind() {
        return ContentKind.RECT;
    }

    @Override
    public String toString() {
        return "Rectangle (" + x + ", " + y + ", " + width + ", " + height + ")";
    }
}
