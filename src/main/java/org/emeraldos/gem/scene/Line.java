package org.emeraldos.gem.scene;

public final class Line extends Content {
    private final int startX;
    private final int startY;
    private final int endX;
    private final int endY;

    public Line(NodeHandle handle, int startX, int startY, int endX, int endY) {
        super(handle);
        this.startX = startX;
        this.startY = startY;
        this.endX = endX;
        this.endY = endY;
    }

    public int startX() {
        return startX;
    }

    public int startY() {
        return startY;
    }

    public int endX() {
        return endX;
    }

    public int endY() {
        return endY;
    }

    @Override
    public ContentKind kind() {
        return ContentKind.LINE;
    }

    @Override
    public String toString() {
        return "Line (" + startX + ", " + startY + ", " + endX + ", " + endY + ")";
    }
}
