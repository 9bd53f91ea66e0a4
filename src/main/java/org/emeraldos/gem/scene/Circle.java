package org.emeraldos.gem.scene;

public final class Circle extends Content {
    private final int x;
    private final int y;
    private final int radius;

    public Circle(NodeHandle handle, int x, int y, int radius) {
        super(handle);
        this.x = x;
        this.y = y;
        this.radius = radius;
    }

    public int x() {
        return x;
    }

    public int y() {
        return y;
    }

    public int radius() {
        return radius;
    }

    @Override
    public ContentKind kind() {
        return ContentKind.CIRCLE;
    }

    @Override
    public String toString() {
        return "Circle (" + x + ", " + y + ", " + radius + ")";
    }
}
