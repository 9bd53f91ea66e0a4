package org.emeraldos.gem.scene;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of the scene graph.
 */
public final class Window implements StyledNode {
    public static final int DEFAULT_X = 45;
    public static final int DEFAULT_Y = 35;
    public static final int DEFAULT_WIDTH = 30;
    public static final int DEFAULT_HEIGHT = 20;
    public static final String DEFAULT_TITLE = "Title";

    private final int x;
    private final int y;
    private final int width;
    private final int height;
    private final String title;
    private final List<Content> contents;
    private final Map<String, String> styles = new LinkedHashMap<>();

    public Window(int x, int y, int width, int height, String title, List<Content> contents) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.title = title;
        this.contents = List.copyOf(contents);
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

    public String title() {
        return title;
    }

    public List<Content> contents() {
        return contents;
    }

    @Override
    public String kindName() {
        return "window";
    }

    @Override
    public Map<String, String> styles() {
        return styles;
    }

    @Override
    public List<Content> children() {
        return contents;
    }

    @Override
    public String toString() {
        return "Window " + title + "(" + x + ", " + y + ", " + width + ", " + height + ") " + contents;
    }
}
