package org.emeraldos.gem.scene;

import java.util.List;
import java.util.Map;

/**
 * Scene graph node that takes part in style resolution.
 */
public interface StyledNode {

    /**
     * Lowercase kind name matched by type selectors.
     */
    String kindName();

    /**
     * Resolved style, property to raw value. Only style resolution writes to it.
     */
    Map<String, String> styles();

    /**
     * Owned child nodes, empty for leaves.
     */
    List<Content> children();
}
