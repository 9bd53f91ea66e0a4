package org.emeraldos.gem.compiler;

import org.emeraldos.gem.scene.Content;
import org.emeraldos.gem.scene.NodeHandle;

import java.util.List;
import java.util.Optional;

/**
 * Class and id registries of one compiled document, with the arena their handles point into.
 */
public final class Registries {
    private final List<Content> arena;
    private final ClassIndex classes;
    private final IdIndex ids;

    Registries(List<Content> arena, ClassIndex classes, IdIndex ids) {
        this.arena = List.copyOf(arena);
        this.classes = classes;
        this.ids = ids;
    }

    public Content node(NodeHandle handle) {
        return arena.get(handle.index());
    }

    /**
     * Every content node of the document, children before their parents.
     */
    public List<Content> nodes() {
        return arena;
    }

    public ClassIndex classes() {
        return classes;
    }

    public IdIndex ids() {
        return ids;
    }

    public List<Content> nodesWithClass(String className) {
        return classes.nodes(className)
                      .stream()
                      .map(this::node)
                      .toList();
    }

    public Optional<Content> nodeWithId(String id) {
        return ids.node(id)
                  .map(this::node);
    }

    public Optional<String> idOf(Content node) {
        return ids.idOf(node.handle());
    }

    public List<String> classesOf(Content node) {
        return classes.classesOf(node.handle());
    }
}
