package org.emeraldos.gem.compiler;

import org.emeraldos.gem.scene.NodeHandle;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Id name to node. An id names at most one node in a document.
 */
public final class IdIndex {
    private final Map<String, NodeHandle> nodesById = new HashMap<>();
    private final Map<NodeHandle, String> idsByNode = new HashMap<>();

    /**
     * Register {@code id} for {@code node}.
     *
     * @return the node already holding the id, or empty if the id was free and is now registered
     */
    Optional<NodeHandle> register(String id, NodeHandle node) {
        var holder = nodesById.putIfAbsent(id, node);
        if (holder != null && !holder.equals(node)) {
            return Optional.of(holder);
        }
        idsByNode.put(node, id);
        return Optional.empty();
    }

    public Optional<NodeHandle> node(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public Optional<String> idOf(NodeHandle node) {
        return Optional.ofNullable(idsByNode.get(node));
    }

    public int size() {
        return nodesById.size();
    }
}
