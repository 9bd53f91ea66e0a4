package org.emeraldos.gem.compiler;

import org.emeraldos.gem.scene.NodeHandle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Class name to the nodes carrying it, in registration order.
 */
public final class ClassIndex {
    private final Map<String, List<NodeHandle>> nodesByClass = new LinkedHashMap<>();
    private final Map<NodeHandle, List<String>> classesByNode = new LinkedHashMap<>();

    void add(String className, NodeHandle node) {
        nodesByClass.computeIfAbsent(className, key -> new ArrayList<>())
                    .add(node);
        classesByNode.computeIfAbsent(node, key -> new ArrayList<>())
                     .add(className);
    }

    public List<NodeHandle> nodes(String className) {
        return Collections.unmodifiableList(nodesByClass.getOrDefault(className, List.of()));
    }

    public List<String> classesOf(NodeHandle node) {
        return Collections.unmodifiableList(classesByNode.getOrDefault(node, List.of()));
    }

    public Set<String> classNames() {
        return Collections.unmodifiableSet(nodesByClass.keySet());
    }
}
