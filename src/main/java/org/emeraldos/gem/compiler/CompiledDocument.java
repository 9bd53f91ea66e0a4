package org.emeraldos.gem.compiler;

import org.emeraldos.gem.scene.Window;

import java.util.List;

/**
 * Output of one compile: the scene graph, its registries and the includes left for later phases.
 */
public record CompiledDocument(Window window, Registries registries, List<Include> includes) {

    public CompiledDocument {
        includes = List.copyOf(includes);
    }

    /**
     * Stylesheet includes in document order.
     */
    public List<Include> styleIncludes() {
        return includesOf(IncludeKind.STYLE);
    }

    public List<Include> markdownIncludes() {
        return includesOf(IncludeKind.MARKDOWN);
    }

    private List<Include> includesOf(IncludeKind kind) {
        return includes.stream()
                       .filter(include -> include.kind() == kind)
                       .toList();
    }
}
