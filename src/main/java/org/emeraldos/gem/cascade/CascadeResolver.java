package org.emeraldos.gem.cascade;

import org.emeraldos.gem.compiler.CompiledDocument;
import org.emeraldos.gem.compiler.Registries;
import org.emeraldos.gem.scene.Content;
import org.emeraldos.gem.scene.StyledNode;
import org.emeraldos.gem.scene.Window;
import org.emeraldos.gem.sheet.Stylesheet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies stylesheets to a compiled scene graph.
 *
 * <p>Depth first, parent before child, every node first inherits all resolved properties of its
 * parent, then takes the declarations of every matching rule in stylesheet order. There is no
 * specificity: a later matching rule overwrites an earlier one. Each stylesheet is a separate pass
 * over the whole tree, so later stylesheets win over earlier ones.
 */
public final class CascadeResolver {
    private final List<Rule> rules;
    private final Registries registries;

    private CascadeResolver(Stylesheet stylesheet, Registries registries) {
        this.rules = new ArrayList<>();
        stylesheet.rules()
                  .forEach((selector, declarations) -> rules.add(new Rule(Selector.parse(selector), declarations)));
        this.registries = registries;
    }

    /**
     * Apply stylesheets in order to the window of a compiled document.
     */
    public static void apply(List<Stylesheet> stylesheets, CompiledDocument document) {
        for (var stylesheet : stylesheets) {
            apply(stylesheet, document.window(), document.registries());
        }
    }

    public static void apply(Stylesheet stylesheet, Window window, Registries registries) {
        new CascadeResolver(stylesheet, registries).resolve(window, Map.of());
    }

    private void resolve(StyledNode node, Map<String, String> inherited) {
        var styles = node.styles();
        styles.putAll(inherited);

        var id = idOf(node);
        var classes = classesOf(node);
        for (var rule : rules) {
            if (rule.selector()
                    .matches(node.kindName(), id, classes)) {
                styles.putAll(rule.declarations());
            }
        }

        for (var child : node.children()) {
            resolve(child, styles);
        }
    }

    // The window itself carries neither id nor classes.
    private Optional<String> idOf(StyledNode node) {
        return node instanceof Content content
               ? registries.idOf(content)
               : Optional.empty();
    }

    private List<String> classesOf(StyledNode node) {
        return node instanceof Content content
               ? registries.classesOf(content)
               : List.of();
    }

    private record Rule(Selector selector, Map<String, String> declarations) {}
}
