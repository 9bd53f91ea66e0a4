package org.emeraldos.gem.cascade;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A rule selector: whitespace-separated simple selectors, any one of which selects a node.
 * A simple selector is a kind name ({@code rect}), an id ({@code #main}) or a class ({@code .box}).
 */
public record Selector(String source, List<String> alternatives) {

    public Selector {
        alternatives = List.copyOf(alternatives);
    }

    public static Selector parse(String source) {
        var alternatives = Arrays.stream(source.trim()
                                               .split("\\s+"))
                                 .filter(alternative -> !alternative.isEmpty())
                                 .toList();
        return new Selector(source, alternatives);
    }

    public boolean matches(String kindName, Optional<String> id, List<String> classes) {
        if (alternatives.contains(kindName)) {
            return true;
        }
        if (id.isPresent() && alternatives.contains("#" + id.get())) {
            return true;
        }
        return classes.stream()
                      .anyMatch(className -> alternatives.contains("." + className));
    }
}
