package org.emeraldos.gem.sheet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed GemSheet: selector string to declarations (property to raw value), both in source order.
 *
 * <p>A selector declared twice keeps its first position but takes the later declarations as a whole.
 */
public record Stylesheet(String name, Map<String, Map<String, String>> rules) {

    public Stylesheet {
        var copy = new LinkedHashMap<String, Map<String, String>>();
        rules.forEach((selector, declarations) -> copy.put(selector,
                                                           Collections.unmodifiableMap(new LinkedHashMap<>(declarations))));
        rules = Collections.unmodifiableMap(copy);
    }

    public Map<String, String> declarations(String selector) {
        return rules.getOrDefault(selector, Map.of());
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
