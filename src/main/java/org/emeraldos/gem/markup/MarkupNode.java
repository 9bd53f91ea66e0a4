package org.emeraldos.gem.markup;

import org.emeraldos.gem.tree.SourceSpan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * GemXML syntax tree.
 */
public sealed interface MarkupNode {
    SourceSpan span();

    /**
     * Ordered siblings, spanning from the first to the last of them.
     */
    record NodeList(SourceSpan span, List<MarkupNode> body) implements MarkupNode {
        public NodeList {
            body = List.copyOf(body);
        }

        public boolean isEmpty() {
            return body.isEmpty();
        }

        public int size() {
            return body.size();
        }
    }

    /**
     * Literal text.
     */
    record TextNode(SourceSpan span, String content) implements MarkupNode {}

    /**
     * Element with its attributes and children, spanning from the opening to the closing tag.
     */
    record TagNode(SourceSpan span, String tagName, Map<String, String> attributes, NodeList content) implements MarkupNode {
        public TagNode {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        public Optional<String> attribute(String name) {
            return Optional.ofNullable(attributes.get(name));
        }

        public boolean hasAttribute(String name) {
            return attributes.containsKey(name);
        }
    }
}
