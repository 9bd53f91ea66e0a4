package org.emeraldos.gem.scene;

import java.util.Optional;

/**
 * Inline style of a {@link StyledContent}.
 */
public enum Emphasis {
    B("b"),
    I("i"),
    BI("bi"),
    U("u");

    private final String tagName;

    Emphasis(String tagName) {
        this.tagName = tagName;
    }

    public String tagName() {
        return tagName;
    }

    public static Optional<Emphasis> fromTagName(String tagName) {
        for (var emphasis : values()) {
            if (emphasis.tagName.equals(tagName)) {
                return Optional.of(emphasis);
            }
        }
        return Optional.empty();
    }
}
