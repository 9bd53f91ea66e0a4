package org.emeraldos.gem.markup;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of GemXML element names.
 */
public enum TagKind {
    WINDOW("window"),
    TEXT("text"),
    RECT("rect"),
    CIRCLE("circle"),
    LINE("line"),
    INCLUDE("include"),
    DIV("div"),
    H1("h1"),
    H2("h2"),
    H3("h3"),
    B("b"),
    I("i"),
    BI("bi"),
    U("u");

    private static final Map<String, TagKind> BY_NAME = Arrays.stream(values())
                                                              .collect(Collectors.toMap(TagKind::tagName,
                                                                                        Function.identity()));

    private final String tagName;

    TagKind(String tagName) {
        this.tagName = tagName;
    }

    public String tagName() {
        return tagName;
    }

    public static Optional<TagKind> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static boolean isValid(String name) {
        return BY_NAME.containsKey(name);
    }

    /**
     * Header element for a {@code #} run of the given length (1 to 3).
     */
    public static TagKind header(int level) {
        return switch (level) {
            case 1 -> H1;
            case 2 -> H2;
            case 3 -> H3;
            default -> throw new IllegalArgumentException("Header level out of range: " + level);
        };
    }

    /**
     * Emphasis element for a {@code *} run of the given length (1 to 3).
     */
    public static TagKind emphasis(int count) {
        return switch (count) {
            case 1 -> I;
            case 2 -> B;
            case 3 -> BI;
            default -> throw new IllegalArgumentException("Emphasis marker count out of range: " + count);
        };
    }
}
