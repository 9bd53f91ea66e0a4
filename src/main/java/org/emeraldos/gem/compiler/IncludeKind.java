package org.emeraldos.gem.compiler;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Accepted values of the {@code as} attribute of {@code <include>}.
 */
public enum IncludeKind {
    STYLE("style", ".gms", "Stylesheet"),
    MARKDOWN("md", ".md", "Markdown file");

    private final String attributeValue;
    private final String extension;
    private final String description;

    IncludeKind(String attributeValue, String extension, String description) {
        this.attributeValue = attributeValue;
        this.extension = extension;
        this.description = description;
    }

    public String attributeValue() {
        return attributeValue;
    }

    public String extension() {
        return extension;
    }

    public String description() {
        return description;
    }

    public static Optional<IncludeKind> fromAttribute(String value) {
        return Arrays.stream(values())
                     .filter(kind -> kind.attributeValue.equals(value))
                     .findFirst();
    }

    /**
     * Accepted attribute values, comma separated.
     */
    public static String allowed() {
        return Arrays.stream(values())
                     .map(IncludeKind::attributeValue)
                     .collect(Collectors.joining(", "));
    }
}
