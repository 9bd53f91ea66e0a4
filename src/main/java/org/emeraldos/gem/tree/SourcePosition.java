package org.emeraldos.gem.tree;

/**
 * A position in a named source buffer (line and column both 1-based, offset 0-based).
 */
public record SourcePosition(String fileName, int offset, int line, int column) {

    public static SourcePosition start(String fileName) {
        return new SourcePosition(fileName, 0, 1, 1);
    }

    /**
     * Position after consuming {@code consumed}; a newline moves to the first column of the next line.
     */
    public SourcePosition advance(char consumed) {
        if (consumed == '\n') {
            return new SourcePosition(fileName, offset + 1, line + 1, 1);
        }
        return new SourcePosition(fileName, offset + 1, line, column + 1);
    }

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}
