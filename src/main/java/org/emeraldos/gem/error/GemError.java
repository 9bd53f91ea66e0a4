package org.emeraldos.gem.error;

import org.emeraldos.gem.lang.Cause;
import org.emeraldos.gem.tree.SourceSpan;

/**
 * Error raised by any phase of the toolchain. Every error is fatal to the run that produced it.
 */
public sealed interface GemError extends Cause {
    SourceSpan span();

    /**
     * Name of the error kind, e.g. {@code InvalidSyntax}.
     */
    String kind();

    String details();

    @Override
    default String message() {
        return kind() + ": " + details();
    }

    /**
     * Multi-line report naming the file, line and column where the error starts.
     */
    default String report() {
        var start = span().start();
        return "File " + start.fileName() + " (line " + start.line() + " column " + start.column() + ")\n\n" + message();
    }

    /**
     * Same error, reported at another span.
     */
    GemError relocate(SourceSpan span);

    record UnexpectedCharacter(SourceSpan span, String details) implements GemError {
        @Override
        public String kind() {
            return "UnexpectedCharacter";
        }

        @Override
        public GemError relocate(SourceSpan span) {
            return new UnexpectedCharacter(span, details);
        }
    }

    record ExpectedCharacter(SourceSpan span, String details) implements GemError {
        @Override
        public String kind() {
            return "ExpectedCharacter";
        }

        @Override
        public GemError relocate(SourceSpan span) {
            return new ExpectedCharacter(span, details);
        }
    }

    record InvalidSyntax(SourceSpan span, String details) implements GemError {
        @Override
        public String kind() {
            return "InvalidSyntax";
        }

        @Override
        public GemError relocate(SourceSpan span) {
            return new InvalidSyntax(span, details);
        }
    }

    /**
     * Element name outside the GemXML whitelist, or without a compiler builder.
     */
    record UnknownTag(SourceSpan span, String details) implements GemError {
        @Override
        public String kind() {
            return "UnknownTag";
        }

        @Override
        public GemError relocate(SourceSpan span) {
            return new UnknownTag(span, details);
        }
    }

    record MissingAttribute(SourceSpan span, String details) implements GemError {
        @Override
        public String kind() {
            return "MissingAttribute";
        }

        @Override
        public GemError relocate(SourceSpan span) {
            return new MissingAttribute(span, details);
        }
    }

    /**
     * Document does not consist of exactly one window.
     */
    record WindowError(SourceSpan span, String details) implements GemError {
        @Override
        public String kind() {
            return "WindowError";
        }

        @Override
        public GemError relocate(SourceSpan span) {
            return new WindowError(span, details);
        }
    }

    record AttributeError(SourceSpan span, String details) implements GemError {
        @Override
        public String kind() {
            return "AttributeError";
        }

        @Override
        public GemError relocate(SourceSpan span) {
            return new AttributeError(span, details);
        }
    }

    /**
     * Included file is missing, unreadable or has the wrong extension.
     */
    record FileError(SourceSpan span, String details) implements GemError {
        @Override
        public String kind() {
            return "FileError";
        }

        @Override
        public GemError relocate(SourceSpan span) {
            return new FileError(span, details);
        }
    }

    record IdCollision(SourceSpan span, String details) implements GemError {
        @Override
        public String kind() {
            return "IdCollision";
        }

        @Override
        public GemError relocate(SourceSpan span) {
            return new IdCollision(span, details);
        }
    }
}
