package org.emeraldos.gem.markup;

import org.emeraldos.gem.error.GemError;
import org.emeraldos.gem.lang.Result;
import org.emeraldos.gem.lang.Unit;
import org.emeraldos.gem.tree.SourcePosition;
import org.emeraldos.gem.tree.SourceSpan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import static org.emeraldos.gem.lang.Unit.unitResult;

/**
 * Lexer for GemXML markup.
 *
 * <p>Besides tags, attributes, quoted data and text runs, it expands markdown-style shorthand:
 * {@code # title} becomes {@code <h1>title</h1>} and {@code **bold**} becomes {@code <b>bold</b>}.
 * Shorthand content is lexed by a nested lexer and its tokens are spliced in, placed in the
 * shorthand's region of the outer text.
 */
public final class MarkupLexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;
    private static final int MAX_MARKER_RUN = 3;
    private static final String SHORTHAND_SOURCE = "<md-content>";

    private final String input;
    private final List<MarkupToken> tokens = new ArrayList<>();
    private SourcePosition position;

    private MarkupLexer(String fileName, String input) {
        this.input = input;
        this.position = SourcePosition.start(fileName);
    }

    public static Result<List<MarkupToken>> tokenize(String fileName, String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            return Result.failure(new GemError.FileError(SourceSpan.at(SourcePosition.start(fileName)),
                                                         "Markup input exceeds maximum size of " + MAX_INPUT_SIZE
                                                         + " characters."));
        }
        return new MarkupLexer(fileName, input).tokenizeAll();
    }

    private Result<List<MarkupToken>> tokenizeAll() {
        while (!isAtEnd()) {
            var step = nextToken();
            if (step.isFailure()) {
                return step.fold(Result::failure, ignored -> null);
            }
        }
        tokens.add(MarkupToken.eof(SourceSpan.at(position)));
        return Result.success(List.copyOf(tokens));
    }

    private Result<Unit> nextToken() {
        var start = position;
        char c = peek();
        if (isWhitespace(c)) {
            advance();
            return unitResult();
        }
        return switch (c) {
            case '<' -> scanTag(start);
            case '"' -> scanQuoted(start);
            case '#' -> scanHeader(start);
            case '*' -> scanEmphasis(start);
            default -> scanText(start);
        };
    }

    private Result<Unit> scanTag(SourcePosition start) {
        advance();
        // skip <
        skipWhitespace();
        boolean closing = !isAtEnd() && peek() == '/';
        if (closing) {
            advance();
        }
        var opener = closing ? "</" : "<";
        if (isAtEnd() || !isLetter(peek())) {
            return expected("Expected a letter after '" + opener + "'.");
        }
        var name = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isLetterOrDigit(peek())) {
            name.append(advance());
        }
        var tagName = name.toString();
        if (!TagKind.isValid(tagName)) {
            return Result.failure(new GemError.UnknownTag(span(start), tagName));
        }

        var attributes = new LinkedHashMap<String, MarkupToken>();
        var values = new LinkedHashMap<String, MarkupToken>();
        if (!isAtEnd() && peek() != '>') {
            if (!isWhitespace(peek())) {
                return expected("Expected '>' or a whitespace after tag name.");
            }
            skipWhitespace();
            if (closing && !isAtEnd() && peek() != '>') {
                return expected("Expected '>' after closing tag name.");
            }
            while (!isAtEnd() && peek() != '>') {
                var attribute = scanAttribute(attributes, values);
                if (attribute.isFailure()) {
                    return attribute;
                }
            }
        }
        if (isAtEnd()) {
            return expected("Expected '>' to close <" + tagName + ">.");
        }
        advance();
        // skip >
        tokens.add(MarkupToken.of(closing ? TokenKind.CLOSE : TokenKind.TAG, tagName, span(start)));
        attributes.forEach((key, attribute) -> {
            tokens.add(attribute);
            tokens.add(values.get(key));
        });
        return unitResult();
    }

    // name="value", no escapes; a repeated name keeps its first position and its last value.
    private Result<Unit> scanAttribute(LinkedHashMap<String, MarkupToken> attributes,
                                       LinkedHashMap<String, MarkupToken> values) {
        var nameStart = position;
        var name = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isLetter(peek())) {
            name.append(advance());
        }
        var nameSpan = span(nameStart);
        skipWhitespace();
        if (isAtEnd() || peek() != '=') {
            return expected("Expected '=' after attribute, found " + describeCurrent() + " instead.");
        }
        advance();
        skipWhitespace();
        if (isAtEnd() || peek() != '"') {
            return expected("Expected '\"' after '='.");
        }
        var valueStart = position;
        advance();
        var data = scanUntilQuote();
        if (data.isFailure()) {
            return data.fold(Result::failure, ignored -> null);
        }
        var key = name.toString();
        attributes.putIfAbsent(key, MarkupToken.of(TokenKind.ATTRIBUTE, key, nameSpan));
        values.put(key, MarkupToken.of(TokenKind.DATA, data.unwrap(), span(valueStart)));
        skipWhitespace();
        return unitResult();
    }

    private Result<Unit> scanQuoted(SourcePosition start) {
        advance();
        // skip "
        var data = scanUntilQuote();
        if (data.isFailure()) {
            return data.fold(Result::failure, ignored -> null);
        }
        tokens.add(MarkupToken.of(TokenKind.DATA, data.unwrap(), span(start)));
        return unitResult();
    }

    // Reads up to the closing quote on the same line and consumes it.
    private Result<String> scanUntilQuote() {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"' && peek() != '\n') {
            sb.append(advance());
        }
        if (isAtEnd() || peek() != '"') {
            return expected("Expected terminating '\"' character.");
        }
        advance();
        return Result.success(sb.toString());
    }

    private Result<Unit> scanHeader(SourcePosition start) {
        int count = countRun('#');
        skipHorizontalWhitespace();
        if (count > MAX_MARKER_RUN) {
            return Result.failure(new GemError.InvalidSyntax(span(start),
                                                             "Expected a max of 3 '#' characters."));
        }
        var contentStart = position;
        var content = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '\n') {
            content.append(advance());
        }
        if (content.length() == 0) {
            return Result.failure(new GemError.InvalidSyntax(span(contentStart),
                                                             "Expected content after '" + "#".repeat(count) + "'."));
        }
        return splice(TagKind.header(count), start, contentStart, content.toString());
    }

    private Result<Unit> scanEmphasis(SourcePosition start) {
        int count = countRun('*');
        skipHorizontalWhitespace();
        if (count > MAX_MARKER_RUN) {
            return Result.failure(new GemError.InvalidSyntax(span(start),
                                                             "Expected a max of 3 '*' characters."));
        }
        var contentStart = position;
        var content = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '*' && peek() != '\n') {
            content.append(advance());
        }
        if (content.length() == 0) {
            return Result.failure(new GemError.InvalidSyntax(span(contentStart),
                                                             "Expected content after '" + "*".repeat(count) + "'."));
        }
        if (isAtEnd() || peek() == '\n') {
            return Result.failure(new GemError.InvalidSyntax(SourceSpan.at(position),
                                                             "Reached EOL when parsing Markdown tag."));
        }
        int endCount = countRun('*');
        if (endCount != count) {
            return Result.failure(new GemError.InvalidSyntax(SourceSpan.at(position),
                                                             "Expected " + count + " '*' characters, got " + endCount
                                                             + " '*' characters instead."));
        }
        return splice(TagKind.emphasis(count), start, contentStart, content.toString());
    }

    /**
     * Lex shorthand content with a nested lexer and wrap its tokens in a synthesized element.
     * Spliced tokens and nested errors are placed in the content region of this text.
     */
    private Result<Unit> splice(TagKind kind, SourcePosition start, SourcePosition contentStart, String content) {
        var region = span(contentStart);
        var nested = new MarkupLexer(SHORTHAND_SOURCE, content).tokenizeAll();
        if (nested.isFailure()) {
            return nested.fold(cause -> Result.failure(cause instanceof GemError error
                                                       ? error.relocate(region)
                                                       : cause),
                               ignored -> null);
        }
        var inner = nested.unwrap();
        tokens.add(MarkupToken.of(TokenKind.TAG, kind.tagName(), SourceSpan.of(start, contentStart)));
        for (var token : inner.subList(0, inner.size() - 1)) {
            tokens.add(token.withRegion(region));
        }
        tokens.add(MarkupToken.of(TokenKind.CLOSE, kind.tagName(), SourceSpan.at(position)));
        return unitResult();
    }

    private Result<Unit> scanText(SourcePosition start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && !isTextStop(peek())) {
            sb.append(advance());
        }
        if (sb.length() == 0) {
            return Result.failure(new GemError.UnexpectedCharacter(SourceSpan.at(position),
                                                                   "Unexpected Character: " + describeCurrent()));
        }
        tokens.add(MarkupToken.of(TokenKind.TEXT, sb.toString(), span(start)));
        return unitResult();
    }

    private int countRun(char marker) {
        int count = 0;
        while (!isAtEnd() && peek() == marker) {
            advance();
            count++ ;
        }
        return count;
    }

    private <T> Result<T> expected(String details) {
        return Result.failure(new GemError.ExpectedCharacter(SourceSpan.at(position), details));
    }

    private String describeCurrent() {
        return isAtEnd()
               ? "end of input"
               : "'" + peek() + "'";
    }

    private void skipWhitespace() {
        while (!isAtEnd() && isWhitespace(peek())) {
            advance();
        }
    }

    private void skipHorizontalWhitespace() {
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return position.offset() >= input.length();
    }

    private char peek() {
        return input.charAt(position.offset());
    }

    private char advance() {
        char c = peek();
        position = position.advance(c);
        return c;
    }

    private SourceSpan span(SourcePosition start) {
        return SourceSpan.of(start, position);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private static boolean isTextStop(char c) {
        return c == '\n' || c == '<' || c == '>' || c == '"' || c == '\'';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isLetterOrDigit(char c) {
        return isLetter(c) || (c >= '0' && c <= '9');
    }
}
