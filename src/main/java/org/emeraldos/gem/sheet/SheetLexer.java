package org.emeraldos.gem.sheet;

import org.emeraldos.gem.error.GemError;
import org.emeraldos.gem.lang.Result;
import org.emeraldos.gem.lang.Unit;
import org.emeraldos.gem.tree.SourcePosition;
import org.emeraldos.gem.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

import static org.emeraldos.gem.lang.Unit.unitResult;

/**
 * Lexer for GemSheet stylesheets.
 *
 * <p>Outside a block, identifiers are selector names ({@link SheetToken.Tag}). Inside a block an
 * identifier starts a declaration and must be followed by {@code ':'}, a raw value and {@code ';'},
 * unless it is a selector: {@code .name}, {@code #name}, or a name right before an opening brace.
 * Those selector tokens are left for the parser to reject or skip.
 */
public final class SheetLexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private final List<SheetToken> tokens = new ArrayList<>();
    private SourcePosition position;
    private boolean inBlock;

    private SheetLexer(String fileName, String input) {
        this.input = input;
        this.position = SourcePosition.start(fileName);
    }

    public static Result<List<SheetToken>> tokenize(String fileName, String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            return Result.failure(new GemError.FileError(SourceSpan.at(SourcePosition.start(fileName)),
                                                         "Stylesheet input exceeds maximum size of " + MAX_INPUT_SIZE
                                                         + " characters."));
        }
        return new SheetLexer(fileName, input).tokenizeAll();
    }

    private Result<List<SheetToken>> tokenizeAll() {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) {
                break;
            }
            var step = inBlock
                       ? nextInBlock()
                       : nextInSelector();
            if (step.isFailure()) {
                return step.fold(Result::failure, ignored -> null);
            }
        }
        tokens.add(new SheetToken.Eof(SourceSpan.at(position)));
        return Result.success(List.copyOf(tokens));
    }

    private Result<Unit> nextInSelector() {
        var start = position;
        char c = peek();
        switch (c) {
            case '{' -> {
                advance();
                inBlock = true;
                tokens.add(new SheetToken.LBrace(span(start)));
            }
            case '}' -> {
                advance();
                tokens.add(new SheetToken.RBrace(span(start)));
            }
            case '#' -> {
                advance();
                tokens.add(new SheetToken.IdMarker(span(start)));
                return scanMarkedName('#');
            }
            case '.' -> {
                advance();
                tokens.add(new SheetToken.ClassMarker(span(start)));
                return scanMarkedName('.');
            }
            default -> {
                if (!isNamePart(c)) {
                    return unexpected(c);
                }
                scanTag();
            }
        }
        return unitResult();
    }

    private Result<Unit> nextInBlock() {
        var start = position;
        char c = peek();
        if (c == '}') {
            advance();
            inBlock = false;
            tokens.add(new SheetToken.RBrace(span(start)));
            return unitResult();
        }
        if (c == '{') {
            advance();
            tokens.add(new SheetToken.LBrace(span(start)));
            return unitResult();
        }
        if (c == '#' || c == '.') {
            return nextInSelector();
        }
        if (isNamePart(c) && opensBlock()) {
            scanTag();
            return unitResult();
        }
        if (isLetter(c)) {
            return scanDeclaration();
        }
        return unexpected(c);
    }

    // A name followed, after optional whitespace, by '{'.
    private boolean opensBlock() {
        int offset = position.offset();
        while (offset < input.length() && isNamePart(input.charAt(offset))) {
            offset++ ;
        }
        while (offset < input.length() && Character.isWhitespace(input.charAt(offset))) {
            offset++ ;
        }
        return offset < input.length() && input.charAt(offset) == '{';
    }

    // The name of an id or class selector must touch its marker.
    private Result<Unit> scanMarkedName(char marker) {
        if (isAtEnd() || !isNamePart(peek())) {
            return Result.failure(new GemError.ExpectedCharacter(SourceSpan.at(position),
                                                                 "Expected a name after '" + marker + "'."));
        }
        scanTag();
        return unitResult();
    }

    private void scanTag() {
        var start = position;
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isNamePart(peek())) {
            sb.append(advance());
        }
        tokens.add(new SheetToken.Tag(span(start), sb.toString()));
    }

    private Result<Unit> scanDeclaration() {
        var start = position;
        var name = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && (isLetter(peek()) || peek() == '-')) {
            name.append(advance());
        }
        var propertySpan = span(start);
        skipHorizontalWhitespace();
        if (isAtEnd() || peek() != ':') {
            return Result.failure(new GemError.ExpectedCharacter(SourceSpan.at(position),
                                                                 "Expected ':' after property '" + name + "'."));
        }
        advance();
        tokens.add(new SheetToken.Property(propertySpan, name.toString()));
        skipHorizontalWhitespace();

        var valueStart = position;
        var value = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != ';' && peek() != '\n') {
            value.append(advance());
        }
        if (value.length() == 0) {
            return Result.failure(new GemError.ExpectedCharacter(SourceSpan.at(position),
                                                                 "Expected a value after '" + name + ":'."));
        }
        var valueSpan = span(valueStart);
        if (isAtEnd() || peek() != ';') {
            return Result.failure(new GemError.ExpectedCharacter(SourceSpan.at(position),
                                                                 "Expected ';' after value."));
        }
        advance();
        tokens.add(new SheetToken.Value(valueSpan, value.toString()));
        return unitResult();
    }

    private Result<Unit> unexpected(char c) {
        return Result.failure(new GemError.UnexpectedCharacter(SourceSpan.at(position), "'" + c + "'"));
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
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

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNamePart(char c) {
        return isLetter(c) || isDigit(c) || c == '_' || c == '-';
    }
}
