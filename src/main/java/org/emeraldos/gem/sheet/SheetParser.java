package org.emeraldos.gem.sheet;

import org.emeraldos.gem.error.GemError;
import org.emeraldos.gem.lang.Result;
import org.emeraldos.gem.tree.SourcePosition;
import org.emeraldos.gem.tree.SourceSpan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser for GemSheet.
 * Converts stylesheet text into a {@link Stylesheet}.
 */
public final class SheetParser {

    private final List<SheetToken> tokens;
    private final BlockMode blockMode;
    private int pos;

    private SheetParser(List<SheetToken> tokens, BlockMode blockMode) {
        this.tokens = tokens;
        this.blockMode = blockMode;
        this.pos = 0;
    }

    /**
     * Parse stylesheet text, rejecting stray tokens inside blocks.
     */
    public static Result<Stylesheet> parse(String fileName, String text) {
        return parse(fileName, text, BlockMode.STRICT);
    }

    public static Result<Stylesheet> parse(String fileName, String text, BlockMode blockMode) {
        return SheetLexer.tokenize(fileName, text)
                         .flatMap(tokens -> parseTokens(fileName, tokens, blockMode));
    }

    /**
     * Parse a token sequence. A sequence without a trailing {@link SheetToken.Eof} is ended right after its last token.
     */
    public static Result<Stylesheet> parseTokens(String name, List<SheetToken> tokens, BlockMode blockMode) {
        return new SheetParser(endTerminated(name, tokens), blockMode).parseStylesheet(name);
    }

    private static List<SheetToken> endTerminated(String name, List<SheetToken> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1) instanceof SheetToken.Eof) {
            return tokens;
        }
        var end = tokens.isEmpty()
                  ? SourcePosition.start(name)
                  : tokens.get(tokens.size() - 1)
                          .span()
                          .end();
        var terminated = new ArrayList<>(tokens);
        terminated.add(new SheetToken.Eof(SourceSpan.at(end)));
        return terminated;
    }

    private Result<Stylesheet> parseStylesheet(String name) {
        var rules = new LinkedHashMap<String, Map<String, String>>();

        while (!(peek() instanceof SheetToken.Eof)) {
            var selector = parseSelector();
            if (selector.isFailure()) {
                return selector.fold(Result::failure, ignored -> null);
            }
            var declarations = parseBlock();
            if (declarations.isFailure()) {
                return declarations.fold(Result::failure, ignored -> null);
            }
            rules.put(selector.unwrap(), declarations.unwrap());
        }

        return Result.success(new Stylesheet(name, rules));
    }

    /**
     * Selector list: one or more of {@code name}, {@code #name} or {@code .name}, joined by single spaces.
     */
    private Result<String> parseSelector() {
        var alternatives = new ArrayList<String>();

        while (true) {
            var token = peek();
            if (token instanceof SheetToken.Tag tag) {
                advance();
                alternatives.add(tag.name());
            } else if (token instanceof SheetToken.IdMarker || token instanceof SheetToken.ClassMarker) {
                var prefix = token instanceof SheetToken.IdMarker ? "#" : ".";
                advance();
                if (!(peek() instanceof SheetToken.Tag tag)) {
                    return Result.failure(new GemError.InvalidSyntax(peek().span(),
                                                                     "Expected a name after '" + prefix + "'."));
                }
                advance();
                alternatives.add(prefix + tag.name());
            } else {
                break;
            }
        }

        if (!(peek() instanceof SheetToken.LBrace)) {
            return Result.failure(new GemError.InvalidSyntax(peek().span(),
                                                             alternatives.isEmpty()
                                                             ? "Expected a selector, found " + describe(peek()) + "."
                                                             : "Expected '{' after selectors."));
        }
        if (alternatives.isEmpty()) {
            return Result.failure(new GemError.InvalidSyntax(peek().span(),
                                                             "Expected selectors (tags, IDs, or classes) before '{'."));
        }
        advance();
        return Result.success(String.join(" ", alternatives));
    }

    private Result<Map<String, String>> parseBlock() {
        var declarations = new LinkedHashMap<String, String>();

        while (!(peek() instanceof SheetToken.RBrace) && !(peek() instanceof SheetToken.Eof)) {
            var token = peek();
            if (token instanceof SheetToken.Property property
                && tokens.get(pos + 1) instanceof SheetToken.Value value) {
                advance();
                advance();
                declarations.put(property.name(), value.text());
            } else if (blockMode == BlockMode.TOLERANT) {
                advance();
            } else {
                return Result.failure(new GemError.InvalidSyntax(token.span(),
                                                                 "Expected a property or '}', found " + describe(token) + "."));
            }
        }

        if (!(peek() instanceof SheetToken.RBrace)) {
            return Result.failure(new GemError.InvalidSyntax(peek().span(), "Expected '}' after block."));
        }
        advance();
        return Result.success(declarations);
    }

    private SheetToken peek() {
        return tokens.get(pos);
    }

    private void advance() {
        if (pos < tokens.size() - 1) {
            pos++ ;
        }
    }

    private static String describe(SheetToken token) {
        if (token instanceof SheetToken.Tag tag) {
            return "'" + tag.name() + "'";
        }
        if (token instanceof SheetToken.Property property) {
            return "property '" + property.name() + "'";
        }
        if (token instanceof SheetToken.Value value) {
            return "value '" + value.text() + "'";
        }
        if (token instanceof SheetToken.LBrace) {
            return "'{'";
        }
        if (token instanceof SheetToken.RBrace) {
            return "'}'";
        }
        if (token instanceof SheetToken.IdMarker) {
            return "'#'";
        }
        if (token instanceof SheetToken.ClassMarker) {
            return "'.'";
        }
        return "end of input";
    }
}
