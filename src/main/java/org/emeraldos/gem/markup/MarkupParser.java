package org.emeraldos.gem.markup;

import org.emeraldos.gem.error.GemError;
import org.emeraldos.gem.lang.Result;
import org.emeraldos.gem.tree.SourcePosition;
import org.emeraldos.gem.tree.SourceSpan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Recursive descent parser for GemXML.
 * Converts markup text into a {@link MarkupNode.NodeList} of top-level nodes.
 */
public final class MarkupParser {

    private final List<MarkupToken> tokens;
    private int pos;

    private MarkupParser(List<MarkupToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Lex and parse markup text.
     */
    public static Result<MarkupNode.NodeList> parse(String fileName, String text) {
        return MarkupLexer.tokenize(fileName, text)
                          .flatMap(MarkupParser::parseTokens);
    }

    /**
     * Parse a token sequence. A sequence without a trailing EOF token is ended right after its last token.
     */
    public static Result<MarkupNode.NodeList> parseTokens(List<MarkupToken> tokens) {
        return new MarkupParser(endTerminated(tokens)).parseDocument();
    }

    private static List<MarkupToken> endTerminated(List<MarkupToken> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1)
                                       .is(TokenKind.EOF)) {
            return tokens;
        }
        var end = tokens.isEmpty()
                  ? SourcePosition.start("")
                  : tokens.get(tokens.size() - 1)
                          .span()
                          .end();
        var terminated = new ArrayList<>(tokens);
        terminated.add(MarkupToken.eof(SourceSpan.at(end)));
        return terminated;
    }

    private Result<MarkupNode.NodeList> parseDocument() {
        var body = parseTags();
        if (body.isFailure()) {
            return body;
        }
        if (!peek().is(TokenKind.EOF)) {
            return Result.failure(new GemError.InvalidSyntax(peek().span(),
                                                             "Cannot fully parse the file, found " + peek() + "."));
        }
        return body;
    }

    /**
     * Siblings up to the next closing tag or the end of input. Which closing tag it is, is checked by the caller.
     */
    private Result<MarkupNode.NodeList> parseTags() {
        var start = peek().span();
        var span = start;
        var body = new ArrayList<MarkupNode>();

        while (!peek().is(TokenKind.CLOSE) && !peek().is(TokenKind.EOF)) {
            var node = parseTag();
            if (node.isFailure()) {
                return node.fold(Result::failure, ignored -> null);
            }
            var parsed = node.unwrap();
            span = parsed.span();
            body.add(parsed);
        }

        return Result.success(new MarkupNode.NodeList(body.isEmpty()
                                                      ? start
                                                      : SourceSpan.of(start.start(), span.end()),
                                                      body));
    }

    private Result<MarkupNode> parseTag() {
        var token = peek();
        if (token.is(TokenKind.TEXT) || token.is(TokenKind.DATA)) {
            advance();
            return Result.success(new MarkupNode.TextNode(token.span(), token.value()));
        }
        if (!token.is(TokenKind.TAG)) {
            return Result.failure(new GemError.InvalidSyntax(token.span(),
                                                             "Expected a tag, found token (" + token + ") instead."));
        }
        var tagName = token.value();
        advance();

        var attributes = new LinkedHashMap<String, String>();
        while (peek().is(TokenKind.ATTRIBUTE)) {
            var attribute = peek().value();
            advance();
            if (!peek().is(TokenKind.DATA)) {
                return Result.failure(new GemError.InvalidSyntax(peek().span(),
                                                                 "Expected a value for attribute '" + attribute + "'."));
            }
            attributes.put(attribute, peek().value());
            advance();
        }

        var content = parseTags();
        if (content.isFailure()) {
            return content.fold(Result::failure, ignored -> null);
        }

        var closing = peek();
        if (!closing.equals(MarkupToken.of(TokenKind.CLOSE, tagName, closing.span()))) {
            return Result.failure(new GemError.InvalidSyntax(closing.span(),
                                                             "Expected </" + tagName + ">, found token " + closing
                                                             + " instead."));
        }
        advance();
        return Result.success(new MarkupNode.TagNode(SourceSpan.of(token.span().start(), closing.span().end()),
                                                     tagName,
                                                     attributes,
                                                     content.unwrap()));
    }

    private MarkupToken peek() {
        return tokens.get(pos);
    }

    private void advance() {
        if (pos < tokens.size() - 1) {
            pos++ ;
        }
    }
}
