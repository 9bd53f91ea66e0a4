package org.emeraldos.gem.markup;

import org.emeraldos.gem.error.GemError;
import org.emeraldos.gem.lang.Result;
import org.emeraldos.gem.tree.SourceSpan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkupLexerTest {

    @Test
    void tokenize_tagWithAttributeAndText_emitsTagAttributePairTextAndClose() {
        var tokens = lex("<window title=\"Demo\">hi</window>");

        assertThat(tokens).extracting(MarkupToken::kind)
                          .containsExactly(TokenKind.TAG,
                                           TokenKind.ATTRIBUTE,
                                           TokenKind.DATA,
                                           TokenKind.TEXT,
                                           TokenKind.CLOSE,
                                           TokenKind.EOF);
        assertThat(tokens).extracting(MarkupToken::value)
                          .containsExactly("window", "title", "Demo", "hi", "window", "");
    }

    @Test
    void tokenize_attributeSpacingAroundEquals_isAccepted() {
        var tokens = lex("<rect x = \"1\"\n      y=\"2\"></rect>");

        assertThat(tokens).extracting(MarkupToken::value)
                          .containsExactly("rect", "x", "1", "y", "2", "rect", "");
    }

    @Test
    void tokenize_repeatedAttribute_lastValueWins() {
        var tokens = lex("<rect x=\"1\" x=\"2\"></rect>");

        assertThat(tokens).containsExactly(token(TokenKind.TAG, "rect"),
                                           token(TokenKind.ATTRIBUTE, "x"),
                                           token(TokenKind.DATA, "2"),
                                           token(TokenKind.CLOSE, "rect"),
                                           token(TokenKind.EOF, ""));
    }

    @Test
    void tokenize_quotedTextOutsideTag_emitsData() {
        var tokens = lex("\"style.gms\"");

        assertThat(tokens).containsExactly(token(TokenKind.DATA, "style.gms"), token(TokenKind.EOF, ""));
    }

    @Test
    void tokenize_textRun_keepsInnerSpacesAndMarkers() {
        var tokens = lex("<text>Hello *big* world</text>");

        assertThat(tokens.get(1)).isEqualTo(token(TokenKind.TEXT, "Hello *big* world"));
    }

    @Test
    void tokenize_unknownTag_failsWithUnknownTag() {
        var error = errorOf(MarkupLexer.tokenize("doc.xml", "<window>\n  <blink></blink>\n</window>"));

        assertThat(error).isInstanceOf(GemError.UnknownTag.class);
        assertThat(error.details()).isEqualTo("blink");
        assertThat(error.span()
                        .start()
                        .line()).isEqualTo(2);
    }

    @Test
    void tokenize_unknownClosingTag_failsWithUnknownTag() {
        assertThat(errorOf(MarkupLexer.tokenize("doc.xml", "</span>"))).isInstanceOf(GemError.UnknownTag.class);
    }

    @Test
    void tokenize_unterminatedAttributeValue_fails() {
        var error = errorOf(MarkupLexer.tokenize("doc.xml", "<rect x=\"5></rect>\n"));

        assertThat(error).isInstanceOf(GemError.ExpectedCharacter.class);
        assertThat(error.details()).isEqualTo("Expected terminating '\"' character.");
    }

    @Test
    void tokenize_unquotedAttributeValue_fails() {
        var error = errorOf(MarkupLexer.tokenize("doc.xml", "<rect x=5></rect>"));

        assertThat(error).isInstanceOf(GemError.ExpectedCharacter.class);
        assertThat(error.details()).isEqualTo("Expected '\"' after '='.");
    }

    @Test
    void tokenize_tagWithoutName_fails() {
        var error = errorOf(MarkupLexer.tokenize("doc.xml", "< 5>"));

        assertThat(error).isInstanceOf(GemError.ExpectedCharacter.class);
        assertThat(error.details()).isEqualTo("Expected a letter after '<'.");
    }

    @Test
    void tokenize_unclosedTagAtEnd_fails() {
        var error = errorOf(MarkupLexer.tokenize("doc.xml", "<rect"));

        assertThat(error).isInstanceOf(GemError.ExpectedCharacter.class);
        assertThat(error.details()).isEqualTo("Expected '>' to close <rect>.");
    }

    @Test
    void tokenize_strayAngleBracket_failsWithUnexpectedCharacter() {
        var error = errorOf(MarkupLexer.tokenize("doc.xml", "a > b"));

        assertThat(error).isInstanceOf(GemError.UnexpectedCharacter.class);
        assertThat(error.details()).isEqualTo("Unexpected Character: '>'");
        assertThat(error.span()
                        .start()
                        .column()).isEqualTo(3);
    }

    @Test
    void tokenize_headerShorthand_matchesExplicitHeader() {
        assertThat(lex("# Hello")).isEqualTo(lex("<h1>Hello</h1>"));
        assertThat(lex("### Small")).isEqualTo(lex("<h3>Small</h3>"));
    }

    @Test
    void tokenize_emphasisShorthand_matchesExplicitElements() {
        assertThat(lex("*soft*")).isEqualTo(lex("<i>soft</i>"));
        assertThat(lex("**bold**")).isEqualTo(lex("<b>bold</b>"));
        assertThat(lex("***both***")).isEqualTo(lex("<bi>both</bi>"));
    }

    @Test
    void tokenize_headerShorthand_pinsSplicedTokensToContentRegion() {
        var tokens = lex("# Hello");

        var text = tokens.get(1);
        assertThat(text.region()).isPresent();
        assertThat(text.span()
                       .start()
                       .offset()).isEqualTo(2);
        assertThat(text.span()
                       .end()
                       .offset()).isEqualTo(7);
        assertThat(text.span()
                       .start()
                       .fileName()).isEqualTo("doc.xml");
        assertThat(text.localSpan()
                       .start()
                       .offset()).isEqualTo(0);

        var open = tokens.get(0);
        assertThat(open.span()).isEqualTo(SourceSpan.of(open.span()
                                                             .start(),
                                                         text.span()
                                                             .start()));
        assertThat(open.region()).isEmpty();
    }

    @Test
    void tokenize_nestedShorthand_usesOutermostRegion() {
        var tokens = lex("## **big** news");

        assertThat(tokens).containsExactly(token(TokenKind.TAG, "h2"),
                                           token(TokenKind.TAG, "b"),
                                           token(TokenKind.TEXT, "big"),
                                           token(TokenKind.CLOSE, "b"),
                                           token(TokenKind.TEXT, "news"),
                                           token(TokenKind.CLOSE, "h2"),
                                           token(TokenKind.EOF, ""));
        assertThat(tokens.subList(1, 5)).allSatisfy(token -> assertThat(token.span()
                                                                              .start()
                                                                              .offset()).isEqualTo(3));
    }

    @Test
    void tokenize_headerShorthand_endsAtLineEnd() {
        var tokens = lex("# One\ntext");

        assertThat(tokens).containsExactly(token(TokenKind.TAG, "h1"),
                                           token(TokenKind.TEXT, "One"),
                                           token(TokenKind.CLOSE, "h1"),
                                           token(TokenKind.TEXT, "text"),
                                           token(TokenKind.EOF, ""));
    }

    @Test
    void tokenize_mismatchedEmphasisCount_reportsExpectedAndActual() {
        var error = errorOf(MarkupLexer.tokenize("doc.xml", "**bold*"));

        assertThat(error).isInstanceOf(GemError.InvalidSyntax.class);
        assertThat(error.details()).isEqualTo("Expected 2 '*' characters, got 1 '*' characters instead.");
    }

    @Test
    void tokenize_tooManyHashes_fails() {
        var error = errorOf(MarkupLexer.tokenize("doc.xml", "#### Deep"));

        assertThat(error).isInstanceOf(GemError.InvalidSyntax.class);
        assertThat(error.details()).isEqualTo("Expected a max of 3 '#' characters.");
    }

    @Test
    void tokenize_tooManyAsterisks_fails() {
        var error = errorOf(MarkupLexer.tokenize("doc.xml", "****x****"));

        assertThat(error).isInstanceOf(GemError.InvalidSyntax.class);
        assertThat(error.details()).isEqualTo("Expected a max of 3 '*' characters.");
    }

    @Test
    void tokenize_headerWithoutContent_fails() {
        var error = errorOf(MarkupLexer.tokenize("doc.xml", "##   \nnext"));

        assertThat(error).isInstanceOf(GemError.InvalidSyntax.class);
        assertThat(error.details()).isEqualTo("Expected content after '##'.");
    }

    @Test
    void tokenize_emphasisWithoutContent_fails() {
        var error = errorOf(MarkupLexer.tokenize("doc.xml", "* *"));

        assertThat(error).isInstanceOf(GemError.InvalidSyntax.class);
        assertThat(error.details()).isEqualTo("Expected content after '*'.");
    }

    @Test
    void tokenize_emphasisReachingLineEnd_fails() {
        var error = errorOf(MarkupLexer.tokenize("doc.xml", "*open\n*"));

        assertThat(error).isInstanceOf(GemError.InvalidSyntax.class);
        assertThat(error.details()).isEqualTo("Reached EOL when parsing Markdown tag.");
    }

    @Test
    void tokenize_errorInsideShorthand_isReportedAtShorthandContent() {
        var error = errorOf(MarkupLexer.tokenize("doc.xml", "<window>\n# <blink>\n</window>"));

        assertThat(error).isInstanceOf(GemError.UnknownTag.class);
        assertThat(error.span()
                        .start()
                        .fileName()).isEqualTo("doc.xml");
        assertThat(error.span()
                        .start()
                        .line()).isEqualTo(2);
        assertThat(error.span()
                        .start()
                        .column()).isEqualTo(3);
    }

    @Test
    void tokenize_emptyInput_producesOnlyEof() {
        assertThat(lex(" \n\t")).containsExactly(token(TokenKind.EOF, ""));
    }

    @Test
    void token_equality_ignoresSpans() {
        var a = lex("<div></div>").get(0);
        var b = lex("\n\n   <div></div>").get(0);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a.span()).isNotEqualTo(b.span());
    }

    private static List<MarkupToken> lex(String text) {
        var result = MarkupLexer.tokenize("doc.xml", text);
        assertThat(result.isSuccess()).isTrue();
        return result.unwrap();
    }

    private static MarkupToken token(TokenKind kind, String value) {
        return MarkupToken.of(kind, value, null);
    }

    private static GemError errorOf(Result<List<MarkupToken>> result) {
        assertThat(result.isFailure()).isTrue();
        return (GemError) result.causeOpt()
                                .orElseThrow();
    }
}
