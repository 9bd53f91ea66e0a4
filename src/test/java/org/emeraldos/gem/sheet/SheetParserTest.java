package org.emeraldos.gem.sheet;

import org.emeraldos.gem.error.GemError;
import org.emeraldos.gem.lang.Result;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SheetParserTest {

    @Test
    void parse_singleRule_mapsSelectorToDeclarations() {
        var stylesheet = SheetParser.parse("style.gms", "rect { color: red; width: 2; }")
                                    .unwrap();

        assertThat(stylesheet.name()).isEqualTo("style.gms");
        assertThat(stylesheet.rules()).containsOnlyKeys("rect");
        assertThat(stylesheet.declarations("rect")).containsExactly(Map.entry("color", "red"),
                                                                    Map.entry("width", "2"));
    }

    @Test
    void parse_idAndClassSelectors_prefixNames() {
        var stylesheet = SheetParser.parse("style.gms", """
            #title { color: white; }
            .box { border: 1; }
            """)
                                    .unwrap();

        assertThat(stylesheet.rules()
                             .keySet()).containsExactly("#title", ".box");
    }

    @Test
    void parse_selectorList_joinsAlternativesWithSingleSpace() {
        var stylesheet = SheetParser.parse("style.gms", "rect   .box\n#main { color: red; }")
                                    .unwrap();

        assertThat(stylesheet.rules()).containsOnlyKeys("rect .box #main");
    }

    @Test
    void parse_repeatedSelector_replacesWholeDeclarationMap() {
        var stylesheet = SheetParser.parse("style.gms", """
            rect { color: red; width: 2; }
            circle { color: green; }
            rect { color: blue; }
            """)
                                    .unwrap();

        assertThat(stylesheet.declarations("rect")).containsExactly(Map.entry("color", "blue"));
        assertThat(stylesheet.rules()
                             .keySet()).containsExactly("rect", "circle");
    }

    @Test
    void parse_repeatedProperty_lastValueWins() {
        var stylesheet = SheetParser.parse("style.gms", "rect { color: red; color: blue; }")
                                    .unwrap();

        assertThat(stylesheet.declarations("rect")).containsExactly(Map.entry("color", "blue"));
    }

    @Test
    void parse_emptyBlock_givesEmptyDeclarations() {
        var stylesheet = SheetParser.parse("style.gms", "window { }")
                                    .unwrap();

        assertThat(stylesheet.declarations("window")).isEmpty();
        assertThat(stylesheet.rules()).containsKey("window");
    }

    @Test
    void parse_emptyInput_givesEmptyStylesheet() {
        assertThat(SheetParser.parse("style.gms", "")
                              .unwrap()
                              .isEmpty()).isTrue();
    }

    @Test
    void parse_blockWithoutSelector_fails() {
        var error = errorOf(SheetParser.parse("style.gms", "{ color: red; }"));

        assertThat(error).isInstanceOf(GemError.InvalidSyntax.class);
        assertThat(error.details()).isEqualTo("Expected selectors (tags, IDs, or classes) before '{'.");
    }

    @Test
    void parse_unclosedBlock_fails() {
        var error = errorOf(SheetParser.parse("style.gms", "rect { color: red;"));

        assertThat(error).isInstanceOf(GemError.InvalidSyntax.class);
        assertThat(error.details()).isEqualTo("Expected '}' after block.");
    }

    @Test
    void parse_selectorWithoutBlock_fails() {
        var error = errorOf(SheetParser.parse("style.gms", "rect circle"));

        assertThat(error).isInstanceOf(GemError.InvalidSyntax.class);
        assertThat(error.details()).isEqualTo("Expected '{' after selectors.");
    }

    @Test
    void parse_strayBraceInBlock_strictModeFails() {
        var error = errorOf(SheetParser.parse("style.gms", "rect { { color: red; }", BlockMode.STRICT));

        assertThat(error).isInstanceOf(GemError.InvalidSyntax.class);
        assertThat(error.details()).isEqualTo("Expected a property or '}', found '{'.");
    }

    @Test
    void parse_strayBraceInBlock_tolerantModeSkipsIt() {
        var stylesheet = SheetParser.parse("style.gms", "rect { { color: red; }", BlockMode.TOLERANT)
                                    .unwrap();

        assertThat(stylesheet.declarations("rect")).containsExactly(Map.entry("color", "red"));
    }

    @Test
    void parse_nestedSelectorInBlock_strictModeFails() {
        var error = errorOf(SheetParser.parse("style.gms", "rect { .stray{ color: red; }", BlockMode.STRICT));

        assertThat(error).isInstanceOf(GemError.InvalidSyntax.class);
        assertThat(error.details()).isEqualTo("Expected a property or '}', found '.'.");
        assertThat(error.span()
                        .start()
                        .column()).isEqualTo(8);
    }

    @Test
    void parse_nestedSelectorInBlock_tolerantModeSkipsIt() {
        var stylesheet = SheetParser.parse("style.gms", "rect { .stray{ color: red; }", BlockMode.TOLERANT)
                                    .unwrap();

        assertThat(stylesheet.rules()).containsOnlyKeys("rect");
        assertThat(stylesheet.declarations("rect")).containsExactly(Map.entry("color", "red"));
    }

    @Test
    void parse_nestedIdAndTagSelectors_tolerantModeSkipsThem() {
        var stylesheet = SheetParser.parse("style.gms", """
            rect {
                width: 2;
                #x{ color: red; }
            circle { div { border: 1; }
            """, BlockMode.TOLERANT)
                                    .unwrap();

        assertThat(stylesheet.declarations("rect")).containsExactly(Map.entry("width", "2"),
                                                                    Map.entry("color", "red"));
        assertThat(stylesheet.declarations("circle")).containsExactly(Map.entry("border", "1"));
    }

    @Test
    void parseTokens_withoutEndToken_isClosedAfterLastToken() {
        var tokens = SheetLexer.tokenize("a.gms", "rect { color: red; }")
                               .unwrap();

        var error = errorOf(SheetParser.parseTokens("a.gms", tokens.subList(0, 4), BlockMode.STRICT));

        assertThat(error).isInstanceOf(GemError.InvalidSyntax.class);
        assertThat(error.details()).isEqualTo("Expected '}' after block.");
    }

    @Test
    void parseTokens_emptyList_givesEmptyStylesheet() {
        var stylesheet = SheetParser.parseTokens("a.gms", List.of(), BlockMode.STRICT)
                                    .unwrap();

        assertThat(stylesheet.isEmpty()).isTrue();
    }

    @Test
    void parse_lexerError_isReturnedUnchanged() {
        var error = errorOf(SheetParser.parse("style.gms", "rect { color red; }"));

        assertThat(error).isInstanceOf(GemError.ExpectedCharacter.class);
        assertThat(error.span()
                        .start()
                        .fileName()).isEqualTo("style.gms");
    }

    @Test
    void parseTokens_acceptsPrelexedTokens() {
        List<SheetToken> tokens = SheetLexer.tokenize("a.gms", ".box { color: red; }")
                                            .unwrap();

        var stylesheet = SheetParser.parseTokens("a.gms", tokens, BlockMode.STRICT)
                                    .unwrap();

        assertThat(stylesheet.rules()).containsOnlyKeys(".box");
    }

    private static GemError errorOf(Result<Stylesheet> result) {
        assertThat(result.isFailure()).isTrue();
        return (GemError) result.causeOpt()
                                .orElseThrow();
    }
}
