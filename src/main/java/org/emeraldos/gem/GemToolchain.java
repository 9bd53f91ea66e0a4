package org.emeraldos.gem;

import org.emeraldos.gem.cascade.CascadeResolver;
import org.emeraldos.gem.compiler.AssetStore;
import org.emeraldos.gem.compiler.CompiledDocument;
import org.emeraldos.gem.compiler.Compiler;
import org.emeraldos.gem.compiler.Include;
import org.emeraldos.gem.error.GemError;
import org.emeraldos.gem.lang.Cause;
import org.emeraldos.gem.lang.Result;
import org.emeraldos.gem.markup.MarkupNode;
import org.emeraldos.gem.markup.MarkupParser;
import org.emeraldos.gem.sheet.BlockMode;
import org.emeraldos.gem.sheet.SheetParser;
import org.emeraldos.gem.sheet.Stylesheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for turning GemXML and GemSheet text into a styled scene graph.
 *
 * <p>Example usage:
 * <pre>{@code
 * var document = GemToolchain.process("data.xml", """
 *     <window title="Demo">
 *         <include as="style">style.gms</include>
 *         # Hello
 *         <rect class="box"></rect>
 *     </window>
 *     """, assets).unwrap();
 *
 * var window = document.window();
 * }</pre>
 */
public final class GemToolchain {
    private static final Logger log = LoggerFactory.getLogger(GemToolchain.class);

    private GemToolchain() {}

    /**
     * Lex and parse GemXML text into its syntax tree.
     */
    public static Result<MarkupNode.NodeList> parseMarkup(String fileName, String text) {
        return MarkupParser.parse(fileName, text);
    }

    /**
     * Lex and parse GemSheet text.
     */
    public static Result<Stylesheet> parseStylesheet(String fileName, String text) {
        return parseStylesheet(fileName, text, GemConfig.DEFAULT);
    }

    public static Result<Stylesheet> parseStylesheet(String fileName, String text, GemConfig config) {
        return SheetParser.parse(fileName, text, config.blockMode());
    }

    /**
     * Parse, validate and compile GemXML text, without applying any stylesheet.
     */
    public static Result<CompiledDocument> compile(String fileName, String text, AssetStore assets) {
        return compile(fileName, text, assets, GemConfig.DEFAULT);
    }

    public static Result<CompiledDocument> compile(String fileName, String text, AssetStore assets, GemConfig config) {
        return compileDocument(fileName, text, assets, config)
                          .onFailure(cause -> logFailure(fileName, cause));
    }

    /**
     * Compile GemXML text and cascade every included stylesheet over the result, in include order.
     */
    public static Result<CompiledDocument> process(String fileName, String text, AssetStore assets) {
        return process(fileName, text, assets, GemConfig.DEFAULT);
    }

    public static Result<CompiledDocument> process(String fileName, String text, AssetStore assets, GemConfig config) {
        return compileDocument(fileName, text, assets, config)
                      .flatMap(document -> loadStylesheets(document, assets, config)
                                                  .map(stylesheets -> cascade(document, stylesheets)))
                      .onFailure(cause -> logFailure(fileName, cause));
    }

    private static Result<CompiledDocument> compileDocument(String fileName,
                                                            String text,
                                                            AssetStore assets,
                                                            GemConfig config) {
        return parseMarkup(fileName, text)
                          .flatMap(document -> Compiler.compile(document, assets, config.checkIncludesExist()));
    }

    private static Result<List<Stylesheet>> loadStylesheets(CompiledDocument document, AssetStore assets, GemConfig config) {
        var stylesheets = new ArrayList<Stylesheet>();
        for (var include : document.styleIncludes()) {
            var stylesheet = loadStylesheet(include, assets, config);
            if (stylesheet.isFailure()) {
                return stylesheet.fold(Result::failure, ignored -> null);
            }
            stylesheets.add(stylesheet.unwrap());
        }
        return Result.success(stylesheets);
    }

    private static Result<Stylesheet> loadStylesheet(Include include, AssetStore assets, GemConfig config) {
        var text = assets.read(include.path());
        if (text.isFailure()) {
            // report a storage failure at the include that asked for the file
            return text.fold(cause -> Result.failure(cause instanceof GemError error
                                                     ? error.relocate(include.span())
                                                     : cause),
                             ignored -> null);
        }
        return parseStylesheet(include.path(), text.unwrap(), config);
    }

    private static CompiledDocument cascade(CompiledDocument document, List<Stylesheet> stylesheets) {
        log.debug("Applying {} stylesheet(s) to window '{}'",
                  stylesheets.size(),
                  document.window()
                          .title());
        CascadeResolver.apply(stylesheets, document);
        return document;
    }

    private static void logFailure(String fileName, Cause cause) {
        if (log.isDebugEnabled()) {
            log.debug("Processing {} failed\n{}",
                      fileName,
                      cause instanceof GemError error
                      ? error.report()
                      : cause.message());
        }
    }

    /**
     * Create a builder for a configured pipeline over an asset store.
     */
    public static Builder builder(AssetStore assets) {
        return new Builder(assets);
    }

    public static final class Builder {
        private final AssetStore assets;
        private BlockMode blockMode = GemConfig.DEFAULT.blockMode();
        private boolean checkIncludesExist = GemConfig.DEFAULT.checkIncludesExist();

        private Builder(AssetStore assets) {
            this.assets = assets;
        }

        public Builder blockMode(BlockMode mode) {
            this.blockMode = mode;
            return this;
        }

        public Builder checkIncludesExist(boolean check) {
            this.checkIncludesExist = check;
            return this;
        }

        public GemConfig config() {
            return new GemConfig(blockMode, checkIncludesExist);
        }

        public Result<CompiledDocument> compile(String fileName, String text) {
            return GemToolchain.compile(fileName, text, assets, config());
        }

        public Result<CompiledDocument> process(String fileName, String text) {
            return GemToolchain.process(fileName, text, assets, config());
        }
    }
}
