package org.emeraldos.gem.compiler;

import org.emeraldos.gem.error.GemError;
import org.emeraldos.gem.lang.Result;
import org.emeraldos.gem.lang.Unit;
import org.emeraldos.gem.markup.MarkupNode;
import org.emeraldos.gem.markup.TagKind;
import org.emeraldos.gem.scene.Circle;
import org.emeraldos.gem.scene.Content;
import org.emeraldos.gem.scene.Div;
import org.emeraldos.gem.scene.Emphasis;
import org.emeraldos.gem.scene.Header;
import org.emeraldos.gem.scene.Line;
import org.emeraldos.gem.scene.NodeHandle;
import org.emeraldos.gem.scene.Rect;
import org.emeraldos.gem.scene.StyledContent;
import org.emeraldos.gem.scene.Text;
import org.emeraldos.gem.scene.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.emeraldos.gem.lang.Unit.unitResult;

/**
 * Compiles a GemXML syntax tree into a {@link Window} scene graph.
 *
 * <p>A compiler instance serves a single document: the content arena, the class and id registries
 * and the include list all start empty and end up in the returned {@link CompiledDocument}.
 * The first error aborts the compile.
 */
public final class Compiler {
    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private static final int RECT_WIDTH = 10;
    private static final int RECT_HEIGHT = 6;
    private static final int CIRCLE_RADIUS = 4;
    private static final List<String> LINE_ATTRIBUTES = List.of("startx", "starty", "endx", "endy");

    private final AssetStore assets;
    private final boolean checkIncludesExist;
    private final List<Content> arena = new ArrayList<>();
    private final ClassIndex classes = new ClassIndex();
    private final IdIndex ids = new IdIndex();
    private final List<Include> includes = new ArrayList<>();
    private Frame frame;

    private Compiler(AssetStore assets, boolean checkIncludesExist) {
        this.assets = assets;
        this.checkIncludesExist = checkIncludesExist;
    }

    /**
     * Validate and compile a parsed document.
     */
    public static Result<CompiledDocument> compile(MarkupNode.NodeList document, AssetStore assets) {
        return compile(document, assets, true);
    }

    public static Result<CompiledDocument> compile(MarkupNode.NodeList document,
                                                   AssetStore assets,
                                                   boolean checkIncludesExist) {
        return validate(document)
                       .flatMap(ignored -> new Compiler(assets, checkIncludesExist).compileDocument(document));
    }

    /**
     * A document holds exactly one top-level node, and it is a {@code <window>}.
     */
    public static Result<Unit> validate(MarkupNode.NodeList document) {
        if (document.size() != 1) {
            return Result.failure(new GemError.WindowError(document.span(),
                                                           "A GemXML file can only support one window at a time."));
        }
        if (!(document.body()
                      .get(0) instanceof MarkupNode.TagNode tag) || !tag.tagName()
                                                                         .equals(TagKind.WINDOW.tagName())) {
            return Result.failure(new GemError.WindowError(document.span(),
                                                           "Expected <window> tag at the start of the file."));
        }
        return unitResult();
    }

    private Result<CompiledDocument> compileDocument(MarkupNode.NodeList document) {
        var root = (MarkupNode.TagNode) document.body()
                                                .get(0);
        return openWindow(root)
                       .map(window -> new CompiledDocument(window, new Registries(arena, classes, ids), includes))
                       .onSuccess(compiled -> log.debug("Compiled window '{}' with {} content nodes, {} classes, {} ids and {} includes",
                                                        compiled.window()
                                                                .title(),
                                                        arena.size(),
                                                        classes.classNames()
                                                               .size(),
                                                        ids.size(),
                                                        includes.size()));
    }

    private Result<Window> openWindow(MarkupNode.TagNode tag) {
        if (frame != null) {
            return Result.failure(secondWindow(tag));
        }
        var x = intAttribute(tag, "x", Window.DEFAULT_X);
        var y = intAttribute(tag, "y", Window.DEFAULT_Y);
        var width = intAttribute(tag, "width", Window.DEFAULT_WIDTH);
        var height = intAttribute(tag, "height", Window.DEFAULT_HEIGHT);
        for (var attribute : List.of(x, y, width, height)) {
            if (attribute.isFailure()) {
                return attribute.fold(Result::failure, ignored -> null);
            }
        }
        var title = tag.attribute("title")
                       .orElse(Window.DEFAULT_TITLE);
        frame = new Frame(width.unwrap(), height.unwrap());

        return visitChildren(tag.content())
                       .map(contents -> new Window(x.unwrap(), y.unwrap(), width.unwrap(), height.unwrap(), title, contents));
    }

    /**
     * Compile siblings in order. Each child hands back the node it produced, if any.
     */
    private Result<List<Content>> visitChildren(MarkupNode.NodeList nodes) {
        var contents = new ArrayList<Content>();
        for (var node : nodes.body()) {
            var visited = visit(node);
            if (visited.isFailure()) {
                return visited.fold(Result::failure, ignored -> null);
            }
            visited.unwrap()
                   .ifPresent(contents::add);
        }
        return Result.success(contents);
    }

    private Result<Optional<Content>> visit(MarkupNode node) {
        if (node instanceof MarkupNode.TextNode text) {
            return Result.success(Optional.of(add(handle -> new Text(handle, text.content()))));
        }
        if (node instanceof MarkupNode.TagNode tag) {
            return visitTag(tag);
        }
        return Result.failure(new GemError.InvalidSyntax(node.span(), "Nested node list outside of an element."));
    }

    private Result<Optional<Content>> visitTag(MarkupNode.TagNode tag) {
        var kind = TagKind.fromName(tag.tagName());
        if (kind.isEmpty()) {
            return Result.failure(new GemError.UnknownTag(tag.span(), "<" + tag.tagName() + "> (when compiling)"));
        }
        return switch (kind.get()) {
            // the root window is opened before any child is visited
            case WINDOW -> Result.failure(secondWindow(tag));
            case TEXT -> text(tag);
            case RECT -> rect(tag);
            case CIRCLE -> circle(tag);
            case LINE -> line(tag);
            case INCLUDE -> include(tag);
            case DIV -> group(tag, Div::new);
            case H1 -> group(tag, (handle, contents) -> new Header(handle, 1, contents));
            case H2 -> group(tag, (handle, contents) -> new Header(handle, 2, contents));
            case H3 -> group(tag, (handle, contents) -> new Header(handle, 3, contents));
            case B, I, BI, U -> group(tag, (handle, contents) -> new StyledContent(handle, emphasis(tag), contents));
        };
    }

    private Result<Optional<Content>> text(MarkupNode.TagNode tag) {
        var sb = new StringBuilder();
        for (var child : tag.content()
                            .body()) {
            if (!(child instanceof MarkupNode.TextNode literal)) {
                return Result.failure(new GemError.InvalidSyntax(child.span(), "<text> can only contain literal text."));
            }
            sb.append(literal.content());
        }
        return register(tag, add(handle -> new Text(handle, sb.toString())));
    }

    private Result<Optional<Content>> rect(MarkupNode.TagNode tag) {
        var x = intAttribute(tag, "x", Math.floorDiv(frame.width(), 2) - 5);
        var y = intAttribute(tag, "y", Math.floorDiv(frame.height(), 2) - 3);
        var width = intAttribute(tag, "width", RECT_WIDTH);
        var height = intAttribute(tag, "height", RECT_HEIGHT);
        for (var attribute : List.of(x, y, width, height)) {
            if (attribute.isFailure()) {
                return attribute.fold(Result::failure, ignored -> null);
            }
        }
        return register(tag, add(handle -> new Rect(handle, x.unwrap(), y.unwrap(), width.unwrap(), height.unwrap())));
    }

    private Result<Optional<Content>> circle(MarkupNode.TagNode tag) {
        var x = intAttribute(tag, "x", Math.floorDiv(frame.width(), 2));
        var y = intAttribute(tag, "y", Math.floorDiv(frame.height(), 2));
        var radius = intAttribute(tag, "radius", CIRCLE_RADIUS);
        for (var attribute : List.of(x, y, radius)) {
            if (attribute.isFailure()) {
                return attribute.fold(Result::failure, ignored -> null);
            }
        }
        return register(tag, add(handle -> new Circle(handle, x.unwrap(), y.unwrap(), radius.unwrap())));
    }

    // No positional defaults: every end point has to be given.
    private Result<Optional<Content>> line(MarkupNode.TagNode tag) {
        var coordinates = new ArrayList<Integer>();
        for (var name : LINE_ATTRIBUTES) {
            if (!tag.hasAttribute(name)) {
                return Result.failure(new GemError.MissingAttribute(tag.span(), "Missing attribute: '" + name + "'"));
            }
            var value = intAttribute(tag, name, 0);
            if (value.isFailure()) {
                return value.fold(Result::failure, ignored -> null);
            }
            coordinates.add(value.unwrap());
        }
        return register(tag,
                        add(handle -> new Line(handle,
                                               coordinates.get(0),
                                               coordinates.get(1),
                                               coordinates.get(2),
                                               coordinates.get(3))));
    }

    /**
     * Grouping constructs own the nodes produced by their children.
     */
    private Result<Optional<Content>> group(MarkupNode.TagNode tag, GroupFactory factory) {
        var children = visitChildren(tag.content());
        if (children.isFailure()) {
            return children.fold(Result::failure, ignored -> null);
        }
        return register(tag, add(handle -> factory.create(handle, children.unwrap())));
    }

    private Result<Optional<Content>> include(MarkupNode.TagNode tag) {
        var as = tag.attribute("as");
        if (as.isEmpty()) {
            return Result.failure(new GemError.MissingAttribute(tag.span(), "Missing attribute: 'as'"));
        }
        var kind = IncludeKind.fromAttribute(as.get());
        if (kind.isEmpty()) {
            return Result.failure(new GemError.AttributeError(tag.span(),
                                                              "Expected one of the following for 'as' attribute: "
                                                              + IncludeKind.allowed() + "."));
        }
        var body = tag.content()
                      .body();
        if (body.isEmpty()) {
            return Result.failure(new GemError.MissingAttribute(tag.span(), "File path cannot be empty."));
        }
        if (body.size() != 1 || !(body.get(0) instanceof MarkupNode.TextNode literal)) {
            return Result.failure(new GemError.FileError(tag.span(), "Include path must be a single literal path."));
        }
        var path = literal.content()
                          .strip();
        if (path.isEmpty()) {
            return Result.failure(new GemError.MissingAttribute(tag.span(), "File path cannot be empty."));
        }
        var include = kind.get();
        if (!path.endsWith(include.extension())) {
            return Result.failure(new GemError.FileError(tag.span(),
                                                         include.description() + " must end in '" + include.extension()
                                                         + "'."));
        }
        if (checkIncludesExist && !assets.exists(path)) {
            return Result.failure(new GemError.FileError(tag.span(), "Cannot find file " + path + "."));
        }
        includes.add(new Include(include, path, tag.span()));
        log.debug("Recorded {} include '{}' at {}", include.attributeValue(), path, tag.span());
        return Result.success(Optional.empty());
    }

    private Content add(Function<NodeHandle, Content> factory) {
        var node = factory.apply(new NodeHandle(arena.size()));
        arena.add(node);
        return node;
    }

    /**
     * Record the class and id attributes of a freshly built node.
     */
    private Result<Optional<Content>> register(MarkupNode.TagNode tag, Content node) {
        tag.attribute("class")
           .ifPresent(value -> {
                          for (var className : value.trim()
                                                    .split("\\s+")) {
                              if (!className.isEmpty()) {
                                  classes.add(className, node.handle());
                              }
                          }
                      });
        var id = tag.attribute("id");
        if (id.isPresent()) {
            var holder = ids.register(id.get(), node.handle());
            if (holder.isPresent()) {
                var other = arena.get(holder.get()
                                            .index());
                return Result.failure(new GemError.IdCollision(tag.span(),
                                                               "ID " + id.get() + " is already used by object "
                                                               + other.getClass()
                                                                      .getSimpleName() + "."));
            }
        }
        return Result.success(Optional.of(node));
    }

    private static Result<Integer> intAttribute(MarkupNode.TagNode tag, String name, int fallback) {
        var value = tag.attribute(name);
        if (value.isEmpty()) {
            return Result.success(fallback);
        }
        try{
            return Result.success(Integer.parseInt(value.get()
                                                        .strip()));
        } catch (NumberFormatException e) {
            return Result.failure(new GemError.AttributeError(tag.span(),
                                                              "Attribute '" + name + "' must be an integer, found '"
                                                              + value.get() + "'."));
        }
    }

    private static Emphasis emphasis(MarkupNode.TagNode tag) {
        return Emphasis.fromTagName(tag.tagName())
                       .orElseThrow(() -> new IllegalStateException("Not an emphasis tag: " + tag.tagName()));
    }

    private static GemError secondWindow(MarkupNode.TagNode tag) {
        return new GemError.WindowError(tag.span(), "There can only be one.");
    }

    /**
     * Size of the window being compiled; default positions are relative to it.
     */
    private record Frame(int width, int height) {}

    @FunctionalInterface
    private interface GroupFactory {
        Content create(NodeHandle handle, List<Content> contents);
    }
}
