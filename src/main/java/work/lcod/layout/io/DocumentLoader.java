package work.lcod.layout.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import work.lcod.layout.content.BlockContent;
import work.lcod.layout.content.ColbreakContent;
import work.lcod.layout.content.ColumnsContent;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.FlushContent;
import work.lcod.layout.content.FootnoteContent;
import work.lcod.layout.content.PagebreakContent;
import work.lcod.layout.content.ParagraphContent;
import work.lcod.layout.content.PlaceContent;
import work.lcod.layout.content.PlacementScope;
import work.lcod.layout.content.SequenceContent;
import work.lcod.layout.content.Sizing;
import work.lcod.layout.content.Span;
import work.lcod.layout.content.Styles;
import work.lcod.layout.content.TagContent;
import work.lcod.layout.content.TextContent;
import work.lcod.layout.content.VSpaceContent;
import work.lcod.layout.content.VerticalPlacement;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Rel;
import work.lcod.layout.shared.LengthParser;

/**
 * Loads documents (YAML or JSON) into content trees.
 *
 * <p>A document holds a {@code content} list; every entry is a single-key object naming the node
 * kind ({@code par}, {@code block}, {@code place}, {@code v}, {@code colbreak}, {@code flush},
 * {@code pagebreak}, {@code columns}, {@code tag}, {@code text}, {@code footnote}). Footnotes
 * without an explicit marker are numbered in document order.
 */
public final class DocumentLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> BLOCK_KEYS =
        Set.of("width", "height", "breakable", "sticky", "align", "label", "body", "above", "below");
    private static final Set<String> PLACE_KEYS =
        Set.of("float", "scope", "align", "align-x", "clearance", "dx", "dy", "height", "width", "label", "body");

    private final String source;
    private final double em;
    private int footnotes;

    private DocumentLoader(String source, Styles styles) {
        this.source = source;
        this.em = styles.fontSize();
    }

    public static Content load(Path path, Styles styles) {
        try (var in = Files.newInputStream(path)) {
            return new DocumentLoader(path.getFileName().toString(), styles).parse(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read document: " + path, ex);
        }
    }

    public static Content parse(String text, String source, Styles styles) {
        try {
            var root = YAML_MAPPER.readTree(text);
            return new DocumentLoader(source, styles).document(root);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Failed to parse document " + source + ": " + ex.getMessage(), ex);
        }
    }

    private Content parse(InputStream in) throws IOException {
        return document(YAML_MAPPER.readTree(in));
    }

    private Content document(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return SequenceContent.of(List.of());
        }
        if (!root.isObject() || !root.has("content")) {
            throw new IllegalArgumentException("Document " + source + " must have a 'content' list");
        }
        return new SequenceContent(nodes(root.get("content"), "/content"), span("/content"));
    }

    private List<Content> nodes(JsonNode list, String path) {
        if (list == null || list.isNull()) {
            return List.of();
        }
        if (!list.isArray()) {
            throw new IllegalArgumentException("Expected a list at " + source + "#" + path);
        }
        var nodes = new ArrayList<Content>();
        int index = 0;
        for (var item : list) {
            nodes.add(node(item, path + "/" + index++));
        }
        return nodes;
    }

    private Content node(JsonNode item, String path) {
        if (!item.isObject() || item.size() != 1) {
            throw new IllegalArgumentException("Content entry must be an object with a single kind at " + source + "#" + path);
        }
        var entry = item.fields().next();
        var kind = entry.getKey();
        var value = entry.getValue();
        var at = path + "/" + kind;
        return switch (kind) {
            case "par" -> new ParagraphContent(inlines(value, at), span(at));
            case "text" -> new TextContent(value.asText(), span(at));
            case "footnote" -> footnote(value, at);
            case "block" -> block(value, at);
            case "place" -> place(value, at);
            case "v" -> spacing(value, at);
            case "colbreak" -> new ColbreakContent(value.path("weak").asBoolean(false), span(at));
            case "flush" -> new FlushContent(span(at));
            case "pagebreak" -> new PagebreakContent(value.path("weak").asBoolean(false), span(at));
            case "columns" -> columns(value, at);
            case "tag" -> new TagContent(value.asText(), span(at));
            default -> throw new IllegalArgumentException("Unknown content kind '" + kind + "' at " + source + "#" + path);
        };
    }

    private List<Content> inlines(JsonNode value, String path) {
        if (value.isTextual()) {
            return List.of(new TextContent(value.asText(), span(path)));
        }
        if (!value.isArray()) {
            throw new IllegalArgumentException("Expected text or a list of inline items at " + source + "#" + path);
        }
        var inlines = new ArrayList<Content>();
        int index = 0;
        for (var item : value) {
            var at = path + "/" + index++;
            if (item.isTextual()) {
                inlines.add(new TextContent(item.asText(), span(at)));
                continue;
            }
            var node = node(item, at);
            if (!node.isInline()) {
                throw new IllegalArgumentException("Only text and footnotes may appear inline at " + source + "#" + at);
            }
            inlines.add(node);
        }
        return inlines;
    }

    private FootnoteContent footnote(JsonNode value, String path) {
        if (value.isObject() && value.has("ref")) {
            return new FootnoteContent(List.of(), value.get("ref").asText(), true, span(path));
        }
        String marker = value.isObject() && value.hasNonNull("marker")
            ? value.get("marker").asText()
            : Integer.toString(++footnotes);
        var body = value.isObject() ? value.path("body") : value;
        return new FootnoteContent(body.isMissingNode() ? List.of() : inlines(body, path), marker, false, span(path));
    }

    private BlockContent block(JsonNode value, String path) {
        checkKeys(value, BLOCK_KEYS, path);
        var builder = BlockContent.builder().span(span(path));
        if (value.has("width")) {
            builder.width(rel(value.get("width"), path));
        }
        if (value.has("height")) {
            builder.height(sizing(value.get("height"), path));
        }
        builder.breakable(value.path("breakable").asBoolean(true));
        builder.sticky(value.path("sticky").asBoolean(false));
        if (value.has("align")) {
            builder.align(FixedAlignment.from(value.get("align").asText()));
        }
        builder.label(value.path("label").asText(""));
        if (value.has("above")) {
            builder.above(length(value.get("above"), path));
        }
        if (value.has("below")) {
            builder.below(length(value.get("below"), path));
        }
        builder.body(nodes(value.get("body"), path + "/body"));
        return builder.build();
    }

    private PlaceContent place(JsonNode value, String path) {
        checkKeys(value, PLACE_KEYS, path);
        boolean floating = value.path("float").asBoolean(false);
        var builder = PlaceContent.builder()
            .span(span(path))
            .floating(floating)
            .scope(PlacementScope.from(value.path("scope").asText("column")))
            .alignY(value.has("align")
                ? VerticalPlacement.from(value.get("align").asText())
                : floating ? VerticalPlacement.AUTO : VerticalPlacement.IN_FLOW);
        if (value.has("align-x")) {
            builder.alignX(FixedAlignment.from(value.get("align-x").asText()));
        }
        if (value.has("clearance")) {
            builder.clearance(length(value.get("clearance"), path));
        }
        if (value.has("dx")) {
            builder.dx(rel(value.get("dx"), path));
        }
        if (value.has("dy")) {
            builder.dy(rel(value.get("dy"), path));
        }
        if (value.has("body")) {
            builder.body(nodes(value.get("body"), path + "/body"));
        } else {
            // Shorthand: a placed box of the given size.
            var box = BlockContent.builder().span(span(path)).label(value.path("label").asText(""));
            if (value.has("height")) {
                box.height(sizing(value.get("height"), path));
            }
            if (value.has("width")) {
                box.width(rel(value.get("width"), path));
            }
            builder.child(box.build());
        }
        return builder.build();
    }

    private VSpaceContent spacing(JsonNode value, String path) {
        if (value.isObject()) {
            return new VSpaceContent(sizing(value.get("amount"), path), value.path("weak").asBoolean(false), span(path));
        }
        return new VSpaceContent(sizing(value, path), false, span(path));
    }

    private ColumnsContent columns(JsonNode value, String path) {
        int count = value.path("count").asInt(2);
        var gutter = value.has("gutter") ? rel(value.get("gutter"), path) : null;
        return new ColumnsContent(count, gutter, nodes(value.get("body"), path + "/body"), span(path));
    }

    private void checkKeys(JsonNode value, Set<String> allowed, String path) {
        if (!value.isObject()) {
            throw new IllegalArgumentException("Expected an object at " + source + "#" + path);
        }
        var names = value.fieldNames();
        while (names.hasNext()) {
            var name = names.next();
            if (!allowed.contains(name)) {
                throw new IllegalArgumentException("Unknown key '" + name + "' at " + source + "#" + path);
            }
        }
    }

    private double length(JsonNode node, String path) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Missing length at " + source + "#" + path);
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        return LengthParser.parse(node.asText(), em)
            .orElseThrow(() -> new IllegalArgumentException("Missing length at " + source + "#" + path));
    }

    private Rel rel(JsonNode node, String path) {
        if (node.isNumber()) {
            return Rel.abs(node.asDouble());
        }
        return LengthParser.parseRel(node.asText(), em)
            .orElseThrow(() -> new IllegalArgumentException("Missing length at " + source + "#" + path));
    }

    private Sizing sizing(JsonNode node, String path) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Missing amount at " + source + "#" + path);
        }
        if (node.isNumber()) {
            return Sizing.abs(node.asDouble());
        }
        return LengthParser.parseSizing(node.asText(), em)
            .orElseThrow(() -> new IllegalArgumentException("Missing amount at " + source + "#" + path));
    }

    private Span span(String path) {
        return Span.of(source + "#" + path, 0);
    }
}
