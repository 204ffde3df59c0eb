package work.lcod.layout.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.layout.content.LineNumberingScope;
import work.lcod.layout.content.Styles;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.Dir;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Rel;
import work.lcod.layout.geom.Size;
import work.lcod.layout.shared.LengthParser;

/**
 * Reads {@link Settings} from TOML files with {@code [page]}, {@code [text]}, {@code [par]},
 * {@code [block]}, {@code [place]}, {@code [footnote]} and {@code [line-numbering]} tables.
 * Lengths are strings with a unit ({@code "12pt"}, {@code "20mm"}) or plain numbers in points.
 */
public final class SettingsLoader {
    private static final Map<String, Set<String>> TABLES = Map.of(
        "page", Set.of("width", "height", "columns", "gutter", "expand", "flipped"),
        "text", Set.of("size", "leading", "dir", "align"),
        "par", Set.of("spacing", "widows", "orphans"),
        "block", Set.of("spacing", "above", "below"),
        "place", Set.of("clearance"),
        "footnote", Set.of("clearance", "gap"),
        "line-numbering", Set.of("enabled", "scope", "clearance", "margin")
    );

    private SettingsLoader() {}

    public static Settings load(Path path) {
        try {
            return parse(Files.readString(path), path.getFileName().toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read settings: " + path, ex);
        }
    }

    public static Settings parse(String text, String source) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid settings " + source + ": " + errors);
        }
        return fromToml(result, source);
    }

    public static Settings fromToml(TomlTable root, String source) {
        for (String key : root.keySet()) {
            var allowed = TABLES.get(key);
            if (allowed == null || !root.isTable(key)) {
                throw new IllegalArgumentException("Unknown settings table '" + key + "' in " + source);
            }
            for (String inner : root.getTableOrEmpty(key).keySet()) {
                if (!allowed.contains(inner)) {
                    throw new IllegalArgumentException("Unknown key '" + key + "." + inner + "' in " + source);
                }
            }
        }

        var defaults = Settings.defaults();
        var text = root.getTableOrEmpty("text");
        double fontSize = length(text, "size", Styles.defaults().fontSize(), Styles.defaults().fontSize(), source);
        var builder = Styles.builder().fontSize(fontSize);
        builder.leading(length(text, "leading", Styles.defaults().leading(), fontSize, source));
        optionalString(text, "dir").map(Dir::from).ifPresent(builder::dir);
        optionalString(text, "align").map(FixedAlignment::from).ifPresent(builder::parAlign);

        var par = root.getTableOrEmpty("par");
        builder.parSpacing(length(par, "spacing", Styles.defaults().parSpacing(), fontSize, source));
        builder.widows(bool(par, "widows", true));
        builder.orphans(bool(par, "orphans", true));

        var block = root.getTableOrEmpty("block");
        double blockSpacing = length(block, "spacing", Styles.defaults().blockAbove(), fontSize, source);
        builder.blockAbove(length(block, "above", blockSpacing, fontSize, source));
        builder.blockBelow(length(block, "below", blockSpacing, fontSize, source));

        var place = root.getTableOrEmpty("place");
        if (place.contains("clearance")) {
            builder.placeClearance(Optional.of(length(place, "clearance", 0, fontSize, source)));
        }

        var footnote = root.getTableOrEmpty("footnote");
        builder.footnoteClearance(length(footnote, "clearance", Styles.defaults().footnoteClearance(), fontSize, source));
        builder.footnoteGap(length(footnote, "gap", Styles.defaults().footnoteGap(), fontSize, source));

        var numbering = root.getTableOrEmpty("line-numbering");
        builder.lineNumbering(bool(numbering, "enabled", false));
        optionalString(numbering, "scope").map(LineNumberingScope::from).ifPresent(builder::lineNumberingScope);
        if (numbering.contains("clearance")) {
            builder.lineNumberClearance(Optional.of(length(numbering, "clearance", 0, fontSize, source)));
        }
        optionalString(numbering, "margin").map(FixedAlignment::from).ifPresent(builder::lineNumberMargin);

        var page = root.getTableOrEmpty("page");
        var size = new Size(
            length(page, "width", defaults.page().x(), fontSize, source),
            length(page, "height", defaults.page().y(), fontSize, source)
        );
        int columns = page.contains("columns") ? Math.toIntExact(page.getLong("columns")) : 1;
        Rel gutter = optionalString(page, "gutter")
            .map(raw -> LengthParser.parseRel(raw, fontSize).orElseThrow())
            .orElse(defaults.gutter());
        var expandTable = page.getTableOrEmpty("expand");
        var expand = new Axes<>(bool(expandTable, "x", true), bool(expandTable, "y", true));
        builder.pageFlipped(bool(page, "flipped", false));

        var styles = Settings.pageStyles(builder.build(), size);
        return new Settings(size, columns, gutter, expand, styles);
    }

    private static double length(TomlTable table, String key, double fallback, double em, String source) {
        if (!table.contains(key)) {
            return fallback;
        }
        if (table.isLong(key)) {
            return table.getLong(key);
        }
        if (table.isDouble(key)) {
            return table.getDouble(key);
        }
        if (table.isString(key)) {
            return LengthParser.parse(table.getString(key), em).orElse(fallback);
        }
        throw new IllegalArgumentException("Expected a length for '" + key + "' in " + source);
    }

    private static boolean bool(TomlTable table, String key, boolean fallback) {
        Boolean value = table.getBoolean(key);
        return value == null ? fallback : value;
    }

    private static Optional<String> optionalString(TomlTable table, String key) {
        return Optional.ofNullable(table.getString(key)).filter(value -> !value.isBlank());
    }
}
