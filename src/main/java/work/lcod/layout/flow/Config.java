package work.lcod.layout.flow;

import java.util.Optional;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.LineNumberingScope;
import work.lcod.layout.content.Styles;
import work.lcod.layout.geom.Dir;
import work.lcod.layout.geom.Regions;
import work.lcod.layout.geom.Rel;

/**
 * Configuration shared by the whole flow. Derived once before the first region and never changed.
 */
record Config(
    FlowMode mode,
    Styles shared,
    ColumnConfig columns,
    FootnoteConfig footnote,
    Optional<LineNumberConfig> lineNumbers
) {
    static Config of(Styles shared, Regions regions, int columns, Rel columnGutter, FlowMode mode) {
        int count = Double.isFinite(regions.size().x()) ? columns : 1;
        double gutter = columnGutter.relativeTo(regions.base().x());
        double width = (regions.size().x() - gutter * (count - 1)) / count;

        var footnoteStyles = shared.lineNumbering() ? shared.toBuilder().lineNumbering(false).build() : shared;
        var footnote = new FootnoteConfig(
            shared.footnoteSeparator(),
            shared.footnoteClearance(),
            shared.footnoteGap(),
            regions.expand().x(),
            footnoteStyles
        );

        Optional<LineNumberConfig> lineNumbers = Optional.empty();
        if (mode == FlowMode.ROOT && shared.lineNumbering()) {
            lineNumbers = Optional.of(new LineNumberConfig(shared.lineNumberingScope(), defaultClearance(shared)));
        }

        return new Config(mode, shared, new ColumnConfig(count, width, gutter, shared.dir()), footnote, lineNumbers);
    }

    /**
     * A share of the page width (height when flipped), kept between {@code 0.75em} and {@code 2.5em}
     * so numbers stay readable next to both small and large text.
     */
    static double defaultClearance(Styles styles) {
        var pageWidth = styles.pageFlipped() ? styles.pageHeight() : styles.pageWidth();
        double min = Math.max(styles.em(0.75), 0);
        double max = Math.max(styles.em(2.5), 0);
        double value = 0.026 * pageWidth.orElse(0.0);
        return Math.min(Math.max(value, min), max);
    }

    /** Column geometry. Columns progress in {@code dir}. */
    record ColumnConfig(int count, double width, double gutter, Dir dir) {}

    /** Footnote presentation. Entries are laid out with {@code styles}. */
    record FootnoteConfig(Content separator, double clearance, double gap, boolean expand, Styles styles) {}

    /** Where line numbers restart and their default distance to the text. */
    record LineNumberConfig(LineNumberingScope scope, double defaultClearance) {}
}
