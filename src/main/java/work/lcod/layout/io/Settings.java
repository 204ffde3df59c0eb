package work.lcod.layout.io;

import java.util.Objects;
import java.util.Optional;
import work.lcod.layout.content.Styles;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.Rel;
import work.lcod.layout.geom.Size;

/**
 * Page geometry and resolved styles of a layout run.
 */
public record Settings(Size page, int columns, Rel gutter, Axes<Boolean> expand, Styles styles) {
    /** An A4 page in points. */
    public static final Size A4 = new Size(595.28, 841.89);

    public Settings {
        Objects.requireNonNull(page, "page");
        Objects.requireNonNull(expand, "expand");
        Objects.requireNonNull(styles, "styles");
        gutter = gutter == null ? Rel.ratio(0.04) : gutter;
        if (columns < 1) {
            throw new IllegalArgumentException("Column count must be at least 1, got " + columns);
        }
    }

    public static Settings defaults() {
        return new Settings(A4, 1, Rel.ratio(0.04), Axes.splat(true), pageStyles(Styles.defaults(), A4));
    }

    /** Returns styles that know the page size, for page-relative defaults such as line number clearance. */
    static Styles pageStyles(Styles styles, Size page) {
        return styles.toBuilder()
            .pageWidth(Optional.of(page.x()))
            .pageHeight(Optional.of(page.y()))
            .build();
    }
}
