package work.lcod.layout.content;

import java.util.Objects;
import java.util.Optional;
import work.lcod.layout.geom.Dir;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Rel;

/**
 * Resolved style values consumed by flow layout. Produced by the style resolver; never changed
 * during layout.
 */
public record Styles(
    double fontSize,
    double leading,
    double parSpacing,
    double blockAbove,
    double blockBelow,
    FixedAlignment parAlign,
    Dir dir,
    boolean widows,
    boolean orphans,
    Content footnoteSeparator,
    double footnoteClearance,
    double footnoteGap,
    boolean lineNumbering,
    LineNumberingScope lineNumberingScope,
    Optional<Double> lineNumberClearance,
    FixedAlignment lineNumberMargin,
    Optional<Double> placeClearance,
    Optional<Double> pageWidth,
    Optional<Double> pageHeight,
    boolean pageFlipped
) {
    private static final Styles DEFAULTS = builder().build();

    public Styles {
        Objects.requireNonNull(parAlign, "parAlign");
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(footnoteSeparator, "footnoteSeparator");
        Objects.requireNonNull(lineNumberingScope, "lineNumberingScope");
        Objects.requireNonNull(lineNumberClearance, "lineNumberClearance");
        Objects.requireNonNull(lineNumberMargin, "lineNumberMargin");
        Objects.requireNonNull(placeClearance, "placeClearance");
        Objects.requireNonNull(pageWidth, "pageWidth");
        Objects.requireNonNull(pageHeight, "pageHeight");
    }

    public static Styles defaults() {
        return DEFAULTS;
    }

    /** Resolves a length given in {@code em} against the font size. */
    public double em(double value) {
        return value * fontSize;
    }

    /** Clearance between a float and the flow, {@code 1.5em} unless set. */
    public double resolvedPlaceClearance() {
        return placeClearance.orElseGet(() -> em(1.5));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .fontSize(fontSize)
            .leading(leading)
            .parSpacing(parSpacing)
            .blockAbove(blockAbove)
            .blockBelow(blockBelow)
            .parAlign(parAlign)
            .dir(dir)
            .widows(widows)
            .orphans(orphans)
            .footnoteSeparator(footnoteSeparator)
            .footnoteClearance(footnoteClearance)
            .footnoteGap(footnoteGap)
            .lineNumbering(lineNumbering)
            .lineNumberingScope(lineNumberingScope)
            .lineNumberClearance(lineNumberClearance)
            .lineNumberMargin(lineNumberMargin)
            .placeClearance(placeClearance)
            .pageWidth(pageWidth)
            .pageHeight(pageHeight)
            .pageFlipped(pageFlipped);
    }

    /** The default footnote separator: a thin rule over a third of the column. */
    public static Content defaultSeparator() {
        return BlockContent.builder()
            .width(Rel.ratio(1.0 / 3.0))
            .height(0.5)
            .label("footnote-separator")
            .breakable(false)
            .above(0)
            .below(0)
            .build();
    }

    public static final class Builder {
        private double fontSize = 11;
        private double leading = 4;
        private double parSpacing = 8;
        private double blockAbove = 8;
        private double blockBelow = 8;
        private FixedAlignment parAlign = FixedAlignment.START;
        private Dir dir = Dir.LTR;
        private boolean widows = true;
        private boolean orphans = true;
        private Content footnoteSeparator;
        private double footnoteClearance = 10;
        private double footnoteGap = 5;
        private boolean lineNumbering;
        private LineNumberingScope lineNumberingScope = LineNumberingScope.DOCUMENT;
        private Optional<Double> lineNumberClearance = Optional.empty();
        private FixedAlignment lineNumberMargin = FixedAlignment.START;
        private Optional<Double> placeClearance = Optional.empty();
        private Optional<Double> pageWidth = Optional.empty();
        private Optional<Double> pageHeight = Optional.empty();
        private boolean pageFlipped;

        public Builder fontSize(double fontSize) {
            this.fontSize = fontSize;
            return this;
        }

        public Builder leading(double leading) {
            this.leading = leading;
            return this;
        }

        public Builder parSpacing(double parSpacing) {
            this.parSpacing = parSpacing;
            return this;
        }

        public Builder blockAbove(double blockAbove) {
            this.blockAbove = blockAbove;
            return this;
        }

        public Builder blockBelow(double blockBelow) {
            this.blockBelow = blockBelow;
            return this;
        }

        public Builder blockSpacing(double spacing) {
            this.blockAbove = spacing;
            this.blockBelow = spacing;
            return this;
        }

        public Builder parAlign(FixedAlignment parAlign) {
            this.parAlign = parAlign;
            return this;
        }

        public Builder dir(Dir dir) {
            this.dir = dir;
            return this;
        }

        public Builder widows(boolean widows) {
            this.widows = widows;
            return this;
        }

        public Builder orphans(boolean orphans) {
            this.orphans = orphans;
            return this;
        }

        public Builder footnoteSeparator(Content footnoteSeparator) {
            this.footnoteSeparator = footnoteSeparator;
            return this;
        }

        public Builder footnoteClearance(double footnoteClearance) {
            this.footnoteClearance = footnoteClearance;
            return this;
        }

        public Builder footnoteGap(double footnoteGap) {
            this.footnoteGap = footnoteGap;
            return this;
        }

        public Builder lineNumbering(boolean lineNumbering) {
            this.lineNumbering = lineNumbering;
            return this;
        }

        public Builder lineNumberingScope(LineNumberingScope lineNumberingScope) {
            this.lineNumberingScope = lineNumberingScope;
            return this;
        }

        public Builder lineNumberClearance(Optional<Double> lineNumberClearance) {
            this.lineNumberClearance = lineNumberClearance;
            return this;
        }

        public Builder lineNumberMargin(FixedAlignment lineNumberMargin) {
            this.lineNumberMargin = lineNumberMargin;
            return this;
        }

        public Builder placeClearance(Optional<Double> placeClearance) {
            this.placeClearance = placeClearance;
            return this;
        }

        public Builder pageWidth(Optional<Double> pageWidth) {
            this.pageWidth = pageWidth;
            return this;
        }

        public Builder pageHeight(Optional<Double> pageHeight) {
            this.pageHeight = pageHeight;
            return this;
        }

        public Builder pageFlipped(boolean pageFlipped) {
            this.pageFlipped = pageFlipped;
            return this;
        }

        public Styles build() {
            return new Styles(
                fontSize,
                leading,
                parSpacing,
                blockAbove,
                blockBelow,
                parAlign,
                dir,
                widows,
                orphans,
                footnoteSeparator == null ? defaultSeparator() : footnoteSeparator,
                footnoteClearance,
                footnoteGap,
                lineNumbering,
                lineNumberingScope,
                lineNumberClearance,
                lineNumberMargin,
                placeClearance,
                pageWidth,
                pageHeight,
                pageFlipped
            );
        }
    }
}
