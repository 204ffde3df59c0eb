package work.lcod.layout.content;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Rel;

/**
 * A block-level container. Without a body and with a fixed height it is an opaque box (an image,
 * a rule). A breakable block may be split across regions; a fixed height is then spread over
 * the regions it spans.
 */
public record BlockContent(
    Optional<Rel> width,
    Optional<Sizing> height,
    boolean breakable,
    boolean sticky,
    FixedAlignment align,
    String label,
    List<Content> body,
    Optional<Double> above,
    Optional<Double> below,
    Span span
) implements Content {
    public BlockContent {
        Objects.requireNonNull(width, "width");
        Objects.requireNonNull(height, "height");
        Objects.requireNonNull(above, "above");
        Objects.requireNonNull(below, "below");
        align = align == null ? FixedAlignment.START : align;
        label = label == null ? "" : label;
        body = body == null ? List.of() : List.copyOf(body);
        span = span == null ? Span.detached() : span;
    }

    /** An unbreakable box of the given height spanning the available width. */
    public static BlockContent box(String label, double height) {
        return builder().label(label).height(height).breakable(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Optional<Rel> width = Optional.empty();
        private Optional<Sizing> height = Optional.empty();
        private boolean breakable = true;
        private boolean sticky;
        private FixedAlignment align = FixedAlignment.START;
        private String label = "";
        private final List<Content> body = new ArrayList<>();
        private Optional<Double> above = Optional.empty();
        private Optional<Double> below = Optional.empty();
        private Span span = Span.detached();

        public Builder width(Rel width) {
            this.width = Optional.ofNullable(width);
            return this;
        }

        public Builder width(double width) {
            return width(Rel.abs(width));
        }

        public Builder height(Sizing height) {
            this.height = Optional.ofNullable(height);
            return this;
        }

        public Builder height(double height) {
            return height(Sizing.abs(height));
        }

        public Builder breakable(boolean breakable) {
            this.breakable = breakable;
            return this;
        }

        public Builder sticky(boolean sticky) {
            this.sticky = sticky;
            return this;
        }

        public Builder align(FixedAlignment align) {
            this.align = align;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder body(List<Content> children) {
            this.body.addAll(children);
            return this;
        }

        public Builder child(Content child) {
            this.body.add(child);
            return this;
        }

        public Builder above(double above) {
            this.above = Optional.of(above);
            return this;
        }

        public Builder below(double below) {
            this.below = Optional.of(below);
            return this;
        }

        public Builder span(Span span) {
            this.span = span;
            return this;
        }

        public BlockContent build() {
            return new BlockContent(width, height, breakable, sticky, align, label, body, above, below, span);
        }
    }
}
