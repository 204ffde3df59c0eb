package work.lcod.layout.content;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Rel;

/**
 * Content placed at an alignment of its scope instead of in the flow. A floating element may
 * move to a later column or region when it does not fit where it occurs.
 */
public record PlaceContent(
    List<Content> body,
    PlacementScope scope,
    boolean floating,
    FixedAlignment alignX,
    VerticalPlacement alignY,
    Optional<Double> clearance,
    Rel dx,
    Rel dy,
    Span span
) implements Content {
    public PlaceContent {
        body = body == null ? List.of() : List.copyOf(body);
        Objects.requireNonNull(clearance, "clearance");
        scope = scope == null ? PlacementScope.COLUMN : scope;
        alignX = alignX == null ? FixedAlignment.CENTER : alignX;
        alignY = alignY == null ? VerticalPlacement.AUTO : alignY;
        dx = dx == null ? Rel.ZERO : dx;
        dy = dy == null ? Rel.ZERO : dy;
        span = span == null ? Span.detached() : span;
    }

    /** A column-scoped float wrapping a box of the given height. */
    public static PlaceContent floatBox(String label, double height, VerticalPlacement alignY) {
        return builder()
            .floating(true)
            .alignY(alignY)
            .child(BlockContent.box(label, height))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Content> body = new ArrayList<>();
        private PlacementScope scope = PlacementScope.COLUMN;
        private boolean floating;
        private FixedAlignment alignX = FixedAlignment.CENTER;
        private VerticalPlacement alignY = VerticalPlacement.AUTO;
        private Optional<Double> clearance = Optional.empty();
        private Rel dx = Rel.ZERO;
        private Rel dy = Rel.ZERO;
        private Span span = Span.detached();

        public Builder child(Content child) {
            this.body.add(child);
            return this;
        }

        public Builder body(List<Content> children) {
            this.body.addAll(children);
            return this;
        }

        public Builder scope(PlacementScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder floating(boolean floating) {
            this.floating = floating;
            return this;
        }

        public Builder alignX(FixedAlignment alignX) {
            this.alignX = alignX;
            return this;
        }

        public Builder alignY(VerticalPlacement alignY) {
            this.alignY = alignY;
            return this;
        }

        public Builder clearance(double clearance) {
            this.clearance = Optional.of(clearance);
            return this;
        }

        public Builder dx(Rel dx) {
            this.dx = dx;
            return this;
        }

        public Builder dy(Rel dy) {
            this.dy = dy;
            return this;
        }

        public Builder span(Span span) {
            this.span = span;
            return this;
        }

        public PlaceContent build() {
            return new PlaceContent(body, scope, floating, alignX, alignY, clearance, dx, dy, span);
        }
    }
}
