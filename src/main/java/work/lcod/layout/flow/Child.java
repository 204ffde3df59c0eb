package work.lcod.layout.flow;

import java.util.Objects;
import work.lcod.layout.content.Span;
import work.lcod.layout.content.Tag;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Fr;
import work.lcod.layout.geom.Rel;

/**
 * A prepared unit of flow content. Built once by the {@link Collector} and read by the
 * {@link Distributor}, possibly many times across regions and relayout attempts.
 */
sealed interface Child permits
    Child.TagChild,
    Child.RelChild,
    Child.FrChild,
    Child.LineChild,
    Child.FlushChild,
    Child.BreakChild,
    SingleChild,
    MultiChild,
    PlacedChild {

    /** An introspection tag. */
    record TagChild(Tag tag) implements Child {}

    /** Absolute or relative spacing. A weakness of zero means strong spacing. */
    record RelChild(Rel amount, int weakness) implements Child {}

    /** Fractional spacing. */
    record FrChild(Fr fr, int weakness) implements Child {}

    /**
     * A paragraph line. {@code need} is the height the line requires to be placed in the current
     * region, which covers the following lines it is kept together with.
     */
    record LineChild(Frame frame, Axes<FixedAlignment> align, double need, Span span) implements Child {
        public LineChild {
            Objects.requireNonNull(frame, "frame");
        }
    }

    /** Forces pending floats out before the flow continues. */
    record FlushChild() implements Child {}

    /** An explicit column or region break. */
    record BreakChild(boolean weak) implements Child {}
}
