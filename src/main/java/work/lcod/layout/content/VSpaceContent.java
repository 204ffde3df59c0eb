package work.lcod.layout.content;

import java.util.Objects;

/**
 * Vertical spacing. Weak spacing collapses with adjacent weak spacing and vanishes at region starts.
 */
public record VSpaceContent(Sizing amount, boolean weak, Span span) implements Content {
    public VSpaceContent {
        Objects.requireNonNull(amount, "amount");
        span = span == null ? Span.detached() : span;
    }

    public static VSpaceContent of(double points) {
        return new VSpaceContent(Sizing.abs(points), false, Span.detached());
    }

    public static VSpaceContent weak(double points) {
        return new VSpaceContent(Sizing.abs(points), true, Span.detached());
    }

    public static VSpaceContent fr(double value) {
        return new VSpaceContent(Sizing.fr(value), false, Span.detached());
    }
}
