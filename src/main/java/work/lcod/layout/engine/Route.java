package work.lcod.layout.engine;

import work.lcod.layout.content.Span;

/**
 * Tracks how deeply layouts are nested.
 */
public record Route(int depth) {
    /** Nested layouts beyond this depth are rejected. */
    public static final int MAX_LAYOUT_DEPTH = 72;

    public static Route root() {
        return new Route(0);
    }

    public Route extend() {
        return new Route(depth + 1);
    }

    public void checkLayoutDepth(Span span) {
        if (depth > MAX_LAYOUT_DEPTH) {
            throw SourceException.bail(
                span,
                "maximum layout depth exceeded",
                "try to reduce the amount of nesting in your layout"
            );
        }
    }
}
