package work.lcod.layout.content;

/**
 * Asks for all pending floats to be placed before the flow continues.
 */
public record FlushContent(Span span) implements Content {
    public FlushContent {
        span = span == null ? Span.detached() : span;
    }

    public static FlushContent of() {
        return new FlushContent(Span.detached());
    }
}
