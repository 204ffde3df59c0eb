package work.lcod.layout.content;

/**
 * Forces a break to the next column. A weak break is ignored at the start of a column.
 */
public record ColbreakContent(boolean weak, Span span) implements Content {
    public ColbreakContent {
        span = span == null ? Span.detached() : span;
    }

    public static ColbreakContent of() {
        return new ColbreakContent(false, Span.detached());
    }
}
