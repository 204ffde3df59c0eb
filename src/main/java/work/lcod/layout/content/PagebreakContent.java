package work.lcod.layout.content;

/**
 * A page break. Only valid at the document level, never inside a flow container.
 */
public record PagebreakContent(boolean weak, Span span) implements Content {
    public PagebreakContent {
        span = span == null ? Span.detached() : span;
    }
}
