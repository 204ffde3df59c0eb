package work.lcod.layout.content;

import java.util.Objects;

/**
 * A run of inline text.
 */
public record TextContent(String text, Span span) implements Content {
    public TextContent {
        Objects.requireNonNull(text, "text");
        span = span == null ? Span.detached() : span;
    }

    public static TextContent of(String text) {
        return new TextContent(text, Span.detached());
    }
}
