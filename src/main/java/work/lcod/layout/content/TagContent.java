package work.lcod.layout.content;

import java.util.Objects;

/**
 * A named introspection marker, e.g. a label or a heading anchor. Takes no space.
 */
public record TagContent(String name, Span span) implements Content {
    public TagContent {
        Objects.requireNonNull(name, "name");
        span = span == null ? Span.detached() : span;
    }

    public static TagContent of(String name) {
        return new TagContent(name, Span.detached());
    }
}
