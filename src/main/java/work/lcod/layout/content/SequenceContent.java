package work.lcod.layout.content;

import java.util.List;

/**
 * An ordered list of content nodes.
 */
public record SequenceContent(List<Content> children, Span span) implements Content {
    public SequenceContent {
        children = children == null ? List.of() : List.copyOf(children);
        span = span == null ? Span.detached() : span;
    }

    public static SequenceContent of(List<Content> children) {
        return new SequenceContent(children, Span.detached());
    }

    public static SequenceContent of(Content... children) {
        return new SequenceContent(List.of(children), Span.detached());
    }
}
