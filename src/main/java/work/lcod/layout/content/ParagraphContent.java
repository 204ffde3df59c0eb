package work.lcod.layout.content;

import java.util.List;

/**
 * A paragraph made of inline content. It is broken into lines by the paragraph layouter.
 */
public record ParagraphContent(List<Content> inlines, Span span) implements Content {
    public ParagraphContent {
        inlines = inlines == null ? List.of() : List.copyOf(inlines);
        span = span == null ? Span.detached() : span;
    }

    public static ParagraphContent of(String text) {
        return new ParagraphContent(List.of(TextContent.of(text)), Span.detached());
    }

    public static ParagraphContent of(Content... inlines) {
        return new ParagraphContent(List.of(inlines), Span.detached());
    }
}
