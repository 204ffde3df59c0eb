package work.lcod.layout.content;

import java.util.List;
import java.util.Objects;

/**
 * An inline footnote. The marker is rendered in the text; the entry (marker and body) at the
 * bottom of the column. A reference footnote repeats the marker of another note and has no entry.
 */
public record FootnoteContent(List<Content> body, String marker, boolean reference, Span span) implements Content {
    public FootnoteContent {
        body = body == null ? List.of() : List.copyOf(body);
        Objects.requireNonNull(marker, "marker");
        span = span == null ? Span.detached() : span;
    }

    public static FootnoteContent of(String marker, String text) {
        return new FootnoteContent(List.of(TextContent.of(text)), marker, false, Span.detached());
    }

    public static FootnoteContent of(String marker, List<Content> body) {
        return new FootnoteContent(body, marker, false, Span.detached());
    }

    public static FootnoteContent reference(String marker) {
        return new FootnoteContent(List.of(), marker, true, Span.detached());
    }
}
