package work.lcod.layout.content;

import java.util.List;
import work.lcod.layout.geom.Rel;

/**
 * Content laid out in several columns.
 */
public record ColumnsContent(int count, Rel gutter, List<Content> body, Span span) implements Content {
    public ColumnsContent {
        if (count < 1) {
            throw new IllegalArgumentException("Column count must be at least 1, got " + count);
        }
        gutter = gutter == null ? Rel.ratio(0.04) : gutter;
        body = body == null ? List.of() : List.copyOf(body);
        span = span == null ? Span.detached() : span;
    }

    public static ColumnsContent of(int count, Rel gutter, List<Content> body) {
        return new ColumnsContent(count, gutter, body, Span.detached());
    }
}
