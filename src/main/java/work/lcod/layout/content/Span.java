package work.lcod.layout.content;

/**
 * Points back to the source of a content node, for diagnostics.
 */
public record Span(String source, int line) {
    private static final Span DETACHED = new Span("", 0);

    public static Span detached() {
        return DETACHED;
    }

    public static Span of(String source, int line) {
        return new Span(source == null ? "" : source, line);
    }

    public boolean isDetached() {
        return source.isEmpty() && line == 0;
    }

    public String display() {
        if (isDetached()) {
            return "<detached>";
        }
        return line > 0 ? source + ":" + line : source;
    }
}
