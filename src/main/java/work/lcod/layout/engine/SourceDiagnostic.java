package work.lcod.layout.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.layout.content.Span;

/**
 * A message about a problem at a location in the source.
 */
public record SourceDiagnostic(Severity severity, Span span, String message, List<String> hints) {
    public SourceDiagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        span = span == null ? Span.detached() : span;
        hints = hints == null ? List.of() : List.copyOf(hints);
    }

    public static SourceDiagnostic error(Span span, String message) {
        return new SourceDiagnostic(Severity.ERROR, span, message, List.of());
    }

    public static SourceDiagnostic warning(Span span, String message) {
        return new SourceDiagnostic(Severity.WARNING, span, message, List.of());
    }

    public SourceDiagnostic withHint(String hint) {
        var extended = new ArrayList<>(hints);
        extended.add(hint);
        return new SourceDiagnostic(severity, span, message, extended);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /** Single-line rendering, e.g. {@code error: message (doc.yaml:3)}. */
    public String display() {
        var builder = new StringBuilder(severity.name().toLowerCase()).append(": ").append(message);
        if (!span.isDetached()) {
            builder.append(" (").append(span.display()).append(')');
        }
        for (var hint : hints) {
            builder.append("; hint: ").append(hint);
        }
        return builder.toString();
    }
}
