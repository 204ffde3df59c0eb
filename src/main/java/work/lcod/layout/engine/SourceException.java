package work.lcod.layout.engine;

import java.util.List;
import work.lcod.layout.content.Span;

/**
 * Fatal layout failure carrying the diagnostics that caused it.
 */
public final class SourceException extends RuntimeException {
    private final List<SourceDiagnostic> diagnostics;

    public SourceException(List<SourceDiagnostic> diagnostics) {
        super(summary(diagnostics));
        if (diagnostics == null || diagnostics.isEmpty()) {
            throw new IllegalArgumentException("A source exception needs at least one diagnostic");
        }
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static SourceException of(SourceDiagnostic diagnostic) {
        return new SourceException(List.of(diagnostic));
    }

    /** Builds an error at {@code span} with optional hints, ready to be thrown. */
    public static SourceException bail(Span span, String message, String... hints) {
        var diagnostic = SourceDiagnostic.error(span, message);
        for (var hint : hints) {
            diagnostic = diagnostic.withHint(hint);
        }
        return of(diagnostic);
    }

    public List<SourceDiagnostic> diagnostics() {
        return diagnostics;
    }

    private static String summary(List<SourceDiagnostic> diagnostics) {
        if (diagnostics == null || diagnostics.isEmpty()) {
            return "Layout failed";
        }
        return diagnostics.get(0).message();
    }
}
