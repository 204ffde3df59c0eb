package work.lcod.layout.flow;

import java.util.List;
import java.util.Objects;
import work.lcod.layout.content.PlacementScope;
import work.lcod.layout.engine.SourceDiagnostic;

/**
 * A control flow event during flow layout.
 */
sealed interface Stop permits Stop.Finish, Stop.Relayout, Stop.Error {
    /**
     * The current column or region should be finished, either for lack of space ({@code forced}
     * is false) or because of an explicit break.
     */
    record Finish(boolean forced) implements Stop {}

    /** The given scope must be laid out again with a new insertion applied. */
    record Relayout(PlacementScope scope) implements Stop {
        public Relayout {
            Objects.requireNonNull(scope, "scope");
        }
    }

    /** A fatal error. */
    record Error(List<SourceDiagnostic> diagnostics) implements Stop {
        public Error {
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
