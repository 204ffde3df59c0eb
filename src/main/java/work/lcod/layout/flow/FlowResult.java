package work.lcod.layout.flow;

import java.util.List;
import java.util.function.Supplier;
import work.lcod.layout.content.PlacementScope;
import work.lcod.layout.engine.SourceDiagnostic;
import work.lcod.layout.engine.SourceException;

/**
 * Outcome of a flow layout step: a value, or a {@link Stop} that the caller must handle or pass on.
 */
sealed interface FlowResult<T> permits FlowResult.Ok, FlowResult.Stopped {
    record Ok<T>(T value) implements FlowResult<T> {}

    record Stopped<T>(Stop stop) implements FlowResult<T> {}

    FlowResult<Void> OK = new Ok<>(null);

    static FlowResult<Void> ok() {
        return OK;
    }

    static <T> FlowResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> FlowResult<T> stopped(Stop stop) {
        return new Stopped<>(stop);
    }

    static <T> FlowResult<T> finish(boolean forced) {
        return stopped(new Stop.Finish(forced));
    }

    static <T> FlowResult<T> relayout(PlacementScope scope) {
        return stopped(new Stop.Relayout(scope));
    }

    static <T> FlowResult<T> error(List<SourceDiagnostic> diagnostics) {
        return stopped(new Stop.Error(diagnostics));
    }

    /** Runs a layout routine, turning a {@link SourceException} into a {@link Stop.Error}. */
    static <T> FlowResult<T> attempt(Supplier<T> routine) {
        try {
            return ok(routine.get());
        } catch (SourceException ex) {
            return error(ex.diagnostics());
        }
    }

    default boolean isStopped() {
        return this instanceof Stopped;
    }

    /** The value of a successful step. Overridden by {@link Ok}. */
    default T value() {
        throw new IllegalStateException("Flow step stopped: " + stop());
    }

    /** Why the step stopped. Overridden by {@link Stopped}. */
    default Stop stop() {
        throw new IllegalStateException("Flow step did not stop");
    }

    /** Re-types a stopped result so it can be returned from a step with another value type. */
    default <U> FlowResult<U> propagate() {
        return stopped(stop());
    }
}
