package work.lcod.layout.geom;

import java.util.Objects;

/**
 * A pair of values, one per axis.
 */
public record Axes<T>(T x, T y) {
    public Axes {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
    }

    public static <T> Axes<T> splat(T value) {
        return new Axes<>(value, value);
    }

    public Axes<T> withX(T value) {
        return new Axes<>(value, y);
    }

    public Axes<T> withY(T value) {
        return new Axes<>(x, value);
    }

    /**
     * Selects, per axis, the component of {@code ifTrue} or {@code ifFalse} depending on this boolean axes.
     */
    public static Size select(Axes<Boolean> mask, Size ifTrue, Size ifFalse) {
        return new Size(mask.x() ? ifTrue.x() : ifFalse.x(), mask.y() ? ifTrue.y() : ifFalse.y());
    }
}
