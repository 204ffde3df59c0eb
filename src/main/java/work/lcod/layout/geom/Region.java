package work.lcod.layout.geom;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single region to lay content out into.
 */
public record Region(Size size, Axes<Boolean> expand) {
    public Region {
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(expand, "expand");
    }

    public Regions toRegions() {
        return new Regions(size, size.y(), List.of(), Optional.empty(), expand);
    }
}
