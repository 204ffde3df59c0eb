package work.lcod.layout.flow;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import work.lcod.layout.content.Location;

/**
 * Immutable set of floats and footnotes that were already incorporated as insertions. Work copies
 * share the same instance; extending creates a new set, so a discarded attempt never leaks into
 * the state another attempt starts from.
 */
final class SkipSet {
    private static final SkipSet EMPTY = new SkipSet(Set.of());

    private final Set<Location> locations;

    private SkipSet(Set<Location> locations) {
        this.locations = locations;
    }

    static SkipSet empty() {
        return EMPTY;
    }

    boolean contains(Location location) {
        return locations.contains(location);
    }

    SkipSet extend(Collection<Location> additions) {
        if (additions.isEmpty() || locations.containsAll(additions)) {
            return this;
        }
        var copy = new LinkedHashSet<>(locations);
        copy.addAll(additions);
        return new SkipSet(Collections.unmodifiableSet(copy));
    }

    int size() {
        return locations.size();
    }
}
