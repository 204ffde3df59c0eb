package work.lcod.layout.content;

import java.util.Objects;

/**
 * Stable identity of an element within one layout, handed out by a {@link Locator}.
 */
public record Location(String key) implements Comparable<Location> {
    public Location {
        Objects.requireNonNull(key, "key");
    }

    @Override
    public int compareTo(Location other) {
        return key.compareTo(other.key);
    }

    @Override
    public String toString() {
        return key;
    }
}
