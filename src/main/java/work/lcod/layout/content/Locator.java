package work.lcod.layout.content;

import java.util.Objects;

/**
 * Hands out deterministic {@link Location}s. A locator identifies one position in the content
 * tree; {@link #split()} derives numbered children for the nodes below it.
 */
public record Locator(String path) {
    public Locator {
        Objects.requireNonNull(path, "path");
    }

    public static Locator root() {
        return new Locator("0");
    }

    public Location location() {
        return new Location(path);
    }

    public Locator child(String segment) {
        return new Locator(path + "/" + segment);
    }

    public SplitLocator split() {
        return new SplitLocator(this);
    }

    /**
     * Mutable cursor producing consecutive child locators.
     */
    public static final class SplitLocator {
        private final Locator parent;
        private int counter;

        private SplitLocator(Locator parent) {
            this.parent = parent;
        }

        public Locator next() {
            return parent.child(Integer.toString(counter++));
        }

        public Locator parent() {
            return parent;
        }
    }
}
