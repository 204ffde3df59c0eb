package work.lcod.layout.geom;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A sequence of regions: the size of the first one, the heights of the following ones and,
 * optionally, a height that repeats forever once the backlog is exhausted.
 *
 * <p>Instances are immutable; {@link #next()} and the {@code with*} methods return new values.
 */
public record Regions(Size size, double full, List<Double> backlog, Optional<Double> last, Axes<Boolean> expand) {
    public Regions {
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(last, "last");
        Objects.requireNonNull(expand, "expand");
        backlog = backlog == null ? List.of() : List.copyOf(backlog);
    }

    /** A single region without followers. */
    public static Regions one(Size size, Axes<Boolean> expand) {
        return new Regions(size, size.y(), List.of(), Optional.empty(), expand);
    }

    /** An endless sequence of equally sized regions, like the pages of a document. */
    public static Regions repeat(Size size, Axes<Boolean> expand) {
        return new Regions(size, size.y(), List.of(), Optional.of(size.y()), expand);
    }

    /** The base size that relative lengths resolve against. */
    public Size base() {
        return new Size(size.x(), full);
    }

    public Regions withSize(Size newSize) {
        return new Regions(newSize, full, backlog, last, expand);
    }

    public Regions withHeight(double height) {
        return withSize(size.withHeight(height));
    }

    public Regions shrink(double amount) {
        return withHeight(size.y() - amount);
    }

    public Regions withExpand(Axes<Boolean> newExpand) {
        return new Regions(size, full, backlog, last, newExpand);
    }

    public Regions withBacklog(List<Double> newBacklog) {
        return new Regions(size, full, newBacklog, last, expand);
    }

    /**
     * Whether a following region could offer a different (and maybe larger) space than the current one.
     */
    public boolean mayProgress() {
        return !backlog.isEmpty() || last.map(height -> size.y() != height).orElse(false);
    }

    /** Whether breaking into the next region is possible and meaningful. */
    public boolean mayBreak() {
        return Double.isFinite(size.y()) && mayProgress();
    }

    /** Whether the current region is exhausted while a following one exists. */
    public boolean isFull() {
        return Abs.fits(0, size.y()) && mayProgress();
    }

    /** Advances to the next region. Without a backlog or a repeating height, the regions stay put. */
    public Regions next() {
        if (!backlog.isEmpty()) {
            double height = backlog.get(0);
            return new Regions(size.withHeight(height), height, backlog.subList(1, backlog.size()), last, expand);
        }
        if (last.isPresent()) {
            double height = last.get();
            return new Regions(size.withHeight(height), height, backlog, last, expand);
        }
        return this;
    }

    /**
     * The height of the {@code index}-th region (0 is the current one), if such a region exists.
     */
    public Optional<Double> heightAt(int index) {
        if (index == 0) {
            return Optional.of(size.y());
        }
        if (index - 1 < backlog.size()) {
            return Optional.of(backlog.get(index - 1));
        }
        return last;
    }

    /** The heights of the first {@code count} regions, fewer if the sequence ends earlier. */
    public List<Double> heights(int count) {
        var heights = new ArrayList<Double>(count);
        for (int i = 0; i < count; i++) {
            var height = heightAt(i);
            if (height.isEmpty()) {
                break;
            }
            heights.add(height.get());
        }
        return heights;
    }
}
