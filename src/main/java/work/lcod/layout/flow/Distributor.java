package work.lcod.layout.flow;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.layout.content.Span;
import work.lcod.layout.content.Tag;
import work.lcod.layout.engine.SourceDiagnostic;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.geom.Abs;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Fr;
import work.lcod.layout.geom.Point;
import work.lcod.layout.geom.Region;
import work.lcod.layout.geom.Regions;
import work.lcod.layout.geom.Size;

/**
 * Distributes as many children as fit into one column (or region) and positions them.
 */
final class Distributor {
    private static final Logger log = LoggerFactory.getLogger(Distributor.class);

    static final String OVERFLOW = "content does not fit into the region and will overflow";

    private final Composer composer;
    private final Work work;
    private Regions regions;
    private final List<Item> items = new ArrayList<>();
    private Snapshot sticky;
    private Boolean stickable;

    private Distributor(Composer composer, Regions regions) {
        this.composer = composer;
        this.work = composer.work();
        this.regions = regions;
    }

    /** Fills the first of {@code regions} and returns its frame. */
    static FlowResult<Frame> distribute(Composer composer, Regions regions) {
        var distributor = new Distributor(composer, regions);
        var result = distributor.run();
        boolean forced;
        if (result.isStopped()) {
            if (result.stop() instanceof Stop.Finish finish) {
                forced = finish.forced();
            } else {
                return result.propagate();
            }
        } else {
            forced = distributor.work.done();
        }
        return distributor.finalize(new Region(regions.size(), regions.expand()), forced);
    }

    private FlowResult<Void> run() {
        var spill = work.takeSpill();
        if (spill != null) {
            var result = multiSpill(spill);
            if (result.isStopped()) {
                return result;
            }
        }

        Child child;
        while ((child = work.head()) != null) {
            var result = child(child);
            if (result.isStopped()) {
                return result;
            }
            work.advance();
        }
        return FlowResult.ok();
    }

    private FlowResult<Void> child(Child child) {
        if (child instanceof Child.TagChild tag) {
            work.tags().add(tag.tag());
            return FlowResult.ok();
        }
        if (child instanceof Child.RelChild rel) {
            rel(rel.amount().relativeTo(regions.base().y()), rel.weakness());
            return FlowResult.ok();
        }
        if (child instanceof Child.FrChild fr) {
            fr(fr.fr(), fr.weakness());
            return FlowResult.ok();
        }
        if (child instanceof Child.LineChild line) {
            return line(line);
        }
        if (child instanceof SingleChild single) {
            return single(single);
        }
        if (child instanceof MultiChild multi) {
            return multi(multi);
        }
        if (child instanceof PlacedChild placed) {
            return placed(placed);
        }
        if (child instanceof Child.FlushChild) {
            return flush();
        }
        if (child instanceof Child.BreakChild brk) {
            return breakColumn(brk.weak());
        }
        throw new IllegalStateException("Unknown child: " + child);
    }

    private void rel(double amount, int weakness) {
        if (weakness > 0 && !keepWeakRelSpacing(amount, weakness)) {
            return;
        }
        regions = regions.shrink(amount);
        items.add(new Item.Spacing(amount, weakness));
    }

    private void fr(Fr fr, int weakness) {
        if (weakness > 0 && !keepWeakFrSpacing(fr, weakness)) {
            return;
        }
        // Fractional spacing takes all leftover space, so weak spacing before it is pointless.
        trimSpacing();
        items.add(new Item.Fractional(fr, weakness, null));
    }

    /**
     * Decides whether weak spacing is kept. Adjacent weak spacing collapses into the stronger one or,
     * at equal weakness, the larger one. Weak spacing at the start of the region is dropped.
     */
    private boolean keepWeakRelSpacing(double amount, int weakness) {
        for (int i = items.size() - 1; i >= 0; i--) {
            var item = items.get(i);
            if (item instanceof Item.Spacing previous) {
                if (previous.weakness() > 0) {
                    if (weakness <= previous.weakness()
                        && (weakness < previous.weakness() || amount > previous.amount())) {
                        regions = regions.shrink(amount - previous.amount());
                        items.set(i, new Item.Spacing(amount, weakness));
                    }
                    return false;
                }
                continue;
            }
            if (item instanceof Item.Marker || item instanceof Item.Placed) {
                continue;
            }
            // Fractional spacing already takes all the leftover space.
            if (item instanceof Item.Fractional fractional && fractional.single() == null) {
                return false;
            }
            return true;
        }
        return false;
    }

    private boolean keepWeakFrSpacing(Fr fr, int weakness) {
        for (int i = items.size() - 1; i >= 0; i--) {
            var item = items.get(i);
            if (item instanceof Item.Fractional previous && previous.single() == null && previous.weakness() > 0) {
                if (weakness <= previous.weakness()
                    && (weakness < previous.weakness() || fr.value() > previous.fr().value())) {
                    items.set(i, new Item.Fractional(fr, weakness, null));
                }
                return false;
            }
            if (item instanceof Item.Fractional previous && previous.single() == null) {
                return false;
            }
            if (item instanceof Item.Marker || item instanceof Item.Spacing || item instanceof Item.Placed) {
                continue;
            }
            return true;
        }
        return false;
    }

    /** Removes the last weak spacing, if nothing but tags, strong spacing and placed items follow it. */
    private void trimSpacing() {
        for (int i = items.size() - 1; i >= 0; i--) {
            var item = items.get(i);
            if (item instanceof Item.Spacing spacing && spacing.weakness() > 0) {
                regions = regions.shrink(-spacing.amount());
                items.remove(i);
                return;
            }
            if (item instanceof Item.Fractional fractional && fractional.weakness() > 0) {
                items.remove(i);
                return;
            }
            if (item instanceof Item.Marker || item instanceof Item.Spacing || item instanceof Item.Placed) {
                continue;
            }
            return;
        }
    }

    private FlowResult<Void> line(Child.LineChild line) {
        // The line does not fit but a following region may hold it.
        if (!Abs.fits(regions.size().y(), line.frame().height()) && regions.mayProgress()) {
            return FlowResult.finish(false);
        }

        // The line fits, but the lines it has to stay with do not. Move on if the next region
        // holds all of them.
        if (!Abs.fits(regions.size().y(), line.need())
            && regions.heightAt(1).map(height -> Abs.fits(height, line.need())).orElse(false)) {
            return FlowResult.finish(false);
        }

        warnOverflow(line.frame().height(), line.span());
        return frame(line.frame(), line.align(), false, false);
    }

    private FlowResult<Void> single(SingleChild single) {
        var laidOut = FlowResult.attempt(() -> single.layout(composer.engine(), new Region(regions.base(), regions.expand())));
        if (laidOut.isStopped()) {
            return laidOut.propagate();
        }
        var frame = laidOut.value();

        if (single.fr().isPresent()) {
            var notes = composer.footnotes(regions, frame, 0, false, true);
            if (notes.isStopped()) {
                return notes;
            }
            flushTags();
            items.add(new Item.Fractional(single.fr().get(), 0, single));
            return FlowResult.ok();
        }

        if (!Abs.fits(regions.size().y(), frame.height()) && regions.mayProgress()) {
            return FlowResult.finish(false);
        }

        warnOverflow(frame.height(), single.elem().span());
        return frame(frame, single.align(), single.sticky(), false);
    }

    private FlowResult<Void> multi(MultiChild multi) {
        // Nothing is left in this region, the block starts in the next one.
        if (regions.isFull()) {
            return FlowResult.finish(false);
        }

        var laidOut = FlowResult.attempt(() -> multi.layout(composer.engine(), regions));
        if (laidOut.isStopped()) {
            return laidOut.propagate();
        }
        var slice = laidOut.value();
        var frame = slice.frame();
        var spill = slice.spill();

        // An empty first slice of a block whose content comes later: move the whole block on
        // instead of leaving a stub behind.
        if (frame.isEmpty() && spill.isPresent() && spill.get().existNonEmptyFrame() && regions.mayProgress()) {
            return FlowResult.finish(false);
        }

        var placed = frame(frame, multi.align(), multi.sticky(), true);
        if (placed.isStopped()) {
            return placed;
        }

        if (spill.isPresent()) {
            work.setSpill(spill.get());
            work.advance();
            return FlowResult.finish(false);
        }
        return FlowResult.ok();
    }

    private FlowResult<Void> multiSpill(MultiSpill spill) {
        if (regions.isFull()) {
            work.setSpill(spill);
            return FlowResult.finish(false);
        }

        var laidOut = FlowResult.attempt(() -> spill.layout(composer.engine(), regions));
        if (laidOut.isStopped()) {
            return laidOut.propagate();
        }
        var slice = laidOut.value();

        var placed = frame(slice.frame(), spill.align(), false, true);
        if (placed.isStopped()) {
            return placed;
        }

        if (slice.spill().isPresent()) {
            work.setSpill(slice.spill().get());
            return FlowResult.finish(false);
        }
        return FlowResult.ok();
    }

    private FlowResult<Void> placed(PlacedChild placed) {
        if (placed.floating()) {
            // Floats go into the insertions. Tags before them belong to the flow.
            flushTags();
            boolean clearance = items.stream().anyMatch(Item.Block.class::isInstance);
            return composer.placeFloat(placed, regions, clearance, true);
        }

        var laidOut = FlowResult.attempt(() -> placed.layout(composer.engine(), regions.base()));
        if (laidOut.isStopped()) {
            return laidOut.propagate();
        }
        var frame = laidOut.value();
        var notes = composer.footnotes(regions, frame, 0, true, true);
        if (notes.isStopped()) {
            return notes;
        }
        flushTags();
        items.add(new Item.Placed(frame, placed));
        return FlowResult.ok();
    }

    private FlowResult<Void> flush() {
        if (!work.floats().isEmpty()) {
            return FlowResult.finish(false);
        }
        return FlowResult.ok();
    }

    private FlowResult<Void> breakColumn(boolean weak) {
        // A weak break at the start of a region does nothing.
        if ((!weak || !items.isEmpty()) && (!regions.backlog().isEmpty() || regions.last().isPresent())) {
            work.advance();
            return FlowResult.finish(true);
        }
        return FlowResult.ok();
    }

    /** Places a frame, after handling the footnotes inside it. */
    private FlowResult<Void> frame(Frame frame, Axes<FixedAlignment> align, boolean sticky, boolean breakable) {
        if (sticky) {
            // Remember where the first of consecutive sticky blocks starts. Moving the group along
            // with its successor only helps if something other than migratable items precedes it.
            if (this.sticky == null) {
                if (stickable == null) {
                    stickable = regions.mayProgress() && !items.stream().allMatch(Item::migratable);
                }
                if (stickable) {
                    this.sticky = snapshot();
                }
            }
        } else if (!frame.isEmpty()) {
            this.sticky = null;
            this.stickable = null;
        }

        var notes = composer.footnotes(regions, frame, frame.height(), breakable, true);
        if (notes.isStopped()) {
            return notes;
        }

        regions = regions.shrink(frame.height());
        flushTags();
        items.add(new Item.Block(frame, align));
        return FlowResult.ok();
    }

    private void warnOverflow(double height, Span span) {
        if (!Abs.fits(regions.size().y(), height)) {
            composer.engine().sink().warn(SourceDiagnostic.warning(span, OVERFLOW));
        }
    }

    private void flushTags() {
        for (var tag : work.tags()) {
            items.add(new Item.Marker(tag));
        }
        work.tags().clear();
    }

    private Snapshot snapshot() {
        return new Snapshot(work.copy(), items.size());
    }

    private void restore(Snapshot snapshot) {
        work.restore(snapshot.work());
        items.subList(snapshot.items(), items.size()).clear();
    }

    /** Positions all items in a frame of the region's size (on expanding axes) or the used size. */
    private FlowResult<Frame> finalize(Region region, boolean forced) {
        // Ending on sticky content without being forced to: move the sticky group on.
        if (!forced && sticky != null) {
            log.debug("Moving sticky content to the next region");
            restore(sticky);
        }

        trimSpacing();

        double usedY = 0;
        double usedX = 0;
        var frTotal = Fr.ZERO;
        for (var item : items) {
            if (item instanceof Item.Spacing spacing) {
                usedY += spacing.amount();
            } else if (item instanceof Item.Fractional fractional) {
                frTotal = frTotal.plus(fractional.fr());
            } else if (item instanceof Item.Block block) {
                usedY += block.frame().height();
                usedX = Math.max(usedX, block.frame().width());
            }
        }

        double frSpace = 0;
        if (frTotal.isPositive() && Double.isFinite(region.size().y())) {
            frSpace = region.size().y() - usedY;
            usedY = region.size().y();
        }

        var frFrames = new ArrayList<Frame>();
        for (var item : items) {
            if (item instanceof Item.Fractional fractional && fractional.single() != null) {
                double length = fractional.fr().share(frTotal, frSpace);
                var pod = new Region(new Size(region.size().x(), length), new Axes<>(region.expand().x(), true));
                var laidOut = FlowResult.attempt(() -> fractional.single().layout(composer.engine(), pod));
                if (laidOut.isStopped()) {
                    return laidOut.propagate();
                }
                usedX = Math.max(usedX, laidOut.value().width());
                frFrames.add(laidOut.value());
            }
        }

        if (!region.expand().x()) {
            usedX = Math.max(usedX, composer.insertionWidth());
        }

        var used = new Size(usedX, usedY);
        var size = Axes.select(region.expand(), region.size(), used.min(region.size()));
        double free = size.y() - usedY;

        var output = Frame.of(size);
        var ruler = FixedAlignment.START;
        double offset = 0;
        int frIndex = 0;
        for (var item : items) {
            if (item instanceof Item.Marker marker) {
                output.pushTag(new Point(0, offset + ruler.position(free)), marker.tag());
            } else if (item instanceof Item.Spacing spacing) {
                offset += spacing.amount();
            } else if (item instanceof Item.Fractional fractional) {
                double length = fractional.fr().share(frTotal, frSpace);
                if (fractional.single() != null) {
                    var frame = frFrames.get(frIndex++);
                    double x = fractional.single().align().x().position(size.x() - frame.width());
                    output.pushFrame(new Point(x, offset), frame);
                }
                offset += length;
            } else if (item instanceof Item.Block block) {
                var frame = block.frame();
                ruler = ruler.max(block.align().y());
                double x = block.align().x().position(size.x() - frame.width());
                double y = offset + ruler.position(free);
                output.pushFrame(new Point(x, y), frame);
                offset += frame.height();
            } else if (item instanceof Item.Placed placedItem) {
                var frame = placedItem.frame();
                var placed = placedItem.placed();
                double x = placed.alignX().position(size.x() - frame.width());
                double y = placed.alignY().fixed()
                    .map(align -> align.position(size.y() - frame.height()))
                    .orElse(offset + ruler.position(free));
                var delta = new Point(placed.elem().dx().relativeTo(size.x()), placed.elem().dy().relativeTo(size.y()));
                output.pushFrame(new Point(x, y).plus(delta), frame);
            }
        }

        // Tags after the last item of the whole flow would otherwise get lost.
        if (work.done() && !work.tags().isEmpty()) {
            for (var tag : work.tags()) {
                output.pushTag(new Point(0, offset), tag);
            }
            work.tags().clear();
        }

        return FlowResult.ok(output);
    }

    private record Snapshot(Work work, int items) {}

    /** A positioned element of the column being distributed. */
    private sealed interface Item permits Item.Marker, Item.Spacing, Item.Fractional, Item.Block, Item.Placed {
        record Marker(Tag tag) implements Item {}

        record Spacing(double amount, int weakness) implements Item {}

        /** Fractional spacing, or a fractionally sized block when {@code single} is set. */
        record Fractional(Fr fr, int weakness, SingleChild single) implements Item {}

        record Block(Frame frame, Axes<FixedAlignment> align) implements Item {}

        record Placed(Frame frame, PlacedChild placed) implements Item {}

        /** Whether moving this item to the next region together with a sticky group changes nothing. */
        default boolean migratable() {
            if (this instanceof Marker) {
                return true;
            }
            if (this instanceof Block block) {
                return block.frame().size().isZero() && block.frame().isInvisible();
            }
            return this instanceof Placed placed && !placed.placed().floating();
        }
    }
}
