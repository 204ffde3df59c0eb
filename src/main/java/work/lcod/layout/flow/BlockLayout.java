package work.lcod.layout.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.layout.content.BlockContent;
import work.lcod.layout.content.ColumnsContent;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.SequenceContent;
import work.lcod.layout.content.Sizing;
import work.lcod.layout.content.Styles;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.frame.Fragment;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.frame.FrameItem;
import work.lcod.layout.geom.Abs;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.Point;
import work.lcod.layout.geom.Region;
import work.lcod.layout.geom.Regions;
import work.lcod.layout.geom.Size;

/**
 * Lays out block-level containers, either whole into one region or sliced across many.
 */
final class BlockLayout {
    private BlockLayout() {}

    /** Lays out an unbreakable block into a single frame. */
    static Frame layoutSingle(Engine engine, BlockContent elem, Locator locator, Styles styles, Region region) {
        double width = resolveWidth(elem, region.size().x());
        boolean fixedWidth = Double.isFinite(width);
        var height = resolveHeight(elem, region.size().y());

        if (elem.body().isEmpty()) {
            return leaf(elem, new Size(fixedWidth ? width : 0, height.orElse(0.0)));
        }

        var pod = new Region(
            new Size(width, height.orElse(Double.POSITIVE_INFINITY)),
            new Axes<>(fixedWidth, height.isPresent())
        );
        var body = FlowLayout.layoutFrame(engine, body(elem), locator, styles, pod);
        var size = new Size(fixedWidth ? width : body.width(), height.orElse(body.height()));
        return wrap(elem, size, body);
    }

    /**
     * Lays out a breakable block (or nested columns) into one frame per region. Slices that end up
     * without content stay empty so the distributor can move the whole block on.
     */
    static Fragment layoutMulti(Engine engine, Content content, Locator locator, Styles styles, Regions regions) {
        if (content instanceof ColumnsContent columns) {
            var pod = regions.withExpand(new Axes<>(regions.expand().x(), false));
            return FlowLayout.layoutColumns(engine, columns, locator, styles, pod);
        }

        var elem = (BlockContent) content;
        double width = resolveWidth(elem, regions.size().x());
        boolean fixedWidth = Double.isFinite(width);
        var height = resolveHeight(elem, regions.base().y());
        if (height.isPresent()) {
            return layoutSized(engine, elem, locator, styles, regions, width, height.get());
        }
        if (elem.body().isEmpty()) {
            return Fragment.frame(leaf(elem, new Size(fixedWidth ? width : 0, 0)));
        }

        var pod = regions.withSize(regions.size().withWidth(width)).withExpand(new Axes<>(fixedWidth, false));
        var fragment = FlowLayout.layoutFragment(engine, body(elem), locator, styles, pod);
        var frames = new ArrayList<Frame>(fragment.size());
        for (var body : fragment.frames()) {
            var size = new Size(fixedWidth ? width : body.width(), body.height());
            frames.add(body.isEmpty() ? Frame.of(size) : wrap(elem, size, body));
        }
        return new Fragment(frames);
    }

    /** A breakable block with a fixed height: the height is spread over as many regions as it needs. */
    private static Fragment layoutSized(
        Engine engine,
        BlockContent elem,
        Locator locator,
        Styles styles,
        Regions regions,
        double width,
        double height
    ) {
        boolean fixedWidth = Double.isFinite(width);
        var slices = distribute(height, regions);
        var frames = new ArrayList<Frame>(slices.size());
        if (elem.body().isEmpty()) {
            for (int i = 0; i < slices.size(); i++) {
                var size = new Size(fixedWidth ? width : 0, slices.get(i));
                boolean blank = Abs.isZero(slices.get(i)) && i + 1 < slices.size();
                frames.add(blank ? Frame.of(size) : leaf(elem, size));
            }
            return new Fragment(frames);
        }

        var pod = new Regions(
            new Size(width, slices.get(0)),
            regions.full(),
            slices.subList(1, slices.size()),
            Optional.empty(),
            new Axes<>(fixedWidth, true)
        );
        var fragment = FlowLayout.layoutFragment(engine, body(elem), locator, styles, pod);
        for (int i = 0; i < fragment.size(); i++) {
            var body = fragment.get(i);
            double slice = i < slices.size() ? slices.get(i) : body.height();
            var size = new Size(fixedWidth ? width : body.width(), slice);
            frames.add(body.isEmpty() ? leaf(elem, size) : wrap(elem, size, body));
        }
        return new Fragment(frames);
    }

    /**
     * Splits {@code height} into slices of at most the height of each region. Whatever the last
     * available region cannot hold stays in the last slice.
     */
    static List<Double> distribute(double height, Regions regions) {
        var slices = new ArrayList<Double>();
        double remaining = height;
        for (int i = 0; ; i++) {
            var available = regions.heightAt(i);
            if (available.isEmpty()) {
                int last = slices.size() - 1;
                slices.set(last, slices.get(last) + remaining);
                break;
            }
            double space = available.get();
            boolean repeating = i > regions.backlog().size();
            if (!Double.isFinite(space) || Abs.fits(space, remaining) || (repeating && space <= 0)) {
                slices.add(remaining);
                break;
            }
            slices.add(space);
            remaining -= space;
        }
        return slices;
    }

    private static double resolveWidth(BlockContent elem, double available) {
        return elem.width().map(width -> width.relativeTo(available)).orElse(available);
    }

    /** A fixed height resolved against {@code base}; fractional blocks take the whole region they get. */
    private static Optional<Double> resolveHeight(BlockContent elem, double base) {
        if (elem.height().isEmpty()) {
            return Optional.empty();
        }
        var height = elem.height().get();
        if (height instanceof Sizing.Length length) {
            return Optional.of(length.rel().relativeTo(base));
        }
        return Double.isFinite(base) ? Optional.of(base) : Optional.empty();
    }

    private static Content body(BlockContent elem) {
        return new SequenceContent(elem.body(), elem.span());
    }

    private static Frame leaf(BlockContent elem, Size size) {
        var frame = Frame.of(size);
        if (!elem.label().isEmpty()) {
            frame.push(Point.ZERO, new FrameItem.Shape(elem.label(), size));
        }
        return frame;
    }

    private static Frame wrap(BlockContent elem, Size size, Frame body) {
        var frame = leaf(elem, size);
        frame.pushFrame(Point.ZERO, body);
        return frame;
    }
}
