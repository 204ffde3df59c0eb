package work.lcod.layout.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.layout.content.FootnoteContent;
import work.lcod.layout.content.LineNumberingScope;
import work.lcod.layout.content.Location;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.PlacementScope;
import work.lcod.layout.content.Span;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.engine.SourceDiagnostic;
import work.lcod.layout.engine.SourceException;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.geom.Abs;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.Dir;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Point;
import work.lcod.layout.geom.Regions;
import work.lcod.layout.geom.Size;

/**
 * Composes the frame for one region: its columns, the floats and footnotes inserted into them and
 * the relayout attempts such insertions cause.
 */
final class Composer {
    private static final Logger log = LoggerFactory.getLogger(Composer.class);

    private final Engine engine;
    private final Work work;
    private final Config config;
    private final Size pageBase;
    private final Insertions pageInsertions = new Insertions();
    private Insertions columnInsertions = new Insertions();
    private int column;

    private Composer(Engine engine, Work work, Config config, Size pageBase) {
        this.engine = engine;
        this.work = work;
        this.config = config;
        this.pageBase = pageBase;
    }

    /**
     * Lays out as much of the remaining work as fits into the first of {@code regions}.
     *
     * @throws SourceException when layout fails
     */
    static Frame compose(Engine engine, Work work, Config config, Locator locator, Regions regions) {
        var composer = new Composer(engine, work, config, regions.base());
        return composer.page(locator, regions);
    }

    Engine engine() {
        return engine;
    }

    Work work() {
        return work;
    }

    /** Width of the widest insertion, which the region has to accommodate. */
    double insertionWidth() {
        return Math.max(columnInsertions.width(), pageInsertions.width());
    }

    private Frame page(Locator locator, Regions regions) {
        var numbering = config.lineNumbers();
        if (numbering.isPresent() && numbering.get().scope() == LineNumberingScope.PAGE) {
            work.resetLineNumbers();
        }

        var checkpoint = work.copy();
        Frame inner;
        while (true) {
            var pod = regions.shrink(pageInsertions.height());
            int insertions = pageInsertions.skipCount();
            var result = pageContents(locator, pod);
            if (!result.isStopped()) {
                inner = result.value();
                break;
            }
            var stop = result.stop();
            if (stop instanceof Stop.Relayout relayout && relayout.scope() == PlacementScope.PARENT) {
                ensureProgress(pageInsertions, insertions, relayout.scope());
                log.debug("Relayouting region after a parent-scoped insertion");
                work.restore(checkpoint);
                continue;
            }
            if (stop instanceof Stop.Error error) {
                throw new SourceException(error.diagnostics());
            }
            throw new IllegalStateException("Unhandled stop in region composition: " + stop);
        }
        return pageInsertions.finalize(work, config, inner);
    }

    private FlowResult<Frame> pageContents(Locator locator, Regions regions) {
        var columns = config.columns();
        if (columns.count() == 1) {
            return column(locator, regions);
        }

        // Every column of the following regions becomes a region of its own.
        double columnHeight = regions.size().y();
        var heights = new ArrayList<Double>();
        heights.add(columnHeight);
        heights.addAll(regions.backlog());
        var backlog = new ArrayList<Double>();
        for (double height : heights) {
            for (int i = 0; i < columns.count(); i++) {
                backlog.add(height);
            }
        }
        backlog.remove(0);

        var inner = new Regions(
            new Size(columns.width(), columnHeight),
            regions.full(),
            backlog,
            regions.last(),
            new Axes<>(true, regions.expand().y())
        );

        var size = new Size(regions.size().x(), regions.expand().y() ? regions.size().y() : 0);
        var output = Frame.of(size);
        double offset = 0;
        var split = locator.split();
        for (int i = 0; i < columns.count(); i++) {
            column = i;
            var result = column(split.next(), inner);
            if (result.isStopped()) {
                return result;
            }
            var frame = result.value();
            if (!regions.expand().y()) {
                output.setSize(output.size().withHeight(Math.max(output.height(), frame.height())));
            }

            double width = frame.width();
            double x = columns.dir() == Dir.LTR ? offset : regions.size().x() - offset - width;
            offset += width + columns.gutter();
            output.pushFrame(Point.withX(x), frame);
            inner = inner.next();
        }
        return FlowResult.ok(output);
    }

    private FlowResult<Frame> column(Locator locator, Regions regions) {
        columnInsertions = new Insertions();

        // Continue a footnote that did not fit into the previous column.
        if (work.hasFootnoteSpill()) {
            var spilled = footnoteSpill(work.takeFootnoteSpill(), regions.base());
            if (spilled.isStopped()) {
                return spilled.propagate();
            }
        }

        var checkpoint = work.copy();
        Frame inner;
        while (true) {
            var pod = regions.shrink(columnInsertions.height());
            int insertions = columnInsertions.skipCount();
            var result = columnContents(pod);
            if (!result.isStopped()) {
                inner = result.value();
                break;
            }
            var stop = result.stop();
            if (stop instanceof Stop.Relayout relayout && relayout.scope() == PlacementScope.COLUMN) {
                ensureProgress(columnInsertions, insertions, relayout.scope());
                log.trace("Relayouting column {} after a column-scoped insertion", column);
                work.restore(checkpoint);
                continue;
            }
            return result;
        }

        var numbering = config.lineNumbers();
        if (numbering.isPresent()) {
            LineNumbers.layout(engine, config, numbering.get(), work, column, inner);
        }

        var insertions = columnInsertions;
        columnInsertions = new Insertions();
        return FlowResult.ok(insertions.finalize(work, config, inner));
    }

    private FlowResult<Frame> columnContents(Regions regions) {
        // Footnotes and floats queued by earlier regions come first, in the order they occurred.
        for (var note : work.takeFootnotes()) {
            var result = footnote(note, new Budget(regions), 0, false);
            if (result.isStopped()) {
                return result.propagate();
            }
        }

        for (var placed : work.takeFloats()) {
            var result = placeFloat(placed, regions, false, false);
            if (result.isStopped()) {
                return result.propagate();
            }
        }

        return Distributor.distribute(this, regions);
    }

    /**
     * Inserts a float into the column or region, or queues it when it does not fit and a later
     * region might do better.
     */
    FlowResult<Void> placeFloat(PlacedChild placed, Regions regions, boolean clearance, boolean migratable) {
        var location = placed.location();
        if (skipped(location)) {
            return FlowResult.ok();
        }

        // Floats stay in order: once one is deferred, all following ones are too.
        if (!work.floats().isEmpty()) {
            work.floats().add(placed);
            return FlowResult.ok();
        }

        var scope = placed.scope();
        var base = scope == PlacementScope.COLUMN ? regions.base() : pageBase;
        var laidOut = FlowResult.attempt(() -> placed.layout(engine, base));
        if (laidOut.isStopped()) {
            return laidOut.propagate();
        }
        var frame = laidOut.value();

        double remaining;
        if (scope == PlacementScope.COLUMN) {
            remaining = regions.size().y();
        } else {
            // The region is shared by the remaining columns; their average is the best estimate.
            int count = config.columns().count();
            double sum = 0;
            for (double height : regions.heights(count - column)) {
                sum += height;
            }
            remaining = sum / count;
        }

        double need = frame.height() + (clearance ? placed.clearance() : 0);
        if (!Abs.fits(remaining, need) && regions.mayProgress()) {
            log.debug("Deferring float {} ({} > {})", location, need, remaining);
            work.floats().add(placed);
            return FlowResult.ok();
        }

        var notes = footnotes(regions, frame, need, false, migratable);
        if (notes.isStopped()) {
            return notes;
        }

        var alignY = placed.alignY().fixed().orElseGet(() -> {
            // Automatic placement: top when the float would end up in the upper half.
            double used = base.y() - remaining;
            double ratio = (used + need / 2) / base.y();
            return ratio <= 0.5 ? FixedAlignment.START : FixedAlignment.END;
        });

        var area = scope == PlacementScope.COLUMN ? columnInsertions : pageInsertions;
        area.pushFloat(placed, frame, alignY);
        area.addSkip(location);
        return FlowResult.relayout(scope);
    }

    /**
     * Inserts the footnotes whose markers occur in {@code frame}. {@code flowNeed} is the space the
     * frame itself needs; for breakable frames it is the position of each marker instead.
     */
    FlowResult<Void> footnotes(Regions regions, Frame frame, double flowNeed, boolean breakable, boolean migratable) {
        if (config.mode() != FlowMode.ROOT) {
            return FlowResult.ok();
        }

        var markers = frame.find(FootnoteContent.class);
        if (markers.isEmpty()) {
            return FlowResult.ok();
        }

        // Moving the frame on is only worth it for unbreakable frames and only once.
        boolean canMigrate = migratable && !breakable && regions.mayProgress();
        var budget = new Budget(regions);
        boolean relayout = false;
        for (var marker : markers) {
            double need = breakable ? marker.y() : flowNeed;
            var note = new Note(marker.tag().location(), marker.elem());
            var result = footnote(note, budget, need, canMigrate);
            if (result.isStopped()) {
                if (result.stop() instanceof Stop.Relayout) {
                    relayout = true;
                } else {
                    return result;
                }
            }
            canMigrate = false;
        }

        return relayout ? FlowResult.relayout(PlacementScope.COLUMN) : FlowResult.ok();
    }

    private FlowResult<Void> footnote(Note note, Budget budget, double flowNeed, boolean migratable) {
        var location = note.location();
        if (note.elem().reference() || skipped(location)) {
            return FlowResult.ok();
        }

        // Footnotes stay in order: once one is queued, all following ones are too.
        if (work.hasFootnoteSpill() || columnInsertions.hasFootnoteSpill() || !work.footnotes().isEmpty()) {
            if (work.footnotes().stream().noneMatch(queued -> queued.location().equals(location))) {
                work.footnotes().add(note);
            }
            return FlowResult.ok();
        }

        Frame separator = null;
        double separatorNeed = 0;
        if (!columnInsertions.hasFootnotes()) {
            var laidOut = FlowResult.attempt(() -> FootnoteLayout.separator(engine, config, budget.regions.base()));
            if (laidOut.isStopped()) {
                return laidOut.propagate();
            }
            separator = laidOut.value();
            separatorNeed = config.footnote().clearance() + separator.height();
        }

        var pod = budget.regions.shrink(flowNeed + separatorNeed + config.footnote().gap());
        var laidOut = FlowResult.attempt(() -> FootnoteLayout.entry(engine, config, note, pod).frames());
        if (laidOut.isStopped()) {
            return laidOut.propagate();
        }
        List<Frame> frames = laidOut.value();
        var first = frames.get(0);

        // Not even the first line of the entry fits.
        if (first.isEmpty()) {
            if (migratable) {
                return FlowResult.finish(false);
            }
            if (queueingHelps(budget.regions, flowNeed)) {
                log.debug("Queueing footnote {}", location);
                work.footnotes().add(note);
                return FlowResult.ok();
            }

            // Alone in a fresh column and still too large: no later region does better, so the
            // entry is placed here and overflows.
            log.debug("Footnote {} does not fit into an empty column", location);
            var overflowing = new Regions(
                new Size(pod.size().x(), Math.max(0, pod.size().y())),
                pod.full(),
                List.of(),
                Optional.empty(),
                pod.expand()
            );
            var forced = FlowResult.attempt(() -> FootnoteLayout.entry(engine, config, note, overflowing).frames());
            if (forced.isStopped()) {
                return forced.propagate();
            }
            frames = forced.value();
            first = frames.get(0);
            if (!Abs.fits(overflowing.size().y(), first.height())) {
                engine.sink().warn(SourceDiagnostic.warning(note.elem().span(), Distributor.OVERFLOW));
            }
        }

        if (separator != null) {
            columnInsertions.pushFootnoteSeparator(config, separator);
            budget.shrink(separatorNeed);
        }
        columnInsertions.pushFootnote(config, first);
        columnInsertions.addSkip(location);
        budget.shrink(config.footnote().gap() + first.height());

        if (frames.size() > 1) {
            columnInsertions.setFootnoteSpill(frames.subList(1, frames.size()));
        }

        // Footnotes inside the entry itself.
        for (var nested : Frame.find(frames, FootnoteContent.class)) {
            var inner = new Note(nested.tag().location(), nested.elem());
            var result = footnote(inner, budget, flowNeed, migratable);
            if (result.isStopped() && !(result.stop() instanceof Stop.Relayout)) {
                return result;
            }
        }

        return FlowResult.relayout(PlacementScope.COLUMN);
    }

    /** Starts a column with the next frame of a spilled footnote entry. */
    private FlowResult<Void> footnoteSpill(List<Frame> frames, Size base) {
        var laidOut = FlowResult.attempt(() -> FootnoteLayout.separator(engine, config, base));
        if (laidOut.isStopped()) {
            return laidOut.propagate();
        }
        columnInsertions.pushFootnoteSeparator(config, laidOut.value());
        columnInsertions.pushFootnote(config, frames.get(0));
        if (frames.size() > 1) {
            work.setFootnoteSpill(frames.subList(1, frames.size()));
        }
        return FlowResult.ok();
    }

    /**
     * Whether deferring an entry that does not fit can change anything: something else takes
     * space in this column, or the next region is taller.
     */
    private static boolean queueingHelps(Regions regions, double flowNeed) {
        if (!Abs.isZero(flowNeed) || !Abs.approxEq(regions.size().y(), regions.base().y())) {
            return true;
        }
        double height = regions.size().y();
        return regions.heightAt(1).map(next -> !Abs.fits(height, next)).orElse(false);
    }

    private boolean skipped(Location location) {
        return work.skipped(location) || pageInsertions.skipped(location) || columnInsertions.skipped(location);
    }

    /** Each relayout must be paid for by a new insertion, or the attempts would never end. */
    private static void ensureProgress(Insertions insertions, int before, PlacementScope scope) {
        if (insertions.skipCount() > before) {
            return;
        }
        var diagnostic = SourceDiagnostic
            .error(Span.detached(), "internal error: " + scope.name().toLowerCase() + " relayout without a new insertion")
            .withHint("this is a bug in the layout engine, please report it");
        throw SourceException.of(diagnostic);
    }

    /** The regions left for footnotes of one frame, shrinking with every inserted entry. */
    private static final class Budget {
        private Regions regions;

        Budget(Regions regions) {
            this.regions = regions;
        }

        void shrink(double amount) {
            regions = regions.shrink(amount);
        }
    }
}
