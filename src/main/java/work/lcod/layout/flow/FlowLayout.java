package work.lcod.layout.flow;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.layout.content.ColumnsContent;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.Pair;
import work.lcod.layout.content.SequenceContent;
import work.lcod.layout.content.Span;
import work.lcod.layout.content.Styles;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.engine.SourceException;
import work.lcod.layout.frame.Fragment;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.geom.Region;
import work.lcod.layout.geom.Regions;
import work.lcod.layout.geom.Rel;
import work.lcod.layout.geom.Size;

/**
 * Entry points of flow layout. Content is realized, collected into children and then composed
 * region by region until nothing is left.
 *
 * <p>All methods throw {@link SourceException} when layout fails; warnings go to the engine's sink.
 */
public final class FlowLayout {
    private static final Logger log = LoggerFactory.getLogger(FlowLayout.class);

    private FlowLayout() {}

    /** Lays out content into a single region, producing exactly one frame. */
    public static Frame layoutFrame(Engine engine, Content content, Locator locator, Styles styles, Region region) {
        return layoutFragment(engine, content, locator, styles, region.toRegions()).intoFrame();
    }

    /** Lays out content into a sequence of regions, producing one frame per region used. */
    public static Fragment layoutFragment(Engine engine, Content content, Locator locator, Styles styles, Regions regions) {
        return layoutFragmentMemoized(engine, content, locator, styles, regions, 1, Rel.ZERO);
    }

    /** Lays out the body of a columns element with its column count and gutter. */
    public static Fragment layoutColumns(
        Engine engine,
        ColumnsContent elem,
        Locator locator,
        Styles styles,
        Regions regions
    ) {
        var body = new SequenceContent(elem.body(), elem.span());
        return layoutFragmentMemoized(engine, body, locator, styles, regions, elem.count(), elem.gutter());
    }

    /**
     * Lays out a whole document. In {@link FlowMode#ROOT} mode the flow hosts footnotes and line
     * numbers; otherwise the mode follows the realized content.
     */
    public static Fragment layoutDocument(
        Engine engine,
        Content content,
        Styles styles,
        Regions regions,
        int columns,
        Rel gutter,
        FlowMode mode
    ) {
        checkRegions(content.span(), regions);
        var locator = Locator.root().split();
        var realization = engine.routines().realizer().realize(engine, locator, content, styles);
        var effective = mode == FlowMode.ROOT ? FlowMode.ROOT : FlowMode.from(realization.kind());
        var fragment = layoutFlow(engine, realization.pairs(), locator, styles, regions, columns, gutter, effective);
        log.debug("Laid out document into {} frame(s) ({} cache hits, {} misses)",
            fragment.size(), engine.cache().hits(), engine.cache().misses());
        return fragment;
    }

    /**
     * Lays out realized pairs across {@code regions}. Composes one frame per region until all work
     * is done and, for vertically expanding regions, the backlog is exhausted.
     */
    public static Fragment layoutFlow(
        Engine engine,
        List<Pair> children,
        Locator.SplitLocator locator,
        Styles shared,
        Regions regions,
        int columns,
        Rel gutter,
        FlowMode mode
    ) {
        var config = Config.of(shared, regions, columns, gutter, mode);
        var base = new Size(config.columns().width(), regions.full());
        var work = new Work(Collector.collect(engine, children, locator.next(), base, mode));

        var finished = new ArrayList<Frame>();
        while (true) {
            var frame = Composer.compose(engine, work, config, locator.next(), regions);
            finished.add(frame);

            // Stop when all work is done. Expanding regions are filled up to the end of the backlog.
            if (work.done() && (!regions.expand().y() || regions.backlog().isEmpty())) {
                break;
            }
            regions = regions.next();
        }

        if (log.isTraceEnabled()) {
            log.trace("Flow in {} mode finished with {} frame(s)", mode, finished.size());
        }
        return new Fragment(finished);
    }

    private static Fragment layoutFragmentMemoized(
        Engine engine,
        Content content,
        Locator locator,
        Styles styles,
        Regions regions,
        int columns,
        Rel gutter
    ) {
        var key = new FragmentKey(content, locator, styles, regions, columns, gutter, engine.route().depth());
        return engine.cache().memoize(
            engine.sink(),
            key,
            () -> layoutFragmentImpl(engine, content, locator, styles, regions, columns, gutter)
        );
    }

    private static Fragment layoutFragmentImpl(
        Engine engine,
        Content content,
        Locator locator,
        Styles styles,
        Regions regions,
        int columns,
        Rel gutter
    ) {
        checkRegions(content.span(), regions);

        var nested = engine.nested();
        nested.route().checkLayoutDepth(content.span());

        var split = locator.split();
        var realization = nested.routines().realizer().realize(nested, split, content, styles);
        var mode = FlowMode.from(realization.kind());
        return layoutFlow(nested, realization.pairs(), split, styles, regions, columns, gutter, mode);
    }

    private static void checkRegions(Span span, Regions regions) {
        if (!Double.isFinite(regions.size().x()) && regions.expand().x()) {
            throw SourceException.bail(span, "cannot expand into infinite width");
        }
        if (!Double.isFinite(regions.size().y()) && regions.expand().y()) {
            throw SourceException.bail(span, "cannot expand into infinite height");
        }
    }

    private record FragmentKey(
        Content content,
        Locator locator,
        Styles styles,
        Regions regions,
        int columns,
        Rel gutter,
        int depth
    ) {}
}
