package work.lcod.layout.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.layout.content.BlockContent;
import work.lcod.layout.content.ColbreakContent;
import work.lcod.layout.content.ColumnsContent;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.FlushContent;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.PagebreakContent;
import work.lcod.layout.content.Pair;
import work.lcod.layout.content.ParagraphContent;
import work.lcod.layout.content.PlaceContent;
import work.lcod.layout.content.PlacementScope;
import work.lcod.layout.content.Sizing;
import work.lcod.layout.content.Span;
import work.lcod.layout.content.Styles;
import work.lcod.layout.content.Tag;
import work.lcod.layout.content.TagContent;
import work.lcod.layout.content.VSpaceContent;
import work.lcod.layout.content.VerticalPlacement;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.engine.SourceException;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.FixedAlignment;
import work.lcod.layout.geom.Fr;
import work.lcod.layout.geom.Rel;
import work.lcod.layout.geom.Size;

/**
 * Turns realized pairs into the children the distributor works with. Paragraphs are broken into
 * lines up front since the column width is the same in every region of a flow.
 */
final class Collector {
    private static final Logger log = LoggerFactory.getLogger(Collector.class);

    /** Weakness of spacing around paragraphs and blocks. */
    static final int BLOCK_SPACING_WEAKNESS = 4;
    /** Weakness of the leading between two lines of a paragraph. */
    static final int LEADING_WEAKNESS = 5;

    private final Engine engine;
    private final Locator.SplitLocator locator;
    private final Size base;
    private final List<Child> output = new ArrayList<>();

    private Collector(Engine engine, Locator locator, Size base) {
        this.engine = engine;
        this.locator = locator.split();
        this.base = base;
    }

    /**
     * Collects the children of a flow. {@code base} is the column width and the full region height.
     *
     * @throws SourceException for content that is invalid inside a flow
     */
    static List<Child> collect(Engine engine, List<Pair> pairs, Locator locator, Size base, FlowMode mode) {
        var collector = new Collector(engine, locator, base);
        if (mode == FlowMode.INLINE || (!pairs.isEmpty() && pairs.stream().allMatch(pair -> pair.content().isInline()))) {
            collector.inline(pairs);
        } else {
            collector.blocks(pairs);
        }
        if (log.isTraceEnabled()) {
            log.trace("Collected {} children from {} pairs", collector.output.size(), pairs.size());
        }
        return collector.output;
    }

    private void blocks(List<Pair> pairs) {
        for (var pair : pairs) {
            var child = pair.content();
            var styles = pair.styles();
            if (child instanceof TagContent tag) {
                output.add(new Child.TagChild(new Tag(locator.next().location(), tag)));
            } else if (child instanceof VSpaceContent space) {
                spacing(space);
            } else if (child instanceof ParagraphContent par) {
                par(par, styles);
            } else if (child instanceof BlockContent block) {
                block(block, styles);
            } else if (child instanceof ColumnsContent columns) {
                columns(columns, styles);
            } else if (child instanceof PlaceContent place) {
                place(place, styles);
            } else if (child instanceof ColbreakContent colbreak) {
                output.add(new Child.BreakChild(colbreak.weak()));
            } else if (child instanceof FlushContent) {
                output.add(new Child.FlushChild());
            } else if (child instanceof PagebreakContent pagebreak) {
                throw SourceException.bail(pagebreak.span(), "pagebreaks are not allowed inside of containers");
            } else {
                throw SourceException.bail(child.span(), "unexpected content in a block flow");
            }
        }
    }

    /** Lays out all inline pairs as a single paragraph without surrounding spacing. */
    private void inline(List<Pair> pairs) {
        if (pairs.isEmpty()) {
            return;
        }
        var inlines = new ArrayList<Content>(pairs.size());
        for (var pair : pairs) {
            inlines.add(pair.content());
        }
        var styles = pairs.get(0).styles();
        var lines = engine.routines().paragraphs()
            .layout(engine, locator.next(), inlines, styles, base.x(), styles.lineNumbering());
        lines(lines, styles, pairs.get(0).content().span());
    }

    private void spacing(VSpaceContent space) {
        int weakness = space.weak() ? 1 : 0;
        if (space.amount() instanceof Sizing.Fractional fractional) {
            output.add(new Child.FrChild(fractional.fr(), weakness));
        } else {
            output.add(new Child.RelChild(((Sizing.Length) space.amount()).rel(), weakness));
        }
    }

    private void par(ParagraphContent par, Styles styles) {
        var lines = engine.routines().paragraphs()
            .layout(engine, locator.next(), par.inlines(), styles, base.x(), styles.lineNumbering());
        var spacing = Rel.abs(styles.parSpacing());
        output.add(new Child.RelChild(spacing, BLOCK_SPACING_WEAKNESS));
        lines(lines, styles, par.span());
        output.add(new Child.RelChild(spacing, BLOCK_SPACING_WEAKNESS));
    }

    /**
     * Pushes lines with leading in between. With orphan prevention the first two lines share their
     * need; with widow prevention the last two do.
     */
    private void lines(List<Frame> lines, Styles styles, Span span) {
        int len = lines.size();
        boolean preventOrphans = styles.orphans() && len >= 2 && !lines.get(1).isEmpty();
        boolean preventWidows = styles.widows() && len >= 2 && !lines.get(len - 2).isEmpty();
        boolean preventAll = len == 3 && preventOrphans && preventWidows;

        double leading = styles.leading();
        var align = new Axes<>(FixedAlignment.START, FixedAlignment.START);
        double height0 = len > 0 ? lines.get(0).height() : 0;
        double height1 = len > 1 ? lines.get(1).height() : 0;
        double back2 = len > 1 ? lines.get(len - 2).height() : 0;
        double back1 = len > 0 ? lines.get(len - 1).height() : 0;

        for (int i = 0; i < len; i++) {
            var frame = lines.get(i);
            if (i > 0) {
                output.add(new Child.RelChild(Rel.abs(leading), LEADING_WEAKNESS));
            }

            double need;
            if (preventAll && i == 0) {
                need = height0 + leading + height1 + leading + back1;
            } else if (preventOrphans && i == 0) {
                need = height0 + leading + height1;
            } else if (preventWidows && i >= 2 && i + 2 == len) {
                need = back2 + leading + back1;
            } else {
                need = frame.height();
            }
            output.add(new Child.LineChild(frame, align, need, span));
        }
    }

    private void block(BlockContent elem, Styles styles) {
        var locator = this.locator.next();
        double above = elem.above().orElse(styles.blockAbove());
        double below = elem.below().orElse(styles.blockBelow());
        var align = new Axes<>(elem.align(), FixedAlignment.START);

        output.add(new Child.RelChild(Rel.abs(above), BLOCK_SPACING_WEAKNESS));
        Optional<Fr> fr = elem.height()
            .filter(Sizing.Fractional.class::isInstance)
            .map(height -> ((Sizing.Fractional) height).fr());
        if (!elem.breakable() || fr.isPresent()) {
            output.add(new SingleChild(align, elem.sticky(), fr, elem, styles, locator));
        } else {
            output.add(new MultiChild(align, elem.sticky(), elem, styles, locator));
        }
        output.add(new Child.RelChild(Rel.abs(below), BLOCK_SPACING_WEAKNESS));
    }

    private void columns(ColumnsContent elem, Styles styles) {
        var locator = this.locator.next();
        var spacing = Rel.abs(styles.blockAbove());
        output.add(new Child.RelChild(spacing, BLOCK_SPACING_WEAKNESS));
        output.add(new MultiChild(Axes.splat(FixedAlignment.START), false, elem, styles, locator));
        output.add(new Child.RelChild(Rel.abs(styles.blockBelow()), BLOCK_SPACING_WEAKNESS));
    }

    private void place(PlaceContent elem, Styles styles) {
        var alignY = elem.alignY();
        if (elem.floating()) {
            if (alignY == VerticalPlacement.IN_FLOW || alignY == VerticalPlacement.CENTER) {
                throw SourceException.bail(
                    elem.span(),
                    "vertical floating placement must be `auto`, `top`, or `bottom`"
                );
            }
        } else if (alignY == VerticalPlacement.AUTO) {
            throw SourceException.bail(
                elem.span(),
                "automatic positioning is only available for floating placement",
                "you can enable floating placement with `place(float: true, ..)`"
            );
        }

        if (!elem.floating() && elem.scope() == PlacementScope.PARENT) {
            throw SourceException.bail(
                elem.span(),
                "parent-scoped positioning is currently only available for floating placement",
                "you can enable floating placement with `place(float: true, ..)`"
            );
        }

        double clearance = elem.clearance().orElse(styles.resolvedPlaceClearance());
        output.add(new PlacedChild(
            elem.alignX(),
            alignY,
            elem.scope(),
            elem.floating(),
            clearance,
            elem,
            styles,
            locator.next()
        ));
    }
}
