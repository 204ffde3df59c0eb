package work.lcod.layout.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.FootnoteContent;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.ParLineMarker;
import work.lcod.layout.content.Styles;
import work.lcod.layout.content.Tag;
import work.lcod.layout.content.TextContent;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.frame.FrameItem;
import work.lcod.layout.geom.Abs;
import work.lcod.layout.geom.Point;
import work.lcod.layout.geom.Size;

/**
 * Greedy word-wrapping line breaker on top of a {@link TextShaper}. Footnote markers stick to the
 * preceding word.
 */
public final class DefaultParagraphLayouter implements ParagraphLayouter {
    private final TextShaper shaper;

    public DefaultParagraphLayouter(TextShaper shaper) {
        this.shaper = Objects.requireNonNull(shaper, "shaper");
    }

    @Override
    public List<Frame> layout(
        Engine engine,
        Locator locator,
        List<Content> inlines,
        Styles styles,
        double width,
        boolean numberLines
    ) {
        var atoms = new ArrayList<Atom>();
        int notes = 0;
        for (var inline : inlines) {
            if (inline instanceof TextContent text) {
                for (var word : text.text().trim().split("\\s+")) {
                    if (!word.isEmpty()) {
                        atoms.add(new Atom(word, shaper.measure(word, styles), null, false));
                    }
                }
            } else if (inline instanceof FootnoteContent note) {
                var tag = new Tag(locator.child("fn" + notes++).location(), note);
                atoms.add(new Atom(note.marker(), shaper.measure(note.marker(), styles), tag, !atoms.isEmpty()));
            } else {
                throw SourceException.bail(inline.span(), "unexpected block-level content in a paragraph");
            }
        }
        if (atoms.isEmpty()) {
            return List.of();
        }

        double space = shaper.measure(" ", styles).x();
        var lines = new ArrayList<List<Run>>();
        var current = new ArrayList<Run>();
        double x = 0;
        for (var atom : atoms) {
            double advance = current.isEmpty() || atom.glue() ? 0 : space;
            if (!current.isEmpty() && !atom.glue() && !Abs.fits(width, x + advance + atom.size().x())) {
                lines.add(current);
                current = new ArrayList<>();
                x = 0;
                advance = 0;
            }
            current.add(new Run(atom, x + advance));
            x += advance + atom.size().x();
        }
        lines.add(current);

        var frames = new ArrayList<Frame>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            frames.add(lineFrame(locator, lines.get(i), i, styles, width, numberLines));
        }
        return frames;
    }

    private Frame lineFrame(Locator locator, List<Run> runs, int index, Styles styles, double width, boolean numberLines) {
        var last = runs.get(runs.size() - 1);
        double natural = last.x() + last.atom().size().x();
        double height = styles.fontSize();
        for (var run : runs) {
            height = Math.max(height, run.atom().size().y());
        }
        double lineWidth = Double.isFinite(width) ? Math.max(width, natural) : natural;
        double offset = styles.parAlign().position(lineWidth - natural);

        var frame = Frame.of(new Size(lineWidth, height));
        if (numberLines) {
            var marker = new ParLineMarker(styles.lineNumberMargin(), styles.lineNumberClearance(), null);
            frame.pushTag(Point.ZERO, new Tag(locator.child("line" + index).location(), marker));
        }
        for (var run : runs) {
            var pos = new Point(offset + run.x(), 0);
            frame.push(pos, new FrameItem.Text(run.atom().text(), run.atom().size()));
            if (run.atom().note() != null) {
                frame.pushTag(pos, run.atom().note());
            }
        }
        return frame;
    }

    private record Atom(String text, Size size, Tag note, boolean glue) {}

    private record Run(Atom atom, double x) {}
}
