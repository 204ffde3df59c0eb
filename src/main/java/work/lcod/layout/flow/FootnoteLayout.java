package work.lcod.layout.flow;

import java.util.ArrayList;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.ParagraphContent;
import work.lcod.layout.content.TextContent;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.frame.Fragment;
import work.lcod.layout.frame.Frame;
import work.lcod.layout.geom.Axes;
import work.lcod.layout.geom.Region;
import work.lcod.layout.geom.Regions;
import work.lcod.layout.geom.Size;

/**
 * Footnote entries and the separator above them.
 */
final class FootnoteLayout {
    private static final Locator SEPARATOR = Locator.root().child("footnote-separator");

    private FootnoteLayout() {}

    static Frame separator(Engine engine, Config config, Size base) {
        var region = new Region(base, Axes.splat(false));
        return FlowLayout.layoutFrame(engine, config.footnote().separator(), SEPARATOR, config.footnote().styles(), region);
    }

    /** Lays out the entry of {@code note}: its marker followed by the body, as one paragraph. */
    static Fragment entry(Engine engine, Config config, Note note, Regions regions) {
        var inlines = new ArrayList<Content>();
        inlines.add(TextContent.of(note.elem().marker()));
        inlines.addAll(note.elem().body());
        var paragraph = new ParagraphContent(inlines, note.elem().span());
        var pod = regions.withExpand(new Axes<>(config.footnote().expand(), false));
        var locator = new Locator(note.location().key()).child("entry");
        return FlowLayout.layoutFragment(engine, paragraph, locator, config.footnote().styles(), pod);
    }
}
