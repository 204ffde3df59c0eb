package work.lcod.layout.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.layout.support.LayoutTestSupport.document;

import org.junit.jupiter.api.Test;
import work.lcod.layout.content.BlockContent;
import work.lcod.layout.content.ColbreakContent;
import work.lcod.layout.content.FootnoteContent;
import work.lcod.layout.content.ParagraphContent;
import work.lcod.layout.content.PlaceContent;
import work.lcod.layout.content.PlacementScope;
import work.lcod.layout.content.SequenceContent;
import work.lcod.layout.content.Sizing;
import work.lcod.layout.content.Styles;
import work.lcod.layout.content.TagContent;
import work.lcod.layout.content.VSpaceContent;
import work.lcod.layout.content.VerticalPlacement;
import work.lcod.layout.geom.Rel;

class DocumentLoaderTest {
    @Test
    void loadsAllContentKinds() {
        var content = (SequenceContent) DocumentLoader.load(document("basic.yaml"), Styles.defaults());
        var children = content.children();

        assertEquals(6, children.size());
        assertInstanceOf(ParagraphContent.class, children.get(0));

        var figure = (BlockContent) children.get(1);
        assertEquals("figure", figure.label());
        assertFalse(figure.breakable());
        assertEquals(Sizing.abs(40), figure.height().orElseThrow());

        var par = (ParagraphContent) children.get(2);
        var note = (FootnoteContent) par.inlines().get(1);
        assertEquals("1", note.marker());
        assertFalse(note.reference());

        var chart = (PlaceContent) children.get(3);
        assertTrue(chart.floating());
        assertEquals(VerticalPlacement.BOTTOM, chart.alignY());
        assertEquals(PlacementScope.COLUMN, chart.scope());
        assertEquals("chart", ((BlockContent) chart.body().get(0)).label());

        assertEquals(Sizing.fr(1), ((VSpaceContent) children.get(4)).amount());
        assertEquals("end", ((TagContent) children.get(5)).name());
    }

    @Test
    void spansPointIntoTheDocument() {
        var content = (SequenceContent) DocumentLoader.load(document("basic.yaml"), Styles.defaults());

        assertEquals("basic.yaml#/content/1/block", content.children().get(1).span().source());
    }

    @Test
    void numbersFootnotesInDocumentOrder() {
        var yaml = """
            content:
              - par: ["a", {footnote: "first"}, "b", {footnote: {marker: "*", body: "starred"}}]
              - par: ["c", {footnote: "second"}, {footnote: {ref: "1"}}]
            """;

        var content = (SequenceContent) DocumentLoader.parse(yaml, "inline", Styles.defaults());
        var first = (ParagraphContent) content.children().get(0);
        var second = (ParagraphContent) content.children().get(1);

        assertEquals("1", ((FootnoteContent) first.inlines().get(1)).marker());
        assertEquals("*", ((FootnoteContent) first.inlines().get(3)).marker());
        assertEquals("2", ((FootnoteContent) second.inlines().get(1)).marker());
        assertTrue(((FootnoteContent) second.inlines().get(2)).reference());
    }

    @Test
    void resolvesLengthsWithUnits() {
        var yaml = """
            content:
              - block: {width: "50%", height: "2em", above: "4pt", below: 3}
              - v: {amount: "1cm", weak: true}
            """;
        var styles = Styles.builder().fontSize(10).build();

        var content = (SequenceContent) DocumentLoader.parse(yaml, "units", styles);
        var block = (BlockContent) content.children().get(0);
        var space = (VSpaceContent) content.children().get(1);

        assertEquals(Rel.ratio(0.5), block.width().orElseThrow());
        assertEquals(Sizing.abs(20), block.height().orElseThrow());
        assertEquals(4.0, block.above().orElseThrow());
        assertEquals(3.0, block.below().orElseThrow());
        assertTrue(space.weak());
        assertEquals(72.0 / 2.54, ((Sizing.Length) space.amount()).rel().abs(), 1e-9);
    }

    @Test
    void readsColumnBreaks() {
        var content = (SequenceContent) DocumentLoader.load(document("long.yaml"), Styles.defaults());

        assertInstanceOf(ColbreakContent.class, content.children().get(2));
    }

    @Test
    void rejectsUnknownKinds() {
        var ex = assertThrows(IllegalArgumentException.class,
            () -> DocumentLoader.load(document("invalid.yaml"), Styles.defaults()));

        assertEquals("Unknown content kind 'shape' at invalid.yaml#/content/0", ex.getMessage());
    }

    @Test
    void rejectsUnknownKeys() {
        var yaml = """
            content:
              - block: {colour: red}
            """;

        var ex = assertThrows(IllegalArgumentException.class, () -> DocumentLoader.parse(yaml, "keys", Styles.defaults()));

        assertEquals("Unknown key 'colour' at keys#/content/0/block", ex.getMessage());
    }

    @Test
    void rejectsBlocksInsideParagraphs() {
        var yaml = """
            content:
              - par: ["text", {block: {height: 10}}]
            """;

        assertThrows(IllegalArgumentException.class, () -> DocumentLoader.parse(yaml, "inline", Styles.defaults()));
    }

    @Test
    void requiresContentList() {
        assertThrows(IllegalArgumentException.class, () -> DocumentLoader.parse("title: nothing", "empty", Styles.defaults()));
    }
}
